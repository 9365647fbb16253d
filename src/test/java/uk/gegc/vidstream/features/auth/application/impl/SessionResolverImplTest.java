package uk.gegc.vidstream.features.auth.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.vidstream.features.auth.domain.exception.CredentialsInvalidException;
import uk.gegc.vidstream.features.auth.domain.exception.TokenExpiredException;
import uk.gegc.vidstream.features.auth.domain.exception.TokenInvalidException;
import uk.gegc.vidstream.features.auth.domain.exception.TokenKindMismatchException;
import uk.gegc.vidstream.features.auth.infra.security.AccessTokenClaims;
import uk.gegc.vidstream.features.auth.infra.security.JwtTokenService;
import uk.gegc.vidstream.features.user.domain.model.User;
import uk.gegc.vidstream.features.user.domain.repository.UserRepository;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionResolverImplTest {

    @Mock
    private JwtTokenService jwtTokenService;

    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private SessionResolverImpl sessionResolver;

    private static final LocalDateTime CHANGED_AT = LocalDateTime.of(2025, 3, 1, 10, 0);
    private static final long CHANGED_AT_MILLIS = CHANGED_AT.toInstant(ZoneOffset.UTC).toEpochMilli();

    @Test
    @DisplayName("resolve: returns the stored user for a valid token")
    void resolvesUser() {
        UUID userId = UUID.randomUUID();
        User user = new User();
        user.setId(userId);
        user.setSubscribed(true);
        user.setPasswordChangedAt(CHANGED_AT);
        when(jwtTokenService.verifyAccessToken("token"))
                .thenReturn(new AccessTokenClaims("dave", userId, "dave@example.com", null, CHANGED_AT_MILLIS));
        when(userRepository.findById(userId)).thenReturn(Optional.of(user));

        assertThat(sessionResolver.resolve("token")).isSameAs(user);
    }

    @Test
    @DisplayName("resolve: every verification failure maps to the same credentials error")
    void verificationFailures() {
        when(jwtTokenService.verifyAccessToken("expired")).thenThrow(new TokenExpiredException("expired"));
        when(jwtTokenService.verifyAccessToken("forged")).thenThrow(new TokenInvalidException("bad signature"));
        when(jwtTokenService.verifyAccessToken("refresh")).thenThrow(new TokenKindMismatchException("wrong kind"));

        for (String token : new String[]{"expired", "forged", "refresh"}) {
            assertThatThrownBy(() -> sessionResolver.resolve(token))
                    .isInstanceOf(CredentialsInvalidException.class)
                    .hasMessage(SessionResolverImpl.INVALID_CREDENTIALS);
        }
        verifyNoInteractions(userRepository);
    }

    @Test
    @DisplayName("resolve: an unexpired token for a deleted user is rejected")
    void deletedUser() {
        UUID userId = UUID.randomUUID();
        when(jwtTokenService.verifyAccessToken("token"))
                .thenReturn(new AccessTokenClaims("erin", userId, "erin@example.com", null, CHANGED_AT_MILLIS));
        when(userRepository.findById(userId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> sessionResolver.resolve("token"))
                .isInstanceOf(CredentialsInvalidException.class)
                .hasMessage(SessionResolverImpl.INVALID_CREDENTIALS);
    }

    @Test
    @DisplayName("resolve: a token issued before the last password change is rejected")
    void tokenPredatesPasswordChange() {
        UUID userId = UUID.randomUUID();
        User user = new User();
        user.setId(userId);
        user.setPasswordChangedAt(CHANGED_AT.plusMinutes(5));
        when(jwtTokenService.verifyAccessToken("token"))
                .thenReturn(new AccessTokenClaims("dave", userId, "dave@example.com", null, CHANGED_AT_MILLIS));
        when(userRepository.findById(userId)).thenReturn(Optional.of(user));

        assertThatThrownBy(() -> sessionResolver.resolve("token"))
                .isInstanceOf(CredentialsInvalidException.class)
                .hasMessage(SessionResolverImpl.INVALID_CREDENTIALS);
    }
}
