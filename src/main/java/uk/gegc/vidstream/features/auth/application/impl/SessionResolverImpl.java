package uk.gegc.vidstream.features.auth.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.vidstream.features.auth.application.SessionResolver;
import uk.gegc.vidstream.features.auth.domain.exception.CredentialsInvalidException;
import uk.gegc.vidstream.features.auth.domain.exception.TokenVerificationException;
import uk.gegc.vidstream.features.auth.infra.security.AccessTokenClaims;
import uk.gegc.vidstream.features.auth.infra.security.JwtTokenService;
import uk.gegc.vidstream.features.user.domain.model.User;
import uk.gegc.vidstream.features.user.domain.repository.UserRepository;

@Slf4j
@Service
@RequiredArgsConstructor
public class SessionResolverImpl implements SessionResolver {

    static final String INVALID_CREDENTIALS = "Could not validate credentials";

    private final JwtTokenService jwtTokenService;
    private final UserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    public User resolve(String accessToken) {
        AccessTokenClaims claims;
        try {
            claims = jwtTokenService.verifyAccessToken(accessToken);
        } catch (TokenVerificationException ex) {
            log.debug("Bearer token rejected: {}", ex.getMessage());
            throw new CredentialsInvalidException(INVALID_CREDENTIALS);
        }
        User user = userRepository.findById(claims.userId())
                .orElseThrow(() -> {
                    log.info("Bearer token references missing user {}", claims.userId());
                    return new CredentialsInvalidException(INVALID_CREDENTIALS);
                });
        if (JwtTokenService.passwordChangedAtOf(user) > claims.passwordChangedAt()) {
            log.debug("Bearer token for user {} predates its last password change", user.getId());
            throw new CredentialsInvalidException(INVALID_CREDENTIALS);
        }
        return user;
    }
}
