package uk.gegc.vidstream.features.user.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;
import uk.gegc.vidstream.features.auth.domain.exception.DuplicateIdentityException;
import uk.gegc.vidstream.features.auth.domain.repository.PasswordResetTokenRepository;
import uk.gegc.vidstream.features.subscription.domain.repository.PaymentTransactionRepository;
import uk.gegc.vidstream.features.user.api.dto.UpdateProfileRequest;
import uk.gegc.vidstream.features.user.domain.model.User;
import uk.gegc.vidstream.features.user.domain.repository.UserRepository;
import uk.gegc.vidstream.features.user.infra.mapping.UserMapper;
import uk.gegc.vidstream.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserServiceImplTest {

    @Mock
    private UserRepository userRepository;
    @Mock
    private PaymentTransactionRepository paymentTransactionRepository;
    @Mock
    private PasswordResetTokenRepository passwordResetTokenRepository;
    @Mock
    private PasswordEncoder passwordEncoder;
    @Mock
    private UserMapper userMapper;

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private UserServiceImpl userService;

    private User user;

    @BeforeEach
    void setUp() {
        userService = new UserServiceImpl(userRepository, paymentTransactionRepository,
                passwordResetTokenRepository, passwordEncoder, userMapper, Clock.fixed(NOW, ZoneOffset.UTC));

        user = new User();
        user.setId(UUID.randomUUID());
        user.setUsername("chikondi");
        user.setEmail("chikondi@example.com");
        user.setFirstName("Chikondi");
        user.setLastName("Mwale");
        user.setHashedPassword("old-hash");
        user.setPasswordChangedAt(LocalDateTime.of(2025, 1, 1, 0, 0));
    }

    @Test
    @DisplayName("only supplied fields change and a new password is re-hashed")
    void partialUpdate() {
        when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
        when(passwordEncoder.encode("n3w-password")).thenReturn("new-hash");
        when(userRepository.save(user)).thenReturn(user);

        userService.updateProfile(user.getId(),
                new UpdateProfileRequest(null, null, "Chiko", null, "0881234567", null, "n3w-password"));

        assertThat(user.getUsername()).isEqualTo("chikondi");
        assertThat(user.getFirstName()).isEqualTo("Chiko");
        assertThat(user.getLastName()).isEqualTo("Mwale");
        assertThat(user.getPhoneNumber()).isEqualTo("0881234567");
        assertThat(user.getHashedPassword()).isEqualTo("new-hash");
        assertThat(user.getPasswordChangedAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("a profile update without a password keeps issued tokens valid")
    void profileUpdateKeepsPasswordVersion() {
        when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
        when(userRepository.existsByUsernameAndIdNot("chiko", user.getId())).thenReturn(false);
        when(userRepository.save(user)).thenReturn(user);

        userService.updateProfile(user.getId(),
                new UpdateProfileRequest("chiko", null, null, null, null, null, null));

        assertThat(user.getUsername()).isEqualTo("chiko");
        assertThat(user.getPasswordChangedAt()).isEqualTo(LocalDateTime.of(2025, 1, 1, 0, 0));
        verifyNoInteractions(passwordEncoder);
    }

    @Test
    @DisplayName("taking another account's email is rejected")
    void duplicateEmail() {
        when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
        when(userRepository.existsByEmailAndIdNot("taken@example.com", user.getId())).thenReturn(true);

        assertThatThrownBy(() -> userService.updateProfile(user.getId(),
                new UpdateProfileRequest(null, "taken@example.com", null, null, null, null, null)))
                .isInstanceOf(DuplicateIdentityException.class);
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("deleting a user removes their payments and reset tokens first")
    void deleteCascades() {
        when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));

        userService.deleteUser(user.getId());

        var inOrder = inOrder(paymentTransactionRepository, passwordResetTokenRepository, userRepository);
        inOrder.verify(paymentTransactionRepository).deleteByUserId(user.getId());
        inOrder.verify(passwordResetTokenRepository).deleteByUserId(user.getId());
        inOrder.verify(userRepository).delete(user);
    }

    @Test
    @DisplayName("an unknown user is not found")
    void unknownUser() {
        UUID id = UUID.randomUUID();
        when(userRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> userService.getUser(id)).isInstanceOf(ResourceNotFoundException.class);
    }
}
