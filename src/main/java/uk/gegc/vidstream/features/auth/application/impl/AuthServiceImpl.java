package uk.gegc.vidstream.features.auth.application.impl;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.vidstream.features.auth.api.dto.AccessTokenResponse;
import uk.gegc.vidstream.features.auth.api.dto.JwtResponse;
import uk.gegc.vidstream.features.auth.api.dto.LoginRequest;
import uk.gegc.vidstream.features.auth.api.dto.RefreshRequest;
import uk.gegc.vidstream.features.auth.api.dto.RegisterRequest;
import uk.gegc.vidstream.features.auth.application.AuthService;
import uk.gegc.vidstream.features.auth.domain.exception.CredentialsInvalidException;
import uk.gegc.vidstream.features.auth.domain.exception.DuplicateIdentityException;
import uk.gegc.vidstream.features.auth.domain.exception.TokenInvalidException;
import uk.gegc.vidstream.features.auth.domain.model.PasswordResetToken;
import uk.gegc.vidstream.features.auth.domain.repository.PasswordResetTokenRepository;
import uk.gegc.vidstream.features.auth.infra.security.AccessTokenClaims;
import uk.gegc.vidstream.features.auth.infra.security.JwtTokenService;
import uk.gegc.vidstream.features.auth.infra.security.RefreshTokenClaims;
import uk.gegc.vidstream.features.user.domain.model.User;
import uk.gegc.vidstream.features.user.domain.repository.UserRepository;
import uk.gegc.vidstream.shared.email.EmailService;
import uk.gegc.vidstream.shared.exception.ValidationException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuthServiceImpl implements AuthService {

    static final String TOKEN_TYPE = "bearer";
    static final String INVALID_CREDENTIALS = "Invalid username or password";

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final PasswordResetTokenRepository passwordResetTokenRepository;
    private final EmailService emailService;
    @Qualifier("utcClock")
    private final Clock utcClock;

    @Value("${app.auth.reset-token-pepper}")
    private String resetTokenPepper;

    @Value("${app.auth.reset-token-ttl-minutes:60}")
    private long resetTokenTtlMinutes;

    private String dummyPasswordHash;

    @PostConstruct
    void init() {
        if (resetTokenPepper == null || resetTokenPepper.isBlank()) {
            throw new IllegalStateException("app.auth.reset-token-pepper is not configured");
        }
        dummyPasswordHash = passwordEncoder.encode(generateSecureToken());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> authenticate(String username, String password) {
        Optional<User> user = userRepository.findByUsername(username);
        if (user.isEmpty()) {
            // same hashing cost as a real check so response time does not reveal unknown usernames
            passwordEncoder.matches(password, dummyPasswordHash);
            return Optional.empty();
        }
        return user.filter(u -> passwordEncoder.matches(password, u.getHashedPassword()));
    }

    @Override
    public JwtResponse issueSession(User user) {
        String accessToken = jwtTokenService.issueAccessToken(AccessTokenClaims.of(user));
        String refreshToken = jwtTokenService.issueRefreshToken(RefreshTokenClaims.of(user));
        return new JwtResponse(
                accessToken,
                refreshToken,
                TOKEN_TYPE,
                jwtTokenService.getAccessTokenValidityInMs(),
                jwtTokenService.getRefreshTokenValidityInMs()
        );
    }

    @Override
    public JwtResponse login(LoginRequest request) {
        return authenticate(request.username(), request.password())
                .map(this::issueSession)
                .orElseThrow(() -> new CredentialsInvalidException(INVALID_CREDENTIALS));
    }

    @Override
    @Transactional
    public JwtResponse register(RegisterRequest request) {
        if (userRepository.existsByUsername(request.username())) {
            throw new DuplicateIdentityException("Username already registered");
        }
        if (userRepository.existsByEmail(request.email())) {
            throw new DuplicateIdentityException("Email already registered");
        }

        User user = new User();
        user.setId(UUID.randomUUID());
        user.setUsername(request.username());
        user.setEmail(request.email());
        user.setFirstName(request.firstName());
        user.setLastName(request.lastName());
        user.setPhoneNumber(request.phoneNumber());
        user.setHashedPassword(passwordEncoder.encode(request.password()));
        user.setAdmin(false);
        user.setSubscribed(false);
        user.setSubscriptionExpiry(null);
        LocalDateTime now = LocalDateTime.now(utcClock);
        user.setCreatedAt(now);
        user.setPasswordChangedAt(now);

        User saved;
        try {
            saved = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // a concurrent registration won the unique constraint after our pre-checks passed
            log.info("Registration for '{}' lost a uniqueness race", request.username());
            throw new DuplicateIdentityException("Username or email already registered");
        }

        log.info("Registered user {} ({})", saved.getUsername(), saved.getId());
        return issueSession(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public AccessTokenResponse refresh(RefreshRequest request) {
        RefreshTokenClaims claims = jwtTokenService.verifyRefreshToken(request.refreshToken());
        // by id: a deleted or renamed account's username may since belong to someone else
        User user = userRepository.findById(claims.userId())
                .orElseThrow(() -> new TokenInvalidException("Refresh token account no longer exists"));
        if (JwtTokenService.passwordChangedAtOf(user) > claims.passwordChangedAt()) {
            throw new TokenInvalidException("Refresh token predates the last password change");
        }
        return new AccessTokenResponse(
                jwtTokenService.issueAccessToken(AccessTokenClaims.of(user)),
                TOKEN_TYPE,
                jwtTokenService.getAccessTokenValidityInMs()
        );
    }

    @Override
    @Transactional
    public void generatePasswordResetToken(String email) {
        Optional<User> userOpt = userRepository.findByEmail(email);
        if (userOpt.isEmpty()) {
            // answer identically whether or not the address is registered
            return;
        }
        User user = userOpt.get();
        passwordResetTokenRepository.invalidateUserTokens(user.getId());

        String token = generateSecureToken();
        LocalDateTime now = LocalDateTime.now(utcClock);

        PasswordResetToken resetToken = new PasswordResetToken();
        resetToken.setTokenHash(hashToken(token));
        resetToken.setUserId(user.getId());
        resetToken.setEmail(email);
        resetToken.setCreatedAt(now);
        resetToken.setExpiresAt(now.plusMinutes(resetTokenTtlMinutes));
        passwordResetTokenRepository.save(resetToken);

        emailService.sendPasswordResetEmail(email, token);
    }

    @Override
    @Transactional
    public void resetPassword(String token, String newPassword) {
        LocalDateTime now = LocalDateTime.now(utcClock);
        PasswordResetToken resetToken = passwordResetTokenRepository
                .findByTokenHashAndUsedFalseAndExpiresAtAfter(hashToken(token), now)
                .orElseThrow(() -> new ValidationException("Invalid or expired reset token"));

        if (passwordResetTokenRepository.markUsedIfValid(resetToken.getId(), now) == 0) {
            throw new ValidationException("Invalid or expired reset token");
        }

        User user = userRepository.findById(resetToken.getUserId())
                .orElseThrow(() -> new ValidationException("Invalid reset token"));
        user.setHashedPassword(passwordEncoder.encode(newPassword));
        user.setPasswordChangedAt(now);
        userRepository.save(user);
        log.info("Password reset completed for user {}", user.getId());
    }

    private String generateSecureToken() {
        byte[] bytes = new byte[32];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private String hashToken(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((resetTokenPepper + token).getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
