package uk.gegc.vidstream.features.auth.infra.security;

import uk.gegc.vidstream.features.user.domain.model.User;

import java.util.UUID;

/**
 * A refresh token names the account by id; the username in {@code subject} is informational only.
 */
public record RefreshTokenClaims(String subject, UUID userId, long passwordChangedAt) {

    public static RefreshTokenClaims of(User user) {
        return new RefreshTokenClaims(user.getUsername(), user.getId(), JwtTokenService.passwordChangedAtOf(user));
    }
}
