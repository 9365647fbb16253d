package uk.gegc.vidstream.features.auth.infra.security;

import uk.gegc.vidstream.features.user.domain.model.User;

import java.util.UUID;

/**
 * Identity carried by an access token. Subscription state is deliberately absent: it is always
 * read from the store when the token is resolved.
 *
 * @param subject           username at the time of issue
 * @param phone             may be {@code null} for accounts registered without a phone number
 * @param passwordChangedAt epoch millis of the account's last password change when the token was issued
 */
public record AccessTokenClaims(String subject, UUID userId, String email, String phone, long passwordChangedAt) {

    public static AccessTokenClaims of(User user) {
        return new AccessTokenClaims(user.getUsername(), user.getId(), user.getEmail(), user.getPhoneNumber(),
                JwtTokenService.passwordChangedAtOf(user));
    }
}
