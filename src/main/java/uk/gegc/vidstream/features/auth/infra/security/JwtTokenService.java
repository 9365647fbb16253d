package uk.gegc.vidstream.features.auth.infra.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import uk.gegc.vidstream.features.auth.domain.exception.TokenExpiredException;
import uk.gegc.vidstream.features.auth.domain.exception.TokenInvalidException;
import uk.gegc.vidstream.features.auth.domain.exception.TokenKindMismatchException;
import uk.gegc.vidstream.features.user.domain.model.User;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Issues and verifies HS256-signed bearer tokens.
 *
 * <p>Access tokens carry {@code sub}, {@code user_id}, {@code email} and {@code phone}; refresh
 * tokens carry {@code sub} and {@code user_id}. Both carry {@code pwd_changed_at}, {@code token_type},
 * {@code iat} and {@code exp}, and a token is only accepted where its own kind is expected.
 *
 * <p>{@code pwd_changed_at} is the account's password version when the token was issued. Callers
 * compare it with {@link #passwordChangedAtOf(User)} and refuse tokens minted before the last change.
 */
@Slf4j
@Component
public class JwtTokenService {

    static final String CLAIM_TOKEN_TYPE = "token_type";
    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_PHONE = "phone";
    static final String CLAIM_PASSWORD_CHANGED_AT = "pwd_changed_at";

    private final SecretKey key;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Clock utcClock;

    public JwtTokenService(JwtProperties properties, @Qualifier("utcClock") Clock utcClock) {
        this.key = signingKey(properties.getSecret());
        this.accessTokenTtl = properties.getAccessTokenTtl();
        this.refreshTokenTtl = properties.getRefreshTokenTtl();
        this.utcClock = utcClock;
    }

    public String issueAccessToken(AccessTokenClaims claims) {
        Map<String, Object> body = new HashMap<>();
        body.put(CLAIM_USER_ID, claims.userId().toString());
        body.put(CLAIM_EMAIL, claims.email());
        // jjwt drops null-valued claims; an empty string keeps the claim present
        body.put(CLAIM_PHONE, claims.phone() != null ? claims.phone() : "");
        body.put(CLAIM_PASSWORD_CHANGED_AT, claims.passwordChangedAt());
        return issue(claims.subject(), body, accessTokenTtl, TokenKind.ACCESS);
    }

    public String issueRefreshToken(RefreshTokenClaims claims) {
        Map<String, Object> body = new HashMap<>();
        body.put(CLAIM_USER_ID, claims.userId().toString());
        body.put(CLAIM_PASSWORD_CHANGED_AT, claims.passwordChangedAt());
        return issue(claims.subject(), body, refreshTokenTtl, TokenKind.REFRESH);
    }

    public AccessTokenClaims verifyAccessToken(String token) {
        Claims claims = verify(token, TokenKind.ACCESS);
        String userId = claims.get(CLAIM_USER_ID, String.class);
        String email = claims.get(CLAIM_EMAIL, String.class);
        if (userId == null || email == null || !claims.containsKey(CLAIM_PHONE)) {
            throw new TokenInvalidException("Access token is missing required claims");
        }
        String phone = claims.get(CLAIM_PHONE, String.class);
        return new AccessTokenClaims(claims.getSubject(), parseUserId(userId), email,
                phone == null || phone.isEmpty() ? null : phone, passwordChangedAt(claims));
    }

    public RefreshTokenClaims verifyRefreshToken(String token) {
        Claims claims = verify(token, TokenKind.REFRESH);
        String userId = claims.get(CLAIM_USER_ID, String.class);
        if (userId == null) {
            throw new TokenInvalidException("Refresh token is missing required claims");
        }
        return new RefreshTokenClaims(claims.getSubject(), parseUserId(userId), passwordChangedAt(claims));
    }

    /**
     * Password version of {@code user} as carried in the {@code pwd_changed_at} claim.
     */
    public static long passwordChangedAtOf(User user) {
        LocalDateTime changedAt = user.getPasswordChangedAt();
        return changedAt == null ? 0L : changedAt.toInstant(ZoneOffset.UTC).toEpochMilli();
    }

    public long getAccessTokenValidityInMs() {
        return accessTokenTtl.toMillis();
    }

    public long getRefreshTokenValidityInMs() {
        return refreshTokenTtl.toMillis();
    }

    private String issue(String subject, Map<String, Object> claims, Duration ttl, TokenKind kind) {
        Instant now = utcClock.instant();
        return Jwts.builder()
                .subject(subject)
                .claims(claims)
                .claim(CLAIM_TOKEN_TYPE, kind.claimValue())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    private Claims verify(String token, TokenKind expectedKind) {
        if (token == null || token.isBlank()) {
            throw new TokenInvalidException("Token is empty");
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(utcClock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException ex) {
            log.debug("JWT token is expired: {}", ex.getMessage());
            throw new TokenExpiredException("Token has expired", ex);
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("Rejected JWT token: {}", ex.getMessage());
            throw new TokenInvalidException("Token is invalid", ex);
        }

        if (claims.getSubject() == null || claims.getSubject().isBlank()) {
            throw new TokenInvalidException("Token is missing its subject");
        }
        if (claims.getExpiration() == null) {
            throw new TokenInvalidException("Token is missing its expiry");
        }
        String kind = claims.get(CLAIM_TOKEN_TYPE, String.class);
        if (kind == null) {
            throw new TokenInvalidException("Token is missing its type");
        }
        if (!expectedKind.claimValue().equals(kind)) {
            throw new TokenKindMismatchException("Expected " + expectedKind.claimValue() + " token but got " + kind);
        }
        return claims;
    }

    private static UUID parseUserId(String value) {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException ex) {
            throw new TokenInvalidException("Token carries a malformed user id", ex);
        }
    }

    private static long passwordChangedAt(Claims claims) {
        Object value = claims.get(CLAIM_PASSWORD_CHANGED_AT);
        if (!(value instanceof Number number)) {
            throw new TokenInvalidException("Token is missing its password version");
        }
        return number.longValue();
    }

    private static SecretKey signingKey(String base64Secret) {
        if (base64Secret == null || base64Secret.isBlank()) {
            throw new IllegalStateException("app.jwt.secret is not configured");
        }
        try {
            return Keys.hmacShaKeyFor(Decoders.BASE64.decode(base64Secret));
        } catch (DecodingException | WeakKeyException ex) {
            throw new IllegalStateException("app.jwt.secret must be a Base64 encoded key of at least 256 bits", ex);
        }
    }
}
