package uk.gegc.vidstream.features.auth.domain.exception;

/**
 * Base type for bearer token verification failures. Callers that only care whether a token is
 * usable catch this; callers that report the reason catch the subtypes.
 */
public abstract class TokenVerificationException extends RuntimeException {
    protected TokenVerificationException(String message) {
        super(message);
    }

    protected TokenVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
