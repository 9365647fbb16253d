package uk.gegc.vidstream.features.auth.domain.exception;

public class TokenExpiredException extends TokenVerificationException {
    public TokenExpiredException(String message) {
        super(message);
    }

    public TokenExpiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
