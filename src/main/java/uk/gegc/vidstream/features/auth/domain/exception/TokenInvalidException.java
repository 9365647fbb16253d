package uk.gegc.vidstream.features.auth.domain.exception;

public class TokenInvalidException extends TokenVerificationException {
    public TokenInvalidException(String message) {
        super(message);
    }

    public TokenInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
