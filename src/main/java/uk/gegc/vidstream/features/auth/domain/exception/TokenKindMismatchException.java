package uk.gegc.vidstream.features.auth.domain.exception;

/**
 * A well-formed, unexpired token was presented where the other kind was expected,
 * e.g. a refresh token sent as a bearer credential.
 */
public class TokenKindMismatchException extends TokenVerificationException {
    public TokenKindMismatchException(String message) {
        super(message);
    }
}
