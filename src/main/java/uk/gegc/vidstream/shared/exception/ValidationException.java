package uk.gegc.vidstream.shared.exception;

/**
 * Business-rule validation failure that bean validation cannot express, e.g. an expired reset token.
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }
}
