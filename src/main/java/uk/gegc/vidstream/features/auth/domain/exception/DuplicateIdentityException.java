package uk.gegc.vidstream.features.auth.domain.exception;

public class DuplicateIdentityException extends RuntimeException {
    public DuplicateIdentityException(String message) {
        super(message);
    }
}
