package uk.gegc.vidstream.features.subscription.domain.exception;

public class InvalidTransactionReferenceException extends RuntimeException {
    public InvalidTransactionReferenceException(String message) {
        super(message);
    }
}
