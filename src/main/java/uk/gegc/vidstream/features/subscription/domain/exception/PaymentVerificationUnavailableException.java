package uk.gegc.vidstream.features.subscription.domain.exception;

/**
 * The payment provider could not be reached or answered with a server error.
 * The caller may retry; no subscription state was changed.
 */
public class PaymentVerificationUnavailableException extends RuntimeException {
    public PaymentVerificationUnavailableException(String message) {
        super(message);
    }

    public PaymentVerificationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
