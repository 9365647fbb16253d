package uk.gegc.vidstream.features.subscription.domain.exception;

/**
 * The caller is authenticated but holds no active subscription.
 */
public class SubscriptionRequiredException extends RuntimeException {
    public SubscriptionRequiredException(String message) {
        super(message);
    }
}
