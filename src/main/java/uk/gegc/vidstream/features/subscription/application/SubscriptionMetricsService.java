package uk.gegc.vidstream.features.subscription.application;

/**
 * Counters for payment webhooks and subscription activations.
 */
public interface SubscriptionMetricsService {

    void incrementWebhookReceived(String eventStatus);
    void incrementWebhookOk(String eventStatus);
    void incrementWebhookDuplicate(String eventStatus);
    void incrementWebhookIgnored(String eventStatus);
    void incrementWebhookFailed(String eventStatus);

    void recordWebhookLatency(String eventStatus, long latencyMs);

    void incrementActivationApplied(String planName);
    void incrementActivationAlreadyApplied();
}
