package uk.gegc.vidstream.features.subscription.application;

/**
 * Entitlement as observed at a point in time. Never stored; always derived from the
 * subscription flag, the expiry and the clock.
 */
public enum SubscriptionState {
    UNSUBSCRIBED,
    ACTIVE,
    LAPSED
}
