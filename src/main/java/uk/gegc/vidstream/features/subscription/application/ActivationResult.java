package uk.gegc.vidstream.features.subscription.application;

public enum ActivationResult {
    /** This call completed the transaction and extended the subscription. */
    APPLIED,
    /** The transaction had already been completed; nothing changed. */
    ALREADY_APPLIED
}
