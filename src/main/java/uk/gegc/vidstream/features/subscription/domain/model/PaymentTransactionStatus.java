package uk.gegc.vidstream.features.subscription.domain.model;

public enum PaymentTransactionStatus {
    PENDING,
    COMPLETED,
    FAILED
}
