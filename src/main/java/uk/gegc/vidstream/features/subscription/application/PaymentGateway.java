package uk.gegc.vidstream.features.subscription.application;

import uk.gegc.vidstream.features.subscription.domain.exception.InvalidTransactionReferenceException;
import uk.gegc.vidstream.features.subscription.domain.exception.PaymentVerificationUnavailableException;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Port to the external payment provider. Implementations must not be called inside a
 * database transaction.
 */
public interface PaymentGateway {

    /**
     * Asks the provider to start collecting a charge under the given reference.
     *
     * @throws PaymentVerificationUnavailableException if the provider is unreachable or rejects the call
     */
    ProviderCharge initiateCharge(ChargeRequest request);

    /**
     * Looks up the provider's verdict on a charge.
     *
     * @throws PaymentVerificationUnavailableException if the provider is unreachable or fails
     * @throws InvalidTransactionReferenceException    if the provider does not know the reference
     */
    ProviderVerification verifyCharge(String reference);

    record ChargeRequest(
            String reference,
            BigDecimal amount,
            String currency,
            String phoneNumber,
            String network,
            String email,
            String firstName,
            String lastName,
            String description
    ) {
    }

    record ProviderCharge(String reference, String paymentUrl, String status) {
    }

    record ProviderVerification(String reference, String status, BigDecimal amount, String currency) {

        private static final Set<String> SUCCESS_STATUSES = Set.of("successful", "success");

        public boolean successful() {
            return status != null && SUCCESS_STATUSES.contains(status.toLowerCase());
        }
    }
}
