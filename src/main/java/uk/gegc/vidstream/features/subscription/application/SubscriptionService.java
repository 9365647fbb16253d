package uk.gegc.vidstream.features.subscription.application;

import uk.gegc.vidstream.features.subscription.api.dto.InitiatePaymentRequest;
import uk.gegc.vidstream.features.subscription.api.dto.InitiatePaymentResponse;
import uk.gegc.vidstream.features.subscription.api.dto.SubscriptionStatusDto;
import uk.gegc.vidstream.features.subscription.domain.exception.InvalidTransactionReferenceException;
import uk.gegc.vidstream.features.subscription.domain.exception.PaymentNotCompletedException;
import uk.gegc.vidstream.features.subscription.domain.exception.PaymentVerificationUnavailableException;
import uk.gegc.vidstream.features.user.domain.model.User;

import java.util.UUID;

/**
 * Subscription lifecycle driven by payments.
 *
 * <p>Activation sets {@code is_subscribed} and extends the expiry to
 * {@code max(now, current expiry) + plan duration}. Each transaction reference is applied at most
 * once no matter how many times it is verified or delivered by webhook.
 */
public interface SubscriptionService {

    InitiatePaymentResponse initiatePayment(User user, InitiatePaymentRequest request);

    /**
     * Confirms the caller's own transaction with the provider and activates on success.
     *
     * @throws InvalidTransactionReferenceException    unknown reference, or one owned by another user
     * @throws PaymentNotCompletedException            the provider does not report a successful, fully paid charge
     * @throws PaymentVerificationUnavailableException the provider could not be reached
     */
    SubscriptionStatusDto verifyPayment(User user, String reference);

    /**
     * Confirms a transaction with the provider and applies it. The provider call happens before
     * any database transaction is opened.
     */
    ActivationResult confirmAndActivate(String reference);

    /**
     * Completes the payment transaction and extends the owner's subscription in one database
     * transaction. Must only be called once the provider has confirmed the charge.
     */
    ActivationResult applyActivation(String reference);

    SubscriptionStatusDto getStatus(UUID userId);
}
