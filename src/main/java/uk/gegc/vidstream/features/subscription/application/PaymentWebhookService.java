package uk.gegc.vidstream.features.subscription.application;

public interface PaymentWebhookService {

    enum Result { OK, DUPLICATE, IGNORED }

    /**
     * Authenticates and applies a provider payment event.
     *
     * @param payload         raw request body, exactly as signed by the provider
     * @param signatureHeader hex HMAC-SHA256 of the payload
     */
    Result process(String payload, String signatureHeader);
}
