package uk.gegc.vidstream.features.subscription.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "InitiatePaymentResponse", description = "A started payment and how to confirm it")
public record InitiatePaymentResponse(
        @Schema(description = "Provider page to complete the payment, when the provider offers one")
        String paymentUrl,

        @Schema(description = "Reference to verify the payment with", example = "sub-1b4e28ba-2fa1-11d2-883f-0016d3cca427")
        String transactionReference,

        @Schema(description = "Relative URL that verifies this payment", example = "/api/v1/subscriptions/payments/sub-.../verify")
        String verificationUrl,

        @Schema(description = "Plan being purchased")
        UUID planId
) {
}
