package uk.gegc.vidstream.features.subscription.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

@Schema(name = "InitiatePaymentRequest", description = "Start paying for a plan with mobile money")
public record InitiatePaymentRequest(
        @Schema(description = "Plan to purchase")
        @NotNull(message = "{payment.plan.required}")
        UUID planId,

        @Schema(description = "Mobile-money number to charge", example = "0991234567")
        @NotBlank(message = "{payment.phone.blank}")
        @Size(max = 20, message = "{phone.max}")
        String phoneNumber,

        @Schema(description = "Mobile-money network", example = "airtel")
        @NotBlank(message = "{payment.network.blank}")
        @Size(max = 32, message = "{payment.network.max}")
        String network
) {
}
