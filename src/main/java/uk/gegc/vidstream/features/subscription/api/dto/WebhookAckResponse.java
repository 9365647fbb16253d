package uk.gegc.vidstream.features.subscription.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "WebhookAckResponse", description = "Acknowledgement returned to the payment provider")
public record WebhookAckResponse(
        @Schema(example = "success")
        String status
) {
    public static WebhookAckResponse success() {
        return new WebhookAckResponse("success");
    }
}
