package uk.gegc.vidstream.features.subscription.api;

import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.vidstream.features.subscription.api.dto.WebhookAckResponse;
import uk.gegc.vidstream.features.subscription.application.PaymentWebhookService;
import uk.gegc.vidstream.shared.config.FeatureFlags;

@Slf4j
@RestController
@RequestMapping("/api/v1/subscriptions")
@RequiredArgsConstructor
@Tag(name = "Payment Webhooks", description = "Internal endpoint for PayChangu payment events (not for public use)")
public class PaymentWebhookController {

    private final PaymentWebhookService webhookService;
    private final FeatureFlags featureFlags;

    @Operation(summary = "Handle PayChangu webhook",
            description = "Validates the HMAC signature and activates the subscription for successful payments.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event processed, duplicate or ignored"),
            @ApiResponse(responseCode = "401", description = "Invalid signature",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Payments feature disabled",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Payment provider unavailable, retry later",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @Hidden
    @PostMapping("/webhook")
    public ResponseEntity<WebhookAckResponse> handleWebhook(
            @Parameter(hidden = true) @RequestBody String payload,
            @Parameter(description = "Hex HMAC-SHA256 of the raw body") @RequestHeader(name = "Signature", required = false) String signature
    ) {
        if (!featureFlags.isPayments()) {
            log.warn("Payments feature is disabled, rejecting webhook");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }

        var result = webhookService.process(payload, signature);
        log.debug("Webhook handled with result {}", result);
        return ResponseEntity.ok(WebhookAckResponse.success());
    }
}
