package uk.gegc.vidstream.features.subscription.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import uk.gegc.vidstream.features.auth.infra.security.UserPrincipal;
import uk.gegc.vidstream.features.subscription.api.dto.InitiatePaymentRequest;
import uk.gegc.vidstream.features.subscription.api.dto.InitiatePaymentResponse;
import uk.gegc.vidstream.features.subscription.api.dto.SubscriptionStatusDto;
import uk.gegc.vidstream.features.subscription.application.SubscriptionService;
import uk.gegc.vidstream.shared.config.FeatureFlags;
import uk.gegc.vidstream.shared.exception.ResourceNotFoundException;

@Slf4j
@Tag(name = "Subscriptions", description = "Mobile-money payments and the caller's subscription state")
@RestController
@RequestMapping("/api/v1/subscriptions")
@RequiredArgsConstructor
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final FeatureFlags featureFlags;

    @Operation(summary = "Start a subscription payment",
            description = "Creates a pending transaction and asks PayChangu to collect the plan price.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Payment initiated"),
            @ApiResponse(responseCode = "404", description = "Plan not found or inactive",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Payment provider unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/payments")
    public ResponseEntity<InitiatePaymentResponse> initiatePayment(
            @Parameter(hidden = true) @AuthenticationPrincipal UserPrincipal principal,
            @Valid @RequestBody InitiatePaymentRequest request
    ) {
        requirePaymentsEnabled();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(subscriptionService.initiatePayment(principal.getUser(), request));
    }

    @Operation(summary = "Verify a payment and activate the subscription",
            description = "Safe to repeat: a reference extends the subscription at most once.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subscription active"),
            @ApiResponse(responseCode = "400", description = "Unknown transaction reference",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "402", description = "Payment not completed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Payment provider unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @RequestMapping(value = "/payments/{reference}/verify", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<SubscriptionStatusDto> verifyPayment(
            @Parameter(hidden = true) @AuthenticationPrincipal UserPrincipal principal,
            @PathVariable String reference
    ) {
        requirePaymentsEnabled();
        return ResponseEntity.ok(subscriptionService.verifyPayment(principal.getUser(), reference));
    }

    @Operation(summary = "Get my subscription status")
    @GetMapping("/status")
    public ResponseEntity<SubscriptionStatusDto> getStatus(
            @Parameter(hidden = true) @AuthenticationPrincipal UserPrincipal principal
    ) {
        return ResponseEntity.ok(subscriptionService.getStatus(principal.getId()));
    }

    private void requirePaymentsEnabled() {
        if (!featureFlags.isPayments()) {
            log.warn("Payments feature is disabled, rejecting request");
            throw new ResourceNotFoundException("Payments are disabled");
        }
    }
}
