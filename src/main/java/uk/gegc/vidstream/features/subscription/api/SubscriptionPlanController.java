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
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import uk.gegc.vidstream.features.subscription.api.dto.CreatePlanRequest;
import uk.gegc.vidstream.features.subscription.api.dto.SubscriptionPlanDto;
import uk.gegc.vidstream.features.subscription.api.dto.UpdatePlanRequest;
import uk.gegc.vidstream.features.subscription.application.SubscriptionPlanService;

import java.util.List;
import java.util.UUID;

@Tag(name = "Subscription Plans", description = "Public plan catalogue and admin plan management")
@RestController
@RequestMapping("/api/v1/subscriptions/plans")
@RequiredArgsConstructor
public class SubscriptionPlanController {

    private final SubscriptionPlanService planService;

    @Operation(summary = "List subscription plans", description = "Ordered by price, cheapest first.")
    @GetMapping
    public ResponseEntity<List<SubscriptionPlanDto>> listPlans(
            @Parameter(description = "Only return plans that can currently be bought")
            @RequestParam(name = "active_only", defaultValue = "true") boolean activeOnly
    ) {
        return ResponseEntity.ok(planService.listPlans(activeOnly));
    }

    @Operation(summary = "Get a subscription plan")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Plan found"),
            @ApiResponse(responseCode = "404", description = "Plan not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{planId}")
    public ResponseEntity<SubscriptionPlanDto> getPlan(@PathVariable UUID planId) {
        return ResponseEntity.ok(planService.getPlan(planId));
    }

    @Operation(summary = "Create a subscription plan (admin)")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Plan created"),
            @ApiResponse(responseCode = "400", description = "Validation errors",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Caller is not an admin",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<SubscriptionPlanDto> createPlan(@Valid @RequestBody CreatePlanRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(planService.createPlan(request));
    }

    @Operation(summary = "Update a subscription plan (admin)", description = "Duration and currency are fixed once created.")
    @PatchMapping("/{planId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<SubscriptionPlanDto> updatePlan(
            @PathVariable UUID planId,
            @Valid @RequestBody UpdatePlanRequest request
    ) {
        return ResponseEntity.ok(planService.updatePlan(planId, request));
    }
}
