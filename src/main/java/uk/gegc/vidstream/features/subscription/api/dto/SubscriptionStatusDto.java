package uk.gegc.vidstream.features.subscription.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.vidstream.features.subscription.application.SubscriptionState;

import java.time.LocalDateTime;

@Schema(name = "SubscriptionStatusDto", description = "The caller's subscription as of now")
public record SubscriptionStatusDto(
        @Schema(description = "Stored subscription flag")
        boolean isSubscribed,

        @Schema(description = "Expiry (UTC); null means non-expiring when subscribed")
        LocalDateTime subscriptionExpiry,

        @Schema(description = "Whether gated content is currently accessible")
        boolean isActive,

        @Schema(description = "Derived state", example = "ACTIVE")
        SubscriptionState state,

        @Schema(description = "Plan of the most recent completed payment, if any")
        SubscriptionPlanDto currentPlan
) {
}
