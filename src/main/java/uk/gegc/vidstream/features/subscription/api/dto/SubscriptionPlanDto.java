package uk.gegc.vidstream.features.subscription.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "SubscriptionPlanDto", description = "A purchasable subscription plan")
public record SubscriptionPlanDto(
        @Schema(description = "Plan UUID")
        UUID id,

        @Schema(description = "Display name", example = "Monthly")
        String name,

        @Schema(description = "Marketing description", example = "Unlimited streaming for 30 days")
        String description,

        @Schema(description = "Price in the plan currency", example = "5000.00")
        BigDecimal price,

        @Schema(description = "ISO 4217 currency code", example = "MWK")
        String currency,

        @Schema(description = "Days of access granted per purchase", example = "30")
        int durationDays,

        @Schema(description = "Whether the plan can currently be purchased")
        boolean isActive,

        @Schema(description = "Creation timestamp (UTC)")
        LocalDateTime createdAt
) {
}
