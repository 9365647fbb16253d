package uk.gegc.vidstream.features.subscription.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Partial update. Duration and currency cannot be changed once a plan exists.
 */
@Schema(name = "UpdatePlanRequest", description = "Fields of a plan to change; omitted fields are kept")
public record UpdatePlanRequest(
        @Schema(description = "Display name", example = "Monthly (promo)")
        @Size(min = 1, max = 100, message = "{plan.name.max}")
        String name,

        @Schema(description = "Marketing description")
        @Size(max = 500, message = "{plan.description.max}")
        String description,

        @Schema(description = "New price", example = "4500.00")
        @DecimalMin(value = "0.00", message = "{plan.price.negative}")
        @Digits(integer = 10, fraction = 2, message = "{plan.price.digits}")
        BigDecimal price,

        @Schema(description = "Whether the plan can be purchased")
        Boolean isActive
) {
}
