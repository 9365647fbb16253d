package uk.gegc.vidstream.features.subscription.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

@Schema(name = "CreatePlanRequest", description = "Payload for creating a subscription plan")
public record CreatePlanRequest(
        @Schema(description = "Display name", example = "Monthly")
        @NotBlank(message = "{plan.name.blank}")
        @Size(max = 100, message = "{plan.name.max}")
        String name,

        @Schema(description = "Marketing description")
        @Size(max = 500, message = "{plan.description.max}")
        String description,

        @Schema(description = "Price, zero or more", example = "5000.00")
        @NotNull(message = "{plan.price.required}")
        @DecimalMin(value = "0.00", message = "{plan.price.negative}")
        @Digits(integer = 10, fraction = 2, message = "{plan.price.digits}")
        BigDecimal price,

        @Schema(description = "ISO 4217 currency code; defaults to MWK", example = "MWK")
        @Pattern(regexp = "^[A-Z]{3}$", message = "{plan.currency.invalid}")
        String currency,

        @Schema(description = "Days of access per purchase, at least 1", example = "30")
        @NotNull(message = "{plan.duration.required}")
        @Min(value = 1, message = "{plan.duration.min}")
        Integer durationDays
) {
}
