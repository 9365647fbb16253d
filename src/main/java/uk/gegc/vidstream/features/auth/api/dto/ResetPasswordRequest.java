package uk.gegc.vidstream.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "ResetPasswordRequest", description = "Payload to complete a password reset")
public record ResetPasswordRequest(
        @Schema(description = "Token received by email")
        @NotBlank(message = "{resetToken.blank}")
        String token,

        @Schema(description = "New password", example = "N3wP@ssw0rd!")
        @NotBlank(message = "{password.blank}")
        @Size(min = 8, max = 100, message = "{password.length}")
        String newPassword
) {
}
