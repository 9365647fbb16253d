package uk.gegc.vidstream.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "ForgotPasswordRequest", description = "Payload to start a password reset")
public record ForgotPasswordRequest(
        @Schema(description = "Email address of the account", example = "jdoe@example.com")
        @NotBlank(message = "{email.blank}")
        @Email(message = "{email.invalid}")
        String email
) {
}
