package uk.gegc.vidstream.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "LoginRequest", description = "Payload for user login")
public record LoginRequest(
        @Schema(description = "Username (case-sensitive)", example = "jdoe")
        @NotBlank(message = "{username.blank}")
        String username,

        @Schema(description = "User password", example = "P@ssw0rd!")
        @NotBlank(message = "{password.blank}")
        String password
) {
}
