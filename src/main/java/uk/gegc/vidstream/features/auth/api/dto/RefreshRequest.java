package uk.gegc.vidstream.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "RefreshRequest", description = "Payload carrying a refresh token")
public record RefreshRequest(
        @Schema(description = "Refresh token issued at login", example = "eyJhbGciOiJIUzI1NiJ9...")
        @NotBlank(message = "{refreshToken.blank}")
        String refreshToken
) {
}
