package uk.gegc.vidstream.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "MessageResponse", description = "Human readable acknowledgement")
public record MessageResponse(
        @Schema(description = "Acknowledgement text", example = "Password has been reset successfully")
        String message
) {
}
