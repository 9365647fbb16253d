package uk.gegc.vidstream.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "TokenStatusResponse", description = "Result of checking the caller's bearer token")
public record TokenStatusResponse(
        @Schema(description = "Always true; an invalid token is answered with 401", example = "true")
        boolean valid,

        @Schema(description = "Username the token was issued to", example = "jdoe")
        String username,

        @Schema(description = "Id of the account the token resolves to")
        UUID userId
) {
}
