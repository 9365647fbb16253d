package uk.gegc.vidstream.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "AccessTokenResponse", description = "A freshly minted access token")
public record AccessTokenResponse(
        @Schema(description = "Access token (JWT)", example = "eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9...")
        String accessToken,

        @Schema(description = "Always 'bearer'", example = "bearer")
        String tokenType,

        @Schema(description = "Access token validity in milliseconds", example = "7200000")
        long expiresInMs
) {
}
