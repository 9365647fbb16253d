package uk.gegc.vidstream.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "JwtResponse", description = "Session tokens and their lifetimes")
public record JwtResponse(
        @Schema(description = "Access token (JWT)", example = "eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9...")
        String accessToken,

        @Schema(description = "Refresh token (JWT)", example = "eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9...")
        String refreshToken,

        @Schema(description = "Always 'bearer'", example = "bearer")
        String tokenType,

        @Schema(description = "Access token validity in milliseconds", example = "7200000")
        long accessExpiresInMs,

        @Schema(description = "Refresh token validity in milliseconds", example = "604800000")
        long refreshExpiresInMs
) {
}
