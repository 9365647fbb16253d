package uk.gegc.vidstream.features.user.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "UserDto", description = "Account details as seen by the account holder or an admin")
public record UserDto(
        @Schema(description = "User UUID", example = "3fa85f64-5717-4562-b3fc-2c963f66afa6")
        UUID id,

        @Schema(description = "Username", example = "jdoe")
        String username,

        @Schema(description = "Email address", example = "jdoe@example.com")
        String email,

        @Schema(description = "Given name", example = "Jane")
        String firstName,

        @Schema(description = "Family name", example = "Doe")
        String lastName,

        @Schema(description = "Phone number", example = "+265991234567")
        String phoneNumber,

        @Schema(description = "Avatar image URL")
        String avatarUrl,

        @Schema(description = "Whether the user can manage plans, videos and accounts")
        boolean isAdmin,

        @Schema(description = "Stored subscription flag; see subscription status for entitlement")
        boolean isSubscribed,

        @Schema(description = "Subscription expiry (UTC); null means non-expiring when subscribed")
        LocalDateTime subscriptionExpiry,

        @Schema(description = "Registration timestamp (UTC)")
        LocalDateTime createdAt
) {
}
