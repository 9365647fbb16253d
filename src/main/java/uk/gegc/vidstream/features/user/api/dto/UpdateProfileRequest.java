package uk.gegc.vidstream.features.user.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update: {@code null} fields are left unchanged.
 */
@Schema(name = "UpdateProfileRequest", description = "Fields of the caller's profile to change")
public record UpdateProfileRequest(
        @Schema(description = "New username", example = "jdoe2")
        @Size(min = 3, max = 50, message = "{username.length}")
        @Pattern(regexp = "^\\S+$", message = "{username.whitespace}")
        String username,

        @Schema(description = "New email address", example = "jane@example.com")
        @Size(max = 100, message = "{email.max}")
        @Email(message = "{email.invalid}")
        String email,

        @Schema(description = "Given name", example = "Jane")
        @Size(min = 1, max = 50, message = "{name.max}")
        String firstName,

        @Schema(description = "Family name", example = "Doe")
        @Size(min = 1, max = 50, message = "{name.max}")
        String lastName,

        @Schema(description = "Phone number", example = "+265991234567")
        @Size(max = 20, message = "{phone.max}")
        String phoneNumber,

        @Schema(description = "Avatar image URL")
        @Size(max = 255, message = "{avatarUrl.max}")
        String avatarUrl,

        @Schema(description = "New password", example = "N3wP@ssw0rd!")
        @Size(min = 8, max = 100, message = "{password.length}")
        String password
) {
}
