package uk.gegc.vidstream.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@Schema(name = "RegisterRequest", description = "Payload for user registration")
public record RegisterRequest(
        @Schema(description = "Unique username", example = "jdoe")
        @NotBlank(message = "{username.blank}")
        @Size(min = 3, max = 50, message = "{username.length}")
        @Pattern(regexp = "^\\S+$", message = "{username.whitespace}")
        String username,

        @Schema(description = "Unique email address", example = "jdoe@example.com")
        @NotBlank(message = "{email.blank}")
        @Size(max = 100, message = "{email.max}")
        @Email(message = "{email.invalid}")
        String email,

        @Schema(description = "Password for the new account", example = "P@ssw0rd!")
        @NotBlank(message = "{password.blank}")
        @Size(min = 8, max = 100, message = "{password.length}")
        String password,

        @Schema(description = "Given name", example = "Jane")
        @NotBlank(message = "{firstName.blank}")
        @Size(max = 50, message = "{name.max}")
        String firstName,

        @Schema(description = "Family name", example = "Doe")
        @NotBlank(message = "{lastName.blank}")
        @Size(max = 50, message = "{name.max}")
        String lastName,

        @Schema(description = "Mobile number used for mobile-money payments", example = "+265991234567")
        @Size(max = 20, message = "{phone.max}")
        String phoneNumber
) {
}
