package uk.gegc.vidstream.features.auth.application;

import uk.gegc.vidstream.features.auth.api.dto.AccessTokenResponse;
import uk.gegc.vidstream.features.auth.api.dto.JwtResponse;
import uk.gegc.vidstream.features.auth.api.dto.LoginRequest;
import uk.gegc.vidstream.features.auth.api.dto.RefreshRequest;
import uk.gegc.vidstream.features.auth.api.dto.RegisterRequest;
import uk.gegc.vidstream.features.user.domain.model.User;

import java.util.Optional;

public interface AuthService {

    /**
     * Checks a username/password pair. Unknown usernames and wrong passwords are indistinguishable
     * to the caller, including in response time.
     */
    Optional<User> authenticate(String username, String password);

    JwtResponse issueSession(User user);

    JwtResponse login(LoginRequest request);

    JwtResponse register(RegisterRequest request);

    /**
     * Mints a new access token from a refresh token. The refresh token itself is returned
     * to nobody and stays valid until its own expiry.
     */
    AccessTokenResponse refresh(RefreshRequest request);

    void generatePasswordResetToken(String email);

    void resetPassword(String token, String newPassword);
}
