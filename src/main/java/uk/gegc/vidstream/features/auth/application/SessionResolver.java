package uk.gegc.vidstream.features.auth.application;

import uk.gegc.vidstream.features.auth.domain.exception.CredentialsInvalidException;
import uk.gegc.vidstream.features.user.domain.model.User;

/**
 * Turns a bearer access token into the live account it was issued for.
 */
public interface SessionResolver {

    /**
     * @return the current row for the token's {@code user_id}, never a snapshot taken from claims
     * @throws CredentialsInvalidException if the token fails verification for any reason, is a
     *                                     refresh token, or names a user that no longer exists
     */
    User resolve(String accessToken);
}
