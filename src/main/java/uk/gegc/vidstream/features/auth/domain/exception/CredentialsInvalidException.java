package uk.gegc.vidstream.features.auth.domain.exception;

/**
 * Raised for every authentication failure: unknown user, wrong password, or a bearer token that
 * cannot be resolved to a live account. The message never says which check failed.
 */
public class CredentialsInvalidException extends RuntimeException {
    public CredentialsInvalidException(String message) {
        super(message);
    }
}
