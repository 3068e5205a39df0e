package front.migrator.app.service;

import com.google.api.client.auth.oauth2.Credential;

/**
 * Supplies authenticated sessions for both systems. Credentials are captured and stored
 * elsewhere; this boundary only reads what is already there.
 */
public interface CredentialProvider {

    /**
     * Raised when a credential cannot be supplied at all. Always fatal to the run.
     */
    class MissingCredentialsException extends RuntimeException {
        public MissingCredentialsException(String message) {
            super(message);
        }

        public MissingCredentialsException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * @return the Front API token
     * @throws MissingCredentialsException if no token is configured
     */
    String frontApiToken();

    /**
     * @return an OAuth credential authorized for Gmail label and message modification
     * @throws MissingCredentialsException if client secrets or the stored token are missing
     */
    Credential gmailCredential();
}
