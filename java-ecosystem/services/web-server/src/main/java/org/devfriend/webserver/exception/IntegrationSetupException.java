package org.devfriend.webserver.exception;

/**
 * Tokens were issued and stored, but the integration record could not be written.
 */
public class IntegrationSetupException extends RuntimeException {

    private final Long tokenSecretId;

    public IntegrationSetupException(Long tokenSecretId, Throwable cause) {
        super("Tokens stored in secret " + tokenSecretId + " but the integration could not be saved", cause);
        this.tokenSecretId = tokenSecretId;
    }

    public Long getTokenSecretId() {
        return tokenSecretId;
    }
}
