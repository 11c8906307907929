package org.devfriend.providerclient.oauth;

import org.devfriend.core.model.integration.EOAuthProvider;
import org.devfriend.providerclient.ProviderClientException;

/**
 * Token endpoint answered with an OAuth error the caller can act upon.
 */
public abstract class OAuthProviderException extends ProviderClientException {

    private final EOAuthProvider provider;
    private final String errorCode;

    protected OAuthProviderException(EOAuthProvider provider, String errorCode, String message) {
        super(message);
        this.provider = provider;
        this.errorCode = errorCode;
    }

    public EOAuthProvider getProvider() {
        return provider;
    }

    /**
     * Raw provider error code such as {@code invalid_grant} or {@code bad_verification_code}.
     */
    public String getErrorCode() {
        return errorCode;
    }
}
