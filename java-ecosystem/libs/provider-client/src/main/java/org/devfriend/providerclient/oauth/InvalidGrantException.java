package org.devfriend.providerclient.oauth;

import org.devfriend.core.model.integration.EOAuthProvider;

/**
 * Authorization code expired, was already used, or does not belong to this client. The flow must restart.
 */
public class InvalidGrantException extends OAuthProviderException {

    public InvalidGrantException(EOAuthProvider provider, String errorCode, String message) {
        super(provider, errorCode, message);
    }
}
