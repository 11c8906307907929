package org.devfriend.providerclient.oauth;

import org.devfriend.core.model.integration.EOAuthProvider;

/**
 * Refresh token is revoked or expired. Only a new user consent can restore access.
 */
public class RefreshRevokedException extends OAuthProviderException {

    public RefreshRevokedException(EOAuthProvider provider, String errorCode, String message) {
        super(provider, errorCode, message);
    }
}
