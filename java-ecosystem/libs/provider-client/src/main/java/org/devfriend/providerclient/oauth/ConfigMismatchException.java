package org.devfriend.providerclient.oauth;

import org.devfriend.core.model.integration.EOAuthProvider;

/**
 * Provider rejected the client id, client secret or redirect URI. Usually a stale user credential.
 */
public class ConfigMismatchException extends OAuthProviderException {

    public ConfigMismatchException(EOAuthProvider provider, String errorCode, String message) {
        super(provider, errorCode, message);
    }
}
