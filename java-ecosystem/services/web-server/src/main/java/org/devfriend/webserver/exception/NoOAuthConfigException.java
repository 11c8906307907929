package org.devfriend.webserver.exception;

import org.devfriend.core.model.integration.EOAuthProvider;

/**
 * Neither a usable user credential nor a system default exists for the provider.
 */
public class NoOAuthConfigException extends RuntimeException {

    private final EOAuthProvider provider;

    public NoOAuthConfigException(EOAuthProvider provider) {
        super("No OAuth configuration for " + provider.getId()
                + ". Save a secret with client_id and client_secret or ask an administrator to configure defaults.");
        this.provider = provider;
    }

    public EOAuthProvider getProvider() {
        return provider;
    }
}
