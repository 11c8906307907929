package org.devfriend.webserver.exception;

import org.devfriend.core.model.integration.EOAuthProvider;

/**
 * The integration's tokens can no longer be used; the user has to go through consent again.
 */
public class ReauthRequiredException extends RuntimeException {

    private final Long integrationId;
    private final EOAuthProvider provider;

    public ReauthRequiredException(Long integrationId, EOAuthProvider provider, String reason) {
        super("Integration " + integrationId + " needs to be reconnected: " + reason);
        this.integrationId = integrationId;
        this.provider = provider;
    }

    public Long getIntegrationId() {
        return integrationId;
    }

    public EOAuthProvider getProvider() {
        return provider;
    }

    public String getReconnectUrl() {
        return "/auth/" + provider.getId() + "/authorize";
    }
}
