package org.devfriend.providerclient.oauth;

import com.fasterxml.jackson.databind.JsonNode;
import org.devfriend.core.model.integration.EOAuthProvider;

import java.util.List;
import java.util.Map;

/**
 * Everything that differs between OAuth dialects: endpoints, scopes, response shape and error vocabulary.
 * The authorization flow itself is provider independent and driven from these descriptors.
 */
public interface OAuthProviderDescriptor {

    EOAuthProvider getProvider();

    String getAuthorizeUrl();

    String getTokenUrl();

    List<String> getScopes();

    /**
     * Separator used to join scopes in the authorize URL.
     */
    default String getScopeSeparator() {
        return " ";
    }

    /**
     * Provider specific authorize parameters beyond client_id, redirect_uri, scope, state and response_type.
     */
    default Map<String, String> getExtraAuthorizeParameters() {
        return Map.of();
    }

    /**
     * Extracts the OAuth error code from a token endpoint payload, or {@code null} if the payload is a success.
     */
    String extractError(JsonNode body);

    /**
     * Parses a successful token endpoint payload.
     */
    OAuthTokens parseTokens(JsonNode body);

    /**
     * Maps a provider error to the typed failure for the given phase, or {@code null}
     * when the error says nothing about the grant or the client credentials.
     */
    OAuthProviderException classifyError(EOAuthPhase phase, String errorCode, String description, int httpStatus);
}
