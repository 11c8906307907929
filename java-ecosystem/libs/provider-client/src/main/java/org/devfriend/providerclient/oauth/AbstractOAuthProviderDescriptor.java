package org.devfriend.providerclient.oauth;

import com.fasterxml.jackson.databind.JsonNode;
import org.devfriend.core.model.integration.EOAuthProvider;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * RFC 6749 shaped token responses. Subclasses only declare endpoints, scopes and error vocabularies.
 */
public abstract class AbstractOAuthProviderDescriptor implements OAuthProviderDescriptor {

    private static final Set<String> COMMON_CONFIG_ERRORS = Set.of(
            "invalid_client", "unauthorized_client", "redirect_uri_mismatch"
    );

    private final EOAuthProvider provider;

    protected AbstractOAuthProviderDescriptor(EOAuthProvider provider) {
        this.provider = provider;
    }

    @Override
    public EOAuthProvider getProvider() {
        return provider;
    }

    /**
     * Error codes meaning the authorization code cannot be redeemed.
     */
    protected abstract Set<String> invalidGrantErrors();

    /**
     * Error codes meaning the client credentials or redirect URI are wrong.
     */
    protected abstract Set<String> configMismatchErrors();

    /**
     * Error codes meaning the refresh token is dead.
     */
    protected abstract Set<String> revokedErrors();

    @Override
    public String extractError(JsonNode body) {
        if (body == null) {
            return null;
        }
        JsonNode error = body.get("error");
        if (error == null || error.isNull()) {
            return null;
        }
        if (error.isObject()) {
            return error.path("status").asText(error.path("message").asText("unknown_error"));
        }
        return error.asText();
    }

    @Override
    public OAuthTokens parseTokens(JsonNode body) {
        return new OAuthTokens(
                getTextOrNull(body, "access_token"),
                getTextOrNull(body, "refresh_token"),
                expiresAt(body),
                getTextOrNull(body, "scope"),
                Map.of()
        );
    }

    @Override
    public OAuthProviderException classifyError(EOAuthPhase phase, String errorCode, String description, int httpStatus) {
        String message = provider.getId() + " rejected the " + phaseLabel(phase) + ": " + errorCode
                + (description == null || description.isBlank() ? "" : " (" + description + ")");

        if (COMMON_CONFIG_ERRORS.contains(errorCode) || configMismatchErrors().contains(errorCode)) {
            return new ConfigMismatchException(provider, errorCode, message);
        }
        if (phase == EOAuthPhase.REFRESH) {
            if (revokedErrors().contains(errorCode)) {
                return new RefreshRevokedException(provider, errorCode, message);
            }
            return null;
        }
        if (invalidGrantErrors().contains(errorCode)) {
            return new InvalidGrantException(provider, errorCode, message);
        }
        return httpStatus == 401
                ? new ConfigMismatchException(provider, errorCode, message)
                : new InvalidGrantException(provider, errorCode, message);
    }

    protected Instant expiresAt(JsonNode body) {
        JsonNode expiresIn = body.get("expires_in");
        if (expiresIn == null || expiresIn.isNull() || expiresIn.asLong() <= 0) {
            return null;
        }
        return Instant.now().plusSeconds(expiresIn.asLong());
    }

    protected static String getTextOrNull(JsonNode node, String field) {
        return node != null && node.has(field) && !node.get(field).isNull() && !node.get(field).asText().isEmpty()
                ? node.get(field).asText()
                : null;
    }

    private static String phaseLabel(EOAuthPhase phase) {
        return phase == EOAuthPhase.REFRESH ? "token refresh" : "authorization code";
    }
}
