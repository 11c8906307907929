package org.devfriend.providerclient.oauth;

import org.devfriend.core.model.integration.EOAuthProvider;

/**
 * OAuth application credentials resolved for one request.
 *
 * @param provider     authorization server the credentials belong to
 * @param clientId     OAuth client id
 * @param clientSecret OAuth client secret
 * @param redirectUri  callback registered with the provider
 * @param secretId     id of the user secret the credentials came from, {@code null} for the system default
 */
public record OAuthConfig(
        EOAuthProvider provider,
        String clientId,
        String clientSecret,
        String redirectUri,
        Long secretId
) {
    public boolean isUserSupplied() {
        return secretId != null;
    }

    @Override
    public String toString() {
        return "OAuthConfig[provider=" + provider + ", clientId=" + clientId
                + ", redirectUri=" + redirectUri + ", secretId=" + secretId + "]";
    }
}
