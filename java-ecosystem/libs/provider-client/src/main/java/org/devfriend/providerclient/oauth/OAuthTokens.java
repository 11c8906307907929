package org.devfriend.providerclient.oauth;

import java.time.Instant;
import java.util.Map;

/**
 * Result of a code exchange or a refresh.
 *
 * @param accessToken  bearer token for API calls
 * @param refreshToken refresh token, {@code null} when the provider did not issue (or rotate) one
 * @param expiresAt    absolute expiry, {@code null} for non-expiring tokens
 * @param scope        granted scopes as returned by the provider
 * @param attributes   extra provider data worth keeping (e.g. Slack team)
 */
public record OAuthTokens(
        String accessToken,
        String refreshToken,
        Instant expiresAt,
        String scope,
        Map<String, Object> attributes
) {
    @Override
    public String toString() {
        return "OAuthTokens[expiresAt=" + expiresAt + ", scope=" + scope
                + ", hasRefreshToken=" + (refreshToken != null) + "]";
    }
}
