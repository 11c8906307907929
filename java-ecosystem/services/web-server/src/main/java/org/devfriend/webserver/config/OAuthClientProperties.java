package org.devfriend.webserver.config;

import org.devfriend.core.model.integration.EOAuthProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Process-wide OAuth application defaults and the public URLs the OAuth flow redirects through.
 */
@Component
public class OAuthClientProperties {

    /**
     * System default client id/secret pair for one provider.
     */
    public record ClientCredentials(String clientId, String clientSecret) {
        public boolean isComplete() {
            return clientId != null && !clientId.isBlank() && clientSecret != null && !clientSecret.isBlank();
        }
    }

    @Value("${devfriend.oauth.google.client-id:}")
    private String googleClientId;

    @Value("${devfriend.oauth.google.client-secret:}")
    private String googleClientSecret;

    @Value("${devfriend.oauth.github.client-id:}")
    private String githubClientId;

    @Value("${devfriend.oauth.github.client-secret:}")
    private String githubClientSecret;

    @Value("${devfriend.oauth.slack.client-id:}")
    private String slackClientId;

    @Value("${devfriend.oauth.slack.client-secret:}")
    private String slackClientSecret;

    @Value("${devfriend.frontend-url:http://localhost:88}")
    private String frontendUrl;

    @Value("${devfriend.backend-url:http://localhost:8888}")
    private String backendUrl;

    /**
     * @return the configured default, or empty when either half is missing
     */
    public Optional<ClientCredentials> getSystemDefault(EOAuthProvider provider) {
        ClientCredentials credentials = switch (provider) {
            case GOOGLE -> new ClientCredentials(googleClientId, googleClientSecret);
            case GITHUB -> new ClientCredentials(githubClientId, githubClientSecret);
            case SLACK -> new ClientCredentials(slackClientId, slackClientSecret);
        };
        return credentials.isComplete() ? Optional.of(credentials) : Optional.empty();
    }

    public String getRedirectUri(EOAuthProvider provider) {
        return stripTrailingSlash(backendUrl) + "/auth/" + provider.getId() + "/callback";
    }

    public String getFrontendUrl() {
        return stripTrailingSlash(frontendUrl);
    }

    private static String stripTrailingSlash(String url) {
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
