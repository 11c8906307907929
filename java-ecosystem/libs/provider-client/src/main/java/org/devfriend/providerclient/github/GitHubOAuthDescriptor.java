package org.devfriend.providerclient.github;

import org.devfriend.core.model.integration.EOAuthProvider;
import org.devfriend.providerclient.oauth.AbstractOAuthProviderDescriptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * GitHub OAuth App. Errors come back as HTTP 200 with an {@code error} field. Classic OAuth App
 * tokens carry no expiry and no refresh token; expiring user tokens (opt-in) do.
 */
@Component
public class GitHubOAuthDescriptor extends AbstractOAuthProviderDescriptor {

    private final String authorizeUrl;
    private final String tokenUrl;

    public GitHubOAuthDescriptor(
            @Value("${devfriend.oauth.github.authorize-url:" + GitHubConfig.OAUTH_AUTHORIZE_URL + "}") String authorizeUrl,
            @Value("${devfriend.oauth.github.token-url:" + GitHubConfig.OAUTH_TOKEN_URL + "}") String tokenUrl
    ) {
        super(EOAuthProvider.GITHUB);
        this.authorizeUrl = authorizeUrl;
        this.tokenUrl = tokenUrl;
    }

    @Override
    public String getAuthorizeUrl() {
        return authorizeUrl;
    }

    @Override
    public String getTokenUrl() {
        return tokenUrl;
    }

    @Override
    public List<String> getScopes() {
        return List.of("read:user", "repo", "notifications");
    }

    @Override
    protected Set<String> invalidGrantErrors() {
        return Set.of("bad_verification_code");
    }

    @Override
    protected Set<String> configMismatchErrors() {
        return Set.of("incorrect_client_credentials", "application_suspended");
    }

    @Override
    protected Set<String> revokedErrors() {
        return Set.of("bad_refresh_token");
    }
}
