package org.devfriend.providerclient.google;

import org.devfriend.core.model.integration.EOAuthProvider;
import org.devfriend.providerclient.oauth.AbstractOAuthProviderDescriptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Google OAuth 2.0 for Gmail. {@code access_type=offline} plus {@code prompt=consent} makes Google
 * issue a refresh token on every consent, not only the first one.
 */
@Component
public class GoogleOAuthDescriptor extends AbstractOAuthProviderDescriptor {

    private final String authorizeUrl;
    private final String tokenUrl;

    public GoogleOAuthDescriptor(
            @Value("${devfriend.oauth.google.authorize-url:" + GoogleConfig.OAUTH_AUTHORIZE_URL + "}") String authorizeUrl,
            @Value("${devfriend.oauth.google.token-url:" + GoogleConfig.OAUTH_TOKEN_URL + "}") String tokenUrl
    ) {
        super(EOAuthProvider.GOOGLE);
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
        return List.of(GoogleConfig.GMAIL_READONLY_SCOPE);
    }

    @Override
    public Map<String, String> getExtraAuthorizeParameters() {
        return Map.of(
                "access_type", "offline",
                "prompt", "consent",
                "include_granted_scopes", "true"
        );
    }

    @Override
    protected Set<String> invalidGrantErrors() {
        return Set.of("invalid_grant");
    }

    @Override
    protected Set<String> configMismatchErrors() {
        return Set.of("deleted_client", "disabled_client");
    }

    @Override
    protected Set<String> revokedErrors() {
        return Set.of("invalid_grant");
    }
}
