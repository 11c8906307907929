package org.devfriend.providerclient.slack;

import com.fasterxml.jackson.databind.JsonNode;
import org.devfriend.core.model.integration.EOAuthProvider;
import org.devfriend.providerclient.oauth.AbstractOAuthProviderDescriptor;
import org.devfriend.providerclient.oauth.OAuthTokens;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Slack OAuth v2. Every answer is HTTP 200 with an {@code ok} flag, scopes are comma separated,
 * and refresh tokens exist only when token rotation is enabled for the app.
 */
@Component
public class SlackOAuthDescriptor extends AbstractOAuthProviderDescriptor {

    private final String authorizeUrl;
    private final String tokenUrl;

    public SlackOAuthDescriptor(
            @Value("${devfriend.oauth.slack.authorize-url:" + SlackConfig.OAUTH_AUTHORIZE_URL + "}") String authorizeUrl,
            @Value("${devfriend.oauth.slack.token-url:" + SlackConfig.OAUTH_TOKEN_URL + "}") String tokenUrl
    ) {
        super(EOAuthProvider.SLACK);
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
        return List.of(
                "channels:read", "channels:history", "team:read",
                "groups:read", "groups:history", "im:history", "mpim:history"
        );
    }

    @Override
    public String getScopeSeparator() {
        return ",";
    }

    @Override
    public String extractError(JsonNode body) {
        if (body == null) {
            return null;
        }
        if (body.has("ok") && !body.get("ok").asBoolean()) {
            return body.path("error").asText("unknown_error");
        }
        return super.extractError(body);
    }

    @Override
    public OAuthTokens parseTokens(JsonNode body) {
        OAuthTokens tokens = super.parseTokens(body);

        Map<String, Object> attributes = new LinkedHashMap<>();
        JsonNode team = body.path("team");
        if (team.hasNonNull("id")) {
            attributes.put("team_id", team.get("id").asText());
        }
        if (team.hasNonNull("name")) {
            attributes.put("team_name", team.get("name").asText());
        }
        JsonNode authedUser = body.path("authed_user");
        if (authedUser.hasNonNull("id")) {
            attributes.put("authed_user_id", authedUser.get("id").asText());
        }

        return new OAuthTokens(tokens.accessToken(), tokens.refreshToken(), tokens.expiresAt(), tokens.scope(), attributes);
    }

    @Override
    protected Set<String> invalidGrantErrors() {
        return Set.of("invalid_code", "code_already_used", "code_expired", "oauth_authorization_url_mismatch");
    }

    @Override
    protected Set<String> configMismatchErrors() {
        return Set.of("invalid_client_id", "bad_client_secret", "bad_redirect_uri");
    }

    @Override
    protected Set<String> revokedErrors() {
        return Set.of("invalid_refresh_token", "token_revoked", "invalid_grant", "token_expired");
    }
}
