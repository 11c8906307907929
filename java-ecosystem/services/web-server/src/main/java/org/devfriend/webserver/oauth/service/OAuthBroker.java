package org.devfriend.webserver.oauth.service;

import okhttp3.HttpUrl;
import org.devfriend.core.model.integration.EOAuthProvider;
import org.devfriend.providerclient.oauth.OAuthConfig;
import org.devfriend.providerclient.oauth.OAuthProviderDescriptor;
import org.devfriend.providerclient.oauth.OAuthProviderRegistry;
import org.devfriend.providerclient.oauth.OAuthTokenClient;
import org.devfriend.providerclient.oauth.OAuthTokens;
import org.devfriend.webserver.credential.service.CredentialResolver;
import org.devfriend.webserver.exception.OAuthStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * One authorization-code flow for every provider, parameterized by {@link OAuthProviderDescriptor}.
 */
@Service
public class OAuthBroker {

    private static final Logger log = LoggerFactory.getLogger(OAuthBroker.class);

    /**
     * Outcome of a successful code exchange.
     *
     * @param userId   user the state token was issued to
     * @param provider provider that issued the tokens
     * @param config   OAuth application the code was redeemed with
     * @param tokens   issued tokens
     */
    public record AuthorizationResult(Long userId, EOAuthProvider provider, OAuthConfig config, OAuthTokens tokens) {
    }

    private final CredentialResolver credentialResolver;
    private final OAuthStateService oAuthStateService;
    private final OAuthProviderRegistry providerRegistry;
    private final OAuthTokenClient tokenClient;

    public OAuthBroker(
            CredentialResolver credentialResolver,
            OAuthStateService oAuthStateService,
            OAuthProviderRegistry providerRegistry,
            OAuthTokenClient tokenClient
    ) {
        this.credentialResolver = credentialResolver;
        this.oAuthStateService = oAuthStateService;
        this.providerRegistry = providerRegistry;
        this.tokenClient = tokenClient;
    }

    /**
     * @throws org.devfriend.webserver.exception.NoOAuthConfigException when no OAuth application is configured
     */
    public String buildAuthorizeUrl(Long userId, EOAuthProvider provider) {
        AuthorizationFlow flow = AuthorizationFlow.begin(provider);
        try {
            OAuthConfig config = credentialResolver.resolve(userId, provider);
            OAuthProviderDescriptor descriptor = providerRegistry.get(provider);

            HttpUrl.Builder url = HttpUrl.get(descriptor.getAuthorizeUrl()).newBuilder()
                    .addQueryParameter("client_id", config.clientId())
                    .addQueryParameter("redirect_uri", config.redirectUri())
                    .addQueryParameter("response_type", "code")
                    .addQueryParameter("scope", String.join(descriptor.getScopeSeparator(), descriptor.getScopes()))
                    .addQueryParameter("state", oAuthStateService.generateState(provider, userId));
            descriptor.getExtraAuthorizeParameters().forEach(url::addQueryParameter);

            flow.authorizeUrlIssued();
            log.info("Issued {} authorize URL for user {} ({} credentials)", provider.getId(), userId,
                    config.isUserSupplied() ? "user" : "system");
            return url.build().toString();
        } catch (RuntimeException e) {
            flow.fail(e.getMessage());
            throw e;
        }
    }

    /**
     * Validates the state token, re-resolves the OAuth application and redeems the code.
     *
     * @param expectedProvider provider named by the callback path; a state issued for another provider is rejected
     * @throws OAuthStateException                                             state missing, forged, expired or for another provider
     * @throws org.devfriend.providerclient.oauth.InvalidGrantException        code expired or reused
     * @throws org.devfriend.providerclient.oauth.ConfigMismatchException      client credentials rejected
     * @throws org.devfriend.providerclient.ProviderUnavailableException        network failure or 5xx
     */
    public AuthorizationResult exchangeCode(EOAuthProvider expectedProvider, String state, String code) {
        AuthorizationFlow flow = AuthorizationFlow.resume(expectedProvider);
        try {
            OAuthStateService.ValidatedState validated = oAuthStateService.validate(state);
            if (validated.provider() != expectedProvider) {
                throw new OAuthStateException("OAuth state was issued for " + validated.provider().getId());
            }
            if (code == null || code.isBlank()) {
                throw new IllegalArgumentException("Authorization code is missing");
            }
            flow.codeReceived();

            OAuthConfig config = credentialResolver.resolve(validated.userId(), expectedProvider);
            OAuthTokens tokens = tokenClient.exchangeCode(providerRegistry.get(expectedProvider), config, code);
            flow.tokensExchanged();

            log.info("Exchanged {} authorization code for user {}", expectedProvider.getId(), validated.userId());
            return new AuthorizationResult(validated.userId(), expectedProvider, config, tokens);
        } catch (RuntimeException e) {
            flow.fail(e.getClass().getSimpleName());
            throw e;
        }
    }

    /**
     * @throws org.devfriend.providerclient.oauth.RefreshRevokedException refresh token revoked or expired
     * @throws org.devfriend.providerclient.ProviderUnavailableException   network failure or 5xx
     */
    public OAuthTokens refresh(OAuthConfig config, String refreshToken) {
        return tokenClient.refresh(providerRegistry.get(config.provider()), config, refreshToken);
    }
}
