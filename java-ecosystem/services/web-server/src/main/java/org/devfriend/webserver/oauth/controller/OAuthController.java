package org.devfriend.webserver.oauth.controller;

import org.devfriend.core.model.integration.EOAuthProvider;
import org.devfriend.core.model.integration.Integration;
import org.devfriend.providerclient.ProviderClientException;
import org.devfriend.providerclient.ProviderUnavailableException;
import org.devfriend.providerclient.oauth.ConfigMismatchException;
import org.devfriend.providerclient.oauth.InvalidGrantException;
import org.devfriend.security.service.UserDetailsImpl;
import org.devfriend.webserver.config.OAuthClientProperties;
import org.devfriend.webserver.exception.IntegrationSetupException;
import org.devfriend.webserver.exception.NoOAuthConfigException;
import org.devfriend.webserver.exception.OAuthStateException;
import org.devfriend.webserver.integration.service.IntegrationManager;
import org.devfriend.webserver.oauth.service.OAuthBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Authorization-code flow endpoints. The callback is called by the user's browser coming back from the
 * provider, so it never answers with JSON: every outcome is a redirect to the frontend.
 */
@RestController
public class OAuthController {

    private static final Logger log = LoggerFactory.getLogger(OAuthController.class);

    private final OAuthBroker oAuthBroker;
    private final IntegrationManager integrationManager;
    private final OAuthClientProperties oAuthClientProperties;

    public OAuthController(
            OAuthBroker oAuthBroker,
            IntegrationManager integrationManager,
            OAuthClientProperties oAuthClientProperties
    ) {
        this.oAuthBroker = oAuthBroker;
        this.integrationManager = integrationManager;
        this.oAuthClientProperties = oAuthClientProperties;
    }

    @GetMapping("/auth/{provider}/authorize")
    public ResponseEntity<Map<String, String>> authorize(
            @AuthenticationPrincipal UserDetailsImpl userDetails,
            @PathVariable String provider
    ) {
        String authUrl = oAuthBroker.buildAuthorizeUrl(userDetails.getId(), EOAuthProvider.fromId(provider));
        return ResponseEntity.ok(Map.of("auth_url", authUrl));
    }

    @GetMapping("/auth/{provider}/callback")
    public ResponseEntity<Void> callback(
            @PathVariable String provider,
            @RequestParam(required = false) String code,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String error,
            @RequestParam(name = "error_description", required = false) String errorDescription
    ) {
        EOAuthProvider oAuthProvider;
        try {
            oAuthProvider = EOAuthProvider.fromId(provider);
        } catch (IllegalArgumentException e) {
            log.warn("OAuth callback for unknown provider {}", provider);
            return redirectWithError("unknown_provider");
        }

        if (error != null) {
            log.warn("{} callback error: {} - {}", oAuthProvider.getId(), error, errorDescription);
            return redirectWithError(error);
        }
        if (code == null || code.isBlank()) {
            return redirectWithError("missing_code");
        }

        OAuthBroker.AuthorizationResult result;
        try {
            result = oAuthBroker.exchangeCode(oAuthProvider, state, code);
        } catch (OAuthStateException e) {
            return redirectWithError("invalid_state");
        } catch (NoOAuthConfigException e) {
            return redirectWithError("no_oauth_config");
        } catch (InvalidGrantException e) {
            return redirectWithError("invalid_grant");
        } catch (ConfigMismatchException e) {
            return redirectWithError("config_mismatch");
        } catch (ProviderUnavailableException e) {
            return redirectWithError("provider_unavailable");
        } catch (ProviderClientException e) {
            log.warn("{} token exchange failed: {}", oAuthProvider.getId(), e.getMessage());
            return redirectWithError("token_exchange_failed");
        }

        try {
            Integration integration = integrationManager.connect(result);
            return redirect(Map.of(
                    "oauth_success", "true",
                    "integration_id", String.valueOf(integration.getId())
            ));
        } catch (IntegrationSetupException e) {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("oauth_success", "true");
            params.put("secret_id", String.valueOf(e.getTokenSecretId()));
            params.put("warning", "integration_failed");
            return redirect(params);
        } catch (RuntimeException e) {
            log.error("Failed to store {} tokens for user {}", oAuthProvider.getId(), result.userId(), e);
            return redirectWithError("server_error");
        }
    }

    @GetMapping("/oauth/redirect-uris")
    public ResponseEntity<Map<String, String>> redirectUris() {
        Map<String, String> uris = new LinkedHashMap<>();
        for (EOAuthProvider provider : EOAuthProvider.values()) {
            uris.put(provider.getId(), oAuthClientProperties.getRedirectUri(provider));
        }
        return ResponseEntity.ok(uris);
    }

    private ResponseEntity<Void> redirectWithError(String reason) {
        return redirect(Map.of("oauth_error", reason));
    }

    private ResponseEntity<Void> redirect(Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(oAuthClientProperties.getFrontendUrl() + "/");
        params.forEach(builder::queryParam);
        URI location = builder.encode().build().toUri();
        return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
    }
}
