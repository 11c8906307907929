package org.devfriend.providerclient.oauth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.devfriend.providerclient.HttpClientFactory;
import org.devfriend.providerclient.ProviderClientException;
import org.devfriend.providerclient.ProviderUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Talks to provider token endpoints. One bounded attempt per call; failures are classified
 * into the typed exceptions of this package.
 */
@Component
public class OAuthTokenClient {
    private static final Logger log = LoggerFactory.getLogger(OAuthTokenClient.class);

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OAuthTokenClient(HttpClientFactory httpClientFactory) {
        this.httpClient = httpClientFactory.getBaseClient();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @throws InvalidGrantException        code expired, reused or unknown
     * @throws ConfigMismatchException      client credentials or redirect URI rejected
     * @throws ProviderUnavailableException network failure, timeout or 5xx
     */
    public OAuthTokens exchangeCode(OAuthProviderDescriptor descriptor, OAuthConfig config, String code) {
        FormBody body = new FormBody.Builder()
                .add("grant_type", "authorization_code")
                .add("client_id", config.clientId())
                .add("client_secret", config.clientSecret())
                .add("code", code)
                .add("redirect_uri", config.redirectUri())
                .build();

        return call(descriptor, EOAuthPhase.CODE_EXCHANGE, body);
    }

    /**
     * @throws RefreshRevokedException      refresh token revoked or expired
     * @throws ConfigMismatchException      client credentials rejected
     * @throws ProviderUnavailableException network failure, timeout or 5xx
     */
    public OAuthTokens refresh(OAuthProviderDescriptor descriptor, OAuthConfig config, String refreshToken) {
        FormBody body = new FormBody.Builder()
                .add("grant_type", "refresh_token")
                .add("client_id", config.clientId())
                .add("client_secret", config.clientSecret())
                .add("refresh_token", refreshToken)
                .build();

        return call(descriptor, EOAuthPhase.REFRESH, body);
    }

    private OAuthTokens call(OAuthProviderDescriptor descriptor, EOAuthPhase phase, FormBody body) {
        String providerId = descriptor.getProvider().getId();
        Request request = new Request.Builder()
                .url(descriptor.getTokenUrl())
                .header("Accept", "application/json")
                .post(body)
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String payload = responseBody != null ? responseBody.string() : "";

            if (response.code() >= 500 || response.code() == 429) {
                log.warn("{} token endpoint unavailable during {}: HTTP {}", providerId, phase, response.code());
                throw new ProviderUnavailableException(
                        providerId + " token endpoint returned HTTP " + response.code());
            }

            JsonNode json = parse(payload);
            String error = descriptor.extractError(json);
            if (error != null || !response.isSuccessful()) {
                String errorCode = error != null ? error : "http_" + response.code();
                String description = json != null ? json.path("error_description").asText("") : "";
                log.warn("{} token endpoint rejected {}: {} (HTTP {})", providerId, phase, errorCode, response.code());

                OAuthProviderException classified = descriptor.classifyError(phase, errorCode, description, response.code());
                if (classified != null) {
                    throw classified;
                }
                throw new ProviderClientException(phase.name().toLowerCase(), response.code(), errorCode);
            }

            if (json == null) {
                throw new ProviderClientException(providerId + " token endpoint returned an empty or non JSON body");
            }
            OAuthTokens tokens = descriptor.parseTokens(json);
            if (tokens.accessToken() == null) {
                throw new ProviderClientException(providerId + " token response did not contain an access token");
            }
            return tokens;
        } catch (IOException e) {
            log.warn("{} token endpoint call failed during {}: {}", providerId, phase, e.getMessage());
            throw new ProviderUnavailableException(providerId + " token endpoint unreachable: " + e.getMessage(), e);
        }
    }

    private JsonNode parse(String payload) {
        if (payload == null || payload.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("Token endpoint returned a non JSON body");
            return null;
        }
    }
}
