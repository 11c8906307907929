package org.devfriend.providerclient.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Headers;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.devfriend.providerclient.HttpClientFactory;
import org.devfriend.providerclient.ProviderClientException;
import org.devfriend.providerclient.ProviderUnavailableException;
import org.devfriend.providerclient.TokenRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Shared GET plumbing and HTTP status classification for the data clients.
 */
public abstract class AbstractProviderDataClient implements ProviderDataClient {
    private static final Logger log = LoggerFactory.getLogger(AbstractProviderDataClient.class);

    protected final HttpClientFactory httpClientFactory;
    protected final ObjectMapper objectMapper;

    protected AbstractProviderDataClient(HttpClientFactory httpClientFactory) {
        this.httpClientFactory = httpClientFactory;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Headers sent with every request besides the bearer token.
     */
    protected Map<String, String> defaultHeaders() {
        return Map.of("Accept", "application/json");
    }

    protected JsonNode get(String accessToken, String url, String operation) {
        return getWithHeaders(accessToken, url, operation).body();
    }

    protected JsonResponse getWithHeaders(String accessToken, String url, String operation) {
        OkHttpClient client = httpClientFactory.createClientWithBearerToken(accessToken, defaultHeaders());
        Request request = new Request.Builder().url(url).get().build();

        try (Response response = client.newCall(request).execute()) {
            return new JsonResponse(handleResponse(operation, response), response.headers());
        } catch (IOException e) {
            log.warn("{} {} failed: {}", getServiceType().getId(), operation, e.getMessage());
            throw new ProviderUnavailableException(
                    getServiceType().getId() + " unreachable during " + operation + ": " + e.getMessage(), e);
        }
    }

    /**
     * Classifies the HTTP status and parses the body. Slack overrides this to inspect its {@code ok} flag.
     */
    protected JsonNode handleResponse(String operation, Response response) throws IOException {
        ResponseBody body = response.body();
        String payload = body != null ? body.string() : "";

        if (response.code() == 401) {
            throw new TokenRejectedException(getServiceType().getId() + " rejected the access token during " + operation);
        }
        if (response.code() == 429 || response.code() >= 500) {
            throw new ProviderUnavailableException(
                    getServiceType().getId() + " returned HTTP " + response.code() + " during " + operation);
        }
        if (!response.isSuccessful()) {
            throw new ProviderClientException(operation, response.code(), payload);
        }
        return payload.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(payload);
    }

    protected record JsonResponse(JsonNode body, Headers headers) {
    }

    protected static String getTextOrNull(JsonNode node, String field) {
        return node != null && node.has(field) && !node.get(field).isNull() ? node.get(field).asText() : null;
    }
}
