package org.devfriend.providerclient;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Derives per-token clients from the shared provider client, so all of them keep its
 * connection pool and timeouts.
 */
@Component
public class HttpClientFactory {
    private final OkHttpClient baseClient;

    public HttpClientFactory(OkHttpClient providerHttpClient) {
        this.baseClient = providerHttpClient;
    }

    public OkHttpClient getBaseClient() {
        return baseClient;
    }

    public OkHttpClient createClientWithBearerToken(String accessToken) {
        return createClientWithBearerToken(accessToken, Map.of());
    }

    /**
     * @param extraHeaders provider specific headers added to every request (e.g. GitHub API version)
     */
    public OkHttpClient createClientWithBearerToken(String accessToken, Map<String, String> extraHeaders) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token cannot be null or empty");
        }

        return baseClient.newBuilder()
                .addInterceptor(chain -> {
                    Request.Builder authorized = chain.request().newBuilder()
                            .header("Authorization", "Bearer " + accessToken);
                    extraHeaders.forEach(authorized::header);
                    return chain.proceed(authorized.build());
                })
                .build();
    }
}
