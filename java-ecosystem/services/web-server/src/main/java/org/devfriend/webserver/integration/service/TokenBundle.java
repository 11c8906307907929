package org.devfriend.webserver.integration.service;

import org.devfriend.providerclient.oauth.OAuthTokens;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decrypted content of an issued-token secret.
 *
 * @param accessToken  current access token
 * @param refreshToken refresh token, {@code null} when the provider never granted one
 * @param tokenExpiry  access token expiry, {@code null} when the token does not expire
 * @param scope        granted scopes as reported by the provider
 * @param appSecretId  app credential secret the tokens were issued under, {@code null} for the system default
 */
public record TokenBundle(
        String accessToken,
        String refreshToken,
        Instant tokenExpiry,
        String scope,
        Long appSecretId
) {
    static final String ACCESS_TOKEN = "access_token";
    static final String REFRESH_TOKEN = "refresh_token";
    static final String TOKEN_EXPIRY = "token_expiry";
    static final String SCOPE = "scope";
    static final String APP_SECRET_ID = "app_secret_id";

    public static TokenBundle fromTokens(OAuthTokens tokens, Long appSecretId) {
        return new TokenBundle(tokens.accessToken(), tokens.refreshToken(), tokens.expiresAt(), tokens.scope(), appSecretId);
    }

    public static TokenBundle fromMap(Map<String, Object> values) {
        return new TokenBundle(
                asText(values.get(ACCESS_TOKEN)),
                asText(values.get(REFRESH_TOKEN)),
                parseExpiry(values.get(TOKEN_EXPIRY)),
                asText(values.get(SCOPE)),
                values.get(APP_SECRET_ID) instanceof Number number ? number.longValue() : null
        );
    }

    /**
     * Applies a refresh result. The refresh token is kept unless the provider rotated it.
     */
    public TokenBundle refreshedWith(OAuthTokens tokens) {
        return new TokenBundle(
                tokens.accessToken(),
                tokens.refreshToken() != null ? tokens.refreshToken() : refreshToken,
                tokens.expiresAt(),
                tokens.scope() != null ? tokens.scope() : scope,
                appSecretId
        );
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    public boolean isUsableAt(Instant now, Duration margin) {
        if (accessToken == null || accessToken.isBlank()) {
            return false;
        }
        return tokenExpiry == null || tokenExpiry.isAfter(now.plus(margin));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(ACCESS_TOKEN, accessToken);
        if (refreshToken != null) {
            values.put(REFRESH_TOKEN, refreshToken);
        }
        values.put(TOKEN_EXPIRY, tokenExpiry != null ? tokenExpiry.toString() : null);
        if (scope != null) {
            values.put(SCOPE, scope);
        }
        if (appSecretId != null) {
            values.put(APP_SECRET_ID, appSecretId);
        }
        return values;
    }

    private static Instant parseExpiry(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number epochSeconds) {
            return Instant.ofEpochSecond(epochSeconds.longValue());
        }
        try {
            return Instant.parse(value.toString());
        } catch (DateTimeParseException e) {
            // unreadable expiry forces a refresh
            return Instant.EPOCH;
        }
    }

    private static String asText(Object value) {
        return value != null ? value.toString() : null;
    }
}
