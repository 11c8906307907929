package org.devfriend.providerclient.slack;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.HttpUrl;
import okhttp3.Response;
import org.devfriend.core.model.secret.EServiceType;
import org.devfriend.providerclient.HttpClientFactory;
import org.devfriend.providerclient.ProviderClientException;
import org.devfriend.providerclient.ProviderUnavailableException;
import org.devfriend.providerclient.TokenRejectedException;
import org.devfriend.providerclient.model.EListKind;
import org.devfriend.providerclient.model.ListRequest;
import org.devfriend.providerclient.model.ProviderIdentity;
import org.devfriend.providerclient.model.ProviderItem;
import org.devfriend.providerclient.model.ProviderItemPage;
import org.devfriend.providerclient.model.ProviderSummary;
import org.devfriend.providerclient.sync.AbstractProviderDataClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Slack Web API. Failures arrive as HTTP 200 with {@code ok=false}, so the status check is done on the body.
 */
@Component
public class SlackDataClient extends AbstractProviderDataClient {

    private static final Set<String> TOKEN_ERRORS = Set.of(
            "invalid_auth", "not_authed", "token_revoked", "token_expired", "account_inactive"
    );
    private static final String CONVERSATION_TYPES = "public_channel,private_channel";

    private final HttpUrl apiBase;

    public SlackDataClient(
            HttpClientFactory httpClientFactory,
            @Value("${devfriend.providers.slack.api-base:" + SlackConfig.API_BASE + "}") String apiBase
    ) {
        super(httpClientFactory);
        this.apiBase = HttpUrl.get(apiBase);
    }

    @Override
    public EServiceType getServiceType() {
        return EServiceType.SLACK;
    }

    @Override
    public Set<EListKind> getSupportedLists() {
        return Set.of(EListKind.CHANNELS, EListKind.MESSAGES);
    }

    @Override
    public ProviderIdentity fetchIdentity(String accessToken) {
        JsonNode auth = get(accessToken, url("auth.test").build().toString(), "auth.test");

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("team_id", getTextOrNull(auth, "team_id"));
        attributes.put("team_name", getTextOrNull(auth, "team"));
        attributes.put("workspace_url", getTextOrNull(auth, "url"));

        return new ProviderIdentity(
                getTextOrNull(auth, "user_id"),
                getTextOrNull(auth, "user"),
                getTextOrNull(auth, "team"),
                attributes
        );
    }

    @Override
    public ProviderSummary fetchSummary(String accessToken) {
        String channelsUrl = url("conversations.list")
                .addQueryParameter("types", CONVERSATION_TYPES)
                .addQueryParameter("exclude_archived", "true")
                .addQueryParameter("limit", "200")
                .build().toString();
        JsonNode channels = get(accessToken, channelsUrl, "conversations.list");

        int total = 0;
        int member = 0;
        for (JsonNode channel : channels.path("channels")) {
            total++;
            if (channel.path("is_member").asBoolean(false)) {
                member++;
            }
        }

        Map<String, Object> counts = new LinkedHashMap<>();
        counts.put("channel_count", total);
        counts.put("member_channel_count", member);
        return new ProviderSummary(counts);
    }

    @Override
    public ProviderItemPage fetchList(String accessToken, ListRequest request) {
        int limit = request.pageSizeOr(SlackConfig.DEFAULT_PAGE_SIZE, SlackConfig.MAX_PAGE_SIZE);
        return request.kind() == EListKind.CHANNELS
                ? listChannels(accessToken, request, limit)
                : listMessages(accessToken, request, limit);
    }

    private ProviderItemPage listChannels(String accessToken, ListRequest request, int limit) {
        HttpUrl.Builder channelsUrl = url("conversations.list")
                .addQueryParameter("types", CONVERSATION_TYPES)
                .addQueryParameter("exclude_archived", "true")
                .addQueryParameter("limit", String.valueOf(limit));
        if (request.pageToken() != null) {
            channelsUrl.addQueryParameter("cursor", request.pageToken());
        }

        JsonNode body = get(accessToken, channelsUrl.build().toString(), "conversations.list");
        List<ProviderItem> items = new ArrayList<>();
        for (JsonNode channel : body.path("channels")) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("is_private", channel.path("is_private").asBoolean(false));
            attributes.put("is_member", channel.path("is_member").asBoolean(false));
            attributes.put("num_members", channel.path("num_members").asLong(0));

            items.add(new ProviderItem(
                    getTextOrNull(channel, "id"),
                    getTextOrNull(channel, "name"),
                    getTextOrNull(channel.path("purpose"), "value"),
                    getTextOrNull(channel, "creator"),
                    null,
                    getTextOrNull(channel, "created"),
                    attributes
            ));
        }
        return new ProviderItemPage(items, nextCursor(body));
    }

    private ProviderItemPage listMessages(String accessToken, ListRequest request, int limit) {
        if (request.filter() == null || request.filter().isBlank()) {
            throw new IllegalArgumentException("channel_id is required to list Slack messages");
        }
        HttpUrl.Builder historyUrl = url("conversations.history")
                .addQueryParameter("channel", request.filter())
                .addQueryParameter("limit", String.valueOf(limit));
        if (request.pageToken() != null) {
            historyUrl.addQueryParameter("cursor", request.pageToken());
        }

        JsonNode body = get(accessToken, historyUrl.build().toString(), "conversations.history");
        List<ProviderItem> items = new ArrayList<>();
        for (JsonNode message : body.path("messages")) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("channel_id", request.filter());
            attributes.put("type", getTextOrNull(message, "type"));
            attributes.put("reply_count", message.path("reply_count").asLong(0));

            items.add(new ProviderItem(
                    getTextOrNull(message, "ts"),
                    getTextOrNull(message, "text"),
                    null,
                    getTextOrNull(message, "user"),
                    null,
                    getTextOrNull(message, "ts"),
                    attributes
            ));
        }
        return new ProviderItemPage(items, nextCursor(body));
    }

    @Override
    protected JsonNode handleResponse(String operation, Response response) throws IOException {
        JsonNode body = super.handleResponse(operation, response);
        if (body.path("ok").asBoolean(true)) {
            return body;
        }

        String error = body.path("error").asText("unknown_error");
        if (TOKEN_ERRORS.contains(error)) {
            throw new TokenRejectedException("slack rejected the access token during " + operation + ": " + error);
        }
        if ("ratelimited".equals(error) || "service_unavailable".equals(error) || "fatal_error".equals(error)) {
            throw new ProviderUnavailableException("slack unavailable during " + operation + ": " + error);
        }
        throw new ProviderClientException(operation, response.code(), error);
    }

    private static String nextCursor(JsonNode body) {
        String cursor = body.path("response_metadata").path("next_cursor").asText("");
        return cursor.isBlank() ? null : cursor;
    }

    private HttpUrl.Builder url(String method) {
        return apiBase.newBuilder().addPathSegment(method);
    }
}
