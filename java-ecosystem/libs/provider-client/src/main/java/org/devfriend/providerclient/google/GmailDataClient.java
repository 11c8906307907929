package org.devfriend.providerclient.google;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.HttpUrl;
import org.devfriend.core.model.secret.EServiceType;
import org.devfriend.providerclient.HttpClientFactory;
import org.devfriend.providerclient.model.EListKind;
import org.devfriend.providerclient.model.ListRequest;
import org.devfriend.providerclient.model.ProviderIdentity;
import org.devfriend.providerclient.model.ProviderItem;
import org.devfriend.providerclient.model.ProviderItemPage;
import org.devfriend.providerclient.model.ProviderSummary;
import org.devfriend.providerclient.sync.AbstractProviderDataClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gmail REST API v1, read only.
 */
@Component
public class GmailDataClient extends AbstractProviderDataClient {

    private final HttpUrl apiBase;

    public GmailDataClient(
            HttpClientFactory httpClientFactory,
            @Value("${devfriend.providers.gmail.api-base:" + GoogleConfig.GMAIL_API_BASE + "}") String apiBase
    ) {
        super(httpClientFactory);
        this.apiBase = HttpUrl.get(apiBase);
    }

    @Override
    public EServiceType getServiceType() {
        return EServiceType.GMAIL;
    }

    @Override
    public Set<EListKind> getSupportedLists() {
        return Set.of(EListKind.EMAILS);
    }

    @Override
    public ProviderIdentity fetchIdentity(String accessToken) {
        JsonNode profile = get(accessToken, url("profile").build().toString(), "get profile");
        String email = getTextOrNull(profile, "emailAddress");

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("email_address", email);
        return new ProviderIdentity(email, email, email, attributes);
    }

    @Override
    public ProviderSummary fetchSummary(String accessToken) {
        JsonNode inbox = get(accessToken, url("labels").addPathSegment("INBOX").build().toString(), "get inbox label");

        Map<String, Object> counts = new LinkedHashMap<>();
        counts.put("unread_count", inbox.path("messagesUnread").asLong(0));
        counts.put("total_count", inbox.path("messagesTotal").asLong(0));
        counts.put("unread_threads", inbox.path("threadsUnread").asLong(0));
        return new ProviderSummary(counts);
    }

    @Override
    public ProviderItemPage fetchList(String accessToken, ListRequest request) {
        int pageSize = request.pageSizeOr(GoogleConfig.DEFAULT_PAGE_SIZE, GoogleConfig.MAX_PAGE_SIZE);
        HttpUrl.Builder listUrl = url("messages")
                .addQueryParameter("maxResults", String.valueOf(pageSize))
                .addQueryParameter("labelIds", "INBOX");
        if (request.pageToken() != null) {
            listUrl.addQueryParameter("pageToken", request.pageToken());
        }
        if (request.filter() != null && !request.filter().isBlank()) {
            listUrl.addQueryParameter("q", request.filter());
        }

        JsonNode listing = get(accessToken, listUrl.build().toString(), "list messages");
        List<ProviderItem> items = new ArrayList<>();
        for (JsonNode ref : listing.path("messages")) {
            items.add(fetchMessage(accessToken, ref.path("id").asText()));
        }
        return new ProviderItemPage(items, getTextOrNull(listing, "nextPageToken"));
    }

    private ProviderItem fetchMessage(String accessToken, String messageId) {
        String messageUrl = url("messages").addPathSegment(messageId)
                .addQueryParameter("format", "metadata")
                .addQueryParameter("metadataHeaders", "Subject")
                .addQueryParameter("metadataHeaders", "From")
                .addQueryParameter("metadataHeaders", "Date")
                .build().toString();
        JsonNode message = get(accessToken, messageUrl, "get message");

        Map<String, String> headers = new LinkedHashMap<>();
        for (JsonNode header : message.path("payload").path("headers")) {
            headers.put(header.path("name").asText(), header.path("value").asText());
        }
        boolean unread = false;
        for (JsonNode label : message.path("labelIds")) {
            if ("UNREAD".equals(label.asText())) {
                unread = true;
            }
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("thread_id", getTextOrNull(message, "threadId"));
        attributes.put("unread", unread);

        return new ProviderItem(
                messageId,
                headers.getOrDefault("Subject", "(no subject)"),
                getTextOrNull(message, "snippet"),
                headers.get("From"),
                "https://mail.google.com/mail/u/0/#inbox/" + messageId,
                headers.get("Date"),
                attributes
        );
    }

    private HttpUrl.Builder url(String segment) {
        return apiBase.newBuilder().addPathSegments(segment);
    }
}
