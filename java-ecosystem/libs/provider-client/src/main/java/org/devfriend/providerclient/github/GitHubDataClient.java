package org.devfriend.providerclient.github;

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
 * GitHub REST API for the authenticated user.
 */
@Component
public class GitHubDataClient extends AbstractProviderDataClient {

    private final HttpUrl apiBase;

    public GitHubDataClient(
            HttpClientFactory httpClientFactory,
            @Value("${devfriend.providers.github.api-base:" + GitHubConfig.API_BASE + "}") String apiBase
    ) {
        super(httpClientFactory);
        this.apiBase = HttpUrl.get(apiBase);
    }

    @Override
    public EServiceType getServiceType() {
        return EServiceType.GITHUB;
    }

    @Override
    public Set<EListKind> getSupportedLists() {
        return Set.of(EListKind.REPOS);
    }

    @Override
    protected Map<String, String> defaultHeaders() {
        return Map.of(
                "Accept", GitHubConfig.ACCEPT_HEADER,
                GitHubConfig.API_VERSION_HEADER, GitHubConfig.API_VERSION
        );
    }

    @Override
    public ProviderIdentity fetchIdentity(String accessToken) {
        return parseUser(get(accessToken, url("user").build().toString(), "get current user"));
    }

    @Override
    public ProviderSummary fetchSummary(String accessToken) {
        JsonNode user = get(accessToken, url("user").build().toString(), "get current user");
        JsonNode notifications = get(accessToken,
                url("notifications").addQueryParameter("per_page", "50").build().toString(),
                "list notifications");

        Map<String, Object> counts = new LinkedHashMap<>();
        counts.put("repo_count", user.path("public_repos").asLong(0) + user.path("total_private_repos").asLong(0));
        counts.put("public_repos", user.path("public_repos").asLong(0));
        counts.put("private_repos", user.path("total_private_repos").asLong(0));
        counts.put("unread_notifications", notifications.isArray() ? notifications.size() : 0);
        return new ProviderSummary(counts);
    }

    @Override
    public ProviderItemPage fetchList(String accessToken, ListRequest request) {
        int pageSize = request.pageSizeOr(GitHubConfig.DEFAULT_PAGE_SIZE, GitHubConfig.MAX_PAGE_SIZE);
        int page = parsePage(request.pageToken());
        String reposUrl = url("user/repos")
                .addQueryParameter("per_page", String.valueOf(pageSize))
                .addQueryParameter("page", String.valueOf(page))
                .addQueryParameter("sort", "updated")
                .addQueryParameter("direction", "desc")
                .build().toString();

        JsonResponse response = getWithHeaders(accessToken, reposUrl, "list repositories");
        List<ProviderItem> items = new ArrayList<>();
        for (JsonNode node : response.body()) {
            items.add(parseRepository(node));
        }

        String linkHeader = response.headers().get("Link");
        boolean hasNext = linkHeader != null && linkHeader.contains("rel=\"next\"");
        return new ProviderItemPage(items, hasNext ? String.valueOf(page + 1) : null);
    }

    private ProviderIdentity parseUser(JsonNode node) {
        String login = getTextOrNull(node, "login");
        String name = getTextOrNull(node, "name");

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("username", login);
        attributes.put("avatar_url", getTextOrNull(node, "avatar_url"));
        attributes.put("html_url", getTextOrNull(node, "html_url"));
        attributes.put("email", getTextOrNull(node, "email"));

        return new ProviderIdentity(
                node.has("id") ? String.valueOf(node.get("id").asLong()) : null,
                login,
                name != null ? name : login,
                attributes
        );
    }

    private ProviderItem parseRepository(JsonNode node) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("private", node.path("private").asBoolean(false));
        attributes.put("language", getTextOrNull(node, "language"));
        attributes.put("stargazers_count", node.path("stargazers_count").asLong(0));
        attributes.put("default_branch", getTextOrNull(node, "default_branch"));

        return new ProviderItem(
                String.valueOf(node.path("id").asLong()),
                getTextOrNull(node, "full_name"),
                getTextOrNull(node, "description"),
                getTextOrNull(node.path("owner"), "login"),
                getTextOrNull(node, "html_url"),
                getTextOrNull(node, "updated_at"),
                attributes
        );
    }

    private static int parsePage(String pageToken) {
        if (pageToken == null || pageToken.isBlank()) {
            return 1;
        }
        try {
            return Math.max(1, Integer.parseInt(pageToken));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid page token: " + pageToken);
        }
    }

    private HttpUrl.Builder url(String segments) {
        return apiBase.newBuilder().addPathSegments(segments);
    }
}
