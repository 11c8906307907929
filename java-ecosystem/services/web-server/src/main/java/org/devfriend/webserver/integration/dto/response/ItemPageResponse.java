package org.devfriend.webserver.integration.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.devfriend.providerclient.model.ProviderItem;
import org.devfriend.providerclient.model.ProviderItemPage;

import java.util.List;

public record ItemPageResponse(
        @JsonProperty("items") List<ProviderItem> items,
        @JsonProperty("count") int count,
        @JsonProperty("next_page_token") String nextPageToken
) {
    public static ItemPageResponse fromPage(ProviderItemPage page) {
        return new ItemPageResponse(page.items(), page.items().size(), page.nextPageToken());
    }
}
