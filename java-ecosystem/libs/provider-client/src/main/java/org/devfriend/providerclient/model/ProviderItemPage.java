package org.devfriend.providerclient.model;

import java.util.List;

/**
 * @param items         page content
 * @param nextPageToken cursor for the following page, {@code null} on the last page
 */
public record ProviderItemPage(List<ProviderItem> items, String nextPageToken) {

    public boolean hasNext() {
        return nextPageToken != null;
    }
}
