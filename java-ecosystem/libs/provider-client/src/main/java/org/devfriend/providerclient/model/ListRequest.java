package org.devfriend.providerclient.model;

/**
 * Paging parameters for a list call.
 *
 * @param kind      what to list
 * @param pageToken opaque cursor from a previous {@link ProviderItemPage#nextPageToken()}, {@code null} for the first page
 * @param pageSize  requested page size; clients clamp it to the provider maximum
 * @param filter    provider specific narrowing: Gmail search query, Slack channel id
 */
public record ListRequest(EListKind kind, String pageToken, Integer pageSize, String filter) {

    public static ListRequest firstPage(EListKind kind) {
        return new ListRequest(kind, null, null, null);
    }

    public int pageSizeOr(int defaultSize, int maxSize) {
        if (pageSize == null || pageSize <= 0) {
            return defaultSize;
        }
        return Math.min(pageSize, maxSize);
    }
}
