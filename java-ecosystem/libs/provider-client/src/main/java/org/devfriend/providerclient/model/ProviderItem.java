package org.devfriend.providerclient.model;

import java.util.Map;

/**
 * One email, repository, message or channel.
 *
 * @param id         provider id
 * @param title      subject, repository full name, channel name or message text
 * @param summary    snippet or description, may be {@code null}
 * @param author     sender or owner, may be {@code null}
 * @param url        link to the item on the provider, may be {@code null}
 * @param timestamp  provider timestamp as returned, may be {@code null}
 * @param attributes remaining provider specific fields
 */
public record ProviderItem(
        String id,
        String title,
        String summary,
        String author,
        String url,
        String timestamp,
        Map<String, Object> attributes
) {
}
