package org.devfriend.providerclient.model;

import java.util.Map;

/**
 * Representative counters for an account, e.g. {@code unread_count} for Gmail or {@code repo_count} for GitHub.
 */
public record ProviderSummary(Map<String, Object> counts) {
}
