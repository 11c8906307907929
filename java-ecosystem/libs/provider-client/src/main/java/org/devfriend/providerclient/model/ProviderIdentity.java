package org.devfriend.providerclient.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Account behind an access token, used for display in the integration config.
 *
 * @param accountId   provider account id
 * @param login       username, email address or workspace handle
 * @param displayName human readable name
 * @param attributes  extra provider fields stored verbatim in the integration config
 */
public record ProviderIdentity(
        String accountId,
        String login,
        String displayName,
        Map<String, Object> attributes
) {
    public Map<String, Object> toConfig() {
        Map<String, Object> config = new LinkedHashMap<>();
        if (accountId != null) {
            config.put("account_id", accountId);
        }
        if (login != null) {
            config.put("account_login", login);
        }
        if (displayName != null) {
            config.put("account_name", displayName);
        }
        if (attributes != null) {
            config.putAll(attributes);
        }
        return config;
    }
}
