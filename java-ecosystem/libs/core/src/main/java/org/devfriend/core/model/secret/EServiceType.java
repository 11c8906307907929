package org.devfriend.core.model.secret;

import java.util.List;
import java.util.Locale;

/**
 * Closed set of services a secret or an integration can belong to.
 * Each type declares the secret-bundle keys a user-supplied credential is expected to carry.
 */
public enum EServiceType {
    GITHUB("github", List.of("client_id", "client_secret")),
    GMAIL("gmail", List.of("client_id", "client_secret")),
    SLACK("slack", List.of("client_id", "client_secret")),
    CUSTOM("custom", List.of());

    private final String id;
    private final List<String> expectedFields;

    EServiceType(String id, List<String> expectedFields) {
        this.id = id;
        this.expectedFields = expectedFields;
    }

    public String getId() {
        return id;
    }

    public List<String> getExpectedFields() {
        return expectedFields;
    }

    /**
     * Parses a service type id. {@code email} is accepted as an alias of {@link #GMAIL}.
     */
    public static EServiceType fromId(String serviceTypeId) {
        if (serviceTypeId == null) {
            throw new IllegalArgumentException("Service type cannot be null");
        }

        String normalized = serviceTypeId.trim().toLowerCase(Locale.ENGLISH);
        if ("email".equals(normalized) || "google".equals(normalized)) {
            return GMAIL;
        }
        for (EServiceType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown service type: " + serviceTypeId);
    }
}
