package org.devfriend.core.model.integration;

import org.devfriend.core.model.secret.EServiceType;

import java.util.Locale;

/**
 * OAuth authorization servers, identified the way they appear in {@code /auth/{provider}/...} paths.
 */
public enum EOAuthProvider {
    GOOGLE("google", EServiceType.GMAIL),
    GITHUB("github", EServiceType.GITHUB),
    SLACK("slack", EServiceType.SLACK);

    private final String id;
    private final EServiceType serviceType;

    EOAuthProvider(String id, EServiceType serviceType) {
        this.id = id;
        this.serviceType = serviceType;
    }

    public String getId() {
        return id;
    }

    public EServiceType getServiceType() {
        return serviceType;
    }

    public static EOAuthProvider fromId(String providerId) {
        if (providerId == null) {
            throw new IllegalArgumentException("Provider ID cannot be null");
        }

        String normalized = providerId.trim().toLowerCase(Locale.ENGLISH);
        if ("gmail".equals(normalized) || "email".equals(normalized)) {
            return GOOGLE;
        }
        for (EOAuthProvider provider : values()) {
            if (provider.id.equals(normalized)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown OAuth provider: " + providerId);
    }

    public static EOAuthProvider forServiceType(EServiceType serviceType) {
        for (EOAuthProvider provider : values()) {
            if (provider.serviceType == serviceType) {
                return provider;
            }
        }
        throw new IllegalArgumentException("No OAuth provider for service type: " + serviceType);
    }
}
