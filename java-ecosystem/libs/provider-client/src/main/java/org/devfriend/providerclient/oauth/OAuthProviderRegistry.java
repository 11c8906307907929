package org.devfriend.providerclient.oauth;

import org.devfriend.core.model.integration.EOAuthProvider;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class OAuthProviderRegistry {
    private final Map<EOAuthProvider, OAuthProviderDescriptor> descriptors = new EnumMap<>(EOAuthProvider.class);

    public OAuthProviderRegistry(List<OAuthProviderDescriptor> descriptors) {
        for (OAuthProviderDescriptor descriptor : descriptors) {
            this.descriptors.put(descriptor.getProvider(), descriptor);
        }
    }

    public OAuthProviderDescriptor get(EOAuthProvider provider) {
        OAuthProviderDescriptor descriptor = descriptors.get(provider);
        if (descriptor == null) {
            throw new IllegalArgumentException("No OAuth descriptor for provider: " + provider);
        }
        return descriptor;
    }
}
