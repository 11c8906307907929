package org.devfriend.providerclient.sync;

import org.devfriend.core.model.secret.EServiceType;
import org.devfriend.providerclient.model.ListRequest;
import org.devfriend.providerclient.model.ProviderIdentity;
import org.devfriend.providerclient.model.ProviderItemPage;
import org.devfriend.providerclient.model.ProviderSummary;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Uniform entry point over the per-provider data clients.
 */
@Component
public class SyncGateway {
    private final Map<EServiceType, ProviderDataClient> delegateMap = new EnumMap<>(EServiceType.class);

    public SyncGateway(List<ProviderDataClient> delegates) {
        for (ProviderDataClient delegate : delegates) {
            delegateMap.put(delegate.getServiceType(), delegate);
        }
    }

    public ProviderIdentity fetchIdentity(EServiceType serviceType, String accessToken) {
        return delegate(serviceType).fetchIdentity(accessToken);
    }

    public ProviderSummary fetchSummary(EServiceType serviceType, String accessToken) {
        return delegate(serviceType).fetchSummary(accessToken);
    }

    public ProviderItemPage fetchList(EServiceType serviceType, String accessToken, ListRequest request) {
        ProviderDataClient delegate = delegate(serviceType);
        if (!delegate.getSupportedLists().contains(request.kind())) {
            throw new IllegalArgumentException(
                    serviceType.getId() + " does not support listing " + request.kind().name().toLowerCase());
        }
        return delegate.fetchList(accessToken, request);
    }

    private ProviderDataClient delegate(EServiceType serviceType) {
        ProviderDataClient delegate = delegateMap.get(serviceType);
        if (delegate == null) {
            throw new IllegalArgumentException("No data client for service type: " + serviceType);
        }
        return delegate;
    }
}
