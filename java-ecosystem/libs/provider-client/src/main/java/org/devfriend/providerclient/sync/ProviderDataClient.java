package org.devfriend.providerclient.sync;

import org.devfriend.core.model.secret.EServiceType;
import org.devfriend.providerclient.model.EListKind;
import org.devfriend.providerclient.model.ListRequest;
import org.devfriend.providerclient.model.ProviderIdentity;
import org.devfriend.providerclient.model.ProviderItemPage;
import org.devfriend.providerclient.model.ProviderSummary;

import java.util.Set;

/**
 * Read-only data access for one provider family. Implementations assume the token is valid
 * and do no refresh or retry.
 * <p>
 * All methods throw {@link org.devfriend.providerclient.TokenRejectedException} on HTTP 401 (or the
 * provider's equivalent), {@link org.devfriend.providerclient.ProviderUnavailableException} on
 * network failures, timeouts, 429 and 5xx, and {@link org.devfriend.providerclient.ProviderClientException}
 * on anything else unexpected.
 */
public interface ProviderDataClient {

    EServiceType getServiceType();

    Set<EListKind> getSupportedLists();

    ProviderIdentity fetchIdentity(String accessToken);

    ProviderSummary fetchSummary(String accessToken);

    ProviderItemPage fetchList(String accessToken, ListRequest request);
}
