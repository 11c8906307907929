package org.devfriend.webserver.integration.service;

import org.devfriend.core.model.integration.EIntegrationStatus;
import org.devfriend.core.model.integration.EOAuthProvider;
import org.devfriend.core.model.integration.Integration;
import org.devfriend.core.model.secret.EServiceType;
import org.devfriend.core.model.secret.ESecretKind;
import org.devfriend.core.model.secret.Secret;
import org.devfriend.core.persistence.repository.integration.IntegrationRepository;
import org.devfriend.core.persistence.repository.secret.SecretRepository;
import org.devfriend.core.persistence.repository.user.UserRepository;
import org.devfriend.providerclient.ProviderClientException;
import org.devfriend.providerclient.ProviderUnavailableException;
import org.devfriend.providerclient.TokenRejectedException;
import org.devfriend.providerclient.model.ListRequest;
import org.devfriend.providerclient.model.ProviderIdentity;
import org.devfriend.providerclient.model.ProviderItemPage;
import org.devfriend.providerclient.model.ProviderSummary;
import org.devfriend.providerclient.oauth.ConfigMismatchException;
import org.devfriend.providerclient.oauth.OAuthConfig;
import org.devfriend.providerclient.oauth.OAuthTokens;
import org.devfriend.providerclient.oauth.RefreshRevokedException;
import org.devfriend.providerclient.sync.SyncGateway;
import org.devfriend.security.vault.DecryptionException;
import org.devfriend.security.vault.SecretVault;
import org.devfriend.webserver.credential.service.CredentialResolver;
import org.devfriend.webserver.exception.IntegrationNotFoundException;
import org.devfriend.webserver.exception.IntegrationSetupException;
import org.devfriend.webserver.exception.NoOAuthConfigException;
import org.devfriend.webserver.exception.ReauthRequiredException;
import org.devfriend.webserver.oauth.service.OAuthBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Owns the integration lifecycle: connection after consent, token refresh, auto-heal to
 * {@link EIntegrationStatus#NEEDS_REAUTH}, sync and deletion.
 * <p>
 * Token refresh runs under a per-integration lock from {@link RefreshLockRegistry}; the refreshed
 * bundle is written in its own REQUIRES_NEW transaction before the lock is released, so a caller
 * that waited on the lock reads the new token instead of refreshing again.
 */
@Service
public class IntegrationManager {

    private static final Logger log = LoggerFactory.getLogger(IntegrationManager.class);

    static final Duration EXPIRY_MARGIN = Duration.ofSeconds(60);

    private final IntegrationRepository integrationRepository;
    private final SecretRepository secretRepository;
    private final UserRepository userRepository;
    private final SecretVault secretVault;
    private final OAuthBroker oAuthBroker;
    private final CredentialResolver credentialResolver;
    private final SyncGateway syncGateway;
    private final RefreshLockRegistry lockRegistry;
    private final TransactionTemplate requiresNewTransactionTemplate;

    private Clock clock = Clock.systemUTC();

    @Value("${devfriend.integration.refresh-lock-timeout-seconds:60}")
    private long refreshLockTimeoutSeconds = 60;

    public IntegrationManager(
            IntegrationRepository integrationRepository,
            SecretRepository secretRepository,
            UserRepository userRepository,
            SecretVault secretVault,
            OAuthBroker oAuthBroker,
            CredentialResolver credentialResolver,
            SyncGateway syncGateway,
            RefreshLockRegistry lockRegistry,
            PlatformTransactionManager transactionManager
    ) {
        this.integrationRepository = integrationRepository;
        this.secretRepository = secretRepository;
        this.userRepository = userRepository;
        this.secretVault = secretVault;
        this.oAuthBroker = oAuthBroker;
        this.credentialResolver = credentialResolver;
        this.syncGateway = syncGateway;
        this.lockRegistry = lockRegistry;

        this.requiresNewTransactionTemplate = new TransactionTemplate(transactionManager);
        this.requiresNewTransactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public List<Integration> listIntegrations(Long userId) {
        return integrationRepository.findByUser_IdOrderByCreatedAtDesc(userId);
    }

    public List<Integration> listIntegrations(Long userId, EServiceType serviceType) {
        return integrationRepository.findByUser_IdAndServiceTypeOrderByCreatedAtDesc(userId, serviceType);
    }

    public Integration getIntegration(Long userId, Long integrationId) {
        return integrationRepository.findByUser_IdAndId(userId, integrationId)
                .orElseThrow(() -> new IntegrationNotFoundException(integrationId));
    }

    /**
     * Same as {@link #getIntegration(Long, Long)} but also hides integrations of another service type.
     */
    public Integration getIntegration(Long userId, EServiceType serviceType, Long integrationId) {
        Integration integration = getIntegration(userId, integrationId);
        if (serviceType != null && integration.getServiceType() != serviceType) {
            throw new IntegrationNotFoundException(integrationId);
        }
        return integration;
    }

    // ---------------------------------------------------------------------
    // Connection
    // ---------------------------------------------------------------------

    /**
     * Returns the user's integration for the service type, creating it in {@link EIntegrationStatus#CONNECTING}.
     */
    public Integration createPending(Long userId, EServiceType serviceType) {
        return requiresNewTransactionTemplate.execute(status ->
                integrationRepository.findFirstByUser_IdAndServiceTypeOrderByCreatedAtAsc(userId, serviceType)
                        .orElseGet(() -> {
                            Integration integration = new Integration();
                            integration.setUser(userRepository.getReferenceById(userId));
                            integration.setServiceType(serviceType);
                            integration.setStatus(EIntegrationStatus.CONNECTING);
                            log.info("Created pending {} integration for user {}", serviceType.getId(), userId);
                            return integrationRepository.save(integration);
                        }));
    }

    /**
     * Stores the tokens of a completed authorization as an issued-token secret, then creates or
     * updates the user's integration for that provider as {@link EIntegrationStatus#CONNECTED}.
     *
     * @throws IntegrationSetupException when the tokens were stored but the integration could not be written
     */
    public Integration connect(OAuthBroker.AuthorizationResult result) {
        EOAuthProvider provider = result.provider();
        EServiceType serviceType = provider.getServiceType();
        Long userId = result.userId();

        TokenBundle bundle = TokenBundle.fromTokens(result.tokens(), result.config().secretId());
        Secret tokenSecret = requiresNewTransactionTemplate.execute(status -> {
            Secret secret = new Secret();
            secret.setUser(userRepository.getReferenceById(userId));
            secret.setName(provider.getId() + " OAuth tokens");
            secret.setServiceType(serviceType);
            secret.setKind(ESecretKind.ISSUED_TOKEN);
            secret.setEncryptedValue(secretVault.encrypt(bundle.toMap()));
            return secretRepository.save(secret);
        });

        try {
            Map<String, Object> config = new LinkedHashMap<>(result.tokens().attributes());
            config.putAll(fetchIdentityConfig(serviceType, bundle.accessToken()));
            config.put("credential_source", result.config().isUserSupplied() ? "user" : "system");

            Integration integration = requiresNewTransactionTemplate.execute(status ->
                    upsertConnected(userId, serviceType, tokenSecret.getId(), config));
            log.info("{} integration {} connected for user {}", serviceType.getId(), integration.getId(), userId);
            return integration;
        } catch (RuntimeException e) {
            log.error("Failed to save {} integration for user {} after token exchange", serviceType.getId(), userId, e);
            throw new IntegrationSetupException(tokenSecret.getId(), e);
        }
    }

    private Integration upsertConnected(Long userId, EServiceType serviceType, Long tokenSecretId, Map<String, Object> config) {
        Integration integration = integrationRepository
                .findFirstByUser_IdAndServiceTypeOrderByCreatedAtAsc(userId, serviceType)
                .orElseGet(() -> {
                    Integration created = new Integration();
                    created.setUser(userRepository.getReferenceById(userId));
                    created.setServiceType(serviceType);
                    return created;
                });

        Long previousSecretId = integration.getSecretId();
        integration.setSecretId(tokenSecretId);
        integration.setStatus(EIntegrationStatus.CONNECTED);
        integration.mergeConfig(config);
        Integration saved = integrationRepository.save(integration);

        if (previousSecretId != null && !previousSecretId.equals(tokenSecretId)) {
            deleteIssuedTokenSecret(previousSecretId, saved.getId());
        }
        return saved;
    }

    private Map<String, Object> fetchIdentityConfig(EServiceType serviceType, String accessToken) {
        try {
            ProviderIdentity identity = syncGateway.fetchIdentity(serviceType, accessToken);
            return identity.toConfig();
        } catch (ProviderClientException e) {
            // identity is display data only
            log.warn("Could not fetch {} identity: {}", serviceType.getId(), e.getMessage());
            return Map.of();
        }
    }

    // ---------------------------------------------------------------------
    // Tokens
    // ---------------------------------------------------------------------

    /**
     * @throws ReauthRequiredException      the integration needs a new user consent
     * @throws ProviderUnavailableException refresh could not reach the provider; the integration stays usable
     */
    public String getValidAccessToken(Long userId, EServiceType serviceType, Long integrationId) {
        return accessTokenFor(getIntegration(userId, serviceType, integrationId), EXPIRY_MARGIN).accessToken();
    }

    /**
     * Refreshes the token if it expires within {@code margin}. Used by the proactive refresh job, whose
     * candidate may be stale: the current row is used, and an integration deleted meanwhile is skipped.
     */
    public void refreshIfExpiring(Integration candidate, Duration margin) {
        if (integrationRepository.findById(candidate.getId()).isEmpty()) {
            log.debug("Integration {} was deleted before its scheduled refresh", candidate.getId());
            return;
        }
        accessTokenFor(candidate, margin);
    }

    private record AccessGrant(Integration integration, String accessToken) {
    }

    private AccessGrant accessTokenFor(Integration snapshot, Duration margin) {
        Integration integration = reload(snapshot);
        ensureUsable(integration);
        TokenSnapshot tokens = readTokens(integration);
        if (tokens.bundle().isUsableAt(clock.instant(), margin)) {
            return new AccessGrant(integration, tokens.bundle().accessToken());
        }

        ReentrantLock lock = lockRegistry.lockFor(integration.getId());
        try {
            if (!lock.tryLock(refreshLockTimeoutSeconds, TimeUnit.SECONDS)) {
                throw new ProviderUnavailableException(
                        "Timed out waiting for the token refresh of integration " + integration.getId());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException("Interrupted while waiting for a token refresh", e);
        }

        try {
            // another caller may have refreshed, reconnected or given up while we waited
            Integration current = reload(integration);
            ensureUsable(current);
            TokenSnapshot currentTokens = readTokens(current);
            if (!Objects.equals(current.getSecretId(), integration.getSecretId())
                    || currentTokens.bundle().isUsableAt(clock.instant(), margin)) {
                return new AccessGrant(current, currentTokens.bundle().accessToken());
            }
            return new AccessGrant(current, refreshLocked(current, currentTokens));
        } finally {
            lock.unlock();
        }
    }

    private Integration reload(Integration integration) {
        return integrationRepository.findById(integration.getId())
                .orElseThrow(() -> new IntegrationNotFoundException(integration.getId()));
    }

    private String refreshLocked(Integration integration, TokenSnapshot snapshot) {
        EOAuthProvider provider = EOAuthProvider.forServiceType(integration.getServiceType());
        if (!snapshot.bundle().hasRefreshToken()) {
            throw markNeedsReauth(integration, "no refresh token was granted");
        }

        updateStatus(integration.getId(), integration.getSecretId(), EIntegrationStatus.TOKEN_EXPIRED);
        OAuthTokens tokens;
        try {
            OAuthConfig config = credentialResolver.resolveForRefresh(
                    integration.getUser().getId(), provider, snapshot.bundle().appSecretId());
            tokens = oAuthBroker.refresh(config, snapshot.bundle().refreshToken());
        } catch (NoOAuthConfigException e) {
            throw markNeedsReauth(integration, "no OAuth app is configured to refresh the tokens");
        } catch (RefreshRevokedException | ConfigMismatchException e) {
            throw markNeedsReauth(integration, e.getErrorCode());
        } catch (ProviderUnavailableException e) {
            log.warn("Token refresh for integration {} deferred: {}", integration.getId(), e.getMessage());
            throw e;
        }

        TokenBundle refreshed = snapshot.bundle().refreshedWith(tokens);
        String persisted = requiresNewTransactionTemplate.execute(status -> {
            Integration fresh = integrationRepository.findById(integration.getId())
                    .orElseThrow(() -> new IntegrationNotFoundException(integration.getId()));
            Secret secret = fresh.getSecretId() != null
                    ? secretRepository.findById(fresh.getSecretId()).orElse(null)
                    : null;

            if (secret == null || !secret.getId().equals(snapshot.secretId())
                    || !Objects.equals(secret.getUpdatedAt(), snapshot.updatedAt())) {
                // tokens were replaced or rewritten while the refresh was in flight
                log.info("Discarding refresh result for integration {}: tokens changed meanwhile", integration.getId());
                return null;
            }

            secret.setEncryptedValue(secretVault.encrypt(refreshed.toMap()));
            secretRepository.save(secret);
            fresh.setStatus(EIntegrationStatus.CONNECTED);
            integrationRepository.save(fresh);
            integration.setStatus(EIntegrationStatus.CONNECTED);
            return refreshed.accessToken();
        });

        if (persisted == null) {
            Integration current = reload(integration);
            ensureUsable(current);
            return readTokens(current).bundle().accessToken();
        }
        log.info("Refreshed access token for {} integration {}", provider.getId(), integration.getId());
        return persisted;
    }

    private void ensureUsable(Integration integration) {
        EOAuthProvider provider = EOAuthProvider.forServiceType(integration.getServiceType());
        EIntegrationStatus status = integration.getStatus();
        if (status == EIntegrationStatus.NEEDS_REAUTH || status == EIntegrationStatus.ERROR) {
            throw new ReauthRequiredException(integration.getId(), provider, "status is " + status.name().toLowerCase());
        }
        if (integration.getSecretId() == null) {
            throw new ReauthRequiredException(integration.getId(), provider, "integration is not connected");
        }
    }

    private record TokenSnapshot(Long secretId, LocalDateTime updatedAt, TokenBundle bundle) {
    }

    private TokenSnapshot readTokens(Integration integration) {
        Long secretId = integration.getSecretId();
        Secret secret = secretId != null ? secretRepository.findById(secretId).orElse(null) : null;
        if (secret == null) {
            throw markNeedsReauth(integration, "token secret is missing");
        }
        try {
            TokenBundle bundle = TokenBundle.fromMap(secretVault.decrypt(secret.getEncryptedValue()));
            return new TokenSnapshot(secret.getId(), secret.getUpdatedAt(), bundle);
        } catch (DecryptionException e) {
            log.error("Token secret {} of integration {} cannot be decrypted", secretId, integration.getId());
            throw markNeedsReauth(integration, "stored tokens are unreadable");
        }
    }

    /**
     * Moves the integration to NEEDS_REAUTH unless it was reconnected to another token secret since
     * {@code integration} was read.
     */
    private ReauthRequiredException markNeedsReauth(Integration integration, String reason) {
        boolean marked = updateStatus(integration.getId(), integration.getSecretId(), EIntegrationStatus.NEEDS_REAUTH);
        if (marked) {
            integration.setStatus(EIntegrationStatus.NEEDS_REAUTH);
            log.info("Integration {} moved to NEEDS_REAUTH: {}", integration.getId(), reason);
        } else {
            log.info("Integration {} was reconnected meanwhile, keeping its status ({})", integration.getId(), reason);
        }
        return new ReauthRequiredException(
                integration.getId(), EOAuthProvider.forServiceType(integration.getServiceType()), reason);
    }

    /**
     * Sets the status if the row still points at {@code expectedSecretId}.
     *
     * @return whether the row now carries {@code newStatus}
     */
    private boolean updateStatus(Long integrationId, Long expectedSecretId, EIntegrationStatus newStatus) {
        Boolean updated = requiresNewTransactionTemplate.execute(status ->
                integrationRepository.findById(integrationId)
                        .filter(integration -> Objects.equals(integration.getSecretId(), expectedSecretId))
                        .map(integration -> {
                            if (integration.getStatus() != newStatus) {
                                integration.setStatus(newStatus);
                                integrationRepository.save(integration);
                            }
                            return true;
                        })
                        .orElse(false));
        return Boolean.TRUE.equals(updated);
    }

    // ---------------------------------------------------------------------
    // Provider data
    // ---------------------------------------------------------------------

    /**
     * Pulls the provider summary and stores it in the integration config.
     */
    public Integration sync(Long userId, EServiceType serviceType, Long integrationId) {
        Integration integration = getIntegration(userId, serviceType, integrationId);
        ProviderSummary summary = withAccessToken(integration,
                token -> syncGateway.fetchSummary(integration.getServiceType(), token));

        LocalDateTime now = LocalDateTime.now(clock);
        Integration synced = requiresNewTransactionTemplate.execute(status -> {
            Integration fresh = integrationRepository.findById(integration.getId())
                    .orElseThrow(() -> new IntegrationNotFoundException(integrationId));
            Map<String, Object> values = new LinkedHashMap<>(summary.counts());
            values.put("last_synced_at", now.toString());
            fresh.mergeConfig(values);
            fresh.setUpdatedAt(now);
            return integrationRepository.save(fresh);
        });
        log.debug("Synced {} integration {}", serviceType != null ? serviceType.getId() : "", integrationId);
        return synced;
    }

    public ProviderSummary fetchSummary(Long userId, EServiceType serviceType, Long integrationId) {
        Integration integration = getIntegration(userId, serviceType, integrationId);
        return withAccessToken(integration, token -> syncGateway.fetchSummary(integration.getServiceType(), token));
    }

    public ProviderIdentity fetchIdentity(Long userId, EServiceType serviceType, Long integrationId) {
        Integration integration = getIntegration(userId, serviceType, integrationId);
        return withAccessToken(integration, token -> syncGateway.fetchIdentity(integration.getServiceType(), token));
    }

    public ProviderItemPage fetchList(Long userId, EServiceType serviceType, Long integrationId, ListRequest request) {
        Integration integration = getIntegration(userId, serviceType, integrationId);
        return withAccessToken(integration,
                token -> syncGateway.fetchList(integration.getServiceType(), token, request));
    }

    private <T> T withAccessToken(Integration integration, Function<String, T> call) {
        AccessGrant grant = accessTokenFor(integration, EXPIRY_MARGIN);
        try {
            return call.apply(grant.accessToken());
        } catch (TokenRejectedException e) {
            throw markNeedsReauth(grant.integration(), "provider rejected the access token");
        }
    }

    // ---------------------------------------------------------------------
    // Removal
    // ---------------------------------------------------------------------

    /**
     * Deletes the integration and the issued-token secret only it referenced. App credential secrets are kept.
     */
    public void delete(Long userId, EServiceType serviceType, Long integrationId) {
        Integration integration = getIntegration(userId, serviceType, integrationId);
        requiresNewTransactionTemplate.executeWithoutResult(status -> {
            integrationRepository.delete(integration);
            if (integration.getSecretId() != null) {
                deleteIssuedTokenSecret(integration.getSecretId(), integration.getId());
            }
        });
        lockRegistry.release(integrationId);
        log.info("Deleted {} integration {} for user {}", integration.getServiceType().getId(), integrationId, userId);
    }

    private void deleteIssuedTokenSecret(Long secretId, Long owningIntegrationId) {
        secretRepository.findById(secretId).ifPresent(secret -> {
            if (!secret.isIssuedToken()) {
                return;
            }
            boolean sharedWithOthers = integrationRepository.findBySecretId(secretId).stream()
                    .anyMatch(other -> !other.getId().equals(owningIntegrationId));
            if (!sharedWithOthers) {
                secretRepository.delete(secret);
                log.debug("Deleted issued token secret {}", secretId);
            }
        });
    }

    /**
     * Called before a secret is deleted: integrations pointing at it are moved to {@link EIntegrationStatus#ERROR}.
     */
    public void detachSecret(Long secretId) {
        for (Integration integration : integrationRepository.findBySecretId(secretId)) {
            integration.setSecretId(null);
            integration.setStatus(EIntegrationStatus.ERROR);
            integrationRepository.save(integration);
            log.info("Integration {} lost its token secret {} and moved to ERROR", integration.getId(), secretId);
        }
    }

    /**
     * Integrations the proactive refresh job should look at.
     */
    public List<Integration> findRefreshCandidates() {
        List<Integration> candidates = new ArrayList<>(integrationRepository.findByStatus(EIntegrationStatus.CONNECTED));
        candidates.addAll(integrationRepository.findByStatus(EIntegrationStatus.TOKEN_EXPIRED));
        return candidates;
    }
}
