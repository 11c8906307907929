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
import org.devfriend.providerclient.ProviderUnavailableException;
import org.devfriend.providerclient.TokenRejectedException;
import org.devfriend.providerclient.model.ProviderIdentity;
import org.devfriend.providerclient.model.ProviderSummary;
import org.devfriend.providerclient.oauth.ConfigMismatchException;
import org.devfriend.providerclient.oauth.OAuthConfig;
import org.devfriend.providerclient.oauth.OAuthTokens;
import org.devfriend.providerclient.oauth.RefreshRevokedException;
import org.devfriend.providerclient.sync.SyncGateway;
import org.devfriend.security.vault.SecretVault;
import org.devfriend.webserver.credential.service.CredentialResolver;
import org.devfriend.webserver.exception.IntegrationNotFoundException;
import org.devfriend.webserver.exception.IntegrationSetupException;
import org.devfriend.webserver.exception.NoOAuthConfigException;
import org.devfriend.webserver.exception.ReauthRequiredException;
import org.devfriend.webserver.oauth.service.OAuthBroker;
import org.devfriend.webserver.support.InMemoryRepositories;
import org.devfriend.webserver.support.TestVaults;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("IntegrationManager")
class IntegrationManagerTest {

    private static final Long USER_ID = 1L;
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private IntegrationRepository integrationRepository;

    @Mock
    private SecretRepository secretRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private OAuthBroker oAuthBroker;

    @Mock
    private CredentialResolver credentialResolver;

    @Mock
    private SyncGateway syncGateway;

    @Mock
    private PlatformTransactionManager transactionManager;

    private final SecretVault secretVault = TestVaults.randomVault();
    private InMemoryRepositories store;
    private IntegrationManager manager;

    @BeforeEach
    void setUp() {
        store = InMemoryRepositories.wire(integrationRepository, secretRepository, userRepository);
        manager = new IntegrationManager(integrationRepository, secretRepository, userRepository, secretVault,
                oAuthBroker, credentialResolver, syncGateway, new RefreshLockRegistry(), transactionManager);
        ReflectionTestUtils.setField(manager, "clock", Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Integration connected(EServiceType serviceType, TokenBundle bundle) {
        Secret secret = new Secret();
        secret.setUser(InMemoryRepositories.user(USER_ID));
        secret.setName("tokens");
        secret.setServiceType(serviceType);
        secret.setKind(ESecretKind.ISSUED_TOKEN);
        secret.setEncryptedValue(secretVault.encrypt(bundle.toMap()));
        store.put(secret);

        Integration integration = new Integration();
        integration.setUser(InMemoryRepositories.user(USER_ID));
        integration.setServiceType(serviceType);
        integration.setStatus(EIntegrationStatus.CONNECTED);
        integration.setSecretId(secret.getId());
        return store.put(integration);
    }

    private TokenBundle storedBundle(Integration integration) {
        Secret secret = store.secret(store.integration(integration.getId()).getSecretId());
        return TokenBundle.fromMap(secretVault.decrypt(secret.getEncryptedValue()));
    }

    private void resolvesGoogleConfig() {
        when(credentialResolver.resolveForRefresh(eq(USER_ID), eq(EOAuthProvider.GOOGLE), any())).thenReturn(
                new OAuthConfig(EOAuthProvider.GOOGLE, "cid", "csecret", "http://api/auth/google/callback", null));
    }

    private static Integration copyOf(Integration integration) {
        Integration copy = new Integration();
        copy.setId(integration.getId());
        copy.setUser(integration.getUser());
        copy.setServiceType(integration.getServiceType());
        copy.setStatus(integration.getStatus());
        copy.setSecretId(integration.getSecretId());
        return copy;
    }

    private static OAuthBroker.AuthorizationResult googleResult(String accessToken) {
        OAuthConfig config = new OAuthConfig(EOAuthProvider.GOOGLE, "cid", "cs", "http://api/auth/google/callback", null);
        OAuthTokens tokens = new OAuthTokens(accessToken, "1//fresh", NOW.plusSeconds(3600), "gmail.readonly", Map.of());
        return new OAuthBroker.AuthorizationResult(USER_ID, EOAuthProvider.GOOGLE, config, tokens);
    }

    private static TokenBundle expiredGmailBundle() {
        return new TokenBundle("ya29.old", "1//refresh", NOW.minusSeconds(30), "gmail.readonly", null);
    }

    @Nested
    @DisplayName("connect")
    class Connect {

        private OAuthBroker.AuthorizationResult slackResult(String accessToken) {
            OAuthConfig config = new OAuthConfig(EOAuthProvider.SLACK, "cid", "cs", "http://api/auth/slack/callback", 3L);
            OAuthTokens tokens = new OAuthTokens(accessToken, null, null, "channels:read",
                    Map.of("team_id", "T1", "team_name", "Acme"));
            return new OAuthBroker.AuthorizationResult(USER_ID, EOAuthProvider.SLACK, config, tokens);
        }

        @Test
        @DisplayName("stores an issued-token secret and marks the integration connected")
        void connectCreatesIntegration() {
            when(syncGateway.fetchIdentity(EServiceType.SLACK, "xoxb-1"))
                    .thenReturn(new ProviderIdentity("U1", "alice", "Alice", null));

            Integration integration = manager.connect(slackResult("xoxb-1"));

            assertThat(integration.getStatus()).isEqualTo(EIntegrationStatus.CONNECTED);
            Secret secret = store.secret(integration.getSecretId());
            assertThat(secret.getKind()).isEqualTo(ESecretKind.ISSUED_TOKEN);
            assertThat(secret.getEncryptedValue()).doesNotContain("xoxb-1");
            TokenBundle bundle = storedBundle(integration);
            assertThat(bundle.accessToken()).isEqualTo("xoxb-1");
            assertThat(bundle.appSecretId()).isEqualTo(3L);
            assertThat(bundle.tokenExpiry()).isNull();
            assertThat(integration.getConfig())
                    .containsEntry("team_id", "T1")
                    .containsEntry("account_login", "alice")
                    .containsEntry("credential_source", "user");
        }

        @Test
        @DisplayName("identity lookup failures do not fail the connection")
        void identityFailureIsNotFatal() {
            when(syncGateway.fetchIdentity(eq(EServiceType.SLACK), anyString()))
                    .thenThrow(new ProviderUnavailableException("slack down"));

            Integration integration = manager.connect(slackResult("xoxb-1"));

            assertThat(integration.getStatus()).isEqualTo(EIntegrationStatus.CONNECTED);
            assertThat(integration.getConfig()).containsKey("team_id").doesNotContainKey("account_login");
        }

        @Test
        @DisplayName("reconnecting reuses the integration and drops the previous token secret")
        void reconnectReplacesTokens() {
            Integration existing = connected(EServiceType.SLACK, new TokenBundle("xoxb-old", null, null, null, null));
            existing.setStatus(EIntegrationStatus.NEEDS_REAUTH);
            Long oldSecretId = existing.getSecretId();
            when(syncGateway.fetchIdentity(eq(EServiceType.SLACK), anyString()))
                    .thenReturn(new ProviderIdentity("U1", "alice", null, null));

            Integration integration = manager.connect(slackResult("xoxb-new"));

            assertThat(integration.getId()).isEqualTo(existing.getId());
            assertThat(integration.getStatus()).isEqualTo(EIntegrationStatus.CONNECTED);
            assertThat(integration.getSecretId()).isNotEqualTo(oldSecretId);
            assertThat(store.secret(oldSecretId)).isNull();
            assertThat(storedBundle(integration).accessToken()).isEqualTo("xoxb-new");
        }

        @Test
        @DisplayName("a failed integration write reports the stored token secret")
        void integrationWriteFailure() {
            when(syncGateway.fetchIdentity(eq(EServiceType.SLACK), anyString()))
                    .thenReturn(new ProviderIdentity("U1", "alice", null, null));
            doThrow(new IllegalStateException("db down")).when(integrationRepository).save(any(Integration.class));

            assertThatThrownBy(() -> manager.connect(slackResult("xoxb-1")))
                    .isInstanceOfSatisfying(IntegrationSetupException.class, e ->
                            assertThat(store.secret(e.getTokenSecretId())).isNotNull());
        }

        @Test
        @DisplayName("createPending returns the existing integration")
        void createPendingIsIdempotent() {
            Integration first = manager.createPending(USER_ID, EServiceType.GITHUB);
            Integration second = manager.createPending(USER_ID, EServiceType.GITHUB);

            assertThat(first.getStatus()).isEqualTo(EIntegrationStatus.CONNECTING);
            assertThat(second.getId()).isEqualTo(first.getId());
        }
    }

    @Nested
    @DisplayName("access tokens")
    class AccessTokens {

        @Test
        @DisplayName("a token valid beyond the margin is returned without a refresh")
        void freshTokenNotRefreshed() {
            Integration integration = connected(EServiceType.GMAIL,
                    new TokenBundle("ya29.fresh", "1//refresh", NOW.plusSeconds(3600), null, null));

            assertThat(manager.getValidAccessToken(USER_ID, EServiceType.GMAIL, integration.getId()))
                    .isEqualTo("ya29.fresh");
            verify(oAuthBroker, never()).refresh(any(), any());
        }

        @Test
        @DisplayName("a token without expiry is always usable")
        void nonExpiringToken() {
            Integration integration = connected(EServiceType.GITHUB, new TokenBundle("gho_1", null, null, null, null));

            assertThat(manager.getValidAccessToken(USER_ID, EServiceType.GITHUB, integration.getId())).isEqualTo("gho_1");
        }

        @Test
        @DisplayName("an expired token is refreshed and the refresh token is kept")
        void expiredTokenRefreshed() {
            Integration integration = connected(EServiceType.GMAIL, expiredGmailBundle());
            resolvesGoogleConfig();
            when(oAuthBroker.refresh(any(OAuthConfig.class), eq("1//refresh")))
                    .thenReturn(new OAuthTokens("ya29.new", null, NOW.plusSeconds(3600), null, Map.of()));

            String token = manager.getValidAccessToken(USER_ID, EServiceType.GMAIL, integration.getId());

            assertThat(token).isEqualTo("ya29.new");
            TokenBundle stored = storedBundle(integration);
            assertThat(stored.refreshToken()).isEqualTo("1//refresh");
            assertThat(stored.scope()).isEqualTo("gmail.readonly");
            assertThat(stored.tokenExpiry()).isEqualTo(NOW.plusSeconds(3600));
            assertThat(store.integration(integration.getId()).getStatus()).isEqualTo(EIntegrationStatus.CONNECTED);
        }

        @Test
        @DisplayName("a token expiring within the margin is refreshed")
        void tokenInsideMarginRefreshed() {
            Integration integration = connected(EServiceType.GMAIL,
                    new TokenBundle("ya29.old", "1//refresh", NOW.plusSeconds(30), null, null));
            resolvesGoogleConfig();
            when(oAuthBroker.refresh(any(OAuthConfig.class), eq("1//refresh")))
                    .thenReturn(new OAuthTokens("ya29.new", "1//rotated", NOW.plusSeconds(3600), null, Map.of()));

            assertThat(manager.getValidAccessToken(USER_ID, EServiceType.GMAIL, integration.getId())).isEqualTo("ya29.new");
            assertThat(storedBundle(integration).refreshToken()).isEqualTo("1//rotated");
        }

        @Test
        @DisplayName("a revoked refresh token moves the integration to NEEDS_REAUTH once")
        void revokedRefreshAutoHeals() {
            Integration integration = connected(EServiceType.GMAIL, expiredGmailBundle());
            resolvesGoogleConfig();
            when(oAuthBroker.refresh(any(OAuthConfig.class), anyString()))
                    .thenThrow(new RefreshRevokedException(EOAuthProvider.GOOGLE, "invalid_grant", "Token has been revoked"));

            assertThatThrownBy(() -> manager.getValidAccessToken(USER_ID, EServiceType.GMAIL, integration.getId()))
                    .isInstanceOfSatisfying(ReauthRequiredException.class, e -> {
                        assertThat(e.getIntegrationId()).isEqualTo(integration.getId());
                        assertThat(e.getReconnectUrl()).isEqualTo("/auth/google/authorize");
                    });
            assertThat(store.integration(integration.getId()).getStatus()).isEqualTo(EIntegrationStatus.NEEDS_REAUTH);

            assertThatThrownBy(() -> manager.sync(USER_ID, EServiceType.GMAIL, integration.getId()))
                    .isInstanceOf(ReauthRequiredException.class);
            verify(oAuthBroker, times(1)).refresh(any(), any());
            verify(syncGateway, never()).fetchSummary(any(), any());
        }

        @Test
        @DisplayName("rejected client credentials also require a reconnect")
        void configMismatchOnRefresh() {
            Integration integration = connected(EServiceType.GMAIL, expiredGmailBundle());
            resolvesGoogleConfig();
            when(oAuthBroker.refresh(any(OAuthConfig.class), anyString()))
                    .thenThrow(new ConfigMismatchException(EOAuthProvider.GOOGLE, "invalid_client", "Unauthorized"));

            assertThatThrownBy(() -> manager.getValidAccessToken(USER_ID, EServiceType.GMAIL, integration.getId()))
                    .isInstanceOf(ReauthRequiredException.class);
            assertThat(store.integration(integration.getId()).getStatus()).isEqualTo(EIntegrationStatus.NEEDS_REAUTH);
        }

        @Test
        @DisplayName("an expired token without refresh token requires a reconnect")
        void noRefreshToken() {
            Integration integration = connected(EServiceType.SLACK,
                    new TokenBundle("xoxe-1", null, NOW.minusSeconds(5), null, null));

            assertThatThrownBy(() -> manager.getValidAccessToken(USER_ID, EServiceType.SLACK, integration.getId()))
                    .isInstanceOf(ReauthRequiredException.class);
            assertThat(store.integration(integration.getId()).getStatus()).isEqualTo(EIntegrationStatus.NEEDS_REAUTH);
            verify(oAuthBroker, never()).refresh(any(), any());
        }

        @Test
        @DisplayName("unreadable stored tokens require a reconnect")
        void undecryptableTokens() {
            Integration integration = connected(EServiceType.GITHUB, new TokenBundle("gho_1", null, null, null, null));
            store.secret(integration.getSecretId())
                    .setEncryptedValue(TestVaults.randomVault().encrypt(Map.of("access_token", "gho_1")));

            assertThatThrownBy(() -> manager.getValidAccessToken(USER_ID, EServiceType.GITHUB, integration.getId()))
                    .isInstanceOf(ReauthRequiredException.class);
            assertThat(store.integration(integration.getId()).getStatus()).isEqualTo(EIntegrationStatus.NEEDS_REAUTH);
        }

        @Test
        @DisplayName("an unreachable token endpoint leaves the integration TOKEN_EXPIRED")
        void providerUnavailableDuringRefresh() {
            Integration integration = connected(EServiceType.GMAIL, expiredGmailBundle());
            resolvesGoogleConfig();
            when(oAuthBroker.refresh(any(OAuthConfig.class), anyString()))
                    .thenThrow(new ProviderUnavailableException("Google token endpoint returned 503"));

            assertThatThrownBy(() -> manager.getValidAccessToken(USER_ID, EServiceType.GMAIL, integration.getId()))
                    .isInstanceOf(ProviderUnavailableException.class);
            assertThat(store.integration(integration.getId()).getStatus()).isEqualTo(EIntegrationStatus.TOKEN_EXPIRED);
            assertThat(storedBundle(integration).refreshToken()).isEqualTo("1//refresh");
        }

        @Test
        @DisplayName("refresh uses the OAuth app recorded in the token bundle")
        void refreshUsesIssuingApp() {
            Integration integration = connected(EServiceType.GMAIL,
                    new TokenBundle("ya29.old", "1//refresh", NOW.minusSeconds(30), null, 77L));
            OAuthConfig issuing = new OAuthConfig(EOAuthProvider.GOOGLE, "issuing-cid", "s", "http://api/cb", 77L);
            when(credentialResolver.resolveForRefresh(USER_ID, EOAuthProvider.GOOGLE, 77L)).thenReturn(issuing);
            when(oAuthBroker.refresh(issuing, "1//refresh"))
                    .thenReturn(new OAuthTokens("ya29.new", null, NOW.plusSeconds(3600), null, Map.of()));

            assertThat(manager.getValidAccessToken(USER_ID, EServiceType.GMAIL, integration.getId())).isEqualTo("ya29.new");
            assertThat(storedBundle(integration).appSecretId()).isEqualTo(77L);
            verify(credentialResolver, never()).resolve(any(), any());
        }

        @Test
        @DisplayName("tokens issued under the system app are refreshed with the system app")
        void systemIssuedTokensRefreshWithSystemApp() {
            Integration integration = connected(EServiceType.GMAIL, expiredGmailBundle());
            resolvesGoogleConfig();
            when(oAuthBroker.refresh(any(OAuthConfig.class), eq("1//refresh")))
                    .thenReturn(new OAuthTokens("ya29.new", null, NOW.plusSeconds(3600), null, Map.of()));

            manager.getValidAccessToken(USER_ID, EServiceType.GMAIL, integration.getId());

            verify(credentialResolver).resolveForRefresh(USER_ID, EOAuthProvider.GOOGLE, null);
        }

        @Test
        @DisplayName("no OAuth app left to refresh with requires a reconnect")
        void noOAuthAppForRefresh() {
            Integration integration = connected(EServiceType.GMAIL, expiredGmailBundle());
            when(credentialResolver.resolveForRefresh(eq(USER_ID), eq(EOAuthProvider.GOOGLE), any()))
                    .thenThrow(new NoOAuthConfigException(EOAuthProvider.GOOGLE));

            assertThatThrownBy(() -> manager.getValidAccessToken(USER_ID, EServiceType.GMAIL, integration.getId()))
                    .isInstanceOf(ReauthRequiredException.class);
            assertThat(store.integration(integration.getId()).getStatus()).isEqualTo(EIntegrationStatus.NEEDS_REAUTH);
            verify(oAuthBroker, never()).refresh(any(), any());
        }

        @Test
        @DisplayName("a refresh result is discarded when the tokens were replaced while it was in flight")
        void refreshDiscardedAfterConcurrentReconnect() {
            Integration integration = connected(EServiceType.GMAIL, expiredGmailBundle());
            Long oldSecretId = integration.getSecretId();
            resolvesGoogleConfig();
            when(oAuthBroker.refresh(any(OAuthConfig.class), eq("1//refresh"))).thenAnswer(invocation -> {
                Secret replacement = new Secret();
                replacement.setUser(InMemoryRepositories.user(USER_ID));
                replacement.setServiceType(EServiceType.GMAIL);
                replacement.setKind(ESecretKind.ISSUED_TOKEN);
                replacement.setEncryptedValue(secretVault.encrypt(
                        new TokenBundle("ya29.reconnected", "1//other", NOW.plusSeconds(3600), null, null).toMap()));
                store.put(replacement);
                Integration row = store.integration(integration.getId());
                row.setSecretId(replacement.getId());
                row.setStatus(EIntegrationStatus.CONNECTED);
                return new OAuthTokens("ya29.refreshed", null, NOW.plusSeconds(3600), null, Map.of());
            });

            String token = manager.getValidAccessToken(USER_ID, EServiceType.GMAIL, integration.getId());

            assertThat(token).isEqualTo("ya29.reconnected");
            assertThat(storedBundle(integration).accessToken()).isEqualTo("ya29.reconnected");
            TokenBundle old = TokenBundle.fromMap(secretVault.decrypt(store.secret(oldSecretId).getEncryptedValue()));
            assertThat(old.accessToken()).isEqualTo("ya29.old");
            assertThat(store.integration(integration.getId()).getStatus()).isEqualTo(EIntegrationStatus.CONNECTED);
        }

        @Test
        @DisplayName("a refresh result is discarded when the same token secret was rewritten meanwhile")
        void refreshDiscardedAfterConcurrentWrite() {
            Integration integration = connected(EServiceType.GMAIL, expiredGmailBundle());
            resolvesGoogleConfig();
            when(oAuthBroker.refresh(any(OAuthConfig.class), eq("1//refresh"))).thenAnswer(invocation -> {
                Secret secret = store.secret(integration.getSecretId());
                secret.setEncryptedValue(secretVault.encrypt(
                        new TokenBundle("ya29.elsewhere", "1//refresh", NOW.plusSeconds(3600), null, null).toMap()));
                secret.setUpdatedAt(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
                return new OAuthTokens("ya29.refreshed", null, NOW.plusSeconds(3600), null, Map.of());
            });

            assertThat(manager.getValidAccessToken(USER_ID, EServiceType.GMAIL, integration.getId()))
                    .isEqualTo("ya29.elsewhere");
            assertThat(storedBundle(integration).accessToken()).isEqualTo("ya29.elsewhere");
        }

        @Test
        @DisplayName("a stale integration read before a reconnect keeps the new connection intact")
        void staleSnapshotDoesNotUndoReconnect() {
            Integration integration = connected(EServiceType.GMAIL, expiredGmailBundle());
            Integration stale = copyOf(integration);
            when(syncGateway.fetchIdentity(eq(EServiceType.GMAIL), anyString()))
                    .thenReturn(new ProviderIdentity("alice@example.com", "alice@example.com", null, null));

            Integration reconnected = manager.connect(googleResult("ya29.reconnected"));
            assertThat(reconnected.getSecretId()).isNotEqualTo(stale.getSecretId());

            manager.refreshIfExpiring(stale, Duration.ofMinutes(10));

            Integration current = store.integration(integration.getId());
            assertThat(current.getStatus()).isEqualTo(EIntegrationStatus.CONNECTED);
            assertThat(storedBundle(current).accessToken()).isEqualTo("ya29.reconnected");
            verify(oAuthBroker, never()).refresh(any(), any());
        }

        @Test
        @DisplayName("the refresh job skips integrations deleted since it listed them")
        void refreshSkipsDeletedIntegration() {
            Integration integration = connected(EServiceType.GMAIL, expiredGmailBundle());
            Integration stale = copyOf(integration);
            manager.delete(USER_ID, EServiceType.GMAIL, integration.getId());

            manager.refreshIfExpiring(stale, Duration.ofMinutes(10));

            verify(oAuthBroker, never()).refresh(any(), any());
        }

        @Test
        @DisplayName("a stale read after the integration moved to NEEDS_REAUTH does not refresh")
        void staleSnapshotRespectsNeedsReauth() {
            Integration integration = connected(EServiceType.GMAIL, expiredGmailBundle());
            Integration stale = copyOf(integration);
            integration.setStatus(EIntegrationStatus.NEEDS_REAUTH);

            assertThatThrownBy(() -> manager.refreshIfExpiring(stale, Duration.ofMinutes(10)))
                    .isInstanceOf(ReauthRequiredException.class);
            verify(oAuthBroker, never()).refresh(any(), any());
        }

        @Test
        @DisplayName("integrations in ERROR are not used")
        void errorStatusRequiresReconnect() {
            Integration integration = connected(EServiceType.GITHUB, new TokenBundle("gho_1", null, null, null, null));
            integration.setStatus(EIntegrationStatus.ERROR);

            assertThatThrownBy(() -> manager.getValidAccessToken(USER_ID, EServiceType.GITHUB, integration.getId()))
                    .isInstanceOf(ReauthRequiredException.class);
        }
    }

    @Nested
    @DisplayName("sync")
    class Sync {

        @Test
        @DisplayName("stores the summary counts and bumps updatedAt")
        void syncUpdatesConfig() {
            Integration integration = connected(EServiceType.GMAIL,
                    new TokenBundle("ya29.fresh", "1//refresh", NOW.plusSeconds(3600), null, null));
            integration.mergeConfig(Map.of("account_login", "alice@example.com"));
            when(syncGateway.fetchSummary(EServiceType.GMAIL, "ya29.fresh"))
                    .thenReturn(new ProviderSummary(Map.of("unread_count", 4L, "total_count", 120L)));

            Integration synced = manager.sync(USER_ID, EServiceType.GMAIL, integration.getId());

            assertThat(synced.getConfig())
                    .containsEntry("unread_count", 4L)
                    .containsEntry("total_count", 120L)
                    .containsEntry("account_login", "alice@example.com")
                    .containsKey("last_synced_at");
            assertThat(synced.getUpdatedAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
        }

        @Test
        @DisplayName("a rejected access token moves the integration to NEEDS_REAUTH")
        void tokenRejectedOnSync() {
            Integration integration = connected(EServiceType.GITHUB, new TokenBundle("gho_1", null, null, null, null));
            when(syncGateway.fetchSummary(EServiceType.GITHUB, "gho_1"))
                    .thenThrow(new TokenRejectedException("GitHub returned 401"));

            assertThatThrownBy(() -> manager.sync(USER_ID, EServiceType.GITHUB, integration.getId()))
                    .isInstanceOf(ReauthRequiredException.class);
            assertThat(store.integration(integration.getId()).getStatus()).isEqualTo(EIntegrationStatus.NEEDS_REAUTH);
        }

        @Test
        @DisplayName("an integration of another service type is not found")
        void wrongServiceType() {
            Integration integration = connected(EServiceType.GITHUB, new TokenBundle("gho_1", null, null, null, null));

            assertThatThrownBy(() -> manager.sync(USER_ID, EServiceType.SLACK, integration.getId()))
                    .isInstanceOf(IntegrationNotFoundException.class);
        }

        @Test
        @DisplayName("another user's integration is not found")
        void otherUsersIntegration() {
            Integration integration = connected(EServiceType.GITHUB, new TokenBundle("gho_1", null, null, null, null));

            assertThatThrownBy(() -> manager.getIntegration(2L, integration.getId()))
                    .isInstanceOf(IntegrationNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("removal")
    class Removal {

        @Test
        @DisplayName("delete removes the issued-token secret and keeps app credentials")
        void deleteKeepsAppCredential() {
            Secret appCredential = new Secret();
            appCredential.setUser(InMemoryRepositories.user(USER_ID));
            appCredential.setName("my github app");
            appCredential.setServiceType(EServiceType.GITHUB);
            appCredential.setKind(ESecretKind.APP_CREDENTIAL);
            appCredential.setEncryptedValue(secretVault.encrypt(Map.of("client_id", "a", "client_secret", "b")));
            store.put(appCredential);
            Integration integration = connected(EServiceType.GITHUB,
                    new TokenBundle("gho_1", null, null, null, appCredential.getId()));
            Long tokenSecretId = integration.getSecretId();

            manager.delete(USER_ID, EServiceType.GITHUB, integration.getId());

            assertThat(store.integration(integration.getId())).isNull();
            assertThat(store.secret(tokenSecretId)).isNull();
            assertThat(store.secret(appCredential.getId())).isNotNull();
        }

        @Test
        @DisplayName("detaching a secret moves its integrations to ERROR")
        void detachSecret() {
            Integration integration = connected(EServiceType.SLACK, new TokenBundle("xoxb", null, null, null, null));

            manager.detachSecret(integration.getSecretId());

            Integration stored = store.integration(integration.getId());
            assertThat(stored.getSecretId()).isNull();
            assertThat(stored.getStatus()).isEqualTo(EIntegrationStatus.ERROR);
        }

        @Test
        @DisplayName("refresh candidates are connected or expired integrations")
        void refreshCandidates() {
            Integration connected = connected(EServiceType.GMAIL, expiredGmailBundle());
            Integration expired = connected(EServiceType.GITHUB, new TokenBundle("gho", null, null, null, null));
            expired.setStatus(EIntegrationStatus.TOKEN_EXPIRED);
            Integration broken = connected(EServiceType.SLACK, new TokenBundle("xoxb", null, null, null, null));
            broken.setStatus(EIntegrationStatus.NEEDS_REAUTH);

            assertThat(manager.findRefreshCandidates())
                    .extracting(Integration::getId)
                    .containsExactlyInAnyOrder(connected.getId(), expired.getId());
        }
    }
}
