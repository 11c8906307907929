package org.devfriend.webserver.credential.service;

import org.devfriend.core.model.integration.EOAuthProvider;
import org.devfriend.core.model.secret.ESecretKind;
import org.devfriend.core.model.secret.Secret;
import org.devfriend.core.persistence.repository.secret.SecretRepository;
import org.devfriend.providerclient.oauth.OAuthConfig;
import org.devfriend.security.vault.DecryptionException;
import org.devfriend.security.vault.SecretVault;
import org.devfriend.webserver.config.OAuthClientProperties;
import org.devfriend.webserver.exception.NoOAuthConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which OAuth application a request runs under.
 * <p>
 * A user-saved app credential of the provider's service type wins over the system default.
 * With several candidates the earliest created one that decrypts and carries both
 * {@code client_id} and {@code client_secret} is used; unusable ones are skipped.
 */
@Service
public class CredentialResolver {

    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

    public static final String CLIENT_ID = "client_id";
    public static final String CLIENT_SECRET = "client_secret";
    public static final String REDIRECT_URI = "redirect_uri";

    private final SecretRepository secretRepository;
    private final SecretVault secretVault;
    private final OAuthClientProperties oAuthClientProperties;

    public CredentialResolver(
            SecretRepository secretRepository,
            SecretVault secretVault,
            OAuthClientProperties oAuthClientProperties
    ) {
        this.secretRepository = secretRepository;
        this.secretVault = secretVault;
        this.oAuthClientProperties = oAuthClientProperties;
    }

    /**
     * @throws NoOAuthConfigException when neither a user credential nor a system default is usable
     */
    @Transactional(readOnly = true)
    public OAuthConfig resolve(Long userId, EOAuthProvider provider) {
        Optional<OAuthConfig> userConfig = resolveUserCredential(userId, provider);
        if (userConfig.isPresent()) {
            log.debug("Using user credential secret {} for {} (user {})",
                    userConfig.get().secretId(), provider.getId(), userId);
            return userConfig.get();
        }

        return systemDefault(provider)
                .orElseThrow(() -> {
                    log.info("No OAuth configuration available for {} (user {})", provider.getId(), userId);
                    return new NoOAuthConfigException(provider);
                });
    }

    /**
     * Resolves the OAuth application a refresh token was issued to. Refresh tokens are bound to their
     * client, so the issuing app is used even when {@link #resolve} would now pick another one.
     *
     * @param issuingSecretId app credential secret recorded at connect time, {@code null} for the system default
     * @throws NoOAuthConfigException when the issuing app is gone and nothing else is configured
     */
    @Transactional(readOnly = true)
    public OAuthConfig resolveForRefresh(Long userId, EOAuthProvider provider, Long issuingSecretId) {
        Optional<OAuthConfig> issuing = issuingSecretId != null
                ? secretRepository.findById(issuingSecretId)
                        .filter(secret -> secret.getUser() != null && userId.equals(secret.getUser().getId()))
                        .filter(secret -> secret.getKind() == ESecretKind.APP_CREDENTIAL)
                        .filter(secret -> secret.getServiceType() == provider.getServiceType())
                        .flatMap(secret -> toConfig(secret, provider))
                : systemDefault(provider);

        if (issuing.isPresent()) {
            return issuing.get();
        }
        log.warn("OAuth app {} that issued the {} tokens of user {} is no longer usable, resolving again",
                issuingSecretId != null ? "secret " + issuingSecretId : "system default", provider.getId(), userId);
        return resolve(userId, provider);
    }

    private Optional<OAuthConfig> systemDefault(EOAuthProvider provider) {
        return oAuthClientProperties.getSystemDefault(provider)
                .map(defaults -> new OAuthConfig(
                        provider,
                        defaults.clientId(),
                        defaults.clientSecret(),
                        oAuthClientProperties.getRedirectUri(provider),
                        null
                ));
    }

    private Optional<OAuthConfig> resolveUserCredential(Long userId, EOAuthProvider provider) {
        List<Secret> candidates = secretRepository.findByUser_IdAndServiceTypeAndKindOrderByCreatedAtAscIdAsc(
                userId, provider.getServiceType(), ESecretKind.APP_CREDENTIAL);

        for (Secret candidate : candidates) {
            Optional<OAuthConfig> config = toConfig(candidate, provider);
            if (config.isPresent()) {
                return config;
            }
        }
        return Optional.empty();
    }

    private Optional<OAuthConfig> toConfig(Secret candidate, EOAuthProvider provider) {
        Map<String, Object> bundle;
        try {
            bundle = secretVault.decrypt(candidate.getEncryptedValue());
        } catch (DecryptionException e) {
            log.warn("Skipping secret {} for {}: {}", candidate.getId(), provider.getId(), e.getMessage());
            return Optional.empty();
        }

        String clientId = asText(bundle.get(CLIENT_ID));
        String clientSecret = asText(bundle.get(CLIENT_SECRET));
        if (clientId == null || clientSecret == null) {
            log.debug("Skipping secret {} for {}: client_id or client_secret missing",
                    candidate.getId(), provider.getId());
            return Optional.empty();
        }

        String redirectUri = asText(bundle.get(REDIRECT_URI));
        return Optional.of(new OAuthConfig(
                provider,
                clientId,
                clientSecret,
                redirectUri != null ? redirectUri : oAuthClientProperties.getRedirectUri(provider),
                candidate.getId()
        ));
    }

    private static String asText(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
