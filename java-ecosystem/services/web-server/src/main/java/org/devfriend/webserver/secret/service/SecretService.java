package org.devfriend.webserver.secret.service;

import org.devfriend.core.dto.secret.SecretDTO;
import org.devfriend.core.model.secret.EServiceType;
import org.devfriend.core.model.secret.ESecretKind;
import org.devfriend.core.model.secret.Secret;
import org.devfriend.core.persistence.repository.secret.SecretRepository;
import org.devfriend.core.persistence.repository.user.UserRepository;
import org.devfriend.security.vault.DecryptionException;
import org.devfriend.security.vault.SecretVault;
import org.devfriend.webserver.exception.SecretNotFoundException;
import org.devfriend.webserver.integration.service.IntegrationManager;
import org.devfriend.webserver.secret.dto.request.CreateSecretRequest;
import org.devfriend.webserver.secret.dto.request.UpdateSecretRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * User secret CRUD. Values go through {@link SecretVault} on every write and are never returned;
 * responses only list the field names of bundles that still decrypt.
 */
@Service
public class SecretService {

    private static final Logger log = LoggerFactory.getLogger(SecretService.class);

    private final SecretRepository secretRepository;
    private final UserRepository userRepository;
    private final SecretVault secretVault;
    private final IntegrationManager integrationManager;

    public SecretService(
            SecretRepository secretRepository,
            UserRepository userRepository,
            SecretVault secretVault,
            IntegrationManager integrationManager
    ) {
        this.secretRepository = secretRepository;
        this.userRepository = userRepository;
        this.secretVault = secretVault;
        this.integrationManager = integrationManager;
    }

    @Transactional(readOnly = true)
    public List<SecretDTO> listSecrets(Long userId) {
        return secretRepository.findByUser_IdOrderByCreatedAtDesc(userId).stream()
                .map(secret -> SecretDTO.fromSecret(secret, fieldNames(secret)))
                .toList();
    }

    /**
     * Secrets whose ciphertext still opens with the current (or previous) master key.
     */
    @Transactional(readOnly = true)
    public List<SecretDTO> listDecryptableSecrets(Long userId) {
        List<SecretDTO> decryptable = new ArrayList<>();
        for (Secret secret : secretRepository.findByUser_IdOrderByCreatedAtDesc(userId)) {
            List<String> fields = fieldNames(secret);
            if (fields != null) {
                decryptable.add(SecretDTO.fromSecret(secret, fields));
            }
        }
        return decryptable;
    }

    @Transactional(readOnly = true)
    public SecretDTO getSecret(Long userId, Long secretId) {
        Secret secret = findOwned(userId, secretId);
        return SecretDTO.fromSecret(secret, fieldNames(secret));
    }

    @Transactional
    public SecretDTO createSecret(Long userId, CreateSecretRequest request) {
        EServiceType serviceType = EServiceType.fromId(request.getServiceType());

        Secret secret = new Secret();
        secret.setUser(userRepository.getReferenceById(userId));
        secret.setName(request.getName().trim());
        secret.setServiceType(serviceType);
        secret.setKind(ESecretKind.APP_CREDENTIAL);
        secret.setEncryptedValue(secretVault.encrypt(request.getValues()));

        Secret saved = secretRepository.save(secret);
        log.info("Created {} secret {} for user {}", serviceType.getId(), saved.getId(), userId);
        return SecretDTO.fromSecret(saved, List.copyOf(request.getValues().keySet()));
    }

    @Transactional
    public SecretDTO updateSecret(Long userId, Long secretId, UpdateSecretRequest request) {
        Secret secret = findOwned(userId, secretId);
        if (secret.isIssuedToken()) {
            throw new IllegalArgumentException("Secrets holding issued OAuth tokens cannot be edited");
        }

        if (request.getName() != null) {
            secret.setName(request.getName().trim());
        }
        if (request.getServiceType() != null) {
            secret.setServiceType(EServiceType.fromId(request.getServiceType()));
        }
        if (request.getValues() != null) {
            if (request.getValues().isEmpty()) {
                throw new IllegalArgumentException("Secret values cannot be empty");
            }
            secret.setEncryptedValue(secretVault.encrypt(request.getValues()));
        }

        Secret saved = secretRepository.save(secret);
        log.info("Updated secret {} for user {}", secretId, userId);
        return SecretDTO.fromSecret(saved, fieldNames(saved));
    }

    /**
     * Integrations using the secret as their token store are moved to ERROR before the row goes away.
     */
    @Transactional
    public void deleteSecret(Long userId, Long secretId) {
        Secret secret = findOwned(userId, secretId);
        integrationManager.detachSecret(secretId);
        secretRepository.delete(secret);
        log.info("Deleted secret {} for user {}", secretId, userId);
    }

    private Secret findOwned(Long userId, Long secretId) {
        return secretRepository.findByUser_IdAndId(userId, secretId)
                .orElseThrow(() -> new SecretNotFoundException(secretId));
    }

    private List<String> fieldNames(Secret secret) {
        try {
            Map<String, Object> values = secretVault.decrypt(secret.getEncryptedValue());
            return List.copyOf(values.keySet());
        } catch (DecryptionException e) {
            log.debug("Secret {} is not decryptable: {}", secret.getId(), e.getMessage());
            return null;
        }
    }
}
