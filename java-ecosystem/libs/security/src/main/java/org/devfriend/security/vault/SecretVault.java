package org.devfriend.security.vault;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encrypts secret bundles (JSON field maps) with AES-256-GCM under the server master key.
 * <p>
 * Output layout: Base64(IV[12] || ciphertext || tag[16]). A fresh random IV is drawn per call,
 * so equal bundles never produce equal ciphertexts. When an old key is configured it is tried
 * for decryption only, which allows rotating the master key without re-encrypting everything at once.
 */
public class SecretVault {
    private static final Logger log = LoggerFactory.getLogger(SecretVault.class);

    private static final String ENCRYPTION_ALGO = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;
    private static final int KEY_LENGTH_BYTES = 32;
    private static final TypeReference<LinkedHashMap<String, Object>> BUNDLE_TYPE = new TypeReference<>() {
    };

    private final SecretKey secretKey;
    private final SecretKey oldSecretKey;
    private final ObjectMapper objectMapper;
    private final SecureRandom secureRandom = new SecureRandom();

    public SecretVault(String base64Key, String oldBase64Key, ObjectMapper objectMapper) {
        this.secretKey = toKey(base64Key, "devfriend.security.encryption-key");
        this.oldSecretKey = oldBase64Key == null || oldBase64Key.isBlank()
                ? null
                : toKey(oldBase64Key, "devfriend.security.encryption-key-old");
        this.objectMapper = objectMapper;
    }

    public SecretVault(String base64Key, ObjectMapper objectMapper) {
        this(base64Key, null, objectMapper);
    }

    public String encrypt(Map<String, ?> plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Secret bundle cannot be null");
        }
        try {
            byte[] json = objectMapper.writeValueAsBytes(plaintext);
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGO);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] encrypted = cipher.doFinal(json);

            byte[] encryptedWithIv = new byte[iv.length + encrypted.length];
            System.arraycopy(iv, 0, encryptedWithIv, 0, iv.length);
            System.arraycopy(encrypted, 0, encryptedWithIv, iv.length, encrypted.length);
            return Base64.getEncoder().encodeToString(encryptedWithIv);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Secret bundle is not serializable", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    /**
     * @throws DecryptionException if the value is not valid Base64, is truncated, was tampered with,
     *                             or was encrypted under an unknown key
     */
    public Map<String, Object> decrypt(String ciphertext) {
        if (ciphertext == null || ciphertext.isBlank()) {
            throw new DecryptionException("Ciphertext is empty");
        }

        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(ciphertext.trim());
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Ciphertext is not valid Base64", e);
        }
        if (decoded.length < GCM_IV_LENGTH + GCM_TAG_LENGTH / 8) {
            throw new DecryptionException("Ciphertext is too short");
        }

        byte[] plaintext;
        try {
            plaintext = decryptWithKey(decoded, secretKey);
        } catch (GeneralSecurityException e) {
            if (oldSecretKey == null) {
                throw new DecryptionException("Secret authentication failed", e);
            }
            try {
                plaintext = decryptWithKey(decoded, oldSecretKey);
                log.debug("Secret decrypted with the previous master key");
            } catch (GeneralSecurityException oldKeyFailure) {
                throw new DecryptionException("Secret authentication failed", oldKeyFailure);
            }
        }

        try {
            return objectMapper.readValue(plaintext, BUNDLE_TYPE);
        } catch (IOException e) {
            throw new DecryptionException("Decrypted secret is not a JSON object", e);
        }
    }

    /**
     * True if the value decrypts under the current or old key.
     */
    public boolean canDecrypt(String ciphertext) {
        try {
            decrypt(ciphertext);
            return true;
        } catch (DecryptionException e) {
            return false;
        }
    }

    private byte[] decryptWithKey(byte[] decoded, SecretKey key) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGO);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, decoded, 0, GCM_IV_LENGTH));
        return cipher.doFinal(decoded, GCM_IV_LENGTH, decoded.length - GCM_IV_LENGTH);
    }

    private static SecretKey toKey(String base64Key, String propertyName) {
        if (base64Key == null || base64Key.isBlank()) {
            throw new IllegalStateException(propertyName + " is not configured. "
                    + "Provide a Base64-encoded 32-byte key (e.g. `openssl rand -base64 32`).");
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(base64Key.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(propertyName + " is not valid Base64", e);
        }
        if (keyBytes.length != KEY_LENGTH_BYTES) {
            throw new IllegalStateException(propertyName + " must decode to exactly "
                    + KEY_LENGTH_BYTES + " bytes, got " + keyBytes.length);
        }
        return new SecretKeySpec(keyBytes, "AES");
    }
}
