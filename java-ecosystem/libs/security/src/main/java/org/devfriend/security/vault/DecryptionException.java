package org.devfriend.security.vault;

/**
 * Ciphertext is malformed, was produced with another key, or failed the GCM authentication check.
 * The secret behind it must be treated as unusable.
 */
public class DecryptionException extends RuntimeException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
