package org.devfriend.webserver.exception;

public class SecretNotFoundException extends RuntimeException {
    public SecretNotFoundException(Long secretId) {
        super("Secret not found: " + secretId);
    }
}
