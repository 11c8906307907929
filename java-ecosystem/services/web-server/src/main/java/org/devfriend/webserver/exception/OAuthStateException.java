package org.devfriend.webserver.exception;

public class OAuthStateException extends RuntimeException {
    public OAuthStateException(String message) {
        super(message);
    }
}
