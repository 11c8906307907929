package org.devfriend.webserver.exception;

public class IntegrationNotFoundException extends RuntimeException {
    public IntegrationNotFoundException(Long integrationId) {
        super("Integration not found: " + integrationId);
    }
}
