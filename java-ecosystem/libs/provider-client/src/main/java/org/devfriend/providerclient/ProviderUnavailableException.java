package org.devfriend.providerclient;

/**
 * Network failure, timeout, rate limit or 5xx from a provider. Safe to retry later;
 * never a reason to downgrade an integration.
 */
public class ProviderUnavailableException extends ProviderClientException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
