package org.devfriend.providerclient;

/**
 * Exception thrown when a provider call fails for a reason that is neither an auth problem
 * nor a transient outage (unexpected 4xx, malformed payload).
 */
public class ProviderClientException extends RuntimeException {

    private final int statusCode;
    private final String responseBody;

    public ProviderClientException(String message) {
        super(message);
        this.statusCode = -1;
        this.responseBody = null;
    }

    public ProviderClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.responseBody = null;
    }

    public ProviderClientException(String operation, int statusCode, String responseBody) {
        super(String.format("Provider API error during %s: HTTP %d - %s", operation, statusCode, responseBody));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
