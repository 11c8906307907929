package org.devfriend.providerclient;

/**
 * Provider refused an access token that was believed to be valid (revoked early on the provider side).
 */
public class TokenRejectedException extends ProviderClientException {

    public TokenRejectedException(String message) {
        super(message);
    }
}
