package org.devfriend.webserver.oauth.service;

import org.devfriend.core.model.integration.EOAuthProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks one authorization attempt through {@link EAuthorizationState}. The authorize half and the
 * callback half run in different requests, so each request replays the flow from the state token.
 */
public class AuthorizationFlow {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationFlow.class);

    private final EOAuthProvider provider;
    private EAuthorizationState state = EAuthorizationState.INIT;
    private String failureReason;

    private AuthorizationFlow(EOAuthProvider provider) {
        this.provider = provider;
    }

    public static AuthorizationFlow begin(EOAuthProvider provider) {
        return new AuthorizationFlow(provider);
    }

    /**
     * Resumes a flow at the callback: the authorize URL was issued in an earlier request.
     */
    public static AuthorizationFlow resume(EOAuthProvider provider) {
        AuthorizationFlow flow = new AuthorizationFlow(provider);
        flow.state = EAuthorizationState.AUTHORIZE_URL_ISSUED;
        return flow;
    }

    public void authorizeUrlIssued() {
        transition(EAuthorizationState.INIT, EAuthorizationState.AUTHORIZE_URL_ISSUED);
    }

    public void codeReceived() {
        transition(EAuthorizationState.AUTHORIZE_URL_ISSUED, EAuthorizationState.CODE_RECEIVED);
    }

    public void tokensExchanged() {
        transition(EAuthorizationState.CODE_RECEIVED, EAuthorizationState.TOKEN_EXCHANGED);
    }

    public void fail(String reason) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Authorization flow already finished in state " + state);
        }
        log.debug("{} authorization flow failed in state {}: {}", provider.getId(), state, reason);
        this.state = EAuthorizationState.FAILED;
        this.failureReason = reason;
    }

    private void transition(EAuthorizationState expected, EAuthorizationState next) {
        if (state != expected) {
            throw new IllegalStateException(
                    "Cannot move " + provider.getId() + " authorization flow from " + state + " to " + next);
        }
        this.state = next;
    }

    public EOAuthProvider getProvider() {
        return provider;
    }

    public EAuthorizationState getState() {
        return state;
    }

    public String getFailureReason() {
        return failureReason;
    }
}
