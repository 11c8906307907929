package org.devfriend.webserver.oauth.service;

/**
 * Steps of one in-flight authorization-code flow. Never persisted.
 */
public enum EAuthorizationState {
    INIT,
    AUTHORIZE_URL_ISSUED,
    CODE_RECEIVED,
    TOKEN_EXCHANGED,
    FAILED;

    public boolean isTerminal() {
        return this == TOKEN_EXCHANGED || this == FAILED;
    }
}
