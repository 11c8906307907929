package org.devfriend.core.model.integration;

/**
 * Lifecycle of an integration record. A missing row is the implicit empty state.
 */
public enum EIntegrationStatus {
    /** Row exists, OAuth consent not completed yet. */
    CONNECTING,
    /** Tokens stored and usable. */
    CONNECTED,
    /** Access token expired and a refresh is pending or failed transiently. */
    TOKEN_EXPIRED,
    /** Refresh impossible; only a new user consent brings it back. */
    NEEDS_REAUTH,
    /** The referenced token secret was removed. */
    ERROR;

    public boolean requiresUserAction() {
        return this == NEEDS_REAUTH || this == ERROR;
    }
}
