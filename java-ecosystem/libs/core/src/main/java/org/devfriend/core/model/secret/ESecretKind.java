package org.devfriend.core.model.secret;

/**
 * Origin of a secret. Rotation and deletion rules differ per kind.
 */
public enum ESecretKind {
    /**
     * Saved by the user (OAuth app client id/secret or any custom fields). Survives integration deletion.
     */
    APP_CREDENTIAL,
    /**
     * Token bundle issued by a provider during an OAuth exchange and owned by exactly one integration.
     */
    ISSUED_TOKEN
}
