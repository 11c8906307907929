package org.devfriend.providerclient.model;

import java.util.Locale;

/**
 * Kind of resource a list call returns, named after the REST path segment that exposes it.
 */
public enum EListKind {
    EMAILS,
    REPOS,
    MESSAGES,
    CHANNELS;

    public static EListKind fromPath(String segment) {
        try {
            return valueOf(segment.toUpperCase(Locale.ENGLISH));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown list kind: " + segment);
        }
    }
}
