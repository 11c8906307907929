package org.devfriend.providerclient.oauth;

public enum EOAuthPhase {
    CODE_EXCHANGE,
    REFRESH
}
