package com.tcode.gateway.session;

/**
 * Lifecycle of one client connection.
 */
public enum SessionState {
    UNAUTHENTICATED,
    AUTHENTICATED,
    BRIDGING,
    BRIDGED,
    DRAINING,
    CLOSED;

    public boolean isTerminating() {
        return this == DRAINING || this == CLOSED;
    }
}
