package com.tcode.tunnel.trace;

/**
 * Severity attached to a transport trace event.
 */
public enum TraceLevel {
    CRITICAL,
    ERROR,
    WARNING,
    INFO,
    VERBOSE;

    public boolean isError() {
        return this == CRITICAL || this == ERROR;
    }
}
