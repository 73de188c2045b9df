package com.tcode.tunnel.port;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which subsystem produced a port fact.
 */
public enum PortProvenance {
    LISTENERS("listeners"),
    WAIT_FOR_FORWARDED("waitForForwarded"),
    TUNNEL_QUERY("tunnelQuery"),
    TRACE_FALLBACK("trace_fallback");

    private final String wireName;

    PortProvenance(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
