package com.tcode.tunnel.trace;

import java.util.Map;

/**
 * One categorized trace event kept in a tracker's history.
 *
 * @param timestamp epoch millis at capture
 * @param level     severity reported by the transport
 * @param eventId   transport event id
 * @param message   message text with credentials redacted
 * @param category  derived category
 * @param payload   parsed facts, e.g. {@code state} for connection records or
 *                  {@code localPort}/{@code remotePort} for port records; empty otherwise
 */
public record TraceRecord(
        long timestamp,
        TraceLevel level,
        int eventId,
        String message,
        TraceCategory category,
        Map<String, Object> payload) {

    public TraceRecord {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }
}
