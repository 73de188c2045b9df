package com.tcode.tunnel.trace;

import java.util.Map;

/**
 * Counts over a tracker's retained history.
 *
 * @param errors records logged at an error level, whatever their category
 */
public record TraceStats(int total, Map<TraceCategory, Integer> byCategory, int errors) {

    public int count(TraceCategory category) {
        return byCategory.getOrDefault(category, 0);
    }
}
