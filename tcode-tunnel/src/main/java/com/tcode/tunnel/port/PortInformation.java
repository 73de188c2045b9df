package com.tcode.tunnel.port;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of the ports a transport currently forwards, split into user and
 * management ports.
 *
 * @param timestamp ISO-8601 capture time
 * @param error     why the snapshot is degraded, or {@code null}
 */
public record PortInformation(
        List<TunnelPort> userPorts,
        List<TunnelPort> managementPorts,
        List<TunnelPort> allPorts,
        String timestamp,
        String error) {

    public PortInformation {
        userPorts = userPorts == null ? List.of() : List.copyOf(userPorts);
        managementPorts = managementPorts == null ? List.of() : List.copyOf(managementPorts);
        allPorts = allPorts == null ? List.of() : List.copyOf(allPorts);
    }

    public static PortInformation empty() {
        return new PortInformation(List.of(), List.of(), List.of(), Instant.now().toString(), null);
    }

    public PortInformation withError(String message) {
        return new PortInformation(userPorts, managementPorts, allPorts, timestamp, message);
    }
}
