package com.tcode.tunnel.port;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Raw port record as reported by the relay transport.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TunnelPort(
        String clusterId,
        String tunnelId,
        int portNumber,
        String protocol,
        List<String> labels,
        List<String> portForwardingUris) {

    public TunnelPort {
        labels = labels == null ? List.of() : List.copyOf(labels);
        portForwardingUris = portForwardingUris == null ? List.of() : List.copyOf(portForwardingUris);
    }

    public boolean hasLabel(String label) {
        return labels.contains(label);
    }
}
