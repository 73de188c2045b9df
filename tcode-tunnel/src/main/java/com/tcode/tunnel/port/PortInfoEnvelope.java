package com.tcode.tunnel.port;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Wire form of a port snapshot, sent as {@code portInfo}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PortInfoEnvelope(
        List<ForwardedPort> userPorts,
        List<ForwardedPort> managementPorts,
        List<ForwardedPort> allPorts,
        String timestamp,
        String error) {
}
