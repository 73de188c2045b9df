package com.tcode.tunnel.port;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A local-to-remote port pairing discovered on a transport.
 *
 * @param protocol {@code null} when unspecified, {@code "ipv6"} for IPv6
 *                 listeners, otherwise a named protocol
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PortMapping(
        int localPort,
        int remotePort,
        String protocol,
        @JsonProperty("isActive") boolean active,
        PortProvenance source) {

    public static final int MAX_PORT = 65535;

    public PortMapping {
        if (localPort < 0 || localPort > MAX_PORT) {
            throw new IllegalArgumentException("localPort out of range: " + localPort);
        }
        if (remotePort < 0 || remotePort > MAX_PORT) {
            throw new IllegalArgumentException("remotePort out of range: " + remotePort);
        }
    }
}
