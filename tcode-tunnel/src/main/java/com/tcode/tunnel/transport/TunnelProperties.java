package com.tcode.tunnel.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Relay tunnel coordinates handed out by the codespace directory.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TunnelProperties(
        String tunnelId,
        String clusterId,
        String domain,
        String connectAccessToken,
        String managePortsAccessToken,
        String serviceUri) {

    @Override
    public String toString() {
        // access tokens stay out of logs
        return "TunnelProperties[tunnelId=" + tunnelId + ", clusterId=" + clusterId
                + ", domain=" + domain + "]";
    }
}
