package com.tcode.gateway.directory;

import com.tcode.tunnel.transport.TunnelProperties;

/**
 * What the bridge needs to reach a running codespace.
 */
public record CodespaceConnectionInfo(Codespace codespace, TunnelProperties tunnelProperties) {

    public String getName() {
        return codespace.getName();
    }

    public String getRepositoryFullName() {
        return codespace.getRepositoryFullName();
    }
}
