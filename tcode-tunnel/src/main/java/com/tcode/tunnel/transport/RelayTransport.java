package com.tcode.tunnel.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Opens relay tunnels. The tunnel wire protocol lives behind this seam.
 */
public interface RelayTransport {

    CompletableFuture<TransportConnection> connect(String codespaceName, TunnelProperties properties);
}
