package com.tcode.gateway.transport;

import com.tcode.tunnel.BridgeError;
import com.tcode.tunnel.transport.RelayTransport;
import com.tcode.tunnel.transport.TransportConnection;
import com.tcode.tunnel.transport.TunnelProperties;

import java.util.concurrent.CompletableFuture;

/**
 * Relay transport used when the application provides none. Every connect fails.
 */
public class UnconfiguredRelayTransport implements RelayTransport {

    @Override
    public CompletableFuture<TransportConnection> connect(String codespaceName, TunnelProperties properties) {
        return CompletableFuture.failedFuture(new BridgeError("relay transport not configured"));
    }
}
