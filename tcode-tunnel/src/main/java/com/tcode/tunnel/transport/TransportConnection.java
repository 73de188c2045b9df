package com.tcode.tunnel.transport;

import com.tcode.tunnel.port.TunnelPort;
import com.tcode.tunnel.rpc.RpcFacility;
import com.tcode.tunnel.trace.TraceListener;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * An open relay tunnel to one codespace.
 */
public interface TransportConnection {

    String getCodespaceName();

    /** The trace callback currently installed; may be {@code null}. */
    TraceListener getTraceListener();

    void setTraceListener(TraceListener listener);

    /** Local port on which the tunnel exposes the codespace's SSH server. */
    int getLocalSshPort();

    /** Out-of-band RPC facility carrying the SSH user and ephemeral key, if the codespace offers one. */
    Optional<RpcFacility> getRpcFacility();

    CompletableFuture<List<TunnelPort>> queryPorts();

    void addForwardedPortListener(ForwardedPortListener listener);

    void removeForwardedPortListener(ForwardedPortListener listener);

    CompletableFuture<Void> dispose();
}
