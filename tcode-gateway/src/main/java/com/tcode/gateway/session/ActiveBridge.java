package com.tcode.gateway.session;

import com.tcode.tunnel.rpc.RpcGraceWindow;
import com.tcode.tunnel.shell.ShellChannel;
import com.tcode.tunnel.trace.TraceSubscription;
import com.tcode.tunnel.transport.ForwardedPortListener;
import com.tcode.tunnel.transport.TransportConnection;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * Resources held by one bridge to a codespace, filled in as the bridge
 * sequence acquires them.
 */
@Getter
@Setter
public class ActiveBridge {

    private final String codespaceName;
    private volatile String repositoryFullName;
    private volatile TransportConnection transport;
    private volatile TraceSubscription subscription;
    private volatile RpcGraceWindow rpcWindow;
    private volatile ShellChannel shell;
    private volatile ForwardedPortListener portListener;

    @Setter(AccessLevel.NONE)
    private volatile boolean released;

    ActiveBridge(String codespaceName) {
        this.codespaceName = codespaceName;
    }

    void markReleased() {
        this.released = true;
    }
}
