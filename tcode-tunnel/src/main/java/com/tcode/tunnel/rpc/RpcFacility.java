package com.tcode.tunnel.rpc;

import java.util.concurrent.CompletableFuture;

/**
 * Out-of-band RPC channel into a codespace. Supplies the credentials used to
 * open the SSH shell and keeps the remote agent's session alive.
 */
public interface RpcFacility {

    String getSshUser();

    /** PEM-encoded private key for the SSH user. */
    String getPrivateKey();

    /** The controlling client went away; the facility may stop heartbeats. */
    default void markDisconnected() {
    }

    /** A client re-associated with the facility before it was disposed. */
    default void markReconnected() {
    }

    CompletableFuture<Void> dispose();
}
