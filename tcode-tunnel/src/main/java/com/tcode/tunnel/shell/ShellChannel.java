package com.tcode.tunnel.shell;

import java.util.concurrent.CompletableFuture;

/**
 * An interactive shell running inside a codespace.
 */
public interface ShellChannel {

    void write(String data);

    void resize(int cols, int rows);

    boolean isOpen();

    CompletableFuture<Void> close();
}
