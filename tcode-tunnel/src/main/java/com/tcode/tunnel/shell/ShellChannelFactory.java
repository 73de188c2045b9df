package com.tcode.tunnel.shell;

import java.util.concurrent.CompletableFuture;

public interface ShellChannelFactory {

    CompletableFuture<ShellChannel> open(ShellTarget target, ShellListener listener);
}
