package com.tcode.tunnel;

/**
 * Raised when disposing a shell, transport or RPC facility that is already
 * torn down. Callers performing teardown log it and carry on.
 */
public class ChannelFault extends RuntimeException {

    private final String resource;

    public ChannelFault(String resource, String message, Throwable cause) {
        super(message, cause);
        this.resource = resource;
    }

    public ChannelFault(String resource, String message) {
        this(resource, message, null);
    }

    /** Name of the resource being released: "shell", "transport", "rpc" or "tracker". */
    public String getResource() {
        return resource;
    }
}
