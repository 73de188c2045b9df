package com.tcode.tunnel;

/**
 * The relay tunnel or the shell of a bridge could not be opened. Reported to
 * the client; partially opened resources are rolled back by the caller.
 */
public class BridgeError extends RuntimeException {

    public BridgeError(String message) {
        super(message);
    }

    public BridgeError(String message, Throwable cause) {
        super(message, cause);
    }
}
