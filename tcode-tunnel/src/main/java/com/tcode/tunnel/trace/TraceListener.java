package com.tcode.tunnel.trace;

/**
 * Trace callback installed on a transport connection. Invoked synchronously
 * on the transport's own thread, so implementations must not block.
 */
@FunctionalInterface
public interface TraceListener {

    void onTrace(TraceLevel level, int eventId, String message, Throwable error);
}
