package com.tcode.tunnel.trace;

import com.tcode.tunnel.transport.TransportConnection;

/**
 * Handle returned by {@link PortMappingTracker#attachToClient}. Holds the
 * listener that was installed on the transport before the tracker attached.
 */
public final class TraceSubscription {

    private final TransportConnection transport;
    private final TraceListener previous;
    private final TraceListener interceptor;

    TraceSubscription(TransportConnection transport, TraceListener previous, TraceListener interceptor) {
        this.transport = transport;
        this.previous = previous;
        this.interceptor = interceptor;
    }

    public TransportConnection getTransport() {
        return transport;
    }

    TraceListener getPrevious() {
        return previous;
    }

    TraceListener getInterceptor() {
        return interceptor;
    }
}
