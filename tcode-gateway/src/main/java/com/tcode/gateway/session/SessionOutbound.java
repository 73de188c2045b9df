package com.tcode.gateway.session;

/**
 * Outbound side of a client connection, as seen by its session.
 */
public interface SessionOutbound {

    String getConnectionId();

    /** Serialize and send one message. Dropped silently once the connection is closed. */
    void send(Object message);

    boolean isOpen();
}
