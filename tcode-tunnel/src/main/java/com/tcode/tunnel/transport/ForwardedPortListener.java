package com.tcode.tunnel.transport;

import com.tcode.tunnel.port.TunnelPort;

/**
 * Notified when the relay transport forwards a new port.
 */
@FunctionalInterface
public interface ForwardedPortListener {

    void onPortForwarded(TunnelPort port);
}
