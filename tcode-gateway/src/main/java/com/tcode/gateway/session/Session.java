package com.tcode.gateway.session;

import com.tcode.gateway.directory.CodespaceDirectory;
import com.tcode.tunnel.port.PortInformation;
import com.tcode.tunnel.port.PortMapping;
import lombok.Getter;

import java.util.List;

/**
 * Per-connection state, owned by {@link SessionRegistry} and looked up by
 * connection id. Holds at most one live bridge.
 */
@Getter
public class Session {

    private final String connectionId;
    private final long createdAt;

    private volatile String token;
    private volatile CodespaceDirectory directory;
    private volatile SessionState state = SessionState.UNAUTHENTICATED;
    private volatile String codespaceName;
    private volatile ActiveBridge bridge;
    private volatile PortInformation portSnapshot;
    private volatile List<PortMapping> portMappings = List.of();

    public Session(String connectionId) {
        this.connectionId = connectionId;
        this.createdAt = System.currentTimeMillis();
    }

    public boolean isAuthenticated() {
        return directory != null;
    }

    synchronized void bind(String token, CodespaceDirectory directory) {
        this.token = token;
        this.directory = directory;
    }

    synchronized void setState(SessionState state) {
        this.state = state;
    }

    /**
     * Enter {@link SessionState#BRIDGING} unless the session is already closing.
     */
    synchronized boolean beginBridging() {
        if (state.isTerminating()) {
            return false;
        }
        state = SessionState.BRIDGING;
        return true;
    }

    /**
     * Move to {@code next} only if the session is currently in {@code expected}.
     */
    synchronized boolean transition(SessionState expected, SessionState next) {
        if (state != expected) {
            return false;
        }
        state = next;
        return true;
    }

    void setCodespaceName(String codespaceName) {
        this.codespaceName = codespaceName;
    }

    void setBridge(ActiveBridge bridge) {
        this.bridge = bridge;
    }

    /**
     * Drop {@code expected} if it is still the active bridge.
     */
    synchronized void clearBridge(ActiveBridge expected) {
        if (bridge == expected) {
            bridge = null;
            portSnapshot = null;
            portMappings = List.of();
        }
    }

    void setPortSnapshot(PortInformation portSnapshot) {
        this.portSnapshot = portSnapshot;
    }

    void setPortMappings(List<PortMapping> portMappings) {
        this.portMappings = List.copyOf(portMappings);
    }

    synchronized void clearCaches() {
        bridge = null;
        codespaceName = null;
        portSnapshot = null;
        portMappings = List.of();
    }
}
