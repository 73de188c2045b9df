package com.tcode.gateway.session;

import com.tcode.common.config.ConfigService;
import com.tcode.common.logging.SubsystemLogger;
import com.tcode.gateway.directory.CodespaceDirectoryFactory;
import com.tcode.tunnel.shell.ShellChannelFactory;
import com.tcode.tunnel.transport.RelayTransport;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Owns the sessions of all live connections, keyed by connection id.
 */
public class SessionRegistry {

    private final CodespaceDirectoryFactory directoryFactory;
    private final RelayTransport relayTransport;
    private final ShellChannelFactory shellFactory;
    private final ScheduledExecutorService scheduler;
    private final ConfigService configService;
    private final SubsystemLogger log;

    private final Map<String, SessionLifecycleManager> sessions = new ConcurrentHashMap<>();

    public SessionRegistry(CodespaceDirectoryFactory directoryFactory, RelayTransport relayTransport,
            ShellChannelFactory shellFactory, ScheduledExecutorService scheduler,
            ConfigService configService, SubsystemLogger log) {
        this.directoryFactory = directoryFactory;
        this.relayTransport = relayTransport;
        this.shellFactory = shellFactory;
        this.scheduler = scheduler;
        this.configService = configService;
        this.log = log;
    }

    /**
     * Create the session for a new connection. Configuration is read now and
     * fixed for the session's lifetime.
     */
    public SessionLifecycleManager open(SessionOutbound outbound) {
        String connectionId = outbound.getConnectionId();
        SessionSettings settings = SessionSettings.from(configService.loadConfig());
        SessionLifecycleManager manager = new SessionLifecycleManager(
                new Session(connectionId), outbound, directoryFactory, relayTransport, shellFactory,
                scheduler, settings, log.child("session"));
        SessionLifecycleManager existing = sessions.putIfAbsent(connectionId, manager);
        if (existing != null) {
            return existing;
        }
        log.debug("Session opened", Map.of("conn", connectionId, "sessions", sessions.size()));
        return manager;
    }

    public SessionLifecycleManager get(String connectionId) {
        return sessions.get(connectionId);
    }

    /**
     * Remove and close the session of a closed connection.
     */
    public CompletableFuture<Void> close(String connectionId) {
        SessionLifecycleManager manager = sessions.remove(connectionId);
        if (manager == null) {
            return CompletableFuture.completedFuture(null);
        }
        return manager.close();
    }

    public int size() {
        return sessions.size();
    }

    public Collection<SessionLifecycleManager> all() {
        return Collections.unmodifiableCollection(sessions.values());
    }
}
