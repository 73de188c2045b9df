package com.tcode.gateway.session;

import com.tcode.common.infra.ErrorUtils;
import com.tcode.common.logging.SubsystemLogger;
import com.tcode.gateway.directory.CodespaceDirectory;
import com.tcode.gateway.directory.CodespaceDirectoryFactory;
import com.tcode.gateway.directory.DirectoryError;
import com.tcode.gateway.protocol.ProtocolTypes.Authenticated;
import com.tcode.gateway.protocol.ProtocolTypes.CodespaceState;
import com.tcode.gateway.protocol.ProtocolTypes.CodespaceStates;
import com.tcode.gateway.protocol.ProtocolTypes.CodespacesList;
import com.tcode.gateway.protocol.ProtocolTypes.DisconnectedFromCodespace;
import com.tcode.gateway.protocol.ProtocolTypes.Output;
import com.tcode.gateway.protocol.ProtocolTypes.PortInfoResponse;
import com.tcode.gateway.protocol.ProtocolTypes.PortUpdate;
import com.tcode.tunnel.BridgeError;
import com.tcode.tunnel.ChannelFault;
import com.tcode.tunnel.port.ForwardedPort;
import com.tcode.tunnel.port.PortInfoConverter;
import com.tcode.tunnel.port.PortInformation;
import com.tcode.tunnel.port.PortMapping;
import com.tcode.tunnel.port.TunnelPort;
import com.tcode.tunnel.rpc.RpcFacility;
import com.tcode.tunnel.rpc.RpcGraceWindow;
import com.tcode.tunnel.shell.ShellChannel;
import com.tcode.tunnel.shell.ShellChannelFactory;
import com.tcode.tunnel.shell.ShellListener;
import com.tcode.tunnel.shell.ShellTarget;
import com.tcode.tunnel.trace.PortMappingTracker;
import com.tcode.tunnel.transport.ForwardedPortListener;
import com.tcode.tunnel.transport.RelayTransport;
import com.tcode.tunnel.transport.TransportConnection;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * Drives one client connection through authenticate, bridge and teardown.
 * <p>
 * Operations that change the bridge (connect, disconnect, remote shell
 * close, connection close) are chained so each starts only after the previous
 * one settled. Input, resize and port reads use whatever bridge is current.
 * <p>
 * A bridge acquires, in order: connection info from the directory, a relay
 * transport, the trace interceptor, the RPC facility and the shell. It is
 * released in the reverse order.
 */
public class SessionLifecycleManager {

    private static final String CLOSING = "Session is closing";

    private final Session session;
    private final SessionOutbound outbound;
    private final CodespaceDirectoryFactory directoryFactory;
    private final RelayTransport relayTransport;
    private final ShellChannelFactory shellFactory;
    private final ScheduledExecutorService scheduler;
    private final SessionSettings settings;
    private final SubsystemLogger log;
    private final PortMappingTracker tracker;

    private final Object mutationLock = new Object();
    private CompletableFuture<Void> mutationTail = CompletableFuture.completedFuture(null);

    public SessionLifecycleManager(Session session, SessionOutbound outbound,
            CodespaceDirectoryFactory directoryFactory, RelayTransport relayTransport,
            ShellChannelFactory shellFactory, ScheduledExecutorService scheduler,
            SessionSettings settings, SubsystemLogger log) {
        this.session = session;
        this.outbound = outbound;
        this.directoryFactory = directoryFactory;
        this.relayTransport = relayTransport;
        this.shellFactory = shellFactory;
        this.scheduler = scheduler;
        this.settings = settings;
        this.log = log;
        this.tracker = new PortMappingTracker(settings.traceMaxHistory(), settings.traceDebug(), log.child("trace"));
    }

    public Session getSession() {
        return session;
    }

    public SessionOutbound getOutbound() {
        return outbound;
    }

    public PortMappingTracker getTracker() {
        return tracker;
    }

    // =========================================================================
    // Authentication and directory operations
    // =========================================================================

    /**
     * Bind the session to {@code token}. The token is not checked here; a bad
     * one fails the first directory call.
     */
    public CompletableFuture<Void> authenticate(String token) {
        synchronized (session) {
            String current = session.getToken();
            if (current == null) {
                session.bind(token, directoryFactory.create(token));
                session.transition(SessionState.UNAUTHENTICATED, SessionState.AUTHENTICATED);
                log.info("Session authenticated", Map.of("conn", session.getConnectionId()));
            } else if (!current.equals(token)) {
                throw new AuthError("Session is already authenticated with a different token");
            }
        }
        outbound.send(Authenticated.ok());
        return CompletableFuture.completedFuture(null);
    }

    public CompletableFuture<Void> listCodespaces() {
        return requireDirectory().listCodespaces()
                .thenAccept(codespaces -> outbound.send(CodespacesList.of(codespaces)));
    }

    public CompletableFuture<Void> startCodespace(String codespaceName) {
        return requireDirectory().startCodespace(codespaceName)
                .thenAccept(codespace -> {
                    if (codespace.getName() == null) {
                        codespace.setName(codespaceName);
                    }
                    outbound.send(CodespaceState.of(codespace));
                });
    }

    public CompletableFuture<Void> stopCodespace(String codespaceName) {
        return requireDirectory().stopCodespace(codespaceName)
                .thenAccept(codespace -> {
                    if (codespace.getName() == null) {
                        codespace.setName(codespaceName);
                    }
                    outbound.send(CodespaceState.of(codespace));
                });
    }

    private CodespaceDirectory requireDirectory() {
        CodespaceDirectory directory = session.getDirectory();
        if (directory == null) {
            throw AuthError.notAuthenticated();
        }
        return directory;
    }

    // =========================================================================
    // Bridge lifecycle
    // =========================================================================

    /**
     * Bridge to {@code codespaceName}, replacing any bridge already active.
     */
    public CompletableFuture<Void> connectCodespace(String codespaceName) {
        CodespaceDirectory directory = requireDirectory();
        return enqueueMutation(() -> {
            ActiveBridge previous = session.getBridge();
            if (previous == null) {
                return bridge(directory, codespaceName);
            }
            log.info("Replacing active bridge", Map.of("from", previous.getCodespaceName(), "to", codespaceName));
            return release(previous, false)
                    .thenRun(() -> session.clearBridge(previous))
                    .thenCompose(ignored -> bridge(directory, codespaceName));
        });
    }

    private CompletableFuture<Void> bridge(CodespaceDirectory directory, String codespaceName) {
        if (!session.beginBridging()) {
            return CompletableFuture.failedFuture(new BridgeError(CLOSING));
        }
        session.setCodespaceName(codespaceName);
        ActiveBridge bridge = new ActiveBridge(codespaceName);
        log.info("Bridging codespace", Map.of("codespace", codespaceName));

        CompletableFuture<Void> sequence = directory.getConnectionInfo(codespaceName)
                .thenCompose(info -> {
                    ensureNotClosing();
                    bridge.setRepositoryFullName(info.getRepositoryFullName());
                    return relayTransport.connect(codespaceName, info.tunnelProperties());
                })
                .thenCompose(transport -> {
                    bridge.setTransport(transport);
                    ensureNotClosing();
                    bridge.setSubscription(tracker.attachToClient(transport));
                    RpcFacility rpc = transport.getRpcFacility()
                            .orElseThrow(() -> new BridgeError("No SSH private key available from RPC connection"));
                    bridge.setRpcWindow(new RpcGraceWindow(rpc, scheduler, settings.gracePeriod(), log.child("rpc")));
                    outbound.send(CodespaceState.of(codespaceName, CodespaceStates.STARTING,
                            bridge.getRepositoryFullName()));
                    return shellFactory.open(shellTarget(transport, rpc), shellListener(bridge));
                })
                .thenCompose(shell -> {
                    bridge.setShell(shell);
                    ensureNotClosing();
                    ForwardedPortListener portListener = port -> onPortForwarded(bridge, port);
                    bridge.setPortListener(portListener);
                    bridge.getTransport().addForwardedPortListener(portListener);
                    session.setBridge(bridge);
                    session.transition(SessionState.BRIDGING, SessionState.BRIDGED);
                    outbound.send(CodespaceState.of(codespaceName, CodespaceStates.CONNECTED,
                            bridge.getRepositoryFullName()));
                    log.info("Bridge established", Map.of("codespace", codespaceName));
                    return snapshot(bridge, false);
                })
                .thenAccept(info -> pushPortUpdate(bridge, info));

        return sequence.handle((ok, err) -> {
            if (err == null) {
                return CompletableFuture.<Void>completedFuture(null);
            }
            Throwable cause = ErrorUtils.unwrap(err);
            return rollback(bridge, cause)
                    .thenCompose(ignored -> CompletableFuture.<Void>failedFuture(cause));
        }).thenCompose(f -> f);
    }

    /**
     * A close arriving mid-bridge aborts the remaining steps; rollback then
     * releases whatever was already acquired.
     */
    private void ensureNotClosing() {
        if (session.getState().isTerminating()) {
            throw new BridgeError(CLOSING);
        }
    }

    private CompletableFuture<Void> rollback(ActiveBridge bridge, Throwable cause) {
        log.warn("Bridge failed, rolling back", Map.of(
                "codespace", bridge.getCodespaceName(),
                "error", ErrorUtils.formatErrorMessage(cause)));
        return release(bridge, false).thenRun(() -> {
            session.clearBridge(bridge);
            if (!session.transition(SessionState.BRIDGING, SessionState.AUTHENTICATED)) {
                session.transition(SessionState.BRIDGED, SessionState.AUTHENTICATED);
            }
            if (session.getState().isTerminating()) {
                return;
            }
            String failedState = CodespaceStates.DISCONNECTED;
            if (cause instanceof DirectoryError directoryError && directoryError.getCodespaceState() != null) {
                failedState = directoryError.getCodespaceState();
            }
            outbound.send(CodespaceState.of(bridge.getCodespaceName(), failedState));
        });
    }

    /**
     * Tear down the active bridge and close its RPC facility. No-op without a bridge.
     */
    public CompletableFuture<Void> disconnectCodespace() {
        return enqueueMutation(() -> {
            ActiveBridge bridge = session.getBridge();
            if (bridge == null) {
                return CompletableFuture.completedFuture(null);
            }
            log.info("Disconnecting codespace", Map.of("codespace", bridge.getCodespaceName()));
            return release(bridge, false).thenRun(() -> {
                session.clearBridge(bridge);
                session.transition(SessionState.BRIDGED, SessionState.AUTHENTICATED);
                outbound.send(CodespaceState.of(bridge.getCodespaceName(), CodespaceStates.SHUTDOWN));
                outbound.send(DisconnectedFromCodespace.create());
            });
        });
    }

    /**
     * The client connection is gone. The shell closes now, the RPC facility is
     * given its grace period, everything else is released.
     */
    public CompletableFuture<Void> close() {
        SessionState previous = session.getState();
        if (previous == SessionState.CLOSED) {
            return CompletableFuture.completedFuture(null);
        }
        session.setState(SessionState.DRAINING);
        return enqueueMutation(() -> {
            ActiveBridge bridge = session.getBridge();
            CompletableFuture<Void> released = bridge != null
                    ? release(bridge, true)
                    : CompletableFuture.completedFuture(null);
            return released.thenRun(() -> {
                session.clearCaches();
                tracker.detachFromAllClients();
                tracker.clearTraces();
                session.setState(SessionState.CLOSED);
                log.info("Session closed", Map.of("conn", session.getConnectionId(), "from", previous.name()));
            });
        });
    }

    private void onRemoteShellClosed(ActiveBridge bridge) {
        if (bridge.isReleased() || session.getBridge() != bridge) {
            return;
        }
        log.info("Shell closed by codespace", Map.of("codespace", bridge.getCodespaceName()));
        outbound.send(CodespaceState.of(bridge.getCodespaceName(), CodespaceStates.SHUTDOWN));
        enqueueMutation(() -> {
            if (session.getBridge() != bridge) {
                return CompletableFuture.completedFuture(null);
            }
            return release(bridge, false).thenRun(() -> {
                session.clearBridge(bridge);
                session.transition(SessionState.BRIDGED, SessionState.AUTHENTICATED);
            });
        });
    }

    /**
     * Release a bridge's resources in reverse acquisition order. With
     * {@code graceForRpc} the RPC facility is left to its grace window instead
     * of being closed. Disposal faults are logged and never fail the result.
     */
    private CompletableFuture<Void> release(ActiveBridge bridge, boolean graceForRpc) {
        bridge.markReleased();
        TransportConnection transport = bridge.getTransport();
        ForwardedPortListener portListener = bridge.getPortListener();
        if (transport != null && portListener != null) {
            quietly("transport", () -> {
                transport.removeForwardedPortListener(portListener);
                return CompletableFuture.completedFuture(null);
            });
        }

        ShellChannel shell = bridge.getShell();
        CompletableFuture<Void> shellClosed = shell != null
                ? quietly("shell", shell::close)
                : CompletableFuture.completedFuture(null);

        return shellClosed
                .thenCompose(ignored -> {
                    RpcGraceWindow rpc = bridge.getRpcWindow();
                    if (graceForRpc && rpc != null) {
                        rpc.markDisconnected();
                    }
                    if (bridge.getSubscription() != null) {
                        tracker.unsubscribe(bridge.getSubscription());
                    }
                    if (!graceForRpc && rpc != null) {
                        return quietly("rpc", rpc::close);
                    }
                    return CompletableFuture.<Void>completedFuture(null);
                })
                .thenCompose(ignored -> transport != null
                        ? quietly("transport", transport::dispose)
                        : CompletableFuture.<Void>completedFuture(null))
                .thenRun(tracker::clearTraces);
    }

    private CompletableFuture<Void> quietly(String resource, Supplier<CompletableFuture<Void>> action) {
        CompletableFuture<Void> result;
        try {
            result = action.get();
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.exceptionally(err -> {
            Throwable cause = ErrorUtils.unwrap(err);
            ChannelFault fault = cause instanceof ChannelFault channelFault
                    ? channelFault
                    : new ChannelFault(resource, ErrorUtils.formatErrorMessage(cause), cause);
            log.warn("Ignoring " + fault.getResource() + " disposal fault: " + fault.getMessage());
            return null;
        });
    }

    // =========================================================================
    // Shell I/O
    // =========================================================================

    public void input(String data) {
        ShellChannel shell = activeShell();
        if (shell == null) {
            return;
        }
        try {
            shell.write(data);
        } catch (ChannelFault e) {
            // the shell is going away; its close notification tears the bridge down
            log.warn("Dropping input, " + e.getResource() + " fault: " + e.getMessage());
        }
    }

    public void resize(int cols, int rows) {
        ShellChannel shell = activeShell();
        if (shell == null) {
            return;
        }
        try {
            shell.resize(cols, rows);
        } catch (ChannelFault e) {
            log.warn("Dropping resize, " + e.getResource() + " fault: " + e.getMessage());
        }
    }

    private ShellChannel activeShell() {
        ActiveBridge bridge = session.getBridge();
        if (bridge == null || bridge.isReleased()) {
            return null;
        }
        return bridge.getShell();
    }

    private ShellTarget shellTarget(TransportConnection transport, RpcFacility rpc) {
        return new ShellTarget(
                settings.sshHost(),
                transport.getLocalSshPort(),
                rpc.getSshUser(),
                rpc.getPrivateKey(),
                settings.term(),
                settings.cols(),
                settings.rows(),
                settings.sshConnectTimeoutMs());
    }

    private ShellListener shellListener(ActiveBridge bridge) {
        return new ShellListener() {
            @Override
            public void onData(String data) {
                if (!bridge.isReleased()) {
                    outbound.send(Output.of(data));
                }
            }

            @Override
            public void onClosed() {
                onRemoteShellClosed(bridge);
            }
        };
    }

    // =========================================================================
    // Ports
    // =========================================================================

    /**
     * Send the cached port snapshot; an empty one if nothing is bridged.
     */
    public CompletableFuture<Void> getPortInfo() {
        requireDirectory();
        PortInformation info = session.getPortSnapshot();
        if (info == null) {
            info = PortInformation.empty();
        }
        outbound.send(PortInfoResponse.of(PortInfoConverter.toEnvelope(info)));
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Query the transport again and push the result. A failed query keeps the
     * cached snapshot.
     */
    public CompletableFuture<Void> refreshPorts() {
        requireDirectory();
        ActiveBridge bridge = session.getBridge();
        if (bridge == null || bridge.isReleased()) {
            return CompletableFuture.completedFuture(null);
        }
        return snapshot(bridge, true).thenAccept(info -> pushPortUpdate(bridge, info));
    }

    private void onPortForwarded(ActiveBridge bridge, TunnelPort port) {
        if (bridge.isReleased()) {
            return;
        }
        log.debug("Port forwarded", Map.of("port", port.portNumber()));
        snapshot(bridge, true).thenAccept(info -> pushPortUpdate(bridge, info));
    }

    /**
     * Query ports and cache the result. When the query fails, fall back to
     * the cached snapshot (if {@code keepCached}) or to ports seen in traces.
     */
    private CompletableFuture<PortInformation> snapshot(ActiveBridge bridge, boolean keepCached) {
        CompletableFuture<List<TunnelPort>> query;
        try {
            query = bridge.getTransport().queryPorts();
        } catch (RuntimeException e) {
            query = CompletableFuture.failedFuture(e);
        }
        return query
                .thenApply(PortInfoConverter::partition)
                .exceptionally(err -> {
                    String reason = ErrorUtils.formatErrorMessage(ErrorUtils.unwrap(err));
                    PortInformation cached = session.getPortSnapshot();
                    if (keepCached && cached != null) {
                        log.warn("Port query failed, keeping cached snapshot: " + reason);
                        return cached;
                    }
                    List<PortMapping> mappings = tracker.extractPortMappingsFromTraces();
                    log.warn("Port query failed, using " + mappings.size() + " trace-derived mappings: " + reason);
                    return PortInfoConverter.fromMappings(mappings).withError(reason);
                })
                .thenApply(info -> {
                    if (!bridge.isReleased()) {
                        session.setPortSnapshot(info);
                        session.setPortMappings(currentMappings(info));
                    }
                    return info;
                });
    }

    /**
     * Mappings known for the bridge: queried ports first, then whatever the
     * trace history reports. A snapshot carrying an error was not queried.
     */
    private List<PortMapping> currentMappings(PortInformation info) {
        List<PortMapping> mappings = new ArrayList<>();
        if (info.error() == null) {
            mappings.addAll(PortInfoConverter.toMappings(info.allPorts()));
        }
        mappings.addAll(tracker.extractPortMappingsFromTraces());
        return mappings;
    }

    private void pushPortUpdate(ActiveBridge bridge, PortInformation info) {
        if (bridge.isReleased()) {
            return;
        }
        List<ForwardedPort> userPorts = new ArrayList<>(info.userPorts().size());
        for (TunnelPort port : info.userPorts()) {
            userPorts.add(PortInfoConverter.toForwarded(port, true));
        }
        outbound.send(PortUpdate.of(userPorts, info.timestamp()));
    }

    // =========================================================================
    // Serialization
    // =========================================================================

    private CompletableFuture<Void> enqueueMutation(Supplier<CompletableFuture<Void>> operation) {
        synchronized (mutationLock) {
            CompletableFuture<Void> result = mutationTail
                    .handle((ok, err) -> null)
                    .thenCompose(ignored -> runSafely(operation));
            mutationTail = result;
            return result;
        }
    }

    private static CompletableFuture<Void> runSafely(Supplier<CompletableFuture<Void>> operation) {
        try {
            return operation.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
