package com.tcode.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tcode.common.logging.SubsystemLogger;
import com.tcode.gateway.directory.DirectoryError;
import com.tcode.gateway.protocol.ProtocolError;
import com.tcode.gateway.session.AuthError;
import com.tcode.gateway.session.Session;
import com.tcode.gateway.session.SessionLifecycleManager;
import com.tcode.gateway.session.SessionSettings;
import com.tcode.gateway.support.FakeDirectory;
import com.tcode.gateway.support.FakeRelayTransport;
import com.tcode.gateway.support.FakeShellFactory;
import com.tcode.gateway.support.RecordingOutbound;
import com.tcode.tunnel.ChannelFault;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProtocolRouterTest {

    private ScheduledExecutorService scheduler;
    private RecordingOutbound outbound;
    private FakeDirectory directory;
    private FakeShellFactory shells;
    private SessionLifecycleManager session;
    private ProtocolRouter router;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        outbound = new RecordingOutbound();
        directory = new FakeDirectory();
        FakeRelayTransport relay = new FakeRelayTransport();
        shells = new FakeShellFactory(relay.events);
        session = new SessionLifecycleManager(new Session("conn-1"), outbound, token -> directory, relay,
                shells, scheduler, SessionSettings.defaults(), SubsystemLogger.create("gateway/session"));
        router = new ProtocolRouter(new ObjectMapper(), SubsystemLogger.create("gateway/router"));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private void route(String payload) throws Exception {
        router.route(session, payload).get(5, TimeUnit.SECONDS);
    }

    private String lastError() {
        List<JsonNode> errors = outbound.ofType("error");
        assertFalse(errors.isEmpty(), "expected an error message");
        return errors.get(errors.size() - 1).get("message").asText();
    }

    @Test
    void registersAllClientMessageTypes() {
        assertEquals(10, router.getRegisteredTypes().size());
        assertTrue(router.getRegisteredTypes().contains("connect_codespace"));
        assertTrue(router.getRegisteredTypes().contains("refresh_ports"));
    }

    @Test
    void malformedPayloadsAreProtocolErrors() {
        for (String payload : List.of("not json", "[1,2]", "{}", "{\"type\":42}", "null")) {
            ProtocolError error = assertThrows(ProtocolError.class, () -> router.route(session, payload), payload);
            assertEquals(ProtocolError.INVALID_FORMAT, error.getMessage());
        }
        assertTrue(outbound.messages().isEmpty());
    }

    @Test
    void unknownTypeIsIgnored() throws Exception {
        route("{\"type\":\"make_coffee\"}");
        assertTrue(outbound.messages().isEmpty());
    }

    @Test
    void authenticateRequiresToken() throws Exception {
        route("{\"type\":\"authenticate\"}");
        assertEquals("Missing required field 'token' for authenticate", lastError());
        assertFalse(session.getSession().isAuthenticated());
    }

    @Test
    void authenticateThenList() throws Exception {
        directory.codespaces = List.of(FakeDirectory.codespace("fuzzy", "Available"));

        route("{\"type\":\"authenticate\",\"token\":\"gho_token\"}");
        route("{\"type\":\"list_codespaces\"}");

        assertEquals(List.of("authenticated", "codespaces_list"), outbound.types());
    }

    @Test
    void operationsBeforeAuthenticationReportAuthError() throws Exception {
        route("{\"type\":\"list_codespaces\"}");
        assertEquals(AuthError.NOT_AUTHENTICATED, lastError());

        route("{\"type\":\"connect_codespace\",\"codespace_name\":\"fuzzy\"}");
        assertEquals(AuthError.NOT_AUTHENTICATED, lastError());
        assertTrue(directory.connectionInfoRequests.isEmpty());
    }

    @Test
    void connectRequiresCodespaceName() throws Exception {
        route("{\"type\":\"authenticate\",\"token\":\"gho_token\"}");
        route("{\"type\":\"connect_codespace\",\"codespace_name\":\"  \"}");

        assertEquals("Missing required field 'codespace_name' for connect_codespace", lastError());
    }

    @Test
    void resizeRejectsNonPositiveDimensions() throws Exception {
        route("{\"type\":\"authenticate\",\"token\":\"gho_token\"}");
        route("{\"type\":\"resize\",\"cols\":0,\"rows\":24}");

        assertEquals("Missing required field 'cols' for resize", lastError());
    }

    @Test
    void inputAndResizeReachTheShell() throws Exception {
        route("{\"type\":\"authenticate\",\"token\":\"gho_token\"}");
        route("{\"type\":\"connect_codespace\",\"codespace_name\":\"fuzzy\"}");
        route("{\"type\":\"input\",\"data\":\"ls\\n\"}");
        route("{\"type\":\"resize\",\"cols\":100,\"rows\":30}");

        FakeShellFactory.FakeShell shell = shells.last();
        assertEquals(List.of("ls\n"), shell.written);
        assertEquals(100, shell.cols);
        assertEquals(30, shell.rows);
    }

    @Test
    void shellWriteFaultIsNotReportedToClient() throws Exception {
        route("{\"type\":\"authenticate\",\"token\":\"gho_token\"}");
        route("{\"type\":\"connect_codespace\",\"codespace_name\":\"fuzzy\"}");
        shells.last().writeFailure = new ChannelFault("shell", "write failed: Pipe closed");
        outbound.clear();

        route("{\"type\":\"input\",\"data\":\"ls\"}");
        route("{\"type\":\"resize\",\"cols\":100,\"rows\":30}");

        assertTrue(outbound.messages().isEmpty());
        assertNotNull(session.getSession().getBridge());
    }

    @Test
    void failedOperationSendsOneError() throws Exception {
        route("{\"type\":\"authenticate\",\"token\":\"gho_token\"}");
        directory.connectionInfo = name -> CompletableFuture.failedFuture(
                new DirectoryError("Codespace not found", 404));
        outbound.clear();

        route("{\"type\":\"connect_codespace\",\"codespace_name\":\"ghost\"}");

        assertEquals(1, outbound.ofType("error").size());
        assertEquals("Codespace not found", lastError());
        assertEquals(List.of("Disconnected"), outbound.codespaceStates());
    }

    @Test
    void customHandlerReplacesDefault() throws Exception {
        router.register("get_port_info", (msg, s) -> {
            s.getOutbound().send(Map.of("type", "custom"));
            return CompletableFuture.completedFuture(null);
        });

        route("{\"type\":\"get_port_info\"}");

        assertEquals(List.of("custom"), outbound.types());
    }
}
