package com.tcode.gateway.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tcode.gateway.protocol.ProtocolError;
import com.tcode.gateway.protocol.ProtocolTypes.ErrorMessage;
import com.tcode.gateway.session.SessionLifecycleManager;
import com.tcode.gateway.session.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Terminal bridge WebSocket handler. Each connection gets a session from the
 * {@link SessionRegistry}; inbound text frames go through the
 * {@link ProtocolRouter}.
 */
@Slf4j
public class CodespaceWebSocketHandler extends TextWebSocketHandler {

    private final ObjectMapper objectMapper;
    private final ProtocolRouter router;
    private final SessionRegistry sessionRegistry;
    private final int sendBufferLimit;
    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();

    public CodespaceWebSocketHandler(ObjectMapper objectMapper, ProtocolRouter router,
            SessionRegistry sessionRegistry, int sendBufferLimit) {
        this.objectMapper = objectMapper;
        this.router = router;
        this.sessionRegistry = sessionRegistry;
        this.sendBufferLimit = sendBufferLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        ClientConnection connection = new ClientConnection(session, objectMapper, sendBufferLimit);
        connections.put(connection.getConnectionId(), connection);
        sessionRegistry.open(connection);
        log.info("ws:open conn={} remote={}", connection.getConnectionId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connId = session.getId();
        ClientConnection connection = connections.get(connId);
        SessionLifecycleManager lifecycle = sessionRegistry.get(connId);
        if (connection == null || lifecycle == null) {
            return;
        }
        try {
            router.route(lifecycle, message.getPayload());
        } catch (ProtocolError e) {
            log.warn("ws:in:invalid conn={}: {}", connId, e.getMessage());
            connection.send(ErrorMessage.of(e.getMessage()));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String connId = session.getId();
        connections.remove(connId);
        sessionRegistry.close(connId).whenComplete((ok, err) -> {
            if (err != null) {
                log.warn("ws:close conn={} cleanup failed: {}", connId, err.getMessage());
            }
        });
        log.info("ws:close conn={} code={} reason={}", connId, status.getCode(), status.getReason());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("ws:error conn={}: {}", session.getId(), exception.getMessage());
    }

    /**
     * Number of open connections.
     */
    public int getConnectionCount() {
        return connections.size();
    }
}
