package com.tcode.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tcode.gateway.session.SessionOutbound;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * One browser connection. Sends are serialized through Spring's concurrent
 * decorator since shell output, port events and replies arrive on different
 * threads.
 */
@Slf4j
@Getter
public class ClientConnection implements SessionOutbound {

    private static final int SEND_TIME_LIMIT_MS = 10_000;

    private final String connectionId;
    private final WebSocketSession session;
    private final long connectedAt;
    private final ObjectMapper objectMapper;

    public ClientConnection(WebSocketSession session, ObjectMapper objectMapper, int bufferSizeLimit) {
        this.connectionId = session.getId();
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, bufferSizeLimit);
        this.connectedAt = System.currentTimeMillis();
        this.objectMapper = objectMapper;
    }

    @Override
    public void send(Object message) {
        if (!session.isOpen()) {
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(message);
            session.sendMessage(new TextMessage(json));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} for {}: {}", message.getClass().getSimpleName(), connectionId, e.getMessage());
        } catch (IOException | SessionLimitExceededException e) {
            log.warn("Failed to send to {}: {}", connectionId, e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
