package com.tcode.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tcode.common.infra.ErrorUtils;
import com.tcode.common.logging.SubsystemLogger;
import com.tcode.gateway.directory.DirectoryError;
import com.tcode.gateway.protocol.ProtocolError;
import com.tcode.gateway.protocol.ProtocolTypes.ErrorMessage;
import com.tcode.gateway.protocol.ProtocolTypes.MessageTypes;
import com.tcode.gateway.session.AuthError;
import com.tcode.gateway.session.SessionLifecycleManager;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes inbound client messages to session operations by their {@code type}.
 * <p>
 * A payload that is not a JSON object with a string {@code type} is rejected
 * with {@link ProtocolError}. Unknown types are logged and ignored. Any
 * failure of a dispatched operation becomes one {@code error} message to the
 * originating connection.
 */
public class ProtocolRouter {

    @FunctionalInterface
    public interface MessageHandler {
        CompletableFuture<Void> handle(JsonNode message, SessionLifecycleManager session);
    }

    private final ObjectMapper objectMapper;
    private final SubsystemLogger log;
    private final Map<String, MessageHandler> handlers = new ConcurrentHashMap<>();

    public ProtocolRouter(ObjectMapper objectMapper, SubsystemLogger log) {
        this.objectMapper = objectMapper;
        this.log = log;
        registerDefaults();
    }

    /**
     * Register (or replace) the handler for a message type.
     */
    public void register(String type, MessageHandler handler) {
        handlers.put(type, handler);
        log.debug("Registered message handler: " + type);
    }

    public Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    /**
     * Parse {@code payload} and dispatch it.
     *
     * @return completes once the operation and any error report are done; never fails
     * @throws ProtocolError if the payload has no string {@code type}
     */
    public CompletableFuture<Void> route(SessionLifecycleManager session, String payload) {
        JsonNode message = parse(payload);
        String type = message.get("type").asText();

        MessageHandler handler = handlers.get(type);
        if (handler == null) {
            log.warn("Unknown message type", Map.of("type", type));
            return CompletableFuture.completedFuture(null);
        }
        log.debug("Dispatching " + type, Map.of("conn", session.getSession().getConnectionId()));

        CompletableFuture<Void> result;
        try {
            result = handler.handle(message, session);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        if (result == null) {
            return CompletableFuture.completedFuture(null);
        }
        return result.exceptionally(err -> {
            reportFailure(session, type, ErrorUtils.unwrap(err));
            return null;
        });
    }

    JsonNode parse(String payload) {
        JsonNode message;
        try {
            message = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ProtocolError(ProtocolError.INVALID_FORMAT, e);
        }
        if (message == null || !message.isObject() || !message.path("type").isTextual()) {
            throw new ProtocolError(ProtocolError.INVALID_FORMAT);
        }
        return message;
    }

    private void reportFailure(SessionLifecycleManager session, String type, Throwable cause) {
        String message = ErrorUtils.formatErrorMessage(cause);
        if (cause instanceof ProtocolError || cause instanceof AuthError || cause instanceof DirectoryError) {
            log.warn(type + " rejected: " + message, Map.of("conn", session.getSession().getConnectionId()));
        } else {
            log.error(type + " failed: " + message, cause);
        }
        session.getOutbound().send(ErrorMessage.of(message));
    }

    // =========================================================================
    // Default handlers
    // =========================================================================

    private void registerDefaults() {
        register(MessageTypes.AUTHENTICATE,
                (msg, session) -> session.authenticate(requireText(msg, MessageTypes.AUTHENTICATE, "token")));
        register(MessageTypes.LIST_CODESPACES, (msg, session) -> session.listCodespaces());
        register(MessageTypes.CONNECT_CODESPACE, (msg, session) -> session.connectCodespace(
                requireText(msg, MessageTypes.CONNECT_CODESPACE, "codespace_name")));
        register(MessageTypes.DISCONNECT_CODESPACE, (msg, session) -> session.disconnectCodespace());
        register(MessageTypes.START_CODESPACE, (msg, session) -> session.startCodespace(
                requireText(msg, MessageTypes.START_CODESPACE, "codespace_name")));
        register(MessageTypes.STOP_CODESPACE, (msg, session) -> session.stopCodespace(
                requireText(msg, MessageTypes.STOP_CODESPACE, "codespace_name")));
        register(MessageTypes.INPUT, (msg, session) -> {
            JsonNode data = msg.get("data");
            if (data == null || !data.isTextual()) {
                throw ProtocolError.missingField(MessageTypes.INPUT, "data");
            }
            session.input(data.asText());
            return CompletableFuture.completedFuture(null);
        });
        register(MessageTypes.RESIZE, (msg, session) -> {
            session.resize(requirePositiveInt(msg, "cols"), requirePositiveInt(msg, "rows"));
            return CompletableFuture.completedFuture(null);
        });
        register(MessageTypes.GET_PORT_INFO, (msg, session) -> session.getPortInfo());
        register(MessageTypes.REFRESH_PORTS, (msg, session) -> session.refreshPorts());
    }

    private static String requireText(JsonNode msg, String type, String field) {
        JsonNode value = msg.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw ProtocolError.missingField(type, field);
        }
        return value.asText();
    }

    private static int requirePositiveInt(JsonNode msg, String field) {
        JsonNode value = msg.get(field);
        if (value == null || !value.canConvertToInt() || value.asInt() <= 0) {
            throw ProtocolError.missingField(MessageTypes.RESIZE, field);
        }
        return value.asInt();
    }
}
