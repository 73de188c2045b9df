package com.tcode.gateway.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tcode.gateway.directory.Codespace;
import com.tcode.tunnel.port.ForwardedPort;
import com.tcode.tunnel.port.PortInfoEnvelope;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Terminal bridge WebSocket protocol types.
 *
 * <p>
 * Every message is a JSON object carrying a string {@code type}. Client
 * messages are read straight from the JSON tree by the router; the classes
 * here are the server-to-client messages.
 */
public final class ProtocolTypes {

    private ProtocolTypes() {
    }

    // ── Message types ────────────────────────────────────────────

    public static final class MessageTypes {
        // client → server
        public static final String AUTHENTICATE = "authenticate";
        public static final String LIST_CODESPACES = "list_codespaces";
        public static final String CONNECT_CODESPACE = "connect_codespace";
        public static final String DISCONNECT_CODESPACE = "disconnect_codespace";
        public static final String START_CODESPACE = "start_codespace";
        public static final String STOP_CODESPACE = "stop_codespace";
        public static final String INPUT = "input";
        public static final String RESIZE = "resize";
        public static final String GET_PORT_INFO = "get_port_info";
        public static final String REFRESH_PORTS = "refresh_ports";

        // server → client
        public static final String AUTHENTICATED = "authenticated";
        public static final String CODESPACES_LIST = "codespaces_list";
        public static final String OUTPUT = "output";
        public static final String ERROR = "error";
        public static final String CODESPACE_STATE = "codespace_state";
        public static final String PORT_UPDATE = "port_update";
        public static final String PORT_INFO_RESPONSE = "port_info_response";
        public static final String DISCONNECTED_FROM_CODESPACE = "disconnected_from_codespace";

        private MessageTypes() {
        }
    }

    // ── Codespace states relayed to the client ───────────────────

    public static final class CodespaceStates {
        public static final String STARTING = "Starting";
        public static final String CONNECTED = "Connected";
        public static final String DISCONNECTED = "Disconnected";
        public static final String SHUTDOWN = "Shutdown";

        private CodespaceStates() {
        }
    }

    // ── Server → Client ──────────────────────────────────────────

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Authenticated {
        private String type = MessageTypes.AUTHENTICATED;
        private boolean success;

        public static Authenticated ok() {
            return new Authenticated(MessageTypes.AUTHENTICATED, true);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CodespacesList {
        private String type = MessageTypes.CODESPACES_LIST;
        private List<Codespace> data;

        public static CodespacesList of(List<Codespace> data) {
            return new CodespacesList(MessageTypes.CODESPACES_LIST, data);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Output {
        private String type = MessageTypes.OUTPUT;
        private String data;

        public static Output of(String data) {
            return new Output(MessageTypes.OUTPUT, data);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorMessage {
        private String type = MessageTypes.ERROR;
        private String message;

        public static ErrorMessage of(String message) {
            return new ErrorMessage(MessageTypes.ERROR, message);
        }
    }

    /** {type:"codespace_state", codespace_name, state, repository_full_name?, codespace_data?} */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CodespaceState {
        private String type = MessageTypes.CODESPACE_STATE;

        @JsonProperty("codespace_name")
        private String codespaceName;

        private String state;

        @JsonProperty("repository_full_name")
        private String repositoryFullName;

        @JsonProperty("codespace_data")
        private Codespace codespaceData;

        public static CodespaceState of(String codespaceName, String state) {
            return new CodespaceState(MessageTypes.CODESPACE_STATE, codespaceName, state, null, null);
        }

        public static CodespaceState of(String codespaceName, String state, String repositoryFullName) {
            return new CodespaceState(MessageTypes.CODESPACE_STATE, codespaceName, state, repositoryFullName, null);
        }

        public static CodespaceState of(Codespace codespace) {
            return new CodespaceState(MessageTypes.CODESPACE_STATE, codespace.getName(), codespace.getState(),
                    codespace.getRepositoryFullName(), codespace);
        }
    }

    /** Pushed whenever the bridge's port snapshot changes; lists user ports only. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PortUpdate {
        private String type = MessageTypes.PORT_UPDATE;
        private int portCount;
        private List<ForwardedPort> ports;
        private String timestamp;

        public static PortUpdate of(List<ForwardedPort> userPorts, String timestamp) {
            return new PortUpdate(MessageTypes.PORT_UPDATE, userPorts.size(), userPorts, timestamp);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PortInfoResponse {
        private String type = MessageTypes.PORT_INFO_RESPONSE;
        private PortInfoEnvelope portInfo;

        public static PortInfoResponse of(PortInfoEnvelope portInfo) {
            return new PortInfoResponse(MessageTypes.PORT_INFO_RESPONSE, portInfo);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DisconnectedFromCodespace {
        private String type = MessageTypes.DISCONNECTED_FROM_CODESPACE;

        public static DisconnectedFromCodespace create() {
            return new DisconnectedFromCodespace(MessageTypes.DISCONNECTED_FROM_CODESPACE);
        }
    }
}
