package com.tcode.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Root configuration type for the tcode bridge.
 * Loaded from JSON by {@link ConfigService}; every section has defaults so a
 * missing file yields a working configuration.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TcodeConfig {

    /** WebSocket endpoint settings. */
    private GatewayConfig gateway;

    /** GitHub Codespaces API settings. */
    private GitHubConfig github;

    /** Per-connection session settings. */
    private SessionConfig session;

    /** Tunnel trace interception settings. */
    private TraceConfig trace;

    /** Remote terminal defaults. */
    private TerminalConfig terminal;

    /** SSH connection settings. */
    private SshConfig ssh;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GatewayConfig {
        private String path = "/ws";
        private List<String> allowedOrigins = List.of("*");
        private int maxTextMessageBytes = 512 * 1024;
        private long idleTimeoutMs = 300_000L;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GitHubConfig {
        private String apiBaseUrl = "https://api.github.com";
        private String userAgent = "tcode-bridge/1.0";
        private int timeoutSeconds = 30;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SessionConfig {
        /** How long an RPC facility survives its controlling connection. */
        private long gracePeriodMs = 30_000L;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TraceConfig {
        /** Log every categorized trace record, not only port and error records. */
        private boolean debug = false;
        private int maxHistory = 100;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TerminalConfig {
        private String term = "xterm-256color";
        private int cols = 80;
        private int rows = 24;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SshConfig {
        private String host = "localhost";
        private int connectTimeoutMs = 15_000;
    }
}
