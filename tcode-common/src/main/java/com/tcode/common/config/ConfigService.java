package com.tcode.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the bridge configuration.
 *
 * <p>
 * The file is JSON with {@code ${VAR}} / {@code ${VAR:-default}} substitution.
 * A missing or unreadable file falls back to defaults. Two environment
 * variables override the file: {@value #ENV_TRACE_DEBUG} toggles verbose trace
 * logging and {@value #ENV_GRACE_PERIOD} sets the RPC grace period in
 * milliseconds.
 */
@Slf4j
public class ConfigService {

    public static final String ENV_TRACE_DEBUG = "TCODE_TRACE_DEBUG";
    public static final String ENV_GRACE_PERIOD = "RPC_SESSION_KEEPALIVE";

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, TcodeConfig> cache;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System.getenv());
    }

    public ConfigService(Path configPath, Duration cacheTtl, Map<String, String> env) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public TcodeConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public TcodeConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private TcodeConfig doLoadConfig() {
        TcodeConfig config;
        if (!Files.exists(configPath)) {
            log.info("Config file not found: {}, using defaults", configPath);
            config = new TcodeConfig();
        } else {
            try {
                String raw = substituteEnvVars(Files.readString(configPath));
                config = objectMapper.readValue(raw, TcodeConfig.class);
                log.info("Config loaded from: {}", configPath);
            } catch (IOException e) {
                log.error("Failed to load config from: {}", configPath, e);
                config = new TcodeConfig();
            }
        }
        return applyEnvOverrides(applyDefaults(config));
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Fill in missing sections.
     */
    TcodeConfig applyDefaults(TcodeConfig config) {
        if (config.getGateway() == null) {
            config.setGateway(new TcodeConfig.GatewayConfig());
        }
        if (config.getGithub() == null) {
            config.setGithub(new TcodeConfig.GitHubConfig());
        }
        if (config.getSession() == null) {
            config.setSession(new TcodeConfig.SessionConfig());
        }
        if (config.getTrace() == null) {
            config.setTrace(new TcodeConfig.TraceConfig());
        }
        if (config.getTerminal() == null) {
            config.setTerminal(new TcodeConfig.TerminalConfig());
        }
        if (config.getSsh() == null) {
            config.setSsh(new TcodeConfig.SshConfig());
        }
        if (config.getTrace().getMaxHistory() < 1) {
            log.warn("trace.maxHistory must be positive, got {}; using 100", config.getTrace().getMaxHistory());
            config.getTrace().setMaxHistory(100);
        }
        return config;
    }

    TcodeConfig applyEnvOverrides(TcodeConfig config) {
        String traceDebug = env.get(ENV_TRACE_DEBUG);
        if (traceDebug != null && !traceDebug.isBlank()) {
            config.getTrace().setDebug("1".equals(traceDebug.trim()) || "true".equalsIgnoreCase(traceDebug.trim()));
        }
        String grace = env.get(ENV_GRACE_PERIOD);
        if (grace != null && !grace.isBlank()) {
            try {
                long ms = Long.parseLong(grace.trim());
                if (ms >= 0) {
                    config.getSession().setGracePeriodMs(ms);
                } else {
                    log.warn("Ignoring negative {}={}", ENV_GRACE_PERIOD, grace);
                }
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric {}={}", ENV_GRACE_PERIOD, grace);
            }
        }
        return config;
    }
}
