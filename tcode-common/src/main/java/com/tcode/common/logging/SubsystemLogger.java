package com.tcode.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Logger for one subsystem of the bridge ({@code gateway/session},
 * {@code tunnel/trace}, ...). Components take one in their constructor.
 * <p>
 * The subsystem path maps to the SLF4J logger {@code tcode.<path with dots>},
 * so levels can be tuned per subsystem in logback. Lines carry a
 * {@code [subsystem]} prefix and an optional {@code {key=value}} suffix; the
 * subsystem is also put in the MDC under {@code subsystem}.
 */
public class SubsystemLogger {

    private static final String MDC_KEY = "subsystem";

    private final String subsystem;
    private final String prefix;
    private final Logger logger;

    private SubsystemLogger(String subsystem) {
        this.subsystem = subsystem;
        this.prefix = "[" + subsystem + "] ";
        this.logger = LoggerFactory.getLogger("tcode." + subsystem.replace('/', '.'));
    }

    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem);
    }

    /** Logger for {@code <this subsystem>/<name>}. */
    public SubsystemLogger child(String name) {
        return new SubsystemLogger(subsystem + "/" + name);
    }

    public String getSubsystem() {
        return subsystem;
    }

    public boolean isDebugEnabled() {
        return LogLevel.DEBUG.enabled(logger);
    }

    public void trace(String message) {
        log(LogLevel.TRACE, message, null, null);
    }

    public void trace(String message, Map<String, ?> meta) {
        log(LogLevel.TRACE, message, meta, null);
    }

    public void debug(String message) {
        log(LogLevel.DEBUG, message, null, null);
    }

    public void debug(String message, Map<String, ?> meta) {
        log(LogLevel.DEBUG, message, meta, null);
    }

    public void info(String message) {
        log(LogLevel.INFO, message, null, null);
    }

    public void info(String message, Map<String, ?> meta) {
        log(LogLevel.INFO, message, meta, null);
    }

    public void warn(String message) {
        log(LogLevel.WARN, message, null, null);
    }

    public void warn(String message, Map<String, ?> meta) {
        log(LogLevel.WARN, message, meta, null);
    }

    public void error(String message) {
        log(LogLevel.ERROR, message, null, null);
    }

    public void error(String message, Map<String, ?> meta) {
        log(LogLevel.ERROR, message, meta, null);
    }

    public void error(String message, Throwable error) {
        log(LogLevel.ERROR, message, null, error);
    }

    public void log(LogLevel level, String message, Map<String, ?> meta, Throwable error) {
        if (!level.enabled(logger)) {
            return;
        }
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_KEY, subsystem)) {
            level.write(logger, line(message, meta), error);
        }
    }

    private String line(String message, Map<String, ?> meta) {
        if (meta == null || meta.isEmpty()) {
            return prefix + message;
        }
        return meta.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", ", prefix + message + " {", "}"));
    }
}
