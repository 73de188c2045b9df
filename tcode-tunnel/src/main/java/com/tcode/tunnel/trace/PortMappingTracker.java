package com.tcode.tunnel.trace;

import com.tcode.common.infra.ErrorUtils;
import com.tcode.common.logging.LogRedact;
import com.tcode.common.logging.SubsystemLogger;
import com.tcode.tunnel.port.PortMapping;
import com.tcode.tunnel.port.PortProvenance;
import com.tcode.tunnel.transport.TransportConnection;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Intercepts the trace callback of transport connections to learn which local
 * ports the tunnel bridged to which remote ports.
 * <p>
 * Attaching wraps the transport's current listener; the wrapper forwards each
 * event to the original, then records a categorized {@link TraceRecord} in a
 * bounded history. Detaching puts the original listener back.
 * <p>
 * Interception runs on the transport's thread: categorization is a couple of
 * regex matches and history insertion is constant time.
 */
public class PortMappingTracker {

    public static final int DEFAULT_MAX_HISTORY = 100;

    private static final Pattern FORWARDING = Pattern.compile(
            "Forwarding from (\\S+):(\\d{1,5})(?!\\d) to host port (\\d{1,5})(?!\\d)\\.?");

    private static final Pattern CONNECTION_STATE = Pattern.compile(
            "\\b(connected|connecting|disconnected|disconnecting|reconnecting|reconnected)\\s+(?:to|from)\\s+(?:the\\s+)?(?:tunnel|relay|host)",
            Pattern.CASE_INSENSITIVE);

    private final int maxHistory;
    private final boolean debug;
    private final SubsystemLogger log;

    private final Deque<TraceRecord> history = new ArrayDeque<>();
    private final Map<TransportConnection, TraceSubscription> subscriptions = new IdentityHashMap<>();

    public PortMappingTracker(int maxHistory, boolean debug, SubsystemLogger log) {
        this.maxHistory = maxHistory > 0 ? maxHistory : DEFAULT_MAX_HISTORY;
        this.debug = debug;
        this.log = log;
    }

    public int getMaxHistory() {
        return maxHistory;
    }

    // =========================================================================
    // Attach / detach
    // =========================================================================

    /**
     * Install the interceptor on {@code transport}. Attaching again to a
     * transport that is still attached returns the existing subscription.
     */
    public TraceSubscription attachToClient(TransportConnection transport) {
        synchronized (subscriptions) {
            TraceSubscription existing = subscriptions.get(transport);
            if (existing != null) {
                return existing;
            }
            TraceListener previous = transport.getTraceListener();
            TraceListener interceptor = (level, eventId, message, error) -> {
                if (previous != null) {
                    previous.onTrace(level, eventId, message, error);
                }
                record(level, eventId, message, error);
            };
            TraceSubscription subscription = new TraceSubscription(transport, previous, interceptor);
            transport.setTraceListener(interceptor);
            subscriptions.put(transport, subscription);
            log.debug("Attached trace interceptor", Map.of("codespace", String.valueOf(transport.getCodespaceName())));
            return subscription;
        }
    }

    /**
     * Restore the listener captured when {@code transport} was attached. No-op
     * if it is not attached.
     */
    public void detachFromClient(TransportConnection transport) {
        TraceSubscription subscription;
        synchronized (subscriptions) {
            subscription = subscriptions.get(transport);
        }
        if (subscription != null) {
            unsubscribe(subscription);
        }
    }

    /**
     * Release a subscription. Stale handles, from an earlier attach that has
     * since been detached, are ignored.
     */
    public void unsubscribe(TraceSubscription subscription) {
        synchronized (subscriptions) {
            TransportConnection transport = subscription.getTransport();
            if (subscriptions.get(transport) != subscription) {
                return;
            }
            subscriptions.remove(transport);
            // only restore if nobody replaced our interceptor in the meantime
            if (transport.getTraceListener() == subscription.getInterceptor()) {
                transport.setTraceListener(subscription.getPrevious());
            }
            log.debug("Detached trace interceptor", Map.of("codespace", String.valueOf(transport.getCodespaceName())));
        }
    }

    public void detachFromAllClients() {
        List<TraceSubscription> all;
        synchronized (subscriptions) {
            all = new ArrayList<>(subscriptions.values());
        }
        all.forEach(this::unsubscribe);
    }

    public boolean isAttached(TransportConnection transport) {
        synchronized (subscriptions) {
            return subscriptions.containsKey(transport);
        }
    }

    // =========================================================================
    // Recording
    // =========================================================================

    /**
     * Categorize and store one trace event.
     */
    public TraceRecord record(TraceLevel level, int eventId, String message, Throwable error) {
        String text = message != null ? message : "";
        if (error != null && text.isEmpty()) {
            text = ErrorUtils.formatErrorMessage(error);
        }
        TraceRecord rec = categorize(System.currentTimeMillis(), level, eventId, LogRedact.redactSensitiveText(text));
        synchronized (history) {
            while (history.size() >= maxHistory) {
                history.pollFirst();
            }
            history.addLast(rec);
        }
        logRecord(rec);
        return rec;
    }

    static TraceRecord categorize(long timestamp, TraceLevel level, int eventId, String message) {
        Matcher forwarding = FORWARDING.matcher(message);
        if (forwarding.find()) {
            int localPort = Integer.parseInt(forwarding.group(2));
            int remotePort = Integer.parseInt(forwarding.group(3));
            if (localPort <= PortMapping.MAX_PORT && remotePort <= PortMapping.MAX_PORT) {
                String host = forwarding.group(1);
                Map<String, Object> payload = new HashMap<>();
                payload.put("host", host);
                payload.put("localPort", localPort);
                payload.put("remotePort", remotePort);
                if (isIpv6(host)) {
                    payload.put("protocol", "ipv6");
                }
                return new TraceRecord(timestamp, level, eventId, message, TraceCategory.PORT, payload);
            }
        }
        Matcher connection = CONNECTION_STATE.matcher(message);
        if (connection.find()) {
            return new TraceRecord(timestamp, level, eventId, message, TraceCategory.CONNECTION,
                    Map.of("state", connection.group(1).toLowerCase(Locale.ROOT)));
        }
        if (level != null && level.isError()) {
            return new TraceRecord(timestamp, level, eventId, message, TraceCategory.ERROR, Map.of());
        }
        return new TraceRecord(timestamp, level, eventId, message, TraceCategory.GENERIC, Map.of());
    }

    private static boolean isIpv6(String host) {
        return host.indexOf(':') >= 0;
    }

    private void logRecord(TraceRecord rec) {
        if (debug) {
            log.info("[" + rec.category() + "] " + rec.message());
            return;
        }
        switch (rec.category()) {
            case PORT -> log.info("Port forwarding: " + rec.message());
            case ERROR -> log.warn("Tunnel error: " + rec.message());
            default -> {
                // connection and generic traces are only logged with the debug toggle
            }
        }
    }

    // =========================================================================
    // Queries
    // =========================================================================

    /**
     * One mapping per port record, oldest first, without deduplication.
     */
    public List<PortMapping> extractPortMappingsFromTraces() {
        List<PortMapping> mappings = new ArrayList<>();
        for (TraceRecord rec : snapshot()) {
            if (rec.category() != TraceCategory.PORT) {
                continue;
            }
            Map<String, Object> payload = rec.payload();
            mappings.add(new PortMapping(
                    (Integer) payload.get("localPort"),
                    (Integer) payload.get("remotePort"),
                    (String) payload.get("protocol"),
                    true,
                    PortProvenance.TRACE_FALLBACK));
        }
        return mappings;
    }

    public List<TraceRecord> getTraces() {
        return snapshot();
    }

    public List<TraceRecord> getTracesByCategory(TraceCategory category) {
        List<TraceRecord> result = new ArrayList<>();
        for (TraceRecord rec : snapshot()) {
            if (rec.category() == category) {
                result.add(rec);
            }
        }
        return result;
    }

    /**
     * The {@code count} most recent records, oldest first.
     */
    public List<TraceRecord> getRecentTraces(int count) {
        List<TraceRecord> all = snapshot();
        if (count <= 0) {
            return List.of();
        }
        return all.subList(Math.max(0, all.size() - count), all.size());
    }

    public TraceStats getTraceStats() {
        Map<TraceCategory, Integer> byCategory = new EnumMap<>(TraceCategory.class);
        for (TraceCategory category : TraceCategory.values()) {
            byCategory.put(category, 0);
        }
        int errors = 0;
        List<TraceRecord> all = snapshot();
        for (TraceRecord rec : all) {
            byCategory.merge(rec.category(), 1, Integer::sum);
            if (rec.level() != null && rec.level().isError()) {
                errors++;
            }
        }
        return new TraceStats(all.size(), byCategory, errors);
    }

    public void clearTraces() {
        synchronized (history) {
            history.clear();
        }
        log.debug("Trace history cleared");
    }

    private List<TraceRecord> snapshot() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }
}
