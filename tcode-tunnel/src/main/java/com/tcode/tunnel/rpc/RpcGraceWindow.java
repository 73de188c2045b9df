package com.tcode.tunnel.rpc;

import com.tcode.common.infra.ErrorUtils;
import com.tcode.common.logging.SubsystemLogger;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps an {@link RpcFacility} alive for a grace period after its controlling
 * connection closes, then disposes it unless a client re-associated in time.
 * <p>
 * The timer fires at most once and the facility is disposed at most once,
 * whether disposal comes from the timer or from {@link #close()}.
 */
public class RpcGraceWindow {

    private final RpcFacility facility;
    private final ScheduledExecutorService scheduler;
    private final Duration gracePeriod;
    private final SubsystemLogger log;

    private final AtomicBoolean disposed = new AtomicBoolean(false);
    private CompletableFuture<Void> disposal;
    private ScheduledFuture<?> timer;

    public RpcGraceWindow(RpcFacility facility, ScheduledExecutorService scheduler,
            Duration gracePeriod, SubsystemLogger log) {
        this.facility = facility;
        this.scheduler = scheduler;
        this.gracePeriod = gracePeriod;
        this.log = log;
    }

    public RpcFacility getFacility() {
        return facility;
    }

    public Duration getGracePeriod() {
        return gracePeriod;
    }

    /**
     * Mark the facility disconnected and start the grace timer. Repeated calls
     * while a timer is pending do not restart it.
     */
    public synchronized void markDisconnected() {
        if (disposed.get() || timer != null) {
            return;
        }
        facility.markDisconnected();
        log.info("RPC facility entering grace window", Map.of("graceMs", gracePeriod.toMillis()));
        timer = scheduler.schedule(this::onElapsed, gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Cancel a pending grace timer because a client took the facility over.
     *
     * @return false if the facility was already disposed
     */
    public synchronized boolean reattach() {
        if (disposed.get()) {
            return false;
        }
        cancelTimer();
        facility.markReconnected();
        log.info("RPC facility reattached");
        return true;
    }

    /**
     * Dispose immediately, cancelling any pending grace timer.
     */
    public synchronized CompletableFuture<Void> close() {
        cancelTimer();
        return disposeOnce();
    }

    public boolean isPending() {
        synchronized (this) {
            return timer != null && !disposed.get();
        }
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    private synchronized void onElapsed() {
        timer = null;
        log.info("Grace window elapsed, disposing RPC facility");
        disposeOnce();
    }

    private void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }

    private CompletableFuture<Void> disposeOnce() {
        if (!disposed.compareAndSet(false, true)) {
            return disposal != null ? disposal : CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> result;
        try {
            result = facility.dispose();
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        disposal = result.exceptionally(err -> {
            log.warn("RPC facility disposal failed: " + ErrorUtils.formatErrorMessage(ErrorUtils.unwrap(err)));
            return null;
        });
        return disposal;
    }
}
