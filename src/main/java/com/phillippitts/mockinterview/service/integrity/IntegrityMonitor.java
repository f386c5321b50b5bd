package com.phillippitts.mockinterview.service.integrity;

import com.phillippitts.mockinterview.domain.Violation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Periodic integrity evaluation for one live session.
 *
 * <p>Each evaluation is a one-shot task that schedules the next one at a fresh random delay in
 * {@code [minIntervalMs, maxIntervalMs]}, so the cadence is not predictable from the client.
 * After {@link #cancel()} returns no further evaluation is scheduled and the pending one is
 * removed from the scheduler.
 */
public final class IntegrityMonitor {

    private static final Logger LOG = LogManager.getLogger(IntegrityMonitor.class);

    private final ScheduledExecutorService scheduler;
    private final ViolationSource source;
    private final UUID handle;
    private final IntegrityListener listener;
    private final LongSupplier nextDelayMs;
    private final Object lock = new Object();

    private boolean started;
    private boolean cancelled;
    private ScheduledFuture<?> pending;

    public IntegrityMonitor(ScheduledExecutorService scheduler,
                            ViolationSource source,
                            UUID handle,
                            long minIntervalMs,
                            long maxIntervalMs,
                            IntegrityListener listener) {
        this(scheduler, source, handle, randomDelay(minIntervalMs, maxIntervalMs), listener);
    }

    IntegrityMonitor(ScheduledExecutorService scheduler,
                     ViolationSource source,
                     UUID handle,
                     LongSupplier nextDelayMs,
                     IntegrityListener listener) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.source = Objects.requireNonNull(source, "source");
        this.handle = Objects.requireNonNull(handle, "handle");
        this.nextDelayMs = Objects.requireNonNull(nextDelayMs, "nextDelayMs");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    static LongSupplier randomDelay(long minIntervalMs, long maxIntervalMs) {
        if (minIntervalMs <= 0 || maxIntervalMs < minIntervalMs) {
            throw new IllegalArgumentException(
                    "Invalid monitor interval [" + minIntervalMs + ", " + maxIntervalMs + "]");
        }
        return () -> ThreadLocalRandom.current().nextLong(minIntervalMs, maxIntervalMs + 1);
    }

    public void start() {
        synchronized (lock) {
            if (started || cancelled) {
                return;
            }
            started = true;
            scheduleNextLocked();
        }
    }

    public void cancel() {
        synchronized (lock) {
            cancelled = true;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return started && !cancelled;
        }
    }

    /** One evaluation. Package-private for deterministic tests. */
    void evaluate() {
        synchronized (lock) {
            if (cancelled) {
                return;
            }
        }
        try {
            List<Violation> found = source.poll(handle);
            if (found != null && !found.isEmpty()) {
                listener.onViolations(this, found);
            }
        } catch (RuntimeException e) {
            LOG.warn("Integrity evaluation failed for session handle {}: {}", handle, e.toString());
        } finally {
            synchronized (lock) {
                if (!cancelled) {
                    scheduleNextLocked();
                }
            }
        }
    }

    private void scheduleNextLocked() {
        long delay = nextDelayMs.getAsLong();
        pending = scheduler.schedule(this::evaluate, delay, TimeUnit.MILLISECONDS);
    }
}
