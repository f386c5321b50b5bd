package com.phillippitts.mockinterview.service.timer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per-question countdown.
 *
 * <p>A started timer with duration D delivers D ticks (remaining D-1 ... 0) followed by exactly
 * one expiry. {@link #cancel()} stops further ticks and suppresses the expiry; it is idempotent
 * and safe to call from any thread, including from inside a listener callback.
 *
 * <p>Each timer is single-use. Restarting a question creates a new timer.
 */
public final class QuestionTimer {

    private static final Logger LOG = LogManager.getLogger(QuestionTimer.class);

    private final ScheduledExecutorService scheduler;
    private final long durationSeconds;
    private final long tickIntervalMs;
    private final TimerListener listener;
    private final Object lock = new Object();

    private long remaining;
    private boolean started;
    private boolean finished;
    private ScheduledFuture<?> future;

    public QuestionTimer(ScheduledExecutorService scheduler,
                         long durationSeconds,
                         long tickIntervalMs,
                         TimerListener listener) {
        if (durationSeconds <= 0) {
            throw new IllegalArgumentException("durationSeconds must be > 0");
        }
        if (tickIntervalMs <= 0) {
            throw new IllegalArgumentException("tickIntervalMs must be > 0");
        }
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.durationSeconds = durationSeconds;
        this.tickIntervalMs = tickIntervalMs;
        this.remaining = durationSeconds;
    }

    /**
     * Starts ticking. Calling start on a started or cancelled timer is a no-op.
     */
    public void start() {
        synchronized (lock) {
            if (started || finished) {
                return;
            }
            started = true;
            future = scheduler.scheduleAtFixedRate(this::tick, tickIntervalMs, tickIntervalMs, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Stops the countdown. No tick or expiry is delivered after this returns, except a callback
     * that was already executing on another thread.
     */
    public void cancel() {
        synchronized (lock) {
            finished = true;
            if (future != null) {
                future.cancel(false);
                future = null;
            }
        }
    }

    /** Removes one second and notifies the listener. Package-private for deterministic tests. */
    void tick() {
        long now;
        boolean expired;
        synchronized (lock) {
            if (finished) {
                return;
            }
            remaining = Math.max(0, remaining - 1);
            now = remaining;
            expired = remaining == 0;
            if (expired) {
                finished = true;
                if (future != null) {
                    future.cancel(false);
                    future = null;
                }
            }
        }
        try {
            listener.onTick(this, now);
            if (expired) {
                listener.onExpired(this);
            }
        } catch (RuntimeException e) {
            // A failing listener must not kill the fixed-rate task silently
            LOG.error("Timer listener failed at remaining={}s", now, e);
        }
    }

    public long remainingSeconds() {
        synchronized (lock) {
            return remaining;
        }
    }

    public long durationSeconds() {
        return durationSeconds;
    }

    public long elapsedSeconds() {
        synchronized (lock) {
            return durationSeconds - remaining;
        }
    }

    /** {@code true} while ticks may still be delivered. */
    public boolean isRunning() {
        synchronized (lock) {
            return started && !finished;
        }
    }

    public boolean isExpired() {
        synchronized (lock) {
            return remaining == 0;
        }
    }
}
