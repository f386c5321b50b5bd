package com.phillippitts.mockinterview.service.feedback;

import com.phillippitts.mockinterview.config.logging.SessionLogContext;
import com.phillippitts.mockinterview.domain.AuthToken;
import com.phillippitts.mockinterview.exception.MockInterviewException;
import com.phillippitts.mockinterview.exception.NetworkException;
import com.phillippitts.mockinterview.service.backend.BackoffPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One feedback polling run. Each attempt schedules the next one until a final outcome is reached
 * or {@link #cancel()} is called.
 */
public final class PollingTask {

    private static final Logger LOG = LogManager.getLogger(PollingTask.class);

    private final FeedbackPoller poller;
    private final String sessionId;
    private final AuthToken token;
    private final BackoffPolicy policy;
    private final int maxConsecutiveErrors;
    private final ScheduledExecutorService scheduler;
    private final FeedbackListener listener;
    private final long startedNanos = System.nanoTime();
    private final Object lock = new Object();

    private int attempts;
    private int consecutiveErrors;
    private boolean finished;
    private ScheduledFuture<?> pending;

    PollingTask(FeedbackPoller poller,
                String sessionId,
                AuthToken token,
                BackoffPolicy policy,
                int maxConsecutiveErrors,
                ScheduledExecutorService scheduler,
                FeedbackListener listener) {
        this.poller = poller;
        this.sessionId = sessionId;
        this.token = token;
        this.policy = policy;
        this.maxConsecutiveErrors = Math.max(1, maxConsecutiveErrors);
        this.scheduler = scheduler;
        this.listener = listener;
    }

    public void cancel() {
        synchronized (lock) {
            finished = true;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
    }

    public boolean isDone() {
        synchronized (lock) {
            return finished;
        }
    }

    public int attempts() {
        synchronized (lock) {
            return attempts;
        }
    }

    void schedule(long delayMs) {
        synchronized (lock) {
            if (finished) {
                return;
            }
            pending = scheduler.schedule(SessionLogContext.wrap(sessionId, this::attempt), delayMs, TimeUnit.MILLISECONDS);
        }
    }

    /** One status request. Package-private for deterministic tests. */
    void attempt() {
        synchronized (lock) {
            if (finished) {
                return;
            }
            attempts++;
        }

        PollResult result;
        try {
            result = poller.pollOnce(sessionId, token);
            consecutiveErrors = 0;
        } catch (NetworkException e) {
            consecutiveErrors++;
            LOG.debug("Feedback poll {} failed ({}/{}): {}", attempts, consecutiveErrors, maxConsecutiveErrors, e.getMessage());
            result = consecutiveErrors >= maxConsecutiveErrors
                    ? PollResult.error("backend unreachable after " + consecutiveErrors + " attempts")
                    : PollResult.pending();
        } catch (MockInterviewException e) {
            result = PollResult.error(e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Unexpected failure polling feedback for session {}", sessionId, e);
            result = PollResult.error("unexpected error: " + e.getClass().getSimpleName());
        }

        Duration waited = Duration.ofNanos(System.nanoTime() - startedNanos);
        switch (result.state()) {
            case READY -> {
                if (finish()) {
                    listener.onReady(result.feedback(), waited);
                }
            }
            case ERROR -> {
                if (finish()) {
                    listener.onError(result.reason(), waited);
                }
            }
            case PENDING -> {
                int done = attempts();
                if (policy.isExhausted(done, waited)) {
                    if (finish()) {
                        listener.onDelayed(waited);
                    }
                } else {
                    schedule(policy.delayAfter(done).toMillis());
                }
            }
        }
    }

    private boolean finish() {
        synchronized (lock) {
            if (finished) {
                return false;
            }
            finished = true;
            pending = null;
            return true;
        }
    }
}
