package com.phillippitts.mockinterview.service.session;

import com.phillippitts.mockinterview.config.logging.SessionLogContext;
import com.phillippitts.mockinterview.config.properties.CompletionProperties;
import com.phillippitts.mockinterview.domain.AuthToken;
import com.phillippitts.mockinterview.exception.MockInterviewException;
import com.phillippitts.mockinterview.exception.NetworkException;
import com.phillippitts.mockinterview.service.backend.BackendClient;
import com.phillippitts.mockinterview.service.backend.BackoffPolicy;
import com.phillippitts.mockinterview.service.backend.CompletionSubmission;
import com.phillippitts.mockinterview.service.metrics.SessionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Delivers the final answer snapshot until the backend acknowledges it.
 *
 * <p>The local transition to COMPLETED does not wait for this. Transient failures are retried with
 * backoff; every attempt reuses the submission's idempotency key, so a retry after a lost response
 * is harmless. Once the attempt budget is used up the listener is told once and retries carry on
 * at the maximum interval. Credential and session-level rejections stop immediately.
 */
@Component
public class CompletionSubmitter {

    private static final Logger LOG = LogManager.getLogger(CompletionSubmitter.class);

    private final BackendClient backend;
    private final ScheduledExecutorService scheduler;
    private final CompletionProperties props;
    private final SessionMetrics metrics;

    public CompletionSubmitter(BackendClient backend,
                               @Qualifier("sessionScheduler") ScheduledExecutorService scheduler,
                               CompletionProperties props,
                               SessionMetrics metrics) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Starts submitting; the first attempt runs immediately on the scheduler.
     *
     * @return handle to cancel outstanding retries
     */
    public Submission submit(CompletionSubmission submission, AuthToken token, CompletionListener listener) {
        Submission s = new Submission(submission, token, props.toBackoffPolicy(), listener);
        s.schedule(0);
        return s;
    }

    /**
     * A running submission.
     */
    public final class Submission {

        private final CompletionSubmission submission;
        private final AuthToken token;
        private final BackoffPolicy policy;
        private final CompletionListener listener;
        private final long startedNanos = System.nanoTime();
        private final Object lock = new Object();

        private int attempts;
        private boolean finished;
        private boolean exhausted;
        private ScheduledFuture<?> pending;

        private Submission(CompletionSubmission submission, AuthToken token, BackoffPolicy policy,
                           CompletionListener listener) {
            this.submission = submission;
            this.token = token;
            this.policy = policy;
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

        private void schedule(long delayMs) {
            synchronized (lock) {
                if (finished) {
                    return;
                }
                pending = scheduler.schedule(SessionLogContext.wrap(submission.sessionId(), this::attempt),
                        delayMs, TimeUnit.MILLISECONDS);
            }
        }

        private void attempt() {
            int n;
            synchronized (lock) {
                if (finished) {
                    return;
                }
                n = ++attempts;
            }
            try {
                backend.submitCompletion(submission, token);
                metrics.recordSubmissionAttempt("acknowledged");
                LOG.info("Completion for session {} acknowledged after {} attempt(s)", submission.sessionId(), n);
                if (finish()) {
                    listener.onAcknowledged(n);
                }
            } catch (NetworkException e) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startedNanos);
                if (policy.isExhausted(n, elapsed)) {
                    long delay = policy.maxDelay().toMillis();
                    if (markExhausted()) {
                        metrics.recordSubmissionAttempt("failed");
                        LOG.error("Completion for session {} still unacknowledged after {} attempt(s) ({}); "
                                + "retrying every {} ms", submission.sessionId(), n, e.getMessage(), delay);
                        listener.onRetriesExhausted(n, e);
                    } else {
                        metrics.recordSubmissionAttempt("retry");
                        LOG.debug("Completion attempt {} for session {} failed ({})",
                                n, submission.sessionId(), e.getMessage());
                    }
                    schedule(delay);
                } else {
                    metrics.recordSubmissionAttempt("retry");
                    long delay = policy.delayAfter(n).toMillis();
                    LOG.warn("Completion attempt {} for session {} failed ({}); retrying in {} ms",
                            n, submission.sessionId(), e.getMessage(), delay);
                    schedule(delay);
                }
            } catch (MockInterviewException e) {
                metrics.recordSubmissionAttempt("failed");
                LOG.error("Completion for session {} rejected: {}", submission.sessionId(), e.getMessage());
                if (finish()) {
                    listener.onFailed(n, e);
                }
            }
        }

        private boolean markExhausted() {
            synchronized (lock) {
                if (finished || exhausted) {
                    return false;
                }
                exhausted = true;
                return true;
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
}
