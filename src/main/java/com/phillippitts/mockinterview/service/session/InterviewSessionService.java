package com.phillippitts.mockinterview.service.session;

import com.phillippitts.mockinterview.domain.Answer;
import com.phillippitts.mockinterview.domain.AnswerChannel;
import com.phillippitts.mockinterview.domain.AuthToken;
import com.phillippitts.mockinterview.domain.Capability;
import com.phillippitts.mockinterview.domain.Feedback;
import com.phillippitts.mockinterview.domain.JobContext;
import com.phillippitts.mockinterview.domain.SessionStatus;
import com.phillippitts.mockinterview.domain.SessionSummary;
import com.phillippitts.mockinterview.domain.Violation;
import com.phillippitts.mockinterview.exception.FatalSessionException;
import com.phillippitts.mockinterview.exception.FeedbackTimeoutException;
import com.phillippitts.mockinterview.exception.MockInterviewException;
import com.phillippitts.mockinterview.exception.PreflightFailureException;
import com.phillippitts.mockinterview.exception.SessionStateException;
import com.phillippitts.mockinterview.service.backend.BackendClient;
import com.phillippitts.mockinterview.service.backend.CompletionSubmission;
import com.phillippitts.mockinterview.service.backend.SessionRecord;
import com.phillippitts.mockinterview.service.configurator.ConfiguredSession;
import com.phillippitts.mockinterview.service.configurator.InterviewParameters;
import com.phillippitts.mockinterview.service.configurator.SessionConfigurator;
import com.phillippitts.mockinterview.service.events.CompletionSubmissionFailedEvent;
import com.phillippitts.mockinterview.service.events.FeedbackDelayedEvent;
import com.phillippitts.mockinterview.service.feedback.FeedbackListener;
import com.phillippitts.mockinterview.service.feedback.FeedbackPoller;
import com.phillippitts.mockinterview.service.feedback.PollResult;
import com.phillippitts.mockinterview.service.feedback.PollingTask;
import com.phillippitts.mockinterview.service.integrity.ReportedSignalViolationSource;
import com.phillippitts.mockinterview.service.metrics.SessionMetrics;
import com.phillippitts.mockinterview.service.preflight.CheckResult;
import com.phillippitts.mockinterview.service.preflight.DeviceCapabilityReports;
import com.phillippitts.mockinterview.service.preflight.PreflightChecker;
import com.phillippitts.mockinterview.service.preflight.PreflightReport;
import com.phillippitts.mockinterview.service.scoring.ScoreAggregator;
import com.phillippitts.mockinterview.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Entry point of the session engine for the user flow.
 *
 * <p>Resolves sessions by handle and credential, runs the backend I/O around each
 * {@link SessionStateMachine} operation and owns the per-session background work that outlives
 * IN_PROGRESS: completion delivery and feedback polling.
 *
 * <p>Structural errors (validation, preflight, illegal state) leave the session untouched. Backend
 * failures while configuring abort the new session; the candidate starts over.
 */
@Service
public class InterviewSessionService {

    private static final Logger LOG = LogManager.getLogger(InterviewSessionService.class);

    private final SessionConfigurator configurator;
    private final PreflightChecker preflightChecker;
    private final DeviceCapabilityReports capabilityReports;
    private final ReportedSignalViolationSource signals;
    private final FeedbackPoller feedbackPoller;
    private final CompletionSubmitter completionSubmitter;
    private final ScoreAggregator scoreAggregator;
    private final BackendClient backend;
    private final SessionRegistry registry;
    private final SessionDependencies deps;
    private final Executor workerExecutor;
    private final SessionMetrics metrics;

    private final SessionHooks hooks = new Hooks();
    private final Map<UUID, PollingTask> pollers = new ConcurrentHashMap<>();
    private final Map<UUID, CompletionSubmitter.Submission> submissions = new ConcurrentHashMap<>();

    public InterviewSessionService(SessionConfigurator configurator,
                                   PreflightChecker preflightChecker,
                                   DeviceCapabilityReports capabilityReports,
                                   ReportedSignalViolationSource signals,
                                   FeedbackPoller feedbackPoller,
                                   CompletionSubmitter completionSubmitter,
                                   ScoreAggregator scoreAggregator,
                                   BackendClient backend,
                                   SessionRegistry registry,
                                   SessionDependencies deps,
                                   @Qualifier("workerExecutor") Executor workerExecutor,
                                   SessionMetrics metrics) {
        this.configurator = Objects.requireNonNull(configurator, "configurator");
        this.preflightChecker = Objects.requireNonNull(preflightChecker, "preflightChecker");
        this.capabilityReports = Objects.requireNonNull(capabilityReports, "capabilityReports");
        this.signals = Objects.requireNonNull(signals, "signals");
        this.feedbackPoller = Objects.requireNonNull(feedbackPoller, "feedbackPoller");
        this.completionSubmitter = Objects.requireNonNull(completionSubmitter, "completionSubmitter");
        this.scoreAggregator = Objects.requireNonNull(scoreAggregator, "scoreAggregator");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.deps = Objects.requireNonNull(deps, "deps");
        this.workerExecutor = Objects.requireNonNull(workerExecutor, "workerExecutor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Validates the parameters, creates the backend session and leaves the new session at PREFLIGHT.
     */
    public SessionSnapshot configure(JobContext jobContext,
                                     InterviewParameters parameters,
                                     String resumeReference,
                                     AuthToken token) {
        Objects.requireNonNull(token, "token");
        configurator.validate(jobContext, parameters, resumeReference);

        SessionStateMachine session = open(token);
        session.beginConfiguration();
        try {
            ConfiguredSession configured = configurator.submit(jobContext, parameters, resumeReference, token);
            session.configured(configured);
        } catch (MockInterviewException e) {
            session.abortOnFatal("configuration failed: " + e.getMessage());
            throw e;
        }
        return session.snapshot();
    }

    /**
     * Rebuilds a session from the backend after a reload.
     *
     * @throws FatalSessionException if the backend session was cancelled, expired or lacks its parameters
     */
    public SessionSnapshot resume(String sessionId, AuthToken token) {
        SessionRecord record = backend.fetchSession(sessionId, token);
        if (record.feedback() == null && SessionStatus.fromBackend(record.status()) == SessionStatus.ABORTED) {
            throw new FatalSessionException(sessionId, "Session cannot be resumed from status " + record.status());
        }
        if (record.config() == null || record.questions().isEmpty()) {
            throw new FatalSessionException(sessionId, "Session record lacks interview parameters or questions");
        }

        SessionStateMachine session = open(token);
        session.restore(record, record.config());
        if (session.status() == SessionStatus.COMPLETED) {
            startPolling(session);
        }
        LOG.info("Resumed session {} as {} at question {}", sessionId, session.status(),
                session.snapshot().currentIndex());
        return session.snapshot();
    }

    public SessionSnapshot view(UUID handle, AuthToken token) {
        return registry.get(handle, token).snapshot();
    }

    public void reportCapabilities(UUID handle, AuthToken token, Map<Capability, Boolean> reported) {
        registry.get(handle, token);
        reported.forEach((capability, available) ->
                capabilityReports.report(handle, capability, Boolean.TRUE.equals(available)));
    }

    /**
     * Runs every capability check concurrently. Starts the interview when the mandatory ones pass.
     *
     * @throws PreflightFailureException if a mandatory check failed; the session stays at PREFLIGHT
     */
    public PreflightReport runPreflight(UUID handle, AuthToken token) {
        SessionStateMachine session = registry.get(handle, token);
        requireStatus(session, SessionStatus.PREFLIGHT, "run preflight");
        PreflightReport report = preflightChecker.runAll(handle);
        if (!session.recordPreflight(report)) {
            throw preflightFailure(report);
        }
        return report;
    }

    /**
     * Re-runs one check, keeping the others' results.
     *
     * @throws PreflightFailureException if a mandatory check is still failing afterwards
     */
    public PreflightReport retryCheck(UUID handle, AuthToken token, Capability capability) {
        SessionStateMachine session = registry.get(handle, token);
        requireStatus(session, SessionStatus.PREFLIGHT, "retry preflight check");
        CheckResult result = preflightChecker.runOne(handle, capability);
        boolean started = session.recordPreflightResult(result, preflightChecker.mandatory());
        PreflightReport report = session.preflight();
        if (!started) {
            throw preflightFailure(report);
        }
        return report;
    }

    public SessionSnapshot saveAnswer(UUID handle, AuthToken token, int index, String text, AnswerChannel channel) {
        SessionStateMachine session = registry.get(handle, token);
        boolean changed = session.upsertAnswer(index, text, channel);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Answer {} for session {} via {} (changed={}): {}", index, session.sessionId(), channel,
                    changed, LogSanitizer.truncate(text, 40));
        }
        return session.snapshot();
    }

    public SessionSnapshot navigate(UUID handle, AuthToken token, NavigationAction action, Integer targetIndex) {
        SessionStateMachine session = registry.get(handle, token);
        session.navigate(action, targetIndex);
        return session.snapshot();
    }

    public SessionSnapshot finish(UUID handle, AuthToken token) {
        SessionStateMachine session = registry.get(handle, token);
        session.finish();
        return session.snapshot();
    }

    public SessionSnapshot abort(UUID handle, AuthToken token, String reason) {
        SessionStateMachine session = registry.get(handle, token);
        session.abort(reason == null || reason.isBlank() ? "cancelled by candidate" : reason);
        return session.snapshot();
    }

    /**
     * Queues an integrity signal for the session's monitor. Never blocks the candidate.
     */
    public void reportSignal(UUID handle, AuthToken token, Violation violation) {
        SessionStateMachine session = registry.get(handle, token);
        requireStatus(session, SessionStatus.IN_PROGRESS, "report integrity signals");
        signals.submit(handle, violation);
    }

    /**
     * Builds the post-interview summary.
     *
     * <p>While scoring is pending the summary is marked pending. If polling already gave up, one more
     * status request is made; when feedback is still missing polling restarts and a
     * {@link FeedbackTimeoutException} tells the caller to come back later.
     */
    public SessionSummary summary(UUID handle, AuthToken token) {
        SessionStateMachine session = registry.get(handle, token);
        SessionSnapshot snap = session.snapshot();
        if (snap.status() != SessionStatus.COMPLETED && snap.status() != SessionStatus.SCORED) {
            throw new SessionStateException("summarize", snap.status());
        }
        if (snap.status() == SessionStatus.COMPLETED
                && (snap.feedbackState() == FeedbackState.DELAYED || snap.feedbackState() == FeedbackState.ERROR)) {
            PollResult result = feedbackPoller.pollOnce(snap.sessionId(), token);
            if (result.state() == PollResult.State.READY) {
                session.feedbackReady(result.feedback());
            } else {
                session.feedbackPollingRestarted();
                startPolling(session);
                throw new FeedbackTimeoutException(snap.sessionId(),
                        Duration.between(snap.updatedAt(), deps.getClock().instant()));
            }
        }
        return scoreAggregator.summarize(session.sessionId(), session.status(), session.feedback(),
                session.isFlaggedForReview(), session.completionFraction());
    }

    @Scheduled(fixedRate = 60_000)
    void evictIdleSessions() {
        for (SessionStateMachine s : registry.evictIdle(deps.getClock())) {
            release(s.handle());
        }
    }

    public int activeSessions() {
        return registry.activeCount();
    }

    // ---------------------------------------------------------------- internals

    private SessionStateMachine open(AuthToken token) {
        SessionStateMachine session = new SessionStateMachine(UUID.randomUUID(), token, deps, hooks);
        for (SessionStateMachine superseded : registry.register(session)) {
            superseded.abortOnFatal("superseded by a new session");
        }
        return session;
    }

    private void startPolling(SessionStateMachine session) {
        UUID handle = session.handle();
        String sessionId = session.sessionId();
        PollingTask task = feedbackPoller.start(sessionId, session.token(), new FeedbackListener() {
            @Override
            public void onReady(Feedback feedback, Duration waited) {
                metrics.recordFeedbackWait(waited, "ready");
                session.feedbackReady(feedback);
            }

            @Override
            public void onDelayed(Duration waited) {
                metrics.recordFeedbackWait(waited, "delayed");
                session.feedbackDelayed();
                deps.getPublisher().publishEvent(new FeedbackDelayedEvent(handle, sessionId, waited));
            }

            @Override
            public void onError(String reason, Duration waited) {
                metrics.recordFeedbackWait(waited, "error");
                session.feedbackError(reason);
            }
        });
        PollingTask previous = pollers.put(handle, task);
        if (previous != null) {
            previous.cancel();
        }
        // the first attempt may already have finished on the scheduler
        if (task.isDone()) {
            pollers.remove(handle, task);
        }
    }

    private void release(UUID handle) {
        PollingTask poll = pollers.remove(handle);
        if (poll != null) {
            poll.cancel();
        }
        CompletionSubmitter.Submission submission = submissions.remove(handle);
        if (submission != null) {
            submission.cancel();
        }
        capabilityReports.forget(handle);
        signals.forget(handle);
    }

    private static void requireStatus(SessionStateMachine session, SessionStatus expected, String operation) {
        SessionStatus current = session.status();
        if (current != expected) {
            throw new SessionStateException(operation, current);
        }
    }

    private static PreflightFailureException preflightFailure(PreflightReport report) {
        Map<Capability, String> statuses = new EnumMap<>(Capability.class);
        report.results().forEach((c, r) -> statuses.put(c, r.status().name()));
        return new PreflightFailureException(report.failedMandatory(), statuses);
    }

    private final class Hooks implements SessionHooks {

        @Override
        public void checkpoint(SessionStateMachine session, Answer answer) {
            String sessionId = session.sessionId();
            workerExecutor.execute(() -> {
                try {
                    backend.saveAnswer(sessionId, answer, session.token());
                } catch (MockInterviewException e) {
                    LOG.warn("Checkpoint of answer {} for session {} failed: {}",
                            answer.questionIndex(), sessionId, e.getMessage());
                }
            });
        }

        @Override
        public void completed(SessionStateMachine session, CompletionSubmission submission) {
            UUID handle = session.handle();
            CompletionSubmitter.Submission running = completionSubmitter.submit(submission, session.token(),
                    new CompletionListener() {
                        @Override
                        public void onAcknowledged(int attempts) {
                            submissions.remove(handle);
                            session.completionAcknowledged();
                            if (session.status() == SessionStatus.COMPLETED) {
                                startPolling(session);
                            }
                        }

                        @Override
                        public void onRetriesExhausted(int attempts, MockInterviewException cause) {
                            failed(attempts, cause);
                        }

                        @Override
                        public void onFailed(int attempts, MockInterviewException cause) {
                            submissions.remove(handle);
                            failed(attempts, cause);
                        }

                        private void failed(int attempts, MockInterviewException cause) {
                            deps.getPublisher().publishEvent(new CompletionSubmissionFailedEvent(
                                    handle, submission.sessionId(), attempts, cause.getMessage()));
                            session.completionFailed(cause);
                        }
                    });
            CompletionSubmitter.Submission previous = submissions.put(handle, running);
            if (previous != null) {
                previous.cancel();
            }
            if (running.isDone()) {
                submissions.remove(handle, running);
            }
        }

        @Override
        public void terminated(SessionStateMachine session) {
            release(session.handle());
        }
    }

    List<UUID> pendingPollers() {
        return List.copyOf(pollers.keySet());
    }
}
