package com.phillippitts.mockinterview.service.session;

import com.phillippitts.mockinterview.config.logging.SessionLogContext;
import com.phillippitts.mockinterview.config.properties.IntegrityProperties;
import com.phillippitts.mockinterview.domain.Answer;
import com.phillippitts.mockinterview.domain.AnswerChannel;
import com.phillippitts.mockinterview.domain.AuthToken;
import com.phillippitts.mockinterview.domain.Capability;
import com.phillippitts.mockinterview.domain.Feedback;
import com.phillippitts.mockinterview.domain.InterviewConfig;
import com.phillippitts.mockinterview.domain.Question;
import com.phillippitts.mockinterview.domain.SessionStatus;
import com.phillippitts.mockinterview.domain.Violation;
import com.phillippitts.mockinterview.exception.MockInterviewException;
import com.phillippitts.mockinterview.exception.NetworkException;
import com.phillippitts.mockinterview.exception.SessionStateException;
import com.phillippitts.mockinterview.exception.UnauthorizedException;
import com.phillippitts.mockinterview.exception.ValidationException;
import com.phillippitts.mockinterview.service.answer.AnswerStore;
import com.phillippitts.mockinterview.service.backend.CompletionSubmission;
import com.phillippitts.mockinterview.service.backend.SessionRecord;
import com.phillippitts.mockinterview.service.configurator.ConfiguredSession;
import com.phillippitts.mockinterview.service.events.SessionFlaggedEvent;
import com.phillippitts.mockinterview.service.events.SessionTransitionEvent;
import com.phillippitts.mockinterview.service.events.ViolationRecordedEvent;
import com.phillippitts.mockinterview.service.integrity.EscalationDecision;
import com.phillippitts.mockinterview.service.integrity.EscalationPolicy;
import com.phillippitts.mockinterview.service.integrity.IntegrityListener;
import com.phillippitts.mockinterview.service.integrity.IntegrityMonitor;
import com.phillippitts.mockinterview.service.preflight.CheckResult;
import com.phillippitts.mockinterview.service.preflight.PreflightReport;
import com.phillippitts.mockinterview.service.timer.QuestionTimer;
import com.phillippitts.mockinterview.service.timer.TimerListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe lifecycle of one mock interview session.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * CREATED → CONFIGURING (beginConfiguration)
 * CONFIGURING → PREFLIGHT (configured)
 * PREFLIGHT → IN_PROGRESS (all mandatory checks passed; spawns timer and monitor)
 * IN_PROGRESS → IN_PROGRESS (navigate; timer replaced)
 * IN_PROGRESS → COMPLETED (NEXT on last question, finish, or time expiry on last question)
 * COMPLETED → SCORED (feedbackReady)
 * any non-terminal → ABORTED (abort, fatal backend error, escalation with termination enabled)
 * </pre>
 *
 * <p><b>Thread Safety:</b> user operations, timer ticks and monitor evaluations all mutate the
 * session under one {@link ReentrantLock}. Timer and monitor callbacks carry their own instance and
 * are ignored unless that instance is still the live one, so a callback racing with navigation
 * can never act on a question the candidate already left.
 *
 * <p><b>No leaks:</b> while IN_PROGRESS exactly one {@link QuestionTimer} and one
 * {@link IntegrityMonitor} are live. Every transition out of IN_PROGRESS cancels both under the
 * lock before the new status becomes visible.
 *
 * <p><b>I/O:</b> nothing here talks to the backend. Answer checkpoints, completion delivery and
 * event publishing are collected while locked and run through {@link SessionHooks} after unlock.
 */
public final class SessionStateMachine {

    private static final Logger LOG = LogManager.getLogger(SessionStateMachine.class);

    private final UUID handle;
    private final AuthToken token;
    private final SessionDependencies deps;
    private final SessionHooks hooks;
    private final ReentrantLock lock = new ReentrantLock();
    private final String idempotencyKey = UUID.randomUUID().toString();
    private final List<Violation> violations = new ArrayList<>();

    private SessionStatus status = SessionStatus.CREATED;
    private String sessionId;
    private InterviewConfig config;
    private List<Question> questions = List.of();
    private AnswerStore answers;
    private EscalationPolicy escalation;
    private PreflightReport preflight;
    private Feedback feedback;
    private FeedbackState feedbackState = FeedbackState.NOT_STARTED;
    private boolean flaggedForReview;
    private int currentIndex;
    private long remainingSeconds;
    private QuestionTimer timer;
    private IntegrityMonitor monitor;
    private Instant startedAt;
    private Instant completedAt;
    private Instant updatedAt;
    private String abortReason;

    SessionStateMachine(UUID handle, AuthToken token, SessionDependencies deps, SessionHooks hooks) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.token = Objects.requireNonNull(token, "token");
        this.deps = Objects.requireNonNull(deps, "deps");
        this.hooks = Objects.requireNonNull(hooks, "hooks");
        this.updatedAt = deps.getClock().instant();
    }

    public UUID handle() {
        return handle;
    }

    public AuthToken token() {
        return token;
    }

    public String sessionId() {
        lock.lock();
        try {
            return sessionId;
        } finally {
            lock.unlock();
        }
    }

    public SessionStatus status() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public FeedbackState feedbackState() {
        lock.lock();
        try {
            return feedbackState;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- configuration and preflight

    public void beginConfiguration() {
        List<Runnable> after = new ArrayList<>();
        lock.lock();
        try {
            requireStatus(SessionStatus.CREATED, "configure");
            transitionLocked(SessionStatus.CONFIGURING, "configuration submitted", after);
        } finally {
            lock.unlock();
        }
        runAfterUnlock(after);
    }

    /**
     * Binds the backend session and its questions; moves to PREFLIGHT.
     */
    public void configured(ConfiguredSession configured) {
        Objects.requireNonNull(configured, "configured");
        List<Runnable> after = new ArrayList<>();
        lock.lock();
        try {
            requireStatus(SessionStatus.CONFIGURING, "bind configuration");
            bindLocked(configured.sessionId(), configured.request().config(), configured.questions());
            transitionLocked(SessionStatus.PREFLIGHT, "questions generated", after);
        } finally {
            lock.unlock();
        }
        runAfterUnlock(after);
    }

    /**
     * Records a full preflight run. Starts the interview when every mandatory check passed.
     *
     * @return {@code true} if the session is now IN_PROGRESS
     */
    public boolean recordPreflight(PreflightReport report) {
        Objects.requireNonNull(report, "report");
        List<Runnable> after = new ArrayList<>();
        boolean started;
        lock.lock();
        try {
            requireStatus(SessionStatus.PREFLIGHT, "run preflight");
            preflight = report;
            started = startIfReadyLocked(after);
        } finally {
            lock.unlock();
        }
        runAfterUnlock(after);
        return started;
    }

    /**
     * Records one retried check without touching the others.
     *
     * @return {@code true} if the session is now IN_PROGRESS
     */
    public boolean recordPreflightResult(CheckResult result, Set<Capability> mandatory) {
        Objects.requireNonNull(result, "result");
        List<Runnable> after = new ArrayList<>();
        boolean started;
        lock.lock();
        try {
            requireStatus(SessionStatus.PREFLIGHT, "retry preflight check");
            PreflightReport base = preflight != null ? preflight : PreflightReport.pending(mandatory);
            preflight = base.with(result);
            started = startIfReadyLocked(after);
        } finally {
            lock.unlock();
        }
        runAfterUnlock(after);
        return started;
    }

    public PreflightReport preflight() {
        lock.lock();
        try {
            return preflight;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- answers and navigation

    /**
     * Writes answer text. Typed and voice input share the last-writer-wins path.
     *
     * @return {@code true} if the stored text changed
     */
    public boolean upsertAnswer(int index, String text, AnswerChannel channel) {
        lock.lock();
        try {
            requireStatus(SessionStatus.IN_PROGRESS, "edit answers");
            boolean changed = answers.upsert(index, text, channel, deps.getClock().instant());
            if (changed) {
                touchLocked();
            }
            return changed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies a navigation action.
     *
     * @param action      navigation action
     * @param targetIndex target for {@link NavigationAction#JUMP}, ignored otherwise
     * @throws ValidationException   if a jump target is missing or out of range
     * @throws SessionStateException if the session is not in progress
     */
    public void navigate(NavigationAction action, Integer targetIndex) {
        Objects.requireNonNull(action, "action");
        List<Runnable> after = new ArrayList<>();
        lock.lock();
        try {
            requireStatus(SessionStatus.IN_PROGRESS, "navigate");
            navigateLocked(action, targetIndex, "navigation " + action, after);
        } finally {
            lock.unlock();
        }
        runAfterUnlock(after);
    }

    /**
     * Completes the session from IN_PROGRESS. On a COMPLETED session whose submission ran out of
     * retries this re-submits the final snapshot at once, replacing the background retries.
     */
    public void finish() {
        List<Runnable> after = new ArrayList<>();
        lock.lock();
        try {
            if (status == SessionStatus.COMPLETED && feedbackState == FeedbackState.SUBMISSION_FAILED) {
                feedbackState = FeedbackState.SUBMITTING;
                CompletionSubmission submission = buildSubmissionLocked();
                after.add(() -> hooks.completed(this, submission));
            } else {
                requireStatus(SessionStatus.IN_PROGRESS, "finish");
                completeLocked("finished by candidate", after);
            }
        } finally {
            lock.unlock();
        }
        runAfterUnlock(after);
    }

    /**
     * Explicit cancel by the candidate.
     *
     * @throws SessionStateException if the session already reached a terminal status
     */
    public void abort(String reason) {
        List<Runnable> after = new ArrayList<>();
        lock.lock();
        try {
            if (status.isTerminal()) {
                throw new SessionStateException("abort", status);
            }
            abortLocked(reason, after);
        } finally {
            lock.unlock();
        }
        runAfterUnlock(after);
    }

    /**
     * Aborts after an irrecoverable error. No-op if the session is already terminal.
     *
     * @return {@code true} if this call aborted the session
     */
    public boolean abortOnFatal(String reason) {
        List<Runnable> after = new ArrayList<>();
        boolean aborted = false;
        lock.lock();
        try {
            if (!status.isTerminal()) {
                abortLocked(reason, after);
                aborted = true;
            }
        } finally {
            lock.unlock();
        }
        runAfterUnlock(after);
        return aborted;
    }

    // ---------------------------------------------------------------- post-completion

    /**
     * The backend holds the final answers. Also accepted after the retry budget ran out, since
     * retries continue in the background.
     */
    public void completionAcknowledged() {
        lock.lock();
        try {
            if (status == SessionStatus.COMPLETED && (feedbackState == FeedbackState.SUBMITTING
                    || feedbackState == FeedbackState.SUBMISSION_FAILED)) {
                feedbackState = FeedbackState.PENDING;
                touchLocked();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Handles a completion submission that ran out of retries or was refused. Transient and
     * credential failures keep the completed session as SUBMISSION_FAILED; a backend rejection
     * aborts it.
     */
    public void completionFailed(MockInterviewException cause) {
        List<Runnable> after = new ArrayList<>();
        lock.lock();
        try {
            if (status != SessionStatus.COMPLETED) {
                return;
            }
            if (cause instanceof NetworkException || cause instanceof UnauthorizedException) {
                feedbackState = FeedbackState.SUBMISSION_FAILED;
                touchLocked();
            } else {
                abortLocked("backend rejected completion: " + cause.getMessage(), after);
            }
        } finally {
            lock.unlock();
        }
        runAfterUnlock(after);
    }

    public void feedbackReady(Feedback ready) {
        Objects.requireNonNull(ready, "feedback");
        List<Runnable> after = new ArrayList<>();
        lock.lock();
        try {
            if (status != SessionStatus.COMPLETED) {
                LOG.debug("Ignoring feedback for session {} in status {}", sessionId, status);
                return;
            }
            feedback = ready;
            feedbackState = FeedbackState.READY;
            transitionLocked(SessionStatus.SCORED, "feedback ready", after);
            after.add(() -> hooks.terminated(this));
        } finally {
            lock.unlock();
        }
        runAfterUnlock(after);
    }

    public void feedbackDelayed() {
        setFeedbackState(FeedbackState.DELAYED);
    }

    public void feedbackError(String reason) {
        LOG.warn("Feedback for session {} failed: {}", sessionId(), reason);
        setFeedbackState(FeedbackState.ERROR);
    }

    /** Polling restarted for a delayed or failed feedback run. */
    public void feedbackPollingRestarted() {
        setFeedbackState(FeedbackState.PENDING);
    }

    public Feedback feedback() {
        lock.lock();
        try {
            return feedback;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- resume

    /**
     * Rebuilds this fresh session from a backend record after a reload.
     *
     * <p>An in-progress record resumes at PREFLIGHT because devices must be re-checked; the
     * countdown starts at the first unanswered question. A completed record without feedback
     * resumes at COMPLETED with feedback pending; a record with feedback resumes at SCORED.
     */
    public void restore(SessionRecord record, InterviewConfig restoredConfig) {
        Objects.requireNonNull(record, "record");
        List<Runnable> after = new ArrayList<>();
        lock.lock();
        try {
            requireStatus(SessionStatus.CREATED, "resume");
            bindLocked(record.sessionId(), restoredConfig, record.questions());
            answers.restore(record.answers());
            if (record.flaggedForReview()) {
                flaggedForReview = true;
                escalation.markFlagged();
            }
            currentIndex = firstUnansweredLocked();

            SessionStatus target;
            if (record.feedback() != null) {
                feedback = record.feedback();
                feedbackState = FeedbackState.READY;
                target = SessionStatus.SCORED;
            } else if (SessionStatus.fromBackend(record.status()) == SessionStatus.COMPLETED) {
                feedbackState = FeedbackState.PENDING;
                target = SessionStatus.COMPLETED;
            } else {
                target = SessionStatus.PREFLIGHT;
            }
            SessionStatus from = status;
            status = target;
            touchLocked();
            publishLocked(new SessionTransitionEvent(handle, sessionId, from, target, "resumed", updatedAt), after);
        } finally {
            lock.unlock();
        }
        runAfterUnlock(after);
    }

    // ---------------------------------------------------------------- views

    public SessionSnapshot snapshot() {
        lock.lock();
        try {
            boolean inProgress = status == SessionStatus.IN_PROGRESS;
            return new SessionSnapshot(
                    handle,
                    sessionId,
                    status,
                    config,
                    currentIndex,
                    inProgress ? questions.get(currentIndex) : null,
                    questions.size(),
                    inProgress ? remainingSeconds : 0,
                    answers == null ? List.of() : answers.snapshot(),
                    answers == null ? 0.0 : answers.completionFraction(),
                    violations,
                    flaggedForReview,
                    preflight,
                    preflight == null ? Set.of() : preflight.degraded(),
                    feedbackState,
                    abortReason,
                    timer != null && timer.isRunning(),
                    monitor != null && monitor.isRunning(),
                    updatedAt);
        } finally {
            lock.unlock();
        }
    }

    public boolean isFlaggedForReview() {
        lock.lock();
        try {
            return flaggedForReview;
        } finally {
            lock.unlock();
        }
    }

    public double completionFraction() {
        lock.lock();
        try {
            return answers == null ? 0.0 : answers.completionFraction();
        } finally {
            lock.unlock();
        }
    }

    public Instant updatedAt() {
        lock.lock();
        try {
            return updatedAt;
        } finally {
            lock.unlock();
        }
    }

    /** Live timers plus live monitors; zero whenever the session is not IN_PROGRESS. */
    public int liveBackgroundTasks() {
        lock.lock();
        try {
            int n = 0;
            if (timer != null && timer.isRunning()) {
                n++;
            }
            if (monitor != null && monitor.isRunning()) {
                n++;
            }
            return n;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- internals (lock held)

    private void bindLocked(String backendSessionId, InterviewConfig cfg, List<Question> qs) {
        if (qs == null || qs.isEmpty()) {
            throw new ValidationException("questions", "session has no questions");
        }
        this.sessionId = backendSessionId;
        this.config = Objects.requireNonNull(cfg, "config");
        this.questions = List.copyOf(qs);
        this.answers = new AnswerStore(questions.size());
        this.escalation = EscalationPolicy.from(deps.getIntegrityProperties());
        this.currentIndex = 0;
    }

    private boolean startIfReadyLocked(List<Runnable> after) {
        if (!preflight.allMandatoryChecksPassed()) {
            LOG.info("Session {} waiting on mandatory checks {}", sessionId, preflight.failedMandatory());
            touchLocked();
            return false;
        }
        transitionLocked(SessionStatus.IN_PROGRESS, preflight.degraded().isEmpty()
                ? "preflight passed" : "preflight passed, degraded " + preflight.degraded(), after);
        startedAt = deps.getClock().instant();
        spawnTimerLocked();
        IntegrityProperties ip = deps.getIntegrityProperties();
        monitor = new IntegrityMonitor(deps.getScheduler(), deps.getViolationSource(), handle,
                ip.getMinIntervalMs(), ip.getMaxIntervalMs(), new MonitorCallbacks());
        monitor.start();
        return true;
    }

    private void navigateLocked(NavigationAction action, Integer targetIndex, String reason, List<Runnable> after) {
        int last = questions.size() - 1;
        int target;
        switch (action) {
            case NEXT -> {
                if (currentIndex == last) {
                    completeLocked(reason + " on last question", after);
                    return;
                }
                target = currentIndex + 1;
            }
            case PREVIOUS -> target = Math.max(0, currentIndex - 1);
            case SKIP -> target = Math.min(last, currentIndex + 1);
            case JUMP -> {
                if (targetIndex == null) {
                    throw new ValidationException("targetIndex", "required for JUMP");
                }
                if (targetIndex < 0 || targetIndex > last) {
                    throw new ValidationException("targetIndex",
                            "must be between 0 and " + last + ", got " + targetIndex);
                }
                target = targetIndex;
            }
            default -> throw new IllegalStateException("Unhandled navigation action: " + action);
        }
        if (target == currentIndex) {
            return;
        }
        leaveQuestionLocked(after);
        LOG.debug("Session {} question {} -> {} ({})", sessionId, currentIndex, target, reason);
        currentIndex = target;
        spawnTimerLocked();
        touchLocked();
    }

    private void completeLocked(String reason, List<Runnable> after) {
        leaveQuestionLocked(after);
        cancelBackgroundLocked();
        completedAt = deps.getClock().instant();
        feedbackState = FeedbackState.SUBMITTING;
        transitionLocked(SessionStatus.COMPLETED, reason, after);
        CompletionSubmission submission = buildSubmissionLocked();
        after.add(() -> hooks.completed(this, submission));
    }

    private void abortLocked(String reason, List<Runnable> after) {
        if (status == SessionStatus.IN_PROGRESS) {
            leaveQuestionLocked(after);
        }
        cancelBackgroundLocked();
        abortReason = reason;
        transitionLocked(SessionStatus.ABORTED, reason, after);
        after.add(() -> hooks.terminated(this));
    }

    /** Stops the current countdown, books its time and queues the answer checkpoint. */
    private void leaveQuestionLocked(List<Runnable> after) {
        if (timer == null) {
            return;
        }
        timer.cancel();
        Instant now = deps.getClock().instant();
        answers.recordTimeSpent(currentIndex, timer.elapsedSeconds(), now);
        timer = null;
        answers.get(currentIndex).filter(Answer::isAnswered).ifPresent(a -> after.add(() -> hooks.checkpoint(this, a)));
    }

    private void spawnTimerLocked() {
        if (timer != null) {
            timer.cancel();
        }
        long duration = config.timeLimitSeconds();
        remainingSeconds = duration;
        timer = new QuestionTimer(deps.getScheduler(), duration,
                deps.getSessionProperties().getTickIntervalMs(), new TimerCallbacks());
        timer.start();
    }

    private void cancelBackgroundLocked() {
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
        if (monitor != null) {
            monitor.cancel();
            monitor = null;
        }
        remainingSeconds = 0;
    }

    private CompletionSubmission buildSubmissionLocked() {
        long total = startedAt == null || completedAt == null
                ? answers.totalTimeSpentSeconds()
                : Duration.between(startedAt, completedAt).toSeconds();
        return new CompletionSubmission(sessionId, idempotencyKey, answers.snapshot(), violations,
                flaggedForReview, total, completedAt);
    }

    private int firstUnansweredLocked() {
        for (int i = 0; i < questions.size(); i++) {
            if (!answers.isAnswered(i)) {
                return i;
            }
        }
        return questions.size() - 1;
    }

    private void transitionLocked(SessionStatus next, String reason, List<Runnable> after) {
        if (!status.canTransitionTo(next)) {
            throw new SessionStateException("move to " + next, status);
        }
        SessionStatus from = status;
        status = next;
        touchLocked();
        publishLocked(new SessionTransitionEvent(handle, sessionId, from, next, reason, updatedAt), after);
    }

    private void requireStatus(SessionStatus expected, String operation) {
        if (status != expected) {
            throw new SessionStateException(operation, status);
        }
    }

    private void setFeedbackState(FeedbackState state) {
        lock.lock();
        try {
            if (status == SessionStatus.COMPLETED) {
                feedbackState = state;
                touchLocked();
            }
        } finally {
            lock.unlock();
        }
    }

    private void touchLocked() {
        updatedAt = deps.getClock().instant();
    }

    private void publishLocked(Object event, List<Runnable> after) {
        after.add(() -> deps.getPublisher().publishEvent(event));
    }

    private void runAfterUnlock(List<Runnable> after) {
        for (Runnable r : after) {
            try {
                r.run();
            } catch (RuntimeException e) {
                LOG.error("Post-transition action failed for session {}", sessionId(), e);
            }
        }
    }

    // ---------------------------------------------------------------- background callbacks

    private final class TimerCallbacks implements TimerListener {

        @Override
        public void onTick(QuestionTimer source, long remaining) {
            lock.lock();
            try {
                if (source == timer && status == SessionStatus.IN_PROGRESS) {
                    remainingSeconds = remaining;
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void onExpired(QuestionTimer source) {
            SessionLogContext.wrap(sessionId(), () -> {
                List<Runnable> after = new ArrayList<>();
                lock.lock();
                try {
                    if (source != timer || status != SessionStatus.IN_PROGRESS) {
                        return;
                    }
                    LOG.info("Time expired on question {} of session {}; advancing", currentIndex, sessionId);
                    navigateLocked(NavigationAction.NEXT, null, "time expired", after);
                } finally {
                    lock.unlock();
                }
                runAfterUnlock(after);
            }).run();
        }
    }

    private final class MonitorCallbacks implements IntegrityListener {

        @Override
        public void onViolations(IntegrityMonitor source, List<Violation> found) {
            SessionLogContext.wrap(sessionId(), () -> {
                List<Runnable> after = new ArrayList<>();
                lock.lock();
                try {
                    if (source != monitor || status != SessionStatus.IN_PROGRESS) {
                        return;
                    }
                    for (Violation v : found) {
                        violations.add(v);
                        publishLocked(new ViolationRecordedEvent(handle, sessionId, v), after);
                        EscalationDecision decision = escalation.record(v);
                        if (decision == EscalationDecision.NONE) {
                            continue;
                        }
                        flaggedForReview = true;
                        boolean terminate = decision == EscalationDecision.FLAG_AND_TERMINATE;
                        publishLocked(new SessionFlaggedEvent(handle, sessionId, escalation.countInWindow(),
                                terminate, v.timestamp()), after);
                        if (terminate) {
                            abortLocked("integrity escalation", after);
                            break;
                        }
                    }
                    touchLocked();
                } finally {
                    lock.unlock();
                }
                runAfterUnlock(after);
            }).run();
        }
    }
}
