package com.phillippitts.mockinterview.service.session;

import com.phillippitts.mockinterview.config.properties.CompletionProperties;
import com.phillippitts.mockinterview.config.properties.FeedbackPollingProperties;
import com.phillippitts.mockinterview.config.properties.IntegrityProperties;
import com.phillippitts.mockinterview.config.properties.PreflightProperties;
import com.phillippitts.mockinterview.config.properties.SessionProperties;
import com.phillippitts.mockinterview.domain.Answer;
import com.phillippitts.mockinterview.domain.AnswerChannel;
import com.phillippitts.mockinterview.domain.AuthToken;
import com.phillippitts.mockinterview.domain.Capability;
import com.phillippitts.mockinterview.domain.Feedback;
import com.phillippitts.mockinterview.domain.JobContext;
import com.phillippitts.mockinterview.domain.ScoreDimension;
import com.phillippitts.mockinterview.domain.SessionStatus;
import com.phillippitts.mockinterview.domain.SessionSummary;
import com.phillippitts.mockinterview.domain.Violation;
import com.phillippitts.mockinterview.domain.ViolationKind;
import com.phillippitts.mockinterview.exception.FatalSessionException;
import com.phillippitts.mockinterview.exception.FeedbackTimeoutException;
import com.phillippitts.mockinterview.exception.NetworkException;
import com.phillippitts.mockinterview.exception.PreflightFailureException;
import com.phillippitts.mockinterview.exception.SessionNotFoundException;
import com.phillippitts.mockinterview.exception.SessionStateException;
import com.phillippitts.mockinterview.exception.ValidationException;
import com.phillippitts.mockinterview.service.backend.CompletionSubmission;
import com.phillippitts.mockinterview.service.backend.SessionRecord;
import com.phillippitts.mockinterview.service.configurator.InterviewParameters;
import com.phillippitts.mockinterview.service.configurator.SessionConfigurator;
import com.phillippitts.mockinterview.service.events.CompletionSubmissionFailedEvent;
import com.phillippitts.mockinterview.service.feedback.FeedbackPoller;
import com.phillippitts.mockinterview.service.integrity.ReportedSignalViolationSource;
import com.phillippitts.mockinterview.service.metrics.SessionMetrics;
import com.phillippitts.mockinterview.service.preflight.CheckStatus;
import com.phillippitts.mockinterview.service.preflight.DeviceCapabilityReports;
import com.phillippitts.mockinterview.service.preflight.NetworkProbe;
import com.phillippitts.mockinterview.service.preflight.PreflightChecker;
import com.phillippitts.mockinterview.service.preflight.PreflightReport;
import com.phillippitts.mockinterview.service.preflight.ReportedCapabilityProbe;
import com.phillippitts.mockinterview.service.scoring.ScoreAggregator;
import com.phillippitts.mockinterview.testutil.EventCapturingPublisher;
import com.phillippitts.mockinterview.testutil.FakeBackendClient;
import com.phillippitts.mockinterview.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ScheduledThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class InterviewSessionServiceTest {

    private static final AuthToken TOKEN = new AuthToken("candidate-jwt");
    private static final Feedback FEEDBACK = new Feedback(7.8,
            Map.of(ScoreDimension.COMMUNICATION, 8.0, ScoreDimension.BEHAVIORAL, 7.5),
            List.of("structured answers"), List.of("brevity"), List.of("quantify impact"));

    private ScheduledThreadPoolExecutor scheduler;
    private FakeBackendClient backend;
    private EventCapturingPublisher publisher;
    private IntegrityProperties integrityProps;
    private FeedbackPollingProperties feedbackProps;
    private CompletionProperties completionProps;
    private InterviewSessionService service;
    private SessionRegistry registry;
    private DeviceCapabilityReports reports;

    @BeforeEach
    void setUp() {
        scheduler = new ScheduledThreadPoolExecutor(2);
        scheduler.setRemoveOnCancelPolicy(true);
        backend = new FakeBackendClient();
        publisher = new EventCapturingPublisher();
        integrityProps = new IntegrityProperties();
        feedbackProps = new FeedbackPollingProperties();
        feedbackProps.setInitialIntervalMs(5);
        feedbackProps.setMultiplier(1.0);
        feedbackProps.setMaxIntervalMs(5);
        completionProps = new CompletionProperties();
        completionProps.setInitialIntervalMs(5);
        completionProps.setMaxIntervalMs(5);
        completionProps.setMaxAttempts(3);
        service = buildService();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void fullInterviewFromConfigurationToScoredSummary() {
        backend.feedbackAfterPolls(2, FEEDBACK);

        SessionSnapshot created = service.configure(JobContext.of("Engineering Manager"),
                InterviewParameters.of(5, 2, "Behavioral"), null, TOKEN);
        UUID handle = created.handle();
        assertThat(created.status()).isEqualTo(SessionStatus.PREFLIGHT);
        assertThat(created.questionCount()).isEqualTo(5);

        service.reportCapabilities(handle, TOKEN, Map.of(
                Capability.CAMERA, true, Capability.MICROPHONE, false, Capability.ENVIRONMENT, true));
        PreflightReport report = service.runPreflight(handle, TOKEN);
        assertThat(report.allMandatoryChecksPassed()).isTrue();
        assertThat(report.statusOf(Capability.MICROPHONE)).isEqualTo(CheckStatus.FAILED);

        SessionSnapshot running = service.view(handle, TOKEN);
        assertThat(running.status()).isEqualTo(SessionStatus.IN_PROGRESS);
        assertThat(running.degraded()).containsExactly(Capability.MICROPHONE);
        assertThat(running.remainingSeconds()).isBetween(118L, 120L);

        for (int i = 0; i < 4; i++) {
            service.saveAnswer(handle, TOKEN, i, "Answer to question " + (i + 1), AnswerChannel.TYPED);
            service.navigate(handle, TOKEN, NavigationAction.NEXT, null);
        }
        assertThat(service.view(handle, TOKEN).currentIndex()).isEqualTo(4);
        service.saveAnswer(handle, TOKEN, 4, "Final answer", AnswerChannel.TYPED);

        SessionSnapshot finished = service.finish(handle, TOKEN);
        assertThat(finished.status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(finished.liveTimer()).isFalse();
        assertThat(finished.liveMonitor()).isFalse();

        await().atMost(Duration.ofSeconds(3)).until(() -> service.view(handle, TOKEN).status() == SessionStatus.SCORED);
        SessionSummary summary = service.summary(handle, TOKEN);

        assertThat(summary.overallScore()).isEqualTo(78);
        assertThat(summary.feedbackPending()).isFalse();
        assertThat(summary.completion()).isEqualTo(1.0);
        assertThat(summary.recommendations()).containsExactly("quantify impact");
        assertThat(backend.savedAnswers()).hasSize(5);
        assertThat(backend.submissions()).hasSize(1);
        assertThat(backend.submissions().get(0).answers()).hasSize(5);
        await().atMost(Duration.ofSeconds(1)).until(() -> service.pendingPollers().isEmpty());
        assertThat(scheduler.getQueue()).isEmpty();
    }

    @Test
    void invalidParametersCreateNoSession() {
        assertThatThrownBy(() -> service.configure(JobContext.of("QA"), InterviewParameters.of(3, 2, "mixed"),
                null, TOKEN))
                .isInstanceOf(ValidationException.class);

        assertThat(service.activeSessions()).isZero();
        assertThat(backend.submissions()).isEmpty();
    }

    @Test
    void backendFailureWhileConfiguringAbortsNewSession() {
        backend.failCreate(() -> new NetworkException("timeout"));

        assertThatThrownBy(() -> service.configure(JobContext.of("QA"), InterviewParameters.of(5, 2, "mixed"),
                null, TOKEN))
                .isInstanceOf(NetworkException.class);

        assertThat(service.activeSessions()).isZero();
    }

    @Test
    void mandatoryCheckFailureBlocksStartUntilRetrySucceeds() {
        UUID handle = configure();
        service.reportCapabilities(handle, TOKEN, Map.of(
                Capability.CAMERA, false, Capability.MICROPHONE, true, Capability.ENVIRONMENT, true));

        assertThatThrownBy(() -> service.runPreflight(handle, TOKEN))
                .isInstanceOfSatisfying(PreflightFailureException.class, ex -> {
                    assertThat(ex.getFailedChecks()).containsExactly(Capability.CAMERA);
                    assertThat(ex.getCheckStatuses()).containsEntry(Capability.CAMERA, "FAILED");
                });
        assertThat(service.view(handle, TOKEN).status()).isEqualTo(SessionStatus.PREFLIGHT);

        service.reportCapabilities(handle, TOKEN, Map.of(Capability.CAMERA, true));
        PreflightReport report = service.retryCheck(handle, TOKEN, Capability.CAMERA);

        assertThat(report.allMandatoryChecksPassed()).isTrue();
        assertThat(service.view(handle, TOKEN).status()).isEqualTo(SessionStatus.IN_PROGRESS);
    }

    @Test
    void otherCredentialCannotSeeSession() {
        UUID handle = configure();

        assertThatThrownBy(() -> service.view(handle, new AuthToken("someone-else")))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void newSessionSupersedesActiveOne() {
        UUID first = configure();
        UUID second = configure();

        SessionSnapshot old = service.view(first, TOKEN);
        assertThat(old.status()).isEqualTo(SessionStatus.ABORTED);
        assertThat(old.abortReason()).contains("superseded");
        assertThat(service.view(second, TOKEN).status()).isEqualTo(SessionStatus.PREFLIGHT);
        assertThat(service.activeSessions()).isEqualTo(1);
    }

    @Test
    void summaryRequiresCompletedSession() {
        UUID handle = start();

        assertThatThrownBy(() -> service.summary(handle, TOKEN)).isInstanceOf(SessionStateException.class);
    }

    @Test
    void pendingFeedbackGivesPendingSummary() {
        feedbackProps.setInitialIntervalMs(60_000);
        feedbackProps.setMaxIntervalMs(60_000);
        service = buildService();
        UUID handle = start();
        service.finish(handle, TOKEN);
        await().atMost(Duration.ofSeconds(2))
                .until(() -> service.view(handle, TOKEN).feedbackState() == FeedbackState.PENDING);

        SessionSummary summary = service.summary(handle, TOKEN);

        assertThat(summary.feedbackPending()).isTrue();
        assertThat(summary.overallScore()).isZero();
        assertThat(summary.dimensions()).isEmpty();
    }

    @Test
    void delayedFeedbackRestartsPollingOnSummaryRequest() {
        feedbackProps.setMaxWaitMs(30);
        service = buildService();
        UUID handle = start();
        service.finish(handle, TOKEN);
        await().atMost(Duration.ofSeconds(2))
                .until(() -> service.view(handle, TOKEN).feedbackState() == FeedbackState.DELAYED);

        assertThatThrownBy(() -> service.summary(handle, TOKEN)).isInstanceOf(FeedbackTimeoutException.class);

        SessionSnapshot snap = service.view(handle, TOKEN);
        assertThat(snap.status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(snap.feedbackState()).isIn(FeedbackState.PENDING, FeedbackState.DELAYED);
        assertThat(snap.answers()).extracting(Answer::text).contains("only answer");
    }

    @Test
    void delayedFeedbackThatArrivedIsPickedUpBySummary() {
        feedbackProps.setMaxWaitMs(30);
        service = buildService();
        UUID handle = start();
        service.finish(handle, TOKEN);
        await().atMost(Duration.ofSeconds(2))
                .until(() -> service.view(handle, TOKEN).feedbackState() == FeedbackState.DELAYED);

        backend.feedbackAfterPolls(1, FEEDBACK);
        SessionSummary summary = service.summary(handle, TOKEN);

        assertThat(summary.overallScore()).isEqualTo(78);
        assertThat(service.view(handle, TOKEN).status()).isEqualTo(SessionStatus.SCORED);
    }

    @Test
    void rejectedCompletionAbortsSession() {
        backend.failCompletion(1, () -> new FatalSessionException("sess-1", "session expired"));
        UUID handle = start();

        service.finish(handle, TOKEN);

        await().atMost(Duration.ofSeconds(2)).until(() -> service.view(handle, TOKEN).status() == SessionStatus.ABORTED);
        assertThat(publisher.eventsOf(CompletionSubmissionFailedEvent.class)).hasSize(1);
    }

    @Test
    void outageLongerThanRetryBudgetStillDeliversAnswers() {
        backend.failCompletion(5, () -> new NetworkException("down"));
        UUID handle = start();

        service.finish(handle, TOKEN);

        await().atMost(Duration.ofSeconds(3)).until(() -> backend.submissions().size() == 6
                && !isDelivering(service.view(handle, TOKEN).feedbackState()));
        assertThat(backend.submissions()).hasSize(6)
                .extracting(CompletionSubmission::idempotencyKey)
                .containsOnly(backend.submissions().get(0).idempotencyKey());
        assertThat(publisher.eventsOf(CompletionSubmissionFailedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.attempts()).isEqualTo(3));
        assertThat(service.view(handle, TOKEN).status()).isIn(SessionStatus.COMPLETED, SessionStatus.SCORED);
    }

    @Test
    void undeliveredCompletionSurvivesEvictionAndCanBeResubmitted() {
        completionProps.setMultiplier(1.0);
        completionProps.setMaxIntervalMs(60_000);
        service = buildService();
        backend.failCompletion(3, () -> new NetworkException("down"));
        UUID handle = start();
        service.finish(handle, TOKEN);
        await().atMost(Duration.ofSeconds(2))
                .until(() -> service.view(handle, TOKEN).feedbackState() == FeedbackState.SUBMISSION_FAILED);

        assertThat(registry.evictIdle(Clock.offset(Clock.systemUTC(), Duration.ofHours(2)))).isEmpty();

        service.finish(handle, TOKEN);

        await().atMost(Duration.ofSeconds(2))
                .until(() -> !isDelivering(service.view(handle, TOKEN).feedbackState()));
        assertThat(backend.submissions()).hasSize(4);
        assertThat(backend.submissions()).extracting(CompletionSubmission::idempotencyKey).containsOnly(
                backend.submissions().get(0).idempotencyKey());
    }

    @Test
    void sessionAbandonedAtPreflightIsAbortedOnEviction() {
        UUID handle = configure();
        service.reportCapabilities(handle, TOKEN, Map.of(Capability.CAMERA, true));

        List<SessionStateMachine> evicted = registry.evictIdle(Clock.offset(Clock.systemUTC(), Duration.ofHours(2)));

        assertThat(evicted).singleElement().satisfies(s -> {
            assertThat(s.handle()).isEqualTo(handle);
            assertThat(s.status()).isEqualTo(SessionStatus.ABORTED);
        });
        assertThat(reports.snapshot(handle)).isEmpty();
        assertThatThrownBy(() -> service.view(handle, TOKEN)).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void signalsOnlyAcceptedDuringInterview() {
        UUID handle = configure();

        assertThatThrownBy(() -> service.reportSignal(handle, TOKEN, Violation.of(ViolationKind.TAB_SWITCH, null)))
                .isInstanceOf(SessionStateException.class);
    }

    @Test
    void reportedSignalsReachTheViolationLog() {
        integrityProps.setMinIntervalMs(2);
        integrityProps.setMaxIntervalMs(5);
        service = buildService();
        UUID handle = start();

        service.reportSignal(handle, TOKEN, Violation.of(ViolationKind.FULLSCREEN_EXIT, null));
        service.reportSignal(handle, TOKEN, Violation.of(ViolationKind.TAB_SWITCH, null));

        await().atMost(Duration.ofSeconds(2)).until(() -> service.view(handle, TOKEN).violations().size() == 2);
        assertThat(service.view(handle, TOKEN).flaggedForReview()).isFalse();
    }

    @Test
    void abortStopsEverything() {
        UUID handle = start();

        SessionSnapshot aborted = service.abort(handle, TOKEN, null);

        assertThat(aborted.status()).isEqualTo(SessionStatus.ABORTED);
        assertThat(aborted.abortReason()).isEqualTo("cancelled by candidate");
        assertThat(scheduler.getQueue()).isEmpty();
        assertThat(service.activeSessions()).isZero();
    }

    @Test
    void resumeRestartsAtFirstUnansweredQuestion() {
        backend.storedRecord(new SessionRecord("sess-42", "in_progress", SessionFixtures.config(5, 2),
                SessionFixtures.questions(5, 120),
                List.of(new Answer(0, "saved", Instant.now(), 50, AnswerChannel.TYPED)),
                null, false));

        SessionSnapshot resumed = service.resume("sess-42", TOKEN);

        assertThat(resumed.status()).isEqualTo(SessionStatus.PREFLIGHT);
        assertThat(resumed.currentIndex()).isEqualTo(1);
        assertThat(resumed.answers()).hasSize(1);
    }

    @Test
    void cancelledSessionCannotBeResumed() {
        backend.storedRecord(new SessionRecord("sess-43", "cancelled", SessionFixtures.config(5, 2),
                SessionFixtures.questions(5, 120), List.of(), null, false));

        assertThatThrownBy(() -> service.resume("sess-43", TOKEN)).isInstanceOf(FatalSessionException.class);
        assertThat(service.activeSessions()).isZero();
    }

    // ---------------------------------------------------------------- helpers

    private UUID configure() {
        return service.configure(JobContext.of("Designer"), InterviewParameters.of(5, 2, "mixed"), null, TOKEN)
                .handle();
    }

    private UUID start() {
        UUID handle = configure();
        service.reportCapabilities(handle, TOKEN, Map.of(
                Capability.CAMERA, true, Capability.MICROPHONE, true, Capability.ENVIRONMENT, true));
        service.runPreflight(handle, TOKEN);
        service.saveAnswer(handle, TOKEN, 0, "only answer", AnswerChannel.TYPED);
        return handle;
    }

    private static boolean isDelivering(FeedbackState state) {
        return state == FeedbackState.SUBMITTING || state == FeedbackState.SUBMISSION_FAILED;
    }

    private InterviewSessionService buildService() {
        SessionProperties sessionProps = new SessionProperties();
        SessionMetrics metrics = new SessionMetrics(new SimpleMeterRegistry());
        reports = new DeviceCapabilityReports();
        registry = new SessionRegistry(sessionProps);
        ReportedSignalViolationSource signals = new ReportedSignalViolationSource();
        SyncExecutor worker = new SyncExecutor();
        PreflightChecker checker = new PreflightChecker(List.of(
                new ReportedCapabilityProbe(Capability.CAMERA, reports),
                new ReportedCapabilityProbe(Capability.MICROPHONE, reports),
                new ReportedCapabilityProbe(Capability.ENVIRONMENT, reports),
                new NetworkProbe(backend)), new PreflightProperties(), worker);
        SessionDependencies deps = new SessionDependencies(scheduler, signals, sessionProps, integrityProps,
                publisher, Clock.systemUTC());
        return new InterviewSessionService(
                new SessionConfigurator(backend),
                checker,
                reports,
                signals,
                new FeedbackPoller(backend, scheduler, feedbackProps),
                new CompletionSubmitter(backend, scheduler, completionProps, metrics),
                new ScoreAggregator(),
                backend,
                registry,
                deps,
                worker,
                metrics);
    }
}
