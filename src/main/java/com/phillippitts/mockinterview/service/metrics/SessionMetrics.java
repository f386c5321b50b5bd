package com.phillippitts.mockinterview.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralized metrics for interview sessions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Status transitions by target status</li>
 *   <li>Integrity violations by kind and escalations</li>
 *   <li>Time from completion to feedback</li>
 *   <li>Completion submission attempts and outcomes</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class SessionMetrics {

    private static final String METRIC_PREFIX = "mockinterview.session";

    private final MeterRegistry registry;

    public SessionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransition(String toStatus) {
        Counter.builder(METRIC_PREFIX + ".transitions")
                .description("Session status transitions")
                .tag("to", toStatus.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordViolation(String kind, String severity) {
        Counter.builder(METRIC_PREFIX + ".violations")
                .description("Integrity violations recorded")
                .tag("kind", kind.toLowerCase(Locale.ROOT))
                .tag("severity", severity.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void incrementEscalations(boolean terminated) {
        Counter.builder(METRIC_PREFIX + ".escalations")
                .description("Sessions flagged for review by integrity escalation")
                .tag("terminated", Boolean.toString(terminated))
                .register(registry)
                .increment();
    }

    /**
     * Records the wait between completion and feedback.
     *
     * @param waited wait duration
     * @param outcome ready, delayed or error
     */
    public void recordFeedbackWait(Duration waited, String outcome) {
        Timer.builder(METRIC_PREFIX + ".feedback.wait")
                .description("Time from completion until feedback polling finished")
                .tag("outcome", outcome)
                .register(registry)
                .record(waited);
    }

    /**
     * Records one completion submission attempt.
     *
     * @param outcome acknowledged, retry or failed
     */
    public void recordSubmissionAttempt(String outcome) {
        Counter.builder(METRIC_PREFIX + ".completion.attempts")
                .description("Completion submission attempts")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
