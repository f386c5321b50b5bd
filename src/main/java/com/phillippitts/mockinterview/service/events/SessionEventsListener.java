package com.phillippitts.mockinterview.service.events;

import com.phillippitts.mockinterview.service.metrics.SessionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central handler for session events. Counts everything, logs repeated warnings at most once per
 * minute per key. Never logs candidate content.
 */
@Component
class SessionEventsListener {
    private static final Logger LOG = LogManager.getLogger(SessionEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final SessionMetrics metrics;

    SessionEventsListener(SessionMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onTransition(SessionTransitionEvent e) {
        metrics.recordTransition(e.to().name());
        LOG.info("Session {} ({}): {} -> {}{}", e.handle(), e.sessionId(), e.from(), e.to(),
                e.reason() == null ? "" : " [" + e.reason() + "]");
    }

    @EventListener
    void onViolation(ViolationRecordedEvent e) {
        metrics.recordViolation(e.violation().kind().name(), e.violation().severity().name());
        String key = "violation-" + e.handle() + '-' + e.violation().kind();
        if (shouldLog(key)) {
            LOG.warn("Integrity violation: session={}, kind={}, severity={}",
                    e.sessionId(), e.violation().kind(), e.violation().severity());
        }
    }

    @EventListener
    void onFlagged(SessionFlaggedEvent e) {
        metrics.incrementEscalations(e.terminated());
        LOG.warn("Session {} flagged for review after {} violations in window (terminated={})",
                e.sessionId(), e.countInWindow(), e.terminated());
    }

    @EventListener
    void onFeedbackDelayed(FeedbackDelayedEvent e) {
        if (shouldLog("feedback-delayed-" + e.sessionId())) {
            LOG.warn("Feedback for session {} still pending after {}s; summary will show a pending state",
                    e.sessionId(), e.waited().toSeconds());
        }
    }

    @EventListener
    void onCompletionFailed(CompletionSubmissionFailedEvent e) {
        if (shouldLog("completion-failed-" + e.sessionId())) {
            LOG.error("Completion for session {} not acknowledged after {} attempts: {}",
                    e.sessionId(), e.attempts(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
