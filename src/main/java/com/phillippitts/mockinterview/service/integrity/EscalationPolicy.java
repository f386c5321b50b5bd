package com.phillippitts.mockinterview.service.integrity;

import com.phillippitts.mockinterview.config.properties.IntegrityProperties;
import com.phillippitts.mockinterview.domain.Violation;
import com.phillippitts.mockinterview.domain.ViolationSeverity;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Sliding-window escalation for one session.
 *
 * <p>Violations at or above the minimum severity are counted inside a window of
 * {@code escalationWindowSeconds}, measured back from the newest violation. Once the count
 * exceeds {@code escalationThreshold} the session is flagged for review. Flagging happens once;
 * later violations keep being counted but never produce a second decision.
 *
 * <p>Not thread-safe. The owning session state machine calls it under its lock.
 */
public final class EscalationPolicy {

    private final int threshold;
    private final Duration window;
    private final ViolationSeverity minSeverity;
    private final boolean terminate;
    private final Deque<Instant> counted = new ArrayDeque<>();

    private boolean flagged;

    public EscalationPolicy(int threshold, Duration window, ViolationSeverity minSeverity, boolean terminate) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0");
        }
        this.threshold = threshold;
        this.window = Objects.requireNonNull(window, "window");
        this.minSeverity = Objects.requireNonNull(minSeverity, "minSeverity");
        this.terminate = terminate;
    }

    public static EscalationPolicy from(IntegrityProperties props) {
        return new EscalationPolicy(props.getEscalationThreshold(),
                Duration.ofSeconds(props.getEscalationWindowSeconds()),
                props.getEscalationMinSeverity(),
                props.isTerminateOnEscalation());
    }

    /**
     * Counts a violation and returns the resulting decision.
     */
    public EscalationDecision record(Violation violation) {
        if (!violation.severity().isAtLeast(minSeverity)) {
            return EscalationDecision.NONE;
        }
        counted.addLast(violation.timestamp());
        pruneOld(violation.timestamp());
        if (flagged || counted.size() <= threshold) {
            return EscalationDecision.NONE;
        }
        flagged = true;
        return terminate ? EscalationDecision.FLAG_AND_TERMINATE : EscalationDecision.FLAG;
    }

    public boolean isFlagged() {
        return flagged;
    }

    /** Restores the flag for a resumed session. */
    public void markFlagged() {
        flagged = true;
    }

    public int countInWindow() {
        return counted.size();
    }

    private void pruneOld(Instant newest) {
        Instant cutoff = newest.minus(window);
        while (!counted.isEmpty() && counted.peekFirst().isBefore(cutoff)) {
            counted.removeFirst();
        }
    }
}
