package com.phillippitts.mockinterview.domain;

import java.util.Locale;

/**
 * Lifecycle status of a mock interview session.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * CREATED → CONFIGURING → PREFLIGHT → IN_PROGRESS → COMPLETED → SCORED
 * any non-terminal → ABORTED
 * </pre>
 *
 * <p>Transitions only move forward one step at a time. Going back requires a new session.
 */
public enum SessionStatus {
    CREATED,
    CONFIGURING,
    PREFLIGHT,
    IN_PROGRESS,
    COMPLETED,
    SCORED,
    ABORTED;

    public boolean isTerminal() {
        return this == SCORED || this == ABORTED;
    }

    /**
     * Checks whether moving from this status to {@code next} is a legal transition.
     *
     * @param next target status
     * @return {@code true} if the transition is allowed
     */
    public boolean canTransitionTo(SessionStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == ABORTED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }

    /**
     * Maps a backend status string onto the engine lifecycle.
     *
     * <p>The backend knows {@code created, in_progress, completed, cancelled, expired}; a completed
     * record that already carries feedback is reported as {@link #SCORED} by the caller.
     *
     * @param value backend status value
     * @return mapped status, {@link #ABORTED} for cancelled/expired/unknown values
     */
    public static SessionStatus fromBackend(String value) {
        if (value == null) {
            return ABORTED;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "created" -> CREATED;
            case "in_progress" -> IN_PROGRESS;
            case "completed" -> COMPLETED;
            case "scored" -> SCORED;
            default -> ABORTED;
        };
    }
}
