package com.phillippitts.mockinterview.service.feedback;

import com.phillippitts.mockinterview.domain.Feedback;

import java.util.Objects;

/**
 * Outcome of one feedback status request.
 *
 * @param state    pending, ready or error
 * @param feedback scoring when {@link State#READY}, otherwise {@code null}
 * @param reason   error reason when {@link State#ERROR}, otherwise {@code null}
 */
public record PollResult(State state, Feedback feedback, String reason) {

    public enum State { PENDING, READY, ERROR }

    public PollResult {
        Objects.requireNonNull(state, "state");
        if (state == State.READY && feedback == null) {
            throw new IllegalArgumentException("READY result requires feedback");
        }
    }

    public static PollResult pending() {
        return new PollResult(State.PENDING, null, null);
    }

    public static PollResult ready(Feedback feedback) {
        return new PollResult(State.READY, feedback, null);
    }

    public static PollResult error(String reason) {
        return new PollResult(State.ERROR, null, reason);
    }
}
