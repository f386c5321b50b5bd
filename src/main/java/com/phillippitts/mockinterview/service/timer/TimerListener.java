package com.phillippitts.mockinterview.service.timer;

/**
 * Receives countdown events from a {@link QuestionTimer}. Invoked on the scheduler thread.
 */
public interface TimerListener {

    /**
     * Called once per elapsed second with the seconds still remaining (never negative).
     */
    void onTick(QuestionTimer timer, long remainingSeconds);

    /**
     * Called exactly once when the countdown reaches zero, after the final tick.
     */
    void onExpired(QuestionTimer timer);
}
