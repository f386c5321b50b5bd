package com.phillippitts.mockinterview.service.feedback;

import com.phillippitts.mockinterview.domain.Feedback;

import java.time.Duration;

/**
 * Receives the single final outcome of a polling task. Exactly one method is called, once,
 * unless the task is cancelled first.
 */
public interface FeedbackListener {

    void onReady(Feedback feedback, Duration waited);

    /** The wait budget ran out while feedback was still pending. Non-fatal. */
    void onDelayed(Duration waited);

    /** Persistent failure; the completed session must be kept as is. */
    void onError(String reason, Duration waited);
}
