package com.phillippitts.mockinterview.service.session;

import com.phillippitts.mockinterview.exception.MockInterviewException;

/**
 * Progress of a completion submission. {@link #onAcknowledged} and {@link #onFailed} are terminal and
 * at most one of them is called.
 */
public interface CompletionListener {

    void onAcknowledged(int attempts);

    /**
     * The attempt budget ran out on transient failures. Called at most once; the submission keeps
     * retrying and may still be acknowledged afterwards.
     *
     * @param attempts attempts made so far
     * @param cause    last network failure
     */
    void onRetriesExhausted(int attempts, MockInterviewException cause);

    /**
     * @param attempts attempts made
     * @param cause    the non-retryable rejection
     */
    void onFailed(int attempts, MockInterviewException cause);
}
