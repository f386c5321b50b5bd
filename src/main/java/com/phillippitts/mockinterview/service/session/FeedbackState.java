package com.phillippitts.mockinterview.service.session;

/**
 * Progress of the post-completion pipeline (submission then scoring).
 */
public enum FeedbackState {
    NOT_STARTED,
    SUBMITTING,
    SUBMISSION_FAILED,
    PENDING,
    DELAYED,
    ERROR,
    READY
}
