package com.phillippitts.mockinterview.exception;

import java.time.Duration;

/**
 * Thrown when scoring has not arrived within the polling budget. Non-fatal: the completed
 * session stays valid and the summary shows a pending state.
 */
public class FeedbackTimeoutException extends MockInterviewException {

    private final String sessionId;
    private final Duration waited;

    public FeedbackTimeoutException(String sessionId, Duration waited) {
        super("Feedback for session " + sessionId + " not ready after " + waited.toMillis() + " ms");
        this.sessionId = sessionId;
        this.waited = waited;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Duration getWaited() {
        return waited;
    }
}
