package com.phillippitts.mockinterview.exception;

/**
 * Thrown when the backend rejects or loses a session mid-flow. The session is aborted and the
 * user restarts from configuration.
 */
public class FatalSessionException extends MockInterviewException {

    private final String sessionId;

    public FatalSessionException(String sessionId, String message) {
        super(message + " (session: " + sessionId + ")");
        this.sessionId = sessionId;
    }

    public FatalSessionException(String sessionId, String message, Throwable cause) {
        super(message + " (session: " + sessionId + ")", cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
