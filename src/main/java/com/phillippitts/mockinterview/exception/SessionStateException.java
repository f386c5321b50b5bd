package com.phillippitts.mockinterview.exception;

import com.phillippitts.mockinterview.domain.SessionStatus;

/**
 * Thrown when an operation is not legal in the session's current status.
 */
public class SessionStateException extends MockInterviewException {

    private final SessionStatus currentStatus;
    private final String operation;

    public SessionStateException(String operation, SessionStatus currentStatus) {
        super("Cannot " + operation + " while session is " + currentStatus);
        this.operation = operation;
        this.currentStatus = currentStatus;
    }

    public SessionStatus getCurrentStatus() {
        return currentStatus;
    }

    public String getOperation() {
        return operation;
    }
}
