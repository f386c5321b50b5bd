package com.phillippitts.mockinterview.exception;

/**
 * Thrown when the bearer credential is missing, expired or rejected by the backend.
 * Handled by the external auth collaborator.
 */
public class UnauthorizedException extends MockInterviewException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
