package com.phillippitts.mockinterview.exception;

/**
 * Thrown when interview configuration or a navigation argument is invalid.
 * Recoverable inline; never mutates session state.
 */
public class ValidationException extends MockInterviewException {

    private final String field;
    private final String reason;

    public ValidationException(String field, String reason) {
        super("Invalid " + field + ": " + reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
