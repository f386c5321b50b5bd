package com.phillippitts.mockinterview.exception;

/**
 * Thrown when the backend is unreachable or answers with a transient failure.
 * Callers retry with bounded backoff.
 */
public class NetworkException extends MockInterviewException {

    private final int statusCode;

    public NetworkException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public NetworkException(String message, int statusCode) {
        super(message + " (status: " + statusCode + ")");
        this.statusCode = statusCode;
    }

    /**
     * @return HTTP status of the failed call, or -1 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
