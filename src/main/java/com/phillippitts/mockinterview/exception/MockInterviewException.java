package com.phillippitts.mockinterview.exception;

/**
 * Base exception for all mock interview engine errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class MockInterviewException extends RuntimeException {

    public MockInterviewException(String message) {
        super(message);
    }

    public MockInterviewException(String message, Throwable cause) {
        super(message, cause);
    }

    public MockInterviewException(Throwable cause) {
        super(cause);
    }
}
