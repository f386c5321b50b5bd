package com.phillippitts.mockinterview.presentation.exception;

import com.phillippitts.mockinterview.exception.FatalSessionException;
import com.phillippitts.mockinterview.exception.FeedbackTimeoutException;
import com.phillippitts.mockinterview.exception.NetworkException;
import com.phillippitts.mockinterview.exception.PreflightFailureException;
import com.phillippitts.mockinterview.exception.SessionNotFoundException;
import com.phillippitts.mockinterview.exception.SessionStateException;
import com.phillippitts.mockinterview.exception.UnauthorizedException;
import com.phillippitts.mockinterview.exception.ValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for the REST API boundary.
 *
 * Converts engine exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping candidate content and credentials out of responses.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - invalid configuration or input (HTTP 400).
     */
    @ExceptionHandler(ValidationException.class)
    ResponseEntity<ApiError> handleValidation(ValidationException ex) {
        LOG.warn("Validation failed: field={}, reason={}", ex.getField(), ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Invalid " + ex.getField(), ex.getReason());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleBeanValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        LOG.warn("Request body invalid: {}", details);
        return error(HttpStatus.BAD_REQUEST, "ValidationException", "Invalid request body", details);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    ResponseEntity<ApiError> handleMalformed(Exception ex) {
        LOG.warn("Malformed request: {}", ex.getClass().getSimpleName());
        return error(HttpStatus.BAD_REQUEST, "ValidationException", "Malformed request", "Check path and body format");
    }

    /**
     * Mandatory preflight check not passed - user-remediable (HTTP 409).
     */
    @ExceptionHandler(PreflightFailureException.class)
    ResponseEntity<ApiError> handlePreflight(PreflightFailureException ex) {
        LOG.info("Preflight blocked start: failed={}", ex.getFailedChecks());
        String details = ex.getCheckStatuses().isEmpty()
                ? "Failed: " + ex.getFailedChecks()
                : ex.getCheckStatuses().entrySet().stream()
                        .map(e -> e.getKey() + "=" + e.getValue())
                        .collect(Collectors.joining(", "));
        return error(HttpStatus.CONFLICT, ex.getClass().getSimpleName(),
                "Mandatory environment checks have not passed", details);
    }

    @ExceptionHandler(SessionStateException.class)
    ResponseEntity<ApiError> handleState(SessionStateException ex) {
        LOG.info("Rejected operation '{}' in status {}", ex.getOperation(), ex.getCurrentStatus());
        return error(HttpStatus.CONFLICT, ex.getClass().getSimpleName(), ex.getMessage(),
                "Current status: " + ex.getCurrentStatus());
    }

    @ExceptionHandler(UnauthorizedException.class)
    ResponseEntity<ApiError> handleUnauthorized(UnauthorizedException ex) {
        LOG.warn("Unauthorized: {}", ex.getMessage());
        return error(HttpStatus.UNAUTHORIZED, ex.getClass().getSimpleName(), "Authentication required",
                "Sign in again and retry");
    }

    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(SessionNotFoundException ex) {
        LOG.info("Unknown session handle {}", ex.getHandle());
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(), "Interview session not found",
                "Start or resume a session first");
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(NetworkException.class)
    ResponseEntity<ApiError> handleNetwork(NetworkException ex) {
        LOG.error("Backend unavailable: status={}, msg={}", ex.getStatusCode(), ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Interview service temporarily unavailable", "Please retry in a few seconds");
    }

    /**
     * Non-fatal: scoring still running (HTTP 202).
     */
    @ExceptionHandler(FeedbackTimeoutException.class)
    ResponseEntity<ApiError> handleFeedbackTimeout(FeedbackTimeoutException ex) {
        LOG.info("Feedback still pending for session {}", ex.getSessionId());
        return error(HttpStatus.ACCEPTED, ex.getClass().getSimpleName(), "Feedback is still being generated",
                "Your answers are saved; check back shortly");
    }

    /**
     * Session lost or rejected by the backend (HTTP 410).
     */
    @ExceptionHandler(FatalSessionException.class)
    ResponseEntity<ApiError> handleFatal(FatalSessionException ex) {
        LOG.error("Fatal session error: session={}, msg={}", ex.getSessionId(), ex.getMessage());
        return error(HttpStatus.GONE, ex.getClass().getSimpleName(), "Interview session can no longer continue",
                "Start a new interview");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError", "An unexpected error occurred",
                "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
