package com.phillippitts.mockinterview.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for backend failures with contextual metadata.
 *
 * <p>Classifies the outcome of a backend call into the engine's error taxonomy:
 * <ul>
 *   <li>401/403 → {@link UnauthorizedException}</li>
 *   <li>no response, 408, 429, 5xx → {@link NetworkException} (retryable)</li>
 *   <li>any other 4xx → {@link FatalSessionException}</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw BackendExceptionBuilder.create("Completion submission failed")
 *         .operation("submitCompletion")
 *         .session(sessionId)
 *         .status(503)
 *         .build();
 * </pre>
 */
public final class BackendExceptionBuilder {

    private final String message;
    private String sessionId;
    private String operation;
    private Integer status;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private BackendExceptionBuilder(String message) {
        this.message = message;
    }

    public static BackendExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new BackendExceptionBuilder(message);
    }

    public BackendExceptionBuilder session(String sessionId) {
        this.sessionId = sessionId;
        return this;
    }

    public BackendExceptionBuilder operation(String operation) {
        this.operation = operation;
        return this;
    }

    /**
     * Sets the HTTP status of the failed response. Leave unset when no response arrived.
     */
    public BackendExceptionBuilder status(int status) {
        this.status = status;
        return this;
    }

    public BackendExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public BackendExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Returns {@code true} when the given HTTP status is worth retrying.
     */
    public static boolean isTransient(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    public MockInterviewException build() {
        String detailed = buildDetailedMessage();
        if (status == null) {
            return cause != null ? new NetworkException(detailed, cause) : new NetworkException(detailed);
        }
        if (status == 401 || status == 403) {
            return new UnauthorizedException(detailed);
        }
        if (isTransient(status)) {
            NetworkException ne = new NetworkException(detailed, status);
            if (cause != null) {
                ne.initCause(cause);
            }
            return ne;
        }
        String id = sessionId != null ? sessionId : "unknown";
        return cause != null
                ? new FatalSessionException(id, detailed, cause)
                : new FatalSessionException(id, detailed);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = operation != null || status != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (operation != null) {
            sb.append("operation=").append(operation);
            first = false;
        }
        if (status != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("status=").append(status);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        sb.append(")");
        return sb.toString();
    }
}
