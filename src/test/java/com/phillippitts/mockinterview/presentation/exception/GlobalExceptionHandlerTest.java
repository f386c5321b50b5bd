package com.phillippitts.mockinterview.presentation.exception;

import com.phillippitts.mockinterview.domain.Capability;
import com.phillippitts.mockinterview.domain.SessionStatus;
import com.phillippitts.mockinterview.exception.FatalSessionException;
import com.phillippitts.mockinterview.exception.FeedbackTimeoutException;
import com.phillippitts.mockinterview.exception.NetworkException;
import com.phillippitts.mockinterview.exception.PreflightFailureException;
import com.phillippitts.mockinterview.exception.SessionNotFoundException;
import com.phillippitts.mockinterview.exception.SessionStateException;
import com.phillippitts.mockinterview.exception.UnauthorizedException;
import com.phillippitts.mockinterview.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void validationIsBadRequestNamingTheField() {
        ResponseEntity<GlobalExceptionHandler.ApiError> r =
                handler.handleValidation(new ValidationException("questionCount", "must be between 5 and 20"));

        assertThat(r.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(r.getBody().message()).isEqualTo("Invalid questionCount");
        assertThat(r.getBody().details()).isEqualTo("must be between 5 and 20");
        assertThat(r.getBody().timestamp()).isNotNull();
    }

    @Test
    void preflightWithoutStatusesListsFailedChecks() {
        ResponseEntity<GlobalExceptionHandler.ApiError> r =
                handler.handlePreflight(new PreflightFailureException(Set.of(Capability.NETWORK)));

        assertThat(r.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(r.getBody().details()).isEqualTo("Failed: [NETWORK]");
    }

    @Test
    void feedbackTimeoutIsAcceptedNotAnError() {
        ResponseEntity<GlobalExceptionHandler.ApiError> r =
                handler.handleFeedbackTimeout(new FeedbackTimeoutException("sess-1", Duration.ofMinutes(3)));

        assertThat(r.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(r.getBody().errorCode()).isEqualTo("FeedbackTimeoutException");
    }

    @Test
    void backendErrorsMapToRetryableOrGone() {
        assertThat(handler.handleNetwork(new NetworkException("down")).getStatusCode())
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(handler.handleFatal(new FatalSessionException("sess-1", "expired")).getStatusCode())
                .isEqualTo(HttpStatus.GONE);
        assertThat(handler.handleUnauthorized(new UnauthorizedException("expired")).getStatusCode())
                .isEqualTo(HttpStatus.UNAUTHORIZED);
    }

    @Test
    void stateAndLookupErrors() {
        assertThat(handler.handleState(new SessionStateException("navigate", SessionStatus.COMPLETED)).getStatusCode())
                .isEqualTo(HttpStatus.CONFLICT);
        assertThat(handler.handleNotFound(new SessionNotFoundException(UUID.randomUUID())).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void unexpectedErrorsDoNotLeakMessages() {
        ResponseEntity<GlobalExceptionHandler.ApiError> r =
                handler.handleUnexpected(new IllegalStateException("secret internals"));

        assertThat(r.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(r.getBody().message()).doesNotContain("secret");
        assertThat(r.getBody().details()).doesNotContain("secret");
    }
}
