package com.phillippitts.mockinterview.service.backend;

import com.phillippitts.mockinterview.domain.Answer;
import com.phillippitts.mockinterview.domain.Violation;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Final answer snapshot sent when a session completes. Re-sending the same submission is safe:
 * the backend deduplicates on {@code idempotencyKey}.
 *
 * @param sessionId            backend session id
 * @param idempotencyKey       stable key for this session's completion
 * @param answers              answers ordered by question index
 * @param violations           full violation log
 * @param flaggedForReview     integrity escalation flag
 * @param totalDurationSeconds time from start to completion
 * @param completedAt          local completion time
 */
public record CompletionSubmission(
        String sessionId,
        String idempotencyKey,
        List<Answer> answers,
        List<Violation> violations,
        boolean flaggedForReview,
        long totalDurationSeconds,
        Instant completedAt
) {

    public CompletionSubmission {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(idempotencyKey, "idempotencyKey must not be null");
        answers = answers == null ? List.of() : List.copyOf(answers);
        violations = violations == null ? List.of() : List.copyOf(violations);
    }
}
