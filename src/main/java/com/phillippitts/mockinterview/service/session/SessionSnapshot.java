package com.phillippitts.mockinterview.service.session;

import com.phillippitts.mockinterview.domain.Answer;
import com.phillippitts.mockinterview.domain.Capability;
import com.phillippitts.mockinterview.domain.InterviewConfig;
import com.phillippitts.mockinterview.domain.Question;
import com.phillippitts.mockinterview.domain.SessionStatus;
import com.phillippitts.mockinterview.domain.Violation;
import com.phillippitts.mockinterview.service.preflight.PreflightReport;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Consistent read-only view of a session, taken under its lock.
 *
 * @param handle           engine session handle
 * @param sessionId        backend session id
 * @param status           lifecycle status
 * @param config           interview parameters
 * @param currentIndex     active question index
 * @param currentQuestion  active question, {@code null} outside IN_PROGRESS
 * @param questionCount    number of questions
 * @param remainingSeconds countdown of the active question
 * @param answers          answers ordered by index
 * @param completion       answered fraction, 0..1
 * @param violations       violation log in append order
 * @param flaggedForReview integrity escalation flag
 * @param preflight        latest preflight report, {@code null} before the first run
 * @param degraded         optional capabilities that failed preflight
 * @param feedbackState    post-completion progress
 * @param abortReason      why the session was aborted, if it was
 * @param liveTimer        whether a question timer is running
 * @param liveMonitor      whether an integrity monitor is running
 * @param updatedAt        last mutation time
 */
public record SessionSnapshot(
        UUID handle,
        String sessionId,
        SessionStatus status,
        InterviewConfig config,
        int currentIndex,
        Question currentQuestion,
        int questionCount,
        long remainingSeconds,
        List<Answer> answers,
        double completion,
        List<Violation> violations,
        boolean flaggedForReview,
        PreflightReport preflight,
        Set<Capability> degraded,
        FeedbackState feedbackState,
        String abortReason,
        boolean liveTimer,
        boolean liveMonitor,
        Instant updatedAt
) {
    public SessionSnapshot {
        answers = answers == null ? List.of() : List.copyOf(answers);
        violations = violations == null ? List.of() : List.copyOf(violations);
        degraded = degraded == null ? Set.of() : Set.copyOf(degraded);
    }
}
