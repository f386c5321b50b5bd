package com.phillippitts.mockinterview.service.backend;

import com.phillippitts.mockinterview.domain.Answer;
import com.phillippitts.mockinterview.domain.Feedback;
import com.phillippitts.mockinterview.domain.InterviewConfig;
import com.phillippitts.mockinterview.domain.Question;

import java.util.List;
import java.util.Optional;

/**
 * Backend view of a session, used for resume-on-reload and feedback polling.
 *
 * @param sessionId        backend session id
 * @param status           raw backend status ({@code created, in_progress, completed, ...})
 * @param config           interview parameters, {@code null} if the backend did not report them
 * @param questions        question set
 * @param answers          answers saved so far (may be empty)
 * @param feedback         scoring, {@code null} while pending
 * @param flaggedForReview integrity flag as persisted by the backend
 */
public record SessionRecord(
        String sessionId,
        String status,
        InterviewConfig config,
        List<Question> questions,
        List<Answer> answers,
        Feedback feedback,
        boolean flaggedForReview
) {

    public SessionRecord {
        questions = questions == null ? List.of() : List.copyOf(questions);
        answers = answers == null ? List.of() : List.copyOf(answers);
    }

    public Optional<Feedback> feedbackIfReady() {
        return Optional.ofNullable(feedback);
    }
}
