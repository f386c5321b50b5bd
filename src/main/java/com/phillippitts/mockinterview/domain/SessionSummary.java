package com.phillippitts.mockinterview.domain;

import java.util.List;

/**
 * Presentation model for the post-interview summary. Produced only by the score aggregator.
 *
 * @param sessionId        backend session id
 * @param status           session status when the summary was built
 * @param feedbackPending  {@code true} while scoring has not arrived; scores are then zero
 * @param overallScore     overall score on the 0-100 display scale
 * @param rating           rating label for the overall score
 * @param dimensions       measured and derived dimensions in display units
 * @param strengths        passthrough from feedback
 * @param weaknesses       passthrough from feedback
 * @param recommendations  passthrough from feedback
 * @param flaggedForReview whether integrity escalation flagged the session
 * @param completion       fraction of questions answered, 0..1
 */
public record SessionSummary(
        String sessionId,
        SessionStatus status,
        boolean feedbackPending,
        int overallScore,
        String rating,
        List<DimensionScore> dimensions,
        List<String> strengths,
        List<String> weaknesses,
        List<String> recommendations,
        boolean flaggedForReview,
        double completion
) {

    public SessionSummary {
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        weaknesses = weaknesses == null ? List.of() : List.copyOf(weaknesses);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
