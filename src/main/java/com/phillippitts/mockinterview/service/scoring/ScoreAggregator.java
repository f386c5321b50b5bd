package com.phillippitts.mockinterview.service.scoring;

import com.phillippitts.mockinterview.domain.DimensionScore;
import com.phillippitts.mockinterview.domain.Feedback;
import com.phillippitts.mockinterview.domain.ScoreDimension;
import com.phillippitts.mockinterview.domain.SessionStatus;
import com.phillippitts.mockinterview.domain.SessionSummary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw backend feedback into the {@link SessionSummary} shown after an interview.
 *
 * <p>Raw scores are on a 0-10 scale; the display scale is {@code round(raw * 10)} clamped to
 * [0, 100]. Two radar axes are derived rather than measured:
 * <ul>
 *   <li>Clarity = Communication - 10</li>
 *   <li>Confidence = Body Language - 5</li>
 * </ul>
 * Both are heuristics for presentation only and are clamped to [0, 100] as well.
 *
 * <p>This is the only producer of summaries; a session without feedback yields a pending summary
 * with zero scores rather than sample data.
 */
@Component
public class ScoreAggregator {

    static final String CLARITY = "Clarity";
    static final String CONFIDENCE = "Confidence";
    private static final int CLARITY_OFFSET = 10;
    private static final int CONFIDENCE_OFFSET = 5;

    public SessionSummary summarize(String sessionId,
                                    SessionStatus status,
                                    Feedback feedback,
                                    boolean flaggedForReview,
                                    double completion) {
        if (feedback == null) {
            return new SessionSummary(sessionId, status, true, 0, rating(0), List.of(),
                    List.of(), List.of(), List.of(), flaggedForReview, completion);
        }

        int overall = toDisplayScale(feedback.overallScore());
        List<DimensionScore> dimensions = new ArrayList<>();
        for (ScoreDimension d : ScoreDimension.values()) {
            dimensions.add(new DimensionScore(d.label(), toDisplayScale(feedback.subscore(d)), false));
        }
        int communication = toDisplayScale(feedback.subscore(ScoreDimension.COMMUNICATION));
        int bodyLanguage = toDisplayScale(feedback.subscore(ScoreDimension.BEHAVIORAL));
        dimensions.add(new DimensionScore(CLARITY, clamp(communication - CLARITY_OFFSET), true));
        dimensions.add(new DimensionScore(CONFIDENCE, clamp(bodyLanguage - CONFIDENCE_OFFSET), true));

        return new SessionSummary(sessionId, status, false, overall, rating(overall), dimensions,
                feedback.strengths(), feedback.weaknesses(), feedback.recommendations(),
                flaggedForReview, completion);
    }

    /**
     * Converts a raw 0-10 score to the 0-100 display scale.
     */
    public static int toDisplayScale(double raw) {
        if (Double.isNaN(raw)) {
            return 0;
        }
        return clamp((int) Math.round(raw * 10));
    }

    public static String rating(int displayScore) {
        if (displayScore >= 90) {
            return "Excellent";
        }
        if (displayScore >= 80) {
            return "Very Good";
        }
        if (displayScore >= 70) {
            return "Good";
        }
        if (displayScore >= 60) {
            return "Fair";
        }
        return "Needs Work";
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
