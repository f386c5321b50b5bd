package com.phillippitts.mockinterview.service.scoring;

import com.phillippitts.mockinterview.domain.DimensionScore;
import com.phillippitts.mockinterview.domain.Feedback;
import com.phillippitts.mockinterview.domain.ScoreDimension;
import com.phillippitts.mockinterview.domain.SessionStatus;
import com.phillippitts.mockinterview.domain.SessionSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ScoreAggregatorTest {

    private final ScoreAggregator aggregator = new ScoreAggregator();

    @Test
    void rawScoreIsScaledToHundred() {
        Feedback feedback = new Feedback(7.8, Map.of(), List.of("clear structure"), List.of(), List.of());

        SessionSummary summary = aggregator.summarize("s1", SessionStatus.SCORED, feedback, false, 1.0);

        assertThat(summary.overallScore()).isEqualTo(78);
        assertThat(summary.rating()).isEqualTo("Good");
        assertThat(summary.feedbackPending()).isFalse();
        assertThat(summary.strengths()).containsExactly("clear structure");
    }

    @Test
    void derivedAxesAreOffsetAndMarked() {
        Feedback feedback = new Feedback(8.0, Map.of(
                ScoreDimension.COMMUNICATION, 8.5,
                ScoreDimension.TECHNICAL, 7.0,
                ScoreDimension.PROBLEM_SOLVING, 6.2,
                ScoreDimension.BEHAVIORAL, 9.0), null, null, null);

        SessionSummary summary = aggregator.summarize("s1", SessionStatus.SCORED, feedback, true, 0.8);

        assertThat(summary.dimensions()).extracting(DimensionScore::label, DimensionScore::value, DimensionScore::derived)
                .containsExactly(
                        tuple("Communication", 85, false),
                        tuple("Technical", 70, false),
                        tuple("Problem Solving", 62, false),
                        tuple("Body Language", 90, false),
                        tuple(ScoreAggregator.CLARITY, 75, true),
                        tuple(ScoreAggregator.CONFIDENCE, 85, true));
        assertThat(summary.flaggedForReview()).isTrue();
        assertThat(summary.completion()).isEqualTo(0.8);
    }

    @Test
    void derivedAxesNeverGoNegative() {
        Feedback feedback = new Feedback(0.5, Map.of(
                ScoreDimension.COMMUNICATION, 0.4,
                ScoreDimension.BEHAVIORAL, 0.2), null, null, null);

        SessionSummary summary = aggregator.summarize("s1", SessionStatus.SCORED, feedback, false, 0.2);

        assertThat(summary.dimensions()).filteredOn(DimensionScore::derived)
                .extracting(DimensionScore::value)
                .containsOnly(0);
    }

    @Test
    void missingFeedbackYieldsPendingSummaryWithoutSampleData() {
        SessionSummary summary = aggregator.summarize("s1", SessionStatus.COMPLETED, null, false, 0.6);

        assertThat(summary.feedbackPending()).isTrue();
        assertThat(summary.overallScore()).isZero();
        assertThat(summary.dimensions()).isEmpty();
        assertThat(summary.strengths()).isEmpty();
        assertThat(summary.status()).isEqualTo(SessionStatus.COMPLETED);
    }

    @ParameterizedTest
    @CsvSource({"7.8, 78", "0.0, 0", "10.0, 100", "12.5, 100", "-1.0, 0", "6.65, 67"})
    void displayScaleClampsAndRounds(double raw, int expected) {
        assertThat(ScoreAggregator.toDisplayScale(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"95, Excellent", "90, Excellent", "85, Very Good", "70, Good", "60, Fair", "59, Needs Work", "0, Needs Work"})
    void ratingBands(int score, String rating) {
        assertThat(ScoreAggregator.rating(score)).isEqualTo(rating);
    }
}
