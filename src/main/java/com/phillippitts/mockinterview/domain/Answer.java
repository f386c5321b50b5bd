package com.phillippitts.mockinterview.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Candidate response to one question.
 *
 * @param questionIndex    zero-based question index
 * @param text             current answer text (never null, may be empty)
 * @param lastModified     when the text last changed
 * @param timeSpentSeconds accumulated time spent on the question across visits
 * @param channel          channel of the most recent text write
 */
public record Answer(
        int questionIndex,
        String text,
        Instant lastModified,
        long timeSpentSeconds,
        AnswerChannel channel
) {

    public Answer {
        if (questionIndex < 0) {
            throw new IllegalArgumentException("questionIndex must not be negative, got: " + questionIndex);
        }
        Objects.requireNonNull(text, "Answer text must not be null");
        Objects.requireNonNull(lastModified, "lastModified must not be null");
        if (timeSpentSeconds < 0) {
            throw new IllegalArgumentException("timeSpentSeconds must not be negative, got: " + timeSpentSeconds);
        }
        if (channel == null) {
            channel = AnswerChannel.TYPED;
        }
    }

    public boolean isAnswered() {
        return !text.isBlank();
    }

    public Answer withText(String newText, Instant at, AnswerChannel source) {
        return new Answer(questionIndex, newText, at, timeSpentSeconds, source);
    }

    public Answer plusTimeSpent(long seconds) {
        return new Answer(questionIndex, text, lastModified, timeSpentSeconds + Math.max(0, seconds), channel);
    }
}
