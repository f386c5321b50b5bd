package com.phillippitts.mockinterview.domain;

import java.util.Objects;

/**
 * Validated interview parameters bound to a session.
 *
 * @param questionCount          number of questions, 5..20
 * @param timePerQuestionMinutes countdown per question in minutes, 1..5
 * @param interviewType          question flavour
 * @param experienceLevel        target seniority
 */
public record InterviewConfig(
        int questionCount,
        int timePerQuestionMinutes,
        InterviewType interviewType,
        ExperienceLevel experienceLevel
) {

    public static final int MIN_QUESTIONS = 5;
    public static final int MAX_QUESTIONS = 20;
    public static final int MIN_MINUTES_PER_QUESTION = 1;
    public static final int MAX_MINUTES_PER_QUESTION = 5;

    public InterviewConfig {
        if (questionCount < MIN_QUESTIONS || questionCount > MAX_QUESTIONS) {
            throw new IllegalArgumentException("questionCount must be between "
                    + MIN_QUESTIONS + " and " + MAX_QUESTIONS + ", got: " + questionCount);
        }
        if (timePerQuestionMinutes < MIN_MINUTES_PER_QUESTION || timePerQuestionMinutes > MAX_MINUTES_PER_QUESTION) {
            throw new IllegalArgumentException("timePerQuestionMinutes must be between "
                    + MIN_MINUTES_PER_QUESTION + " and " + MAX_MINUTES_PER_QUESTION + ", got: " + timePerQuestionMinutes);
        }
        Objects.requireNonNull(interviewType, "interviewType must not be null");
        Objects.requireNonNull(experienceLevel, "experienceLevel must not be null");
    }

    public int timeLimitSeconds() {
        return timePerQuestionMinutes * 60;
    }
}
