package com.phillippitts.mockinterview.service.configurator;

/**
 * Raw interview parameters as submitted by the setup form. Unset values fall back to the form
 * defaults (10 questions, 3 minutes, mixed, mid).
 *
 * @param questionCount          requested number of questions
 * @param timePerQuestionMinutes requested minutes per question
 * @param interviewType          behavioral, technical or mixed (case-insensitive)
 * @param experienceLevel        entry, mid or senior (case-insensitive)
 */
public record InterviewParameters(
        Integer questionCount,
        Integer timePerQuestionMinutes,
        String interviewType,
        String experienceLevel
) {

    public static final int DEFAULT_QUESTION_COUNT = 10;
    public static final int DEFAULT_MINUTES_PER_QUESTION = 3;

    public static InterviewParameters of(int questionCount, int timePerQuestionMinutes, String interviewType) {
        return new InterviewParameters(questionCount, timePerQuestionMinutes, interviewType, null);
    }
}
