package com.phillippitts.mockinterview.domain;

import java.util.Objects;
import java.util.Set;

/**
 * A generated interview question.
 *
 * @param id               backend question id
 * @param text             question text
 * @param type             answer format (text, coding, ...)
 * @param category         behavioral, technical, ...
 * @param difficulty       easy, medium, hard
 * @param skillsAssessed   skills this question targets
 * @param timeLimitSeconds countdown for this question
 */
public record Question(
        String id,
        String text,
        String type,
        String category,
        String difficulty,
        Set<String> skillsAssessed,
        int timeLimitSeconds
) {

    public Question {
        Objects.requireNonNull(text, "Question text must not be null");
        if (timeLimitSeconds <= 0) {
            throw new IllegalArgumentException("timeLimitSeconds must be positive, got: " + timeLimitSeconds);
        }
        skillsAssessed = skillsAssessed == null ? Set.of() : Set.copyOf(skillsAssessed);
    }
}
