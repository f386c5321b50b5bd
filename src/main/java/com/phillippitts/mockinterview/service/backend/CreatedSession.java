package com.phillippitts.mockinterview.service.backend;

import com.phillippitts.mockinterview.domain.Question;

import java.util.List;
import java.util.Objects;

/**
 * Backend response to session creation.
 *
 * @param sessionId backend-assigned session id
 * @param questions generated questions, in order
 */
public record CreatedSession(String sessionId, List<Question> questions) {

    public CreatedSession {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        questions = questions == null ? List.of() : List.copyOf(questions);
    }
}
