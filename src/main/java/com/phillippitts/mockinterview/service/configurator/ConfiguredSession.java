package com.phillippitts.mockinterview.service.configurator;

import com.phillippitts.mockinterview.domain.Question;
import com.phillippitts.mockinterview.service.backend.SessionRequest;

import java.util.List;

/**
 * Result of a successful configuration: the validated request and the backend's question set,
 * trimmed to exactly {@code request.config().questionCount()} entries.
 *
 * @param sessionId backend session id
 * @param request   validated request that was sent
 * @param questions question set, one per configured question
 */
public record ConfiguredSession(String sessionId, SessionRequest request, List<Question> questions) {

    public ConfiguredSession {
        questions = List.copyOf(questions);
    }
}
