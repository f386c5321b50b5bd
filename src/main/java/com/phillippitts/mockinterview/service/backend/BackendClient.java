package com.phillippitts.mockinterview.service.backend;

import com.phillippitts.mockinterview.domain.Answer;
import com.phillippitts.mockinterview.domain.AuthToken;

/**
 * REST-shaped backend collaborator that owns sessions, question generation and scoring.
 *
 * <p>Every call carries the caller's bearer credential. Failures are reported through the engine
 * exception taxonomy:
 * <ul>
 *   <li>{@link com.phillippitts.mockinterview.exception.UnauthorizedException} - credential rejected</li>
 *   <li>{@link com.phillippitts.mockinterview.exception.NetworkException} - transient, retry</li>
 *   <li>{@link com.phillippitts.mockinterview.exception.FatalSessionException} - session rejected or lost</li>
 * </ul>
 */
public interface BackendClient {

    /**
     * {@code POST /sessions}: creates the session and generates its questions.
     */
    CreatedSession createSession(SessionRequest request, AuthToken token);

    /**
     * {@code GET /sessions/{id}}: current backend view of a session.
     */
    SessionRecord fetchSession(String sessionId, AuthToken token);

    /**
     * {@code PUT /sessions/{id}/answers/{index}}: checkpoints one answer. Idempotent.
     */
    void saveAnswer(String sessionId, Answer answer, AuthToken token);

    /**
     * {@code PUT /sessions/{id}/completion}: submits the final snapshot. Idempotent under retry.
     */
    void submitCompletion(CompletionSubmission submission, AuthToken token);

    /**
     * {@code GET /health}: reachability probe.
     *
     * @return {@code true} if the backend answered with a 2xx status
     */
    boolean ping();
}
