package com.phillippitts.mockinterview.service.session;

import com.phillippitts.mockinterview.domain.Answer;
import com.phillippitts.mockinterview.service.backend.CompletionSubmission;

/**
 * Side effects a state machine hands off once its lock is released. All of them may do I/O.
 */
interface SessionHooks {

    /** The candidate left a question; save its answer best-effort. */
    void checkpoint(SessionStateMachine session, Answer answer);

    /** The session completed locally; deliver the final snapshot. */
    void completed(SessionStateMachine session, CompletionSubmission submission);

    /** The session reached SCORED or ABORTED; release what is still attached to it. */
    void terminated(SessionStateMachine session);

    SessionHooks NONE = new SessionHooks() {
        @Override
        public void checkpoint(SessionStateMachine session, Answer answer) {
        }

        @Override
        public void completed(SessionStateMachine session, CompletionSubmission submission) {
        }

        @Override
        public void terminated(SessionStateMachine session) {
        }
    };
}
