package com.phillippitts.mockinterview.service.session;

/**
 * Candidate navigation while a session is in progress.
 */
public enum NavigationAction {
    /** Next question; from the last question this completes the session. */
    NEXT,
    /** Previous question; no-op on the first question. */
    PREVIOUS,
    /** Leave the question unanswered and move on; no-op on the last question. */
    SKIP,
    /** Go to an explicit index. */
    JUMP
}
