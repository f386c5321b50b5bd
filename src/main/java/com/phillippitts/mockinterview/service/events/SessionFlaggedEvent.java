package com.phillippitts.mockinterview.service.events;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once when integrity escalation flags a session for review.
 *
 * @param handle        engine session handle
 * @param sessionId     backend session id
 * @param countInWindow counted violations inside the sliding window at the time of flagging
 * @param terminated    whether the termination hook aborted the session
 * @param at            flag time
 */
public record SessionFlaggedEvent(UUID handle, String sessionId, int countInWindow, boolean terminated, Instant at) {
    public SessionFlaggedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
