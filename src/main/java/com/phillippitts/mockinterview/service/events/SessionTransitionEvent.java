package com.phillippitts.mockinterview.service.events;

import com.phillippitts.mockinterview.domain.SessionStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Published after a session changed status.
 *
 * @param handle    engine session handle
 * @param sessionId backend session id, {@code null} before configuration
 * @param from      previous status
 * @param to        new status
 * @param reason    short technical reason (no candidate content)
 * @param at        transition time
 */
public record SessionTransitionEvent(
        UUID handle,
        String sessionId,
        SessionStatus from,
        SessionStatus to,
        String reason,
        Instant at
) {
    public SessionTransitionEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
