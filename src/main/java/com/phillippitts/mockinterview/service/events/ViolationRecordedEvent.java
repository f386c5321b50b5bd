package com.phillippitts.mockinterview.service.events;

import com.phillippitts.mockinterview.domain.Violation;

import java.util.UUID;

/**
 * Published for every violation appended to a session log. Drives the transient UI warning.
 */
public record ViolationRecordedEvent(UUID handle, String sessionId, Violation violation) {
}
