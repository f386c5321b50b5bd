package com.phillippitts.mockinterview.service.events;

import java.time.Duration;
import java.util.UUID;

/**
 * Published when feedback polling gave up without a result. The completed session stays valid.
 */
public record FeedbackDelayedEvent(UUID handle, String sessionId, Duration waited) {
}
