package com.phillippitts.mockinterview.service.events;

import java.util.UUID;

/**
 * Published when the final answer snapshot could not be delivered within the retry budget, or was
 * rejected. Retries continue in the background after the budget runs out.
 */
public record CompletionSubmissionFailedEvent(UUID handle, String sessionId, int attempts, String reason) {
}
