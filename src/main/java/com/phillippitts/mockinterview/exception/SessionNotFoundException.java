package com.phillippitts.mockinterview.exception;

import java.util.UUID;

/**
 * Thrown when an engine handle does not resolve to a live session.
 */
public class SessionNotFoundException extends MockInterviewException {

    private final UUID handle;

    public SessionNotFoundException(UUID handle) {
        super("No interview session for handle " + handle);
        this.handle = handle;
    }

    public UUID getHandle() {
        return handle;
    }
}
