package com.phillippitts.mockinterview.config.logging;

import org.apache.logging.log4j.ThreadContext;

/**
 * Scopes the {@code sessionId} MDC key around background work that runs on shared scheduler
 * threads. The previous value is restored afterwards.
 */
public final class SessionLogContext {

    public static final String SESSION_ID = "sessionId";

    /** Engine handle taken from the request path. */
    public static final String HANDLE = "handle";

    private SessionLogContext() {
    }

    public static Runnable wrap(String sessionId, Runnable task) {
        return () -> {
            String previous = ThreadContext.get(SESSION_ID);
            if (sessionId != null) {
                ThreadContext.put(SESSION_ID, sessionId);
            }
            try {
                task.run();
            } finally {
                if (previous == null) {
                    ThreadContext.remove(SESSION_ID);
                } else {
                    ThreadContext.put(SESSION_ID, previous);
                }
            }
        };
    }
}
