package com.phillippitts.mockinterview.service.session;

import com.phillippitts.mockinterview.config.properties.SessionProperties;
import com.phillippitts.mockinterview.domain.AuthToken;
import com.phillippitts.mockinterview.domain.SessionStatus;
import com.phillippitts.mockinterview.exception.SessionNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory index of engine sessions by handle, scoped to the bearer credential that opened them.
 *
 * <p>Each credential may hold {@code interview.session.max-active-sessions-per-user} active
 * sessions (CREATED through IN_PROGRESS). Registering one more returns the oldest active sessions
 * that have to be superseded. Completed sessions awaiting feedback do not count as active.
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final Map<UUID, SessionStateMachine> sessions = new ConcurrentHashMap<>();
    private final SessionProperties props;

    public SessionRegistry(SessionProperties props) {
        this.props = props;
    }

    /**
     * Adds a session.
     *
     * @return active sessions of the same credential that exceed the per-user limit, oldest first
     */
    public synchronized List<SessionStateMachine> register(SessionStateMachine session) {
        String owner = session.token().fingerprint();
        List<SessionStateMachine> active = new ArrayList<>();
        for (SessionStateMachine s : sessions.values()) {
            if (s.token().fingerprint().equals(owner) && isActive(s.status())) {
                active.add(s);
            }
        }
        active.sort(Comparator.comparing(SessionStateMachine::updatedAt));
        sessions.put(session.handle(), session);

        int excess = active.size() + 1 - props.getMaxActiveSessionsPerUser();
        if (excess <= 0) {
            return List.of();
        }
        LOG.info("Credential {} exceeds {} active session(s); superseding {}", owner,
                props.getMaxActiveSessionsPerUser(), excess);
        return List.copyOf(active.subList(0, excess));
    }

    /**
     * Resolves a handle for the credential that owns it. A handle owned by another credential is
     * reported as not found.
     */
    public SessionStateMachine get(UUID handle, AuthToken token) {
        SessionStateMachine s = sessions.get(handle);
        if (s == null || !s.token().fingerprint().equals(token.fingerprint())) {
            throw new SessionNotFoundException(handle);
        }
        return s;
    }

    public void remove(UUID handle) {
        sessions.remove(handle);
    }

    public int activeCount() {
        int n = 0;
        for (SessionStateMachine s : sessions.values()) {
            if (isActive(s.status())) {
                n++;
            }
        }
        return n;
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Removes sessions idle for longer than the retention period: terminal ones, completed ones
     * whose answers the backend already holds, and ones abandoned before the interview started.
     * Abandoned sessions are aborted on the way out. Completed sessions still delivering their
     * final answers are kept however long that takes.
     *
     * @return removed sessions, so the caller can release what is still attached to them
     */
    public List<SessionStateMachine> evictIdle(Clock clock) {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(props.getRetentionMinutes()));
        List<SessionStateMachine> evicted = new ArrayList<>();
        List<SessionStateMachine> abandoned = new ArrayList<>();
        sessions.values().removeIf(s -> {
            if (!s.updatedAt().isBefore(cutoff)) {
                return false;
            }
            SessionStatus st = s.status();
            boolean idle;
            if (st == SessionStatus.COMPLETED) {
                idle = !isDelivering(s.feedbackState());
            } else {
                idle = st.isTerminal() || isBeforeInterview(st);
            }
            if (idle) {
                evicted.add(s);
                if (!st.isTerminal() && st != SessionStatus.COMPLETED) {
                    abandoned.add(s);
                }
            }
            return idle;
        });
        for (SessionStateMachine s : abandoned) {
            s.abortOnFatal("abandoned");
        }
        if (!evicted.isEmpty()) {
            LOG.info("Evicted {} idle session(s), {} abandoned before start; {} remain",
                    evicted.size(), abandoned.size(), sessions.size());
        }
        return evicted;
    }

    private static boolean isDelivering(FeedbackState state) {
        return state == FeedbackState.SUBMITTING || state == FeedbackState.SUBMISSION_FAILED;
    }

    private static boolean isBeforeInterview(SessionStatus status) {
        return status == SessionStatus.CREATED || status == SessionStatus.CONFIGURING
                || status == SessionStatus.PREFLIGHT;
    }

    static boolean isActive(SessionStatus status) {
        return !status.isTerminal() && status != SessionStatus.COMPLETED;
    }
}
