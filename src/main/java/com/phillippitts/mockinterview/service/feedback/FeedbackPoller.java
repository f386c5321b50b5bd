package com.phillippitts.mockinterview.service.feedback;

import com.phillippitts.mockinterview.config.properties.FeedbackPollingProperties;
import com.phillippitts.mockinterview.domain.AuthToken;
import com.phillippitts.mockinterview.domain.SessionStatus;
import com.phillippitts.mockinterview.service.backend.BackendClient;
import com.phillippitts.mockinterview.service.backend.BackoffPolicy;
import com.phillippitts.mockinterview.service.backend.SessionRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Retrieves asynchronously generated feedback after a session completed.
 *
 * <p>Polling runs as a cancellable {@link PollingTask} on the shared session scheduler, paced by a
 * {@link BackoffPolicy}. Transient errors are retried; after {@code maxConsecutiveErrors} in a row
 * the task reports an error. When the total wait budget runs out while feedback is still pending
 * the task reports a delay instead; neither outcome touches the completed session record.
 */
@Component
public class FeedbackPoller {

    private static final Logger LOG = LogManager.getLogger(FeedbackPoller.class);

    private final BackendClient backend;
    private final ScheduledExecutorService scheduler;
    private final FeedbackPollingProperties props;

    public FeedbackPoller(BackendClient backend,
                          @Qualifier("sessionScheduler") ScheduledExecutorService scheduler,
                          FeedbackPollingProperties props) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Starts polling. The first request is issued immediately.
     *
     * @param sessionId backend session id
     * @param token     caller credential
     * @param listener  receives the final outcome
     * @return handle to cancel polling
     */
    public PollingTask start(String sessionId, AuthToken token, FeedbackListener listener) {
        PollingTask task = new PollingTask(this, sessionId, token, props.toBackoffPolicy(),
                props.getMaxConsecutiveErrors(), scheduler, listener);
        LOG.debug("Feedback polling started for session {}", sessionId);
        task.schedule(0);
        return task;
    }

    /**
     * Issues a single status request.
     *
     * <p>Transport and credential failures propagate as engine exceptions; a session that the
     * backend reports as cancelled or expired is an {@link PollResult.State#ERROR}.
     */
    public PollResult pollOnce(String sessionId, AuthToken token) {
        SessionRecord record = backend.fetchSession(sessionId, token);
        if (record.feedback() != null) {
            return PollResult.ready(record.feedback());
        }
        if (SessionStatus.fromBackend(record.status()) == SessionStatus.ABORTED) {
            return PollResult.error("backend reports session as " + record.status());
        }
        return PollResult.pending();
    }
}
