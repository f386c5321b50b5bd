package com.phillippitts.mockinterview.service.session;

import com.phillippitts.mockinterview.config.properties.IntegrityProperties;
import com.phillippitts.mockinterview.config.properties.SessionProperties;
import com.phillippitts.mockinterview.service.integrity.ViolationSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Groups the collaborators every {@link SessionStateMachine} needs, for cleaner construction.
 */
@Component
public final class SessionDependencies {
    private final ScheduledExecutorService scheduler;
    private final ViolationSource violationSource;
    private final SessionProperties sessionProperties;
    private final IntegrityProperties integrityProperties;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    @Autowired
    public SessionDependencies(@Qualifier("sessionScheduler") ScheduledExecutorService scheduler,
                               ViolationSource violationSource,
                               SessionProperties sessionProperties,
                               IntegrityProperties integrityProperties,
                               ApplicationEventPublisher publisher) {
        this(scheduler, violationSource, sessionProperties, integrityProperties, publisher, Clock.systemUTC());
    }

    public SessionDependencies(ScheduledExecutorService scheduler,
                               ViolationSource violationSource,
                               SessionProperties sessionProperties,
                               IntegrityProperties integrityProperties,
                               ApplicationEventPublisher publisher,
                               Clock clock) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.violationSource = Objects.requireNonNull(violationSource, "violationSource");
        this.sessionProperties = Objects.requireNonNull(sessionProperties, "sessionProperties");
        this.integrityProperties = Objects.requireNonNull(integrityProperties, "integrityProperties");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ScheduledExecutorService getScheduler() {
        return scheduler;
    }

    public ViolationSource getViolationSource() {
        return violationSource;
    }

    public SessionProperties getSessionProperties() {
        return sessionProperties;
    }

    public IntegrityProperties getIntegrityProperties() {
        return integrityProperties;
    }

    public ApplicationEventPublisher getPublisher() {
        return publisher;
    }

    public Clock getClock() {
        return clock;
    }
}
