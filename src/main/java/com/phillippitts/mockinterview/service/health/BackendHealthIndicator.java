package com.phillippitts.mockinterview.service.health;

import com.phillippitts.mockinterview.service.backend.BackendClient;
import com.phillippitts.mockinterview.service.session.SessionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the interview backend.
 *
 * <ul>
 *   <li>UP: backend answers its health endpoint</li>
 *   <li>DEGRADED: backend unreachable but no interview is running, so nobody is affected yet</li>
 *   <li>DOWN: backend unreachable while interviews are running</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class BackendHealthIndicator implements HealthIndicator {

    private final BackendClient backend;
    private final SessionRegistry registry;

    public BackendHealthIndicator(BackendClient backend, SessionRegistry registry) {
        this.backend = backend;
        this.registry = registry;
    }

    @Override
    public Health health() {
        boolean reachable = backend.ping();
        int active = registry.activeCount();

        Health.Builder builder = new Health.Builder();
        if (reachable) {
            builder.up().withDetail("backend", "reachable");
        } else if (active == 0) {
            builder.status("DEGRADED").withDetail("backend", "unreachable");
        } else {
            builder.down().withDetail("backend", "unreachable");
        }
        return builder
                .withDetail("activeSessions", active)
                .withDetail("trackedSessions", registry.size())
                .build();
    }
}
