package com.phillippitts.mockinterview.service.health;

import com.phillippitts.mockinterview.service.backend.BackendClient;
import com.phillippitts.mockinterview.service.session.SessionRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BackendHealthIndicatorTest {

    private final BackendClient backend = mock(BackendClient.class);
    private final SessionRegistry registry = mock(SessionRegistry.class);
    private final BackendHealthIndicator indicator = new BackendHealthIndicator(backend, registry);

    @Test
    void upWhenBackendReachable() {
        when(backend.ping()).thenReturn(true);
        when(registry.activeCount()).thenReturn(3);
        when(registry.size()).thenReturn(5);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("backend", "reachable")
                .containsEntry("activeSessions", 3)
                .containsEntry("trackedSessions", 5);
    }

    @Test
    void degradedWhenUnreachableAndIdle() {
        when(backend.ping()).thenReturn(false);
        when(registry.activeCount()).thenReturn(0);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("backend", "unreachable");
    }

    @Test
    void downWhenUnreachableDuringInterviews() {
        when(backend.ping()).thenReturn(false);
        when(registry.activeCount()).thenReturn(1);

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }
}
