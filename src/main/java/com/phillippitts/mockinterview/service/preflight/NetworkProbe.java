package com.phillippitts.mockinterview.service.preflight;

import com.phillippitts.mockinterview.domain.Capability;
import com.phillippitts.mockinterview.service.backend.BackendClient;

import java.util.Objects;
import java.util.UUID;

/**
 * Network check: the backend must answer its health endpoint.
 */
public class NetworkProbe implements CapabilityProbe {

    private final BackendClient backend;

    public NetworkProbe(BackendClient backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
    }

    @Override
    public Capability capability() {
        return Capability.NETWORK;
    }

    @Override
    public CheckResult probe(UUID handle) {
        return backend.ping()
                ? CheckResult.success(Capability.NETWORK)
                : CheckResult.failed(Capability.NETWORK, "backend unreachable");
    }
}
