package com.phillippitts.mockinterview.service.preflight;

import com.phillippitts.mockinterview.domain.Capability;

import java.util.Objects;
import java.util.UUID;

/**
 * Probe backed by the client's own capability report (camera, microphone, environment).
 */
public class ReportedCapabilityProbe implements CapabilityProbe {

    private final Capability capability;
    private final DeviceCapabilityReports reports;

    public ReportedCapabilityProbe(Capability capability, DeviceCapabilityReports reports) {
        this.capability = Objects.requireNonNull(capability, "capability");
        this.reports = Objects.requireNonNull(reports, "reports");
    }

    @Override
    public Capability capability() {
        return capability;
    }

    @Override
    public CheckResult probe(UUID handle) {
        Boolean available = reports.lookup(handle, capability);
        if (available == null) {
            return CheckResult.failed(capability, "not reported by client");
        }
        return available ? CheckResult.success(capability) : CheckResult.failed(capability, "unavailable on device");
    }
}
