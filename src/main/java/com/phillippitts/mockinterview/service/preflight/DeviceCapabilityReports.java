package com.phillippitts.mockinterview.service.preflight;

import com.phillippitts.mockinterview.domain.Capability;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest device capability reports from the candidate's client, per session.
 *
 * <p>Camera, microphone and environment access can only be observed on the client; the client
 * posts what it found and the matching probes read it here.
 */
@Component
public class DeviceCapabilityReports {

    private final Map<UUID, Map<Capability, Boolean>> reports = new ConcurrentHashMap<>();

    public void report(UUID handle, Capability capability, boolean available) {
        reports.computeIfAbsent(handle, h -> new ConcurrentHashMap<>()).put(capability, available);
    }

    /**
     * @return reported availability, or {@code null} if the client has not reported it
     */
    public Boolean lookup(UUID handle, Capability capability) {
        Map<Capability, Boolean> perSession = reports.get(handle);
        return perSession == null ? null : perSession.get(capability);
    }

    public Map<Capability, Boolean> snapshot(UUID handle) {
        Map<Capability, Boolean> perSession = reports.get(handle);
        Map<Capability, Boolean> copy = new EnumMap<>(Capability.class);
        if (perSession != null) {
            copy.putAll(perSession);
        }
        return copy;
    }

    public void forget(UUID handle) {
        reports.remove(handle);
    }
}
