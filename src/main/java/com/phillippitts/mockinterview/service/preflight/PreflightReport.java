package com.phillippitts.mockinterview.service.preflight;

import com.phillippitts.mockinterview.domain.Capability;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Aggregated preflight state for a session. Immutable; retrying one check produces a new report
 * via {@link #with(CheckResult)} and leaves the other results untouched.
 *
 * @param results   latest result per capability
 * @param mandatory capabilities that gate the interview
 */
public record PreflightReport(Map<Capability, CheckResult> results, Set<Capability> mandatory) {

    public PreflightReport {
        Map<Capability, CheckResult> copy = new EnumMap<>(Capability.class);
        if (results != null) {
            copy.putAll(results);
        }
        results = Collections.unmodifiableMap(copy);
        mandatory = mandatory == null || mandatory.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Capability.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(mandatory));
    }

    public static PreflightReport pending(Set<Capability> mandatory) {
        Map<Capability, CheckResult> results = new EnumMap<>(Capability.class);
        for (Capability c : Capability.values()) {
            results.put(c, CheckResult.checking(c));
        }
        return new PreflightReport(results, mandatory);
    }

    public PreflightReport with(CheckResult result) {
        Map<Capability, CheckResult> next = new EnumMap<>(Capability.class);
        next.putAll(results);
        next.put(result.capability(), result);
        return new PreflightReport(next, mandatory);
    }

    public CheckStatus statusOf(Capability capability) {
        CheckResult r = results.get(capability);
        return r == null ? CheckStatus.CHECKING : r.status();
    }

    /**
     * {@code true} once every mandatory capability reports {@link CheckStatus#SUCCESS}.
     */
    public boolean allMandatoryChecksPassed() {
        for (Capability c : mandatory) {
            if (statusOf(c) != CheckStatus.SUCCESS) {
                return false;
            }
        }
        return true;
    }

    public Set<Capability> failedMandatory() {
        Set<Capability> failed = EnumSet.noneOf(Capability.class);
        for (Capability c : mandatory) {
            if (statusOf(c) != CheckStatus.SUCCESS) {
                failed.add(c);
            }
        }
        return failed;
    }

    /**
     * Optional capabilities that failed. The session may start but runs in degraded mode.
     */
    public Set<Capability> degraded() {
        Set<Capability> degraded = EnumSet.noneOf(Capability.class);
        results.forEach((c, r) -> {
            if (!mandatory.contains(c) && r.status() == CheckStatus.FAILED) {
                degraded.add(c);
            }
        });
        return degraded;
    }
}
