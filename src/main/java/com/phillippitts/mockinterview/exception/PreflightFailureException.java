package com.phillippitts.mockinterview.exception;

import com.phillippitts.mockinterview.domain.Capability;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Thrown when a session is asked to start while a mandatory capability check has not passed.
 * User-remediable by retrying the failed checks.
 */
public class PreflightFailureException extends MockInterviewException {

    private final Set<Capability> failedChecks;
    private final Map<Capability, String> checkStatuses;

    public PreflightFailureException(Set<Capability> failedChecks) {
        this(failedChecks, Map.of());
    }

    /**
     * @param failedChecks  mandatory checks that did not pass
     * @param checkStatuses status name per capability, for the client to render
     */
    public PreflightFailureException(Set<Capability> failedChecks, Map<Capability, String> checkStatuses) {
        super("Mandatory preflight checks not passed: " + failedChecks);
        this.failedChecks = Set.copyOf(failedChecks);
        Map<Capability, String> copy = new EnumMap<>(Capability.class);
        copy.putAll(checkStatuses);
        this.checkStatuses = Collections.unmodifiableMap(copy);
    }

    public Set<Capability> getFailedChecks() {
        return failedChecks;
    }

    public Map<Capability, String> getCheckStatuses() {
        return checkStatuses;
    }
}
