package com.phillippitts.mockinterview.service.preflight;

import com.phillippitts.mockinterview.domain.Capability;

import java.util.UUID;

/**
 * Independent pass/fail probe of one environment capability.
 *
 * <p>Implementations must not depend on other probes' outcomes. They may block; the checker
 * runs them concurrently and bounds each with a timeout.
 */
public interface CapabilityProbe {

    Capability capability();

    /**
     * Probes the capability for the given session.
     *
     * @param handle engine session handle
     * @return result with {@link CheckStatus#SUCCESS} or {@link CheckStatus#FAILED}
     */
    CheckResult probe(UUID handle);
}
