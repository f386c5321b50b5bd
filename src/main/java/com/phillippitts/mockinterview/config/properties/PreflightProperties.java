package com.phillippitts.mockinterview.config.properties;

import com.phillippitts.mockinterview.domain.Capability;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration properties for environment preflight checks.
 */
@ConfigurationProperties(prefix = "interview.preflight")
@Validated
public class PreflightProperties {

    /** Upper bound for a single capability probe; a probe that overruns counts as failed. */
    @Positive(message = "Check timeout must be positive")
    private long checkTimeoutMs = 5_000;

    /** Checks that must succeed before the interview may start. Others only degrade the session. */
    @NotNull
    private List<Capability> mandatoryChecks =
            List.of(Capability.CAMERA, Capability.NETWORK, Capability.ENVIRONMENT);

    public long getCheckTimeoutMs() {
        return checkTimeoutMs;
    }

    public void setCheckTimeoutMs(long checkTimeoutMs) {
        this.checkTimeoutMs = checkTimeoutMs;
    }

    public List<Capability> getMandatoryChecks() {
        return mandatoryChecks;
    }

    public void setMandatoryChecks(List<Capability> mandatoryChecks) {
        this.mandatoryChecks = mandatoryChecks == null ? List.of() : List.copyOf(mandatoryChecks);
    }

    public Set<Capability> mandatorySet() {
        return mandatoryChecks.isEmpty() ? EnumSet.noneOf(Capability.class) : EnumSet.copyOf(mandatoryChecks);
    }
}
