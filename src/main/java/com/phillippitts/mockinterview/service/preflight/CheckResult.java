package com.phillippitts.mockinterview.service.preflight;

import com.phillippitts.mockinterview.domain.Capability;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of a single capability probe.
 *
 * @param capability probed capability
 * @param status     probe status
 * @param detail     short reason on failure, {@code null} otherwise
 * @param checkedAt  when the status was determined
 */
public record CheckResult(Capability capability, CheckStatus status, String detail, Instant checkedAt) {

    public CheckResult {
        Objects.requireNonNull(capability, "capability must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (checkedAt == null) {
            checkedAt = Instant.now();
        }
    }

    public static CheckResult checking(Capability capability) {
        return new CheckResult(capability, CheckStatus.CHECKING, null, Instant.now());
    }

    public static CheckResult success(Capability capability) {
        return new CheckResult(capability, CheckStatus.SUCCESS, null, Instant.now());
    }

    public static CheckResult failed(Capability capability, String detail) {
        return new CheckResult(capability, CheckStatus.FAILED, detail, Instant.now());
    }

    public boolean passed() {
        return status == CheckStatus.SUCCESS;
    }
}
