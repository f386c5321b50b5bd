package com.phillippitts.mockinterview.service.preflight;

import com.phillippitts.mockinterview.domain.Capability;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class PreflightReportTest {

    private static final EnumSet<Capability> MANDATORY =
            EnumSet.of(Capability.CAMERA, Capability.NETWORK, Capability.ENVIRONMENT);

    @Test
    void pendingReportHasEveryCheckChecking() {
        PreflightReport report = PreflightReport.pending(MANDATORY);

        assertThat(report.results().values()).allMatch(r -> r.status() == CheckStatus.CHECKING);
        assertThat(report.allMandatoryChecksPassed()).isFalse();
        assertThat(report.degraded()).isEmpty();
    }

    @Test
    void withReplacesOnlyOneResult() {
        PreflightReport report = PreflightReport.pending(MANDATORY)
                .with(CheckResult.success(Capability.CAMERA))
                .with(CheckResult.success(Capability.NETWORK));

        PreflightReport next = report.with(CheckResult.failed(Capability.MICROPHONE, "denied"));

        assertThat(next.statusOf(Capability.CAMERA)).isEqualTo(CheckStatus.SUCCESS);
        assertThat(next.statusOf(Capability.ENVIRONMENT)).isEqualTo(CheckStatus.CHECKING);
        assertThat(next.failedMandatory()).containsExactly(Capability.ENVIRONMENT);
        assertThat(next.degraded()).containsExactly(Capability.MICROPHONE);
        // original is immutable
        assertThat(report.statusOf(Capability.MICROPHONE)).isEqualTo(CheckStatus.CHECKING);
    }

    @Test
    void passesOnceAllMandatorySucceed() {
        PreflightReport report = PreflightReport.pending(MANDATORY)
                .with(CheckResult.success(Capability.CAMERA))
                .with(CheckResult.success(Capability.NETWORK))
                .with(CheckResult.success(Capability.ENVIRONMENT));

        assertThat(report.allMandatoryChecksPassed()).isTrue();
        assertThat(report.failedMandatory()).isEmpty();
    }
}
