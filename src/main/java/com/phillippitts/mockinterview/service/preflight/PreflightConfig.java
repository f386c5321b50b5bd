package com.phillippitts.mockinterview.service.preflight;

import com.phillippitts.mockinterview.domain.Capability;
import com.phillippitts.mockinterview.service.backend.BackendClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the default probe per capability.
 */
@Configuration
class PreflightConfig {

    @Bean
    CapabilityProbe cameraProbe(DeviceCapabilityReports reports) {
        return new ReportedCapabilityProbe(Capability.CAMERA, reports);
    }

    @Bean
    CapabilityProbe microphoneProbe(DeviceCapabilityReports reports) {
        return new ReportedCapabilityProbe(Capability.MICROPHONE, reports);
    }

    @Bean
    CapabilityProbe environmentProbe(DeviceCapabilityReports reports) {
        return new ReportedCapabilityProbe(Capability.ENVIRONMENT, reports);
    }

    @Bean
    CapabilityProbe networkProbe(BackendClient backend) {
        return new NetworkProbe(backend);
    }
}
