package com.phillippitts.mockinterview.config.properties;

import com.phillippitts.mockinterview.domain.ViolationSeverity;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the integrity monitor and its escalation policy.
 */
@ConfigurationProperties(prefix = "interview.integrity")
@Validated
public class IntegrityProperties {

    /** Lower bound between two signal evaluations, in milliseconds. */
    @Positive(message = "Min interval must be positive")
    private long minIntervalMs = 2_000;

    /** Upper bound between two signal evaluations, in milliseconds. */
    @Positive(message = "Max interval must be positive")
    private long maxIntervalMs = 5_000;

    /** Escalation fires once the number of counted violations inside the window exceeds this value. */
    @Positive(message = "Escalation threshold must be positive")
    private int escalationThreshold = 5;

    /** Sliding window for escalation counting, in seconds. */
    @Positive(message = "Escalation window must be positive")
    private int escalationWindowSeconds = 300;

    /** Violations below this severity are logged but not counted towards escalation. */
    @NotNull
    private ViolationSeverity escalationMinSeverity = ViolationSeverity.WARNING;

    /** Abort the session when escalation fires. Off: escalation only flags for review. */
    private boolean terminateOnEscalation = false;

    public long getMinIntervalMs() {
        return minIntervalMs;
    }

    public void setMinIntervalMs(long minIntervalMs) {
        this.minIntervalMs = minIntervalMs;
    }

    public long getMaxIntervalMs() {
        return maxIntervalMs;
    }

    public void setMaxIntervalMs(long maxIntervalMs) {
        this.maxIntervalMs = maxIntervalMs;
    }

    public int getEscalationThreshold() {
        return escalationThreshold;
    }

    public void setEscalationThreshold(int escalationThreshold) {
        this.escalationThreshold = escalationThreshold;
    }

    public int getEscalationWindowSeconds() {
        return escalationWindowSeconds;
    }

    public void setEscalationWindowSeconds(int escalationWindowSeconds) {
        this.escalationWindowSeconds = escalationWindowSeconds;
    }

    public ViolationSeverity getEscalationMinSeverity() {
        return escalationMinSeverity;
    }

    public void setEscalationMinSeverity(ViolationSeverity escalationMinSeverity) {
        this.escalationMinSeverity = escalationMinSeverity;
    }

    public boolean isTerminateOnEscalation() {
        return terminateOnEscalation;
    }

    public void setTerminateOnEscalation(boolean terminateOnEscalation) {
        this.terminateOnEscalation = terminateOnEscalation;
    }
}
