package com.phillippitts.mockinterview.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the session engine itself.
 */
@ConfigurationProperties(prefix = "interview.session")
@Validated
public class SessionProperties {

    /** Interval between countdown ticks, in milliseconds. One tick removes one second. */
    @Positive(message = "Tick interval must be positive")
    private long tickIntervalMs = 1000;

    /** Live (non-terminal) sessions allowed per bearer credential. */
    @Min(value = 1, message = "At least one active session per user is required")
    private int maxActiveSessionsPerUser = 1;

    /** Minutes a terminal session stays readable in the registry before eviction. */
    @Positive(message = "Retention minutes must be positive")
    private int retentionMinutes = 60;

    public long getTickIntervalMs() {
        return tickIntervalMs;
    }

    public void setTickIntervalMs(long tickIntervalMs) {
        this.tickIntervalMs = tickIntervalMs;
    }

    public int getMaxActiveSessionsPerUser() {
        return maxActiveSessionsPerUser;
    }

    public void setMaxActiveSessionsPerUser(int maxActiveSessionsPerUser) {
        this.maxActiveSessionsPerUser = maxActiveSessionsPerUser;
    }

    public int getRetentionMinutes() {
        return retentionMinutes;
    }

    public void setRetentionMinutes(int retentionMinutes) {
        this.retentionMinutes = retentionMinutes;
    }
}
