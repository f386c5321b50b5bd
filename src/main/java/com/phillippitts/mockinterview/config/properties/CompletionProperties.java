package com.phillippitts.mockinterview.config.properties;

import com.phillippitts.mockinterview.service.backend.BackoffPolicy;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Retry policy for submitting the final answer snapshot to the backend.
 */
@ConfigurationProperties(prefix = "interview.completion")
@Validated
public class CompletionProperties {

    @Positive
    private long initialIntervalMs = 1_000;

    @DecimalMin("1.0")
    private double multiplier = 2.0;

    @Positive
    private long maxIntervalMs = 30_000;

    /** Attempts before the submission is reported as failed; retries then continue at the max interval. */
    @Positive
    private int maxAttempts = 10;

    public BackoffPolicy toBackoffPolicy() {
        return new BackoffPolicy(Duration.ofMillis(initialIntervalMs), multiplier,
                Duration.ofMillis(maxIntervalMs), Duration.ZERO, maxAttempts);
    }

    public long getInitialIntervalMs() {
        return initialIntervalMs;
    }

    public void setInitialIntervalMs(long initialIntervalMs) {
        this.initialIntervalMs = initialIntervalMs;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public void setMultiplier(double multiplier) {
        this.multiplier = multiplier;
    }

    public long getMaxIntervalMs() {
        return maxIntervalMs;
    }

    public void setMaxIntervalMs(long maxIntervalMs) {
        this.maxIntervalMs = maxIntervalMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }
}
