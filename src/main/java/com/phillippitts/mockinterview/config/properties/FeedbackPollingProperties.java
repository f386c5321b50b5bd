package com.phillippitts.mockinterview.config.properties;

import com.phillippitts.mockinterview.service.backend.BackoffPolicy;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for polling asynchronous feedback after completion.
 */
@ConfigurationProperties(prefix = "interview.feedback")
@Validated
public class FeedbackPollingProperties {

    @Positive
    private long initialIntervalMs = 3_000;

    /** Growth factor between polls; 1.0 polls at a fixed interval. */
    @DecimalMin("1.0")
    private double multiplier = 1.5;

    @Positive
    private long maxIntervalMs = 15_000;

    /** Total wait before surfacing a non-fatal "feedback delayed" outcome. */
    @Positive
    private long maxWaitMs = 180_000;

    /** Consecutive transport failures tolerated before the poller reports an error. */
    @Positive
    private int maxConsecutiveErrors = 5;

    public BackoffPolicy toBackoffPolicy() {
        return new BackoffPolicy(Duration.ofMillis(initialIntervalMs), multiplier,
                Duration.ofMillis(maxIntervalMs), Duration.ofMillis(maxWaitMs), 0);
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

    public long getMaxWaitMs() {
        return maxWaitMs;
    }

    public void setMaxWaitMs(long maxWaitMs) {
        this.maxWaitMs = maxWaitMs;
    }

    public int getMaxConsecutiveErrors() {
        return maxConsecutiveErrors;
    }

    public void setMaxConsecutiveErrors(int maxConsecutiveErrors) {
        this.maxConsecutiveErrors = maxConsecutiveErrors;
    }
}
