package com.phillippitts.mockinterview.service.backend;

import java.time.Duration;
import java.util.Objects;

/**
 * Explicit retry/poll pacing: exponential growth from an initial delay, capped per step, with
 * optional bounds on total wait and on attempt count.
 *
 * @param initialDelay delay before the second attempt
 * @param multiplier   growth factor per attempt (1.0 = fixed interval)
 * @param maxDelay     cap for a single delay
 * @param maxTotalWait total time budget; zero means unbounded
 * @param maxAttempts  attempt budget; zero or less means unbounded
 */
public record BackoffPolicy(
        Duration initialDelay,
        double multiplier,
        Duration maxDelay,
        Duration maxTotalWait,
        int maxAttempts
) {

    public BackoffPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive, got: " + initialDelay);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            maxDelay = initialDelay;
        }
        if (maxTotalWait == null || maxTotalWait.isNegative()) {
            maxTotalWait = Duration.ZERO;
        }
    }

    public static BackoffPolicy fixed(Duration interval, Duration maxTotalWait) {
        return new BackoffPolicy(interval, 1.0, interval, maxTotalWait, 0);
    }

    /**
     * Delay to wait after the given number of completed attempts.
     *
     * @param completedAttempts attempts already made (1 after the first)
     * @return delay before the next attempt
     */
    public Duration delayAfter(int completedAttempts) {
        int exponent = Math.max(0, completedAttempts - 1);
        double millis = initialDelay.toMillis() * Math.pow(multiplier, exponent);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    /**
     * Checks whether another attempt is allowed.
     *
     * @param completedAttempts attempts already made
     * @param elapsed           time since the first attempt
     * @return {@code true} when either budget is used up
     */
    public boolean isExhausted(int completedAttempts, Duration elapsed) {
        if (maxAttempts > 0 && completedAttempts >= maxAttempts) {
            return true;
        }
        return !maxTotalWait.isZero() && elapsed.compareTo(maxTotalWait) >= 0;
    }
}
