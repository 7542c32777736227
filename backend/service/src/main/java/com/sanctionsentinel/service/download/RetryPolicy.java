package com.sanctionsentinel.service.download;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with proportional jitter. {@code maxAttempts} counts the first attempt.
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, double jitterRatio) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Objects.requireNonNull(initialDelay, "initialDelay is required");
        Objects.requireNonNull(maxDelay, "maxDelay is required");
        if (jitterRatio < 0 || jitterRatio > 1) {
            throw new IllegalArgumentException("jitterRatio must be within [0, 1]");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(5, Duration.ofSeconds(2), Duration.ofMinutes(2), 0.2);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0);
    }

    /**
     * Delay before retry number {@code retry} (1 for the first retry). {@code random} yields
     * values in [0, 1).
     */
    public Duration delayBefore(int retry, DoubleSupplier random) {
        long base = initialDelay.toMillis();
        for (int i = 1; i < retry && base < maxDelay.toMillis(); i++) {
            base *= 2;
        }
        base = Math.min(base, maxDelay.toMillis());
        long jitter = Math.round(base * jitterRatio * (random.getAsDouble() * 2 - 1));
        return Duration.ofMillis(Math.max(0, Math.min(maxDelay.toMillis(), base + jitter)));
    }

    public Duration capped(Duration requested) {
        return requested.compareTo(maxDelay) > 0 ? maxDelay : requested;
    }
}
