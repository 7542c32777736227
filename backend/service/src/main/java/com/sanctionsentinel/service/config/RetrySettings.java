package com.sanctionsentinel.service.config;

import com.sanctionsentinel.service.download.RetryPolicy;

import java.time.Duration;

public record RetrySettings(int maxAttempts, long initialDelayMillis, long maxDelayMillis, double jitterRatio) {
    public RetrySettings {
        RetryPolicy defaults = RetryPolicy.defaults();
        maxAttempts = maxAttempts <= 0 ? defaults.maxAttempts() : maxAttempts;
        initialDelayMillis = initialDelayMillis <= 0 ? defaults.initialDelay().toMillis() : initialDelayMillis;
        maxDelayMillis = maxDelayMillis <= 0 ? defaults.maxDelay().toMillis() : maxDelayMillis;
        jitterRatio = jitterRatio < 0 || jitterRatio > 1 ? defaults.jitterRatio() : jitterRatio;
    }

    public static RetrySettings defaults() {
        return new RetrySettings(0, 0, 0, RetryPolicy.defaults().jitterRatio());
    }

    public RetryPolicy toPolicy() {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(initialDelayMillis), Duration.ofMillis(maxDelayMillis),
                jitterRatio);
    }
}
