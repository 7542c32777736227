package com.sanctionsentinel.service.download;

import com.sanctionsentinel.core.model.SanctionsSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Enforces a minimum spacing between request starts for each source.
 */
public class SourceRateLimiter {
    private final Clock clock;
    private final Sleeper sleeper;
    private final Map<SanctionsSource, Object> monitors = new ConcurrentHashMap<>();
    private final Map<SanctionsSource, Instant> lastStart = new ConcurrentHashMap<>();

    public SourceRateLimiter(Clock clock, Sleeper sleeper) {
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until {@code minInterval} has passed since the previous request start for the
     * source, then records this start.
     *
     * @return how long the caller waited
     */
    public Duration acquire(SanctionsSource source, Duration minInterval) throws InterruptedException {
        Object monitor = monitors.computeIfAbsent(source, ignored -> new Object());
        synchronized (monitor) {
            Duration waited = Duration.ZERO;
            Instant now = clock.instant();
            Instant start = now;
            Instant previous = lastStart.get(source);
            if (previous != null && !minInterval.isZero()) {
                Instant earliest = previous.plus(minInterval);
                if (earliest.isAfter(now)) {
                    waited = Duration.between(now, earliest);
                    sleeper.sleep(waited);
                    start = earliest;
                }
            }
            lastStart.put(source, start);
            return waited;
        }
    }
}
