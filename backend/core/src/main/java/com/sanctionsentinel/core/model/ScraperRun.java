package com.sanctionsentinel.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record ScraperRun(
        String runId,
        SanctionsSource source,
        Instant startedAt,
        Instant completedAt,
        RunStatus status,
        RunMetrics metrics,
        String errorMessage,
        int retryCount
) {
    public ScraperRun {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(status, "status is required");
        metrics = metrics == null ? RunMetrics.empty() : metrics;
    }

    public static ScraperRun started(SanctionsSource source, Instant startedAt) {
        return new ScraperRun(runIdFor(source, startedAt), source, startedAt, null, RunStatus.RUNNING,
                RunMetrics.empty(), null, 0);
    }

    /** Deterministic idempotency key: one id per source and start instant. */
    public static String runIdFor(SanctionsSource source, Instant startedAt) {
        return source.name().toLowerCase(java.util.Locale.ROOT) + "_" + startedAt.toEpochMilli();
    }

    public ScraperRun complete(Instant finishedAt, RunStatus terminalStatus, RunMetrics finalMetrics,
                               String error, int retries) {
        return new ScraperRun(runId, source, startedAt, finishedAt, terminalStatus, finalMetrics, error, retries);
    }

    public Duration duration() {
        if (completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }
}
