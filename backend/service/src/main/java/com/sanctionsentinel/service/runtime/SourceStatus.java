package com.sanctionsentinel.service.runtime;

import com.sanctionsentinel.core.model.RunStatus;
import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.core.model.ScraperRun;

import java.time.Instant;
import java.util.Map;

public record SourceStatus(
        SanctionsSource source,
        Instant windowStart,
        boolean running,
        Map<RunStatus, Integer> runsByStatus,
        ScraperRun lastRun,
        ScraperRun lastSuccessfulRun,
        int totalChanges,
        int entityCount
) {
    public SourceStatus {
        runsByStatus = runsByStatus == null ? Map.of() : Map.copyOf(runsByStatus);
    }
}
