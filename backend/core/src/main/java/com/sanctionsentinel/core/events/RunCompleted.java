package com.sanctionsentinel.core.events;

import com.sanctionsentinel.core.model.RunStatus;
import com.sanctionsentinel.core.model.SanctionsSource;

import java.time.Instant;

public record RunCompleted(
        Instant timestamp,
        SanctionsSource source,
        String runId,
        RunStatus status,
        long durationMillis,
        int changeCount,
        String errorMessage
) implements Event {
    @Override
    public String type() {
        return "RunCompleted";
    }
}
