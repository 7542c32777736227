package com.sanctionsentinel.core.events;

import com.sanctionsentinel.core.model.SanctionsSource;

import java.time.Instant;

public record ChangesDetected(
        Instant timestamp,
        SanctionsSource source,
        String runId,
        int added,
        int modified,
        int removed
) implements Event {
    @Override
    public String type() {
        return "ChangesDetected";
    }
}
