package com.sanctionsentinel.core.events;

import com.sanctionsentinel.core.model.RunStage;
import com.sanctionsentinel.core.model.SanctionsSource;

import java.time.Instant;

public record RunStageChanged(
        Instant timestamp,
        SanctionsSource source,
        String runId,
        RunStage stage,
        String outcome
) implements Event {
    @Override
    public String type() {
        return "RunStageChanged";
    }

    public long timestampMs() {
        return timestamp.toEpochMilli();
    }
}
