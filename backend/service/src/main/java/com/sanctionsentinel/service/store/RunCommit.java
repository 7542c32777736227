package com.sanctionsentinel.service.store;

import com.sanctionsentinel.core.model.CanonicalEntity;
import com.sanctionsentinel.core.model.ChangeEvent;
import com.sanctionsentinel.core.model.ContentSnapshot;
import com.sanctionsentinel.core.model.ScraperRun;

import java.util.List;
import java.util.Objects;

public record RunCommit(
        ScraperRun run,
        List<CanonicalEntity> entities,
        List<ChangeEvent> events,
        ContentSnapshot snapshot
) {
    public RunCommit {
        Objects.requireNonNull(run, "run is required");
        Objects.requireNonNull(snapshot, "snapshot is required");
        entities = entities == null ? List.of() : List.copyOf(entities);
        events = events == null ? List.of() : List.copyOf(events);
        if (snapshot.source() != run.source()) {
            throw new IllegalArgumentException("Snapshot source " + snapshot.source() + " does not match run " + run.runId());
        }
        for (ChangeEvent event : events) {
            if (!run.runId().equals(event.runId())) {
                throw new IllegalArgumentException("Change event " + event.eventId() + " belongs to run " + event.runId());
            }
        }
    }
}
