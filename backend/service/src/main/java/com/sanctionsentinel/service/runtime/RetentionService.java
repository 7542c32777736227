package com.sanctionsentinel.service.runtime;

import com.sanctionsentinel.core.model.ContentSnapshot;
import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.service.store.EventStore;
import com.sanctionsentinel.service.store.PayloadArchive;
import com.sanctionsentinel.service.store.PruneResult;
import com.sanctionsentinel.service.store.SanctionsRepository;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Deletes run history, snapshots, archived payloads and pipeline events older than the retention
 * window. Entities, change events and the latest snapshot of each source are kept.
 */
public class RetentionService {
    private static final Logger LOGGER = Logger.getLogger(RetentionService.class.getName());

    private final SanctionsRepository repository;
    private final PayloadArchive archive;
    private final EventStore eventStore;
    private final Clock clock;
    private final Duration retention;

    public RetentionService(SanctionsRepository repository, PayloadArchive archive, EventStore eventStore, Clock clock,
                            Duration retention) {
        this.repository = repository;
        this.archive = archive;
        this.eventStore = eventStore;
        this.clock = clock;
        this.retention = Objects.requireNonNull(retention, "retention is required");
        if (retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be positive, got " + retention);
        }
    }

    public Report sweep() {
        Instant cutoff = clock.instant().minus(retention);
        PruneResult pruned = repository.pruneBefore(cutoff);
        int archivedFiles = archive.pruneBefore(cutoff, latestArchivePaths());
        int events = eventStore == null ? 0 : eventStore.pruneBefore(cutoff);
        Report report = new Report(cutoff, pruned.runsRemoved(), pruned.snapshotsRemoved(), archivedFiles, events);
        LOGGER.info("Retention sweep finished: " + report);
        return report;
    }

    private List<Path> latestArchivePaths() {
        List<Path> keep = new ArrayList<>();
        for (SanctionsSource source : SanctionsSource.values()) {
            repository.getLatestSnapshot(source)
                    .map(ContentSnapshot::archivePath)
                    .map(Path::of)
                    .ifPresent(keep::add);
        }
        return keep;
    }

    public record Report(Instant cutoff, int runsRemoved, int snapshotsRemoved, int archivedPayloadsRemoved,
                         int eventsRemoved) {
    }
}
