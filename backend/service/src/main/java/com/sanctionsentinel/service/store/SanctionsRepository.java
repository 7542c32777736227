package com.sanctionsentinel.service.store;

import com.sanctionsentinel.core.model.CanonicalEntity;
import com.sanctionsentinel.core.model.ChangeEvent;
import com.sanctionsentinel.core.model.ContentSnapshot;
import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.core.model.ScraperRun;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence for the four logical tables: sanctioned entities, change events, scraper runs
 * and content snapshots. Implementations must make {@link #commitRun(RunCommit)} all-or-nothing.
 */
public interface SanctionsRepository {
    List<CanonicalEntity> getLatestEntities(SanctionsSource source);

    void replaceEntities(SanctionsSource source, List<CanonicalEntity> entities, String runId);

    Optional<ContentSnapshot> getLatestSnapshot(SanctionsSource source);

    void appendChangeEvents(List<ChangeEvent> events);

    void upsertRun(ScraperRun run);

    /** Atomically replaces the source's entities and records the events, snapshot and final run. */
    void commitRun(RunCommit commit);

    Optional<ScraperRun> findRun(String runId);

    /** Runs started at or after {@code since}, newest first; a null source means every source. */
    List<ScraperRun> findRuns(SanctionsSource source, Instant since);

    List<ChangeEvent> findChangeEvents(String runId);

    /**
     * Stamps delivery metadata on events that have not been stamped yet.
     *
     * @return number of events stamped
     */
    int markNotified(Collection<String> eventIds, Instant sentAt, Set<String> channels);

    /**
     * Deletes completed runs started before {@code cutoff} and snapshots captured before it. The
     * latest snapshot of each source, RUNNING runs and change events are never deleted.
     */
    PruneResult pruneBefore(Instant cutoff);
}
