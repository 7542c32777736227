package com.sanctionsentinel.service.ledger;

import com.sanctionsentinel.core.model.CanonicalEntity;
import com.sanctionsentinel.core.model.ChangeEvent;
import com.sanctionsentinel.core.model.ContentSnapshot;
import com.sanctionsentinel.core.model.RunMetrics;
import com.sanctionsentinel.core.model.RunStatus;
import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.core.model.ScraperRun;
import com.sanctionsentinel.service.store.RunCommit;
import com.sanctionsentinel.service.store.SanctionsRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Lifecycle bookkeeping for scraper runs: at most one RUNNING run per source, and each run
 * reaches a terminal status exactly once.
 */
public class RunLedger {
    private static final Logger LOGGER = Logger.getLogger(RunLedger.class.getName());

    private final SanctionsRepository repository;
    private final Clock clock;
    private final Map<SanctionsSource, String> running = new ConcurrentHashMap<>();
    private final Map<String, RunMetrics> progress = new ConcurrentHashMap<>();
    private final Map<String, PendingFailure> abandoned = new ConcurrentHashMap<>();
    private final Object completionLock = new Object();

    public RunLedger(SanctionsRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public ScraperRun beginRun(SanctionsSource source) {
        Instant startedAt = clock.instant();
        while (repository.findRun(ScraperRun.runIdFor(source, startedAt)).isPresent()) {
            startedAt = startedAt.plusMillis(1);
        }
        ScraperRun run = ScraperRun.started(source, startedAt);
        String existing = running.putIfAbsent(source, run.runId());
        if (existing != null) {
            throw new ConflictException(source, existing);
        }
        try {
            repository.upsertRun(run);
        } catch (RuntimeException e) {
            running.remove(source, run.runId());
            throw e;
        }
        LOGGER.info(() -> "Started run " + run.runId() + " for " + source);
        return run;
    }

    /** Records a terminal status without touching entities; used for SKIPPED and FAILED runs. */
    public ScraperRun completeRun(String runId, RunStatus status, RunMetrics metrics, String errorMessage, int retryCount) {
        synchronized (completionLock) {
            ScraperRun done = prepareCompletion(runId, status, metrics, errorMessage, retryCount);
            repository.upsertRun(done);
            release(done);
            return done;
        }
    }

    /**
     * Completes a run and publishes its results in one repository commit. If the commit fails
     * the run stays RUNNING and nothing from it is visible.
     */
    public ScraperRun commitRun(
            String runId,
            RunStatus status,
            RunMetrics metrics,
            int retryCount,
            List<CanonicalEntity> entities,
            List<ChangeEvent> events,
            ContentSnapshot snapshot
    ) {
        if (status != RunStatus.SUCCESS && status != RunStatus.PARTIAL) {
            throw new InvalidStateException("Only successful runs commit results, got " + status);
        }
        synchronized (completionLock) {
            ScraperRun done = prepareCompletion(runId, status, metrics, null, retryCount);
            repository.commitRun(new RunCommit(done, entities, events, snapshot));
            release(done);
            return done;
        }
    }

    public ContentSnapshot recordSnapshot(SanctionsSource source, String contentHash, long sizeBytes, String runId,
                                          String archivePath) {
        return new ContentSnapshot(source, contentHash, sizeBytes, clock.instant(), runId, archivePath);
    }

    public Optional<ScraperRun> findRun(String runId) {
        return repository.findRun(runId);
    }

    public List<ScraperRun> recentRuns(SanctionsSource source, Instant since) {
        return repository.findRuns(source, since);
    }

    public boolean isRunning(SanctionsSource source) {
        return running.containsKey(source);
    }

    /** Remembers the metrics a run has reached so far; an expired run is failed with them. */
    public void recordProgress(String runId, RunMetrics metrics) {
        if (running.containsValue(runId)) {
            progress.put(runId, metrics);
        }
    }

    /**
     * Releases the source of a run whose FAILED status could not be written. The failure is kept
     * and written again by {@link #retryAbandonedRuns()}.
     */
    public void abandonRun(ScraperRun run, RunMetrics metrics, String errorMessage, int retryCount) {
        abandoned.put(run.runId(), new PendingFailure(metrics, errorMessage, retryCount));
        running.remove(run.source(), run.runId());
        progress.remove(run.runId());
        LOGGER.warning("Abandoned run " + run.runId() + " for " + run.source() + "; its FAILED status is pending");
    }

    public int abandonedCount() {
        return abandoned.size();
    }

    /**
     * Writes the FAILED status of abandoned runs. Runs that still cannot be written stay pending.
     *
     * @return the runs now recorded as FAILED
     */
    public List<ScraperRun> retryAbandonedRuns() {
        List<ScraperRun> failed = new ArrayList<>();
        for (Map.Entry<String, PendingFailure> entry : List.copyOf(abandoned.entrySet())) {
            String runId = entry.getKey();
            PendingFailure pending = entry.getValue();
            try {
                failed.add(completeRun(runId, RunStatus.FAILED, pending.metrics(), pending.errorMessage(),
                        pending.retryCount()));
                abandoned.remove(runId);
            } catch (InvalidStateException e) {
                abandoned.remove(runId);
                LOGGER.fine(() -> "Abandoned run " + runId + " no longer needs failing: " + e.getMessage());
            } catch (RuntimeException e) {
                LOGGER.warning("Still unable to record abandoned run " + runId + " as FAILED: " + e.getMessage());
            }
        }
        return failed;
    }

    /**
     * Fails every tracked RUNNING run older than {@code maxLifetime}.
     *
     * @return the runs that were expired, in their FAILED form
     */
    public List<ScraperRun> expireStaleRuns(Duration maxLifetime) {
        Instant cutoff = clock.instant().minus(maxLifetime);
        List<ScraperRun> expired = new ArrayList<>();
        for (String runId : List.copyOf(running.values())) {
            Optional<ScraperRun> run = repository.findRun(runId);
            if (run.isEmpty() || run.get().status() != RunStatus.RUNNING || !run.get().startedAt().isBefore(cutoff)) {
                continue;
            }
            try {
                expired.add(completeRun(runId, RunStatus.FAILED, progress.getOrDefault(runId, run.get().metrics()),
                        "run exceeded maximum lifetime of " + maxLifetime, run.get().retryCount()));
                LOGGER.warning("Expired run " + runId + " after exceeding " + maxLifetime);
            } catch (InvalidStateException e) {
                LOGGER.fine(() -> "Run " + runId + " completed while being expired: " + e.getMessage());
            }
        }
        return expired;
    }

    /**
     * Fails RUNNING runs persisted by a previous process; nothing in this process can finish them.
     */
    public List<ScraperRun> recoverInterruptedRuns() {
        List<ScraperRun> recovered = new ArrayList<>();
        for (ScraperRun run : repository.findRuns(null, Instant.EPOCH)) {
            if (run.status() != RunStatus.RUNNING || running.containsValue(run.runId())
                    || abandoned.containsKey(run.runId())) {
                continue;
            }
            ScraperRun failed = run.complete(clock.instant(), RunStatus.FAILED, run.metrics(),
                    "run interrupted by service restart", run.retryCount());
            repository.upsertRun(failed);
            recovered.add(failed);
            LOGGER.warning("Marked interrupted run " + run.runId() + " as FAILED");
        }
        return recovered;
    }

    private ScraperRun prepareCompletion(String runId, RunStatus status, RunMetrics metrics, String errorMessage,
                                         int retryCount) {
        if (!status.isTerminal()) {
            throw new InvalidStateException("Cannot complete run " + runId + " with non-terminal status " + status);
        }
        ScraperRun run = repository.findRun(runId)
                .orElseThrow(() -> new InvalidStateException("Unknown run " + runId));
        if (run.status() != RunStatus.RUNNING) {
            throw new InvalidStateException("Run " + runId + " already completed with status " + run.status());
        }
        return run.complete(clock.instant(), status, metrics, errorMessage, retryCount);
    }

    private void release(ScraperRun done) {
        running.remove(done.source(), done.runId());
        progress.remove(done.runId());
        LOGGER.info(() -> String.format("Run %s finished with %s after %d ms", done.runId(), done.status(),
                done.duration().toMillis()));
    }

    private record PendingFailure(RunMetrics metrics, String errorMessage, int retryCount) {
    }
}
