package com.sanctionsentinel.service.runtime;

import com.sanctionsentinel.core.bus.EventBus;
import com.sanctionsentinel.core.diff.ChangeDetector;
import com.sanctionsentinel.core.diff.DetectionSummary;
import com.sanctionsentinel.core.events.AlertRaised;
import com.sanctionsentinel.core.events.ChangesDetected;
import com.sanctionsentinel.core.events.RunCompleted;
import com.sanctionsentinel.core.events.RunStageChanged;
import com.sanctionsentinel.core.model.CanonicalEntity;
import com.sanctionsentinel.core.model.ChangeEvent;
import com.sanctionsentinel.core.model.ContentSnapshot;
import com.sanctionsentinel.core.model.RunMetrics;
import com.sanctionsentinel.core.model.RunStage;
import com.sanctionsentinel.core.model.RunStatus;
import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.core.model.ScraperRun;
import com.sanctionsentinel.core.risk.RiskClassifier;
import com.sanctionsentinel.service.dedup.ContentDeduplicator;
import com.sanctionsentinel.service.download.DownloadException;
import com.sanctionsentinel.service.download.DownloadResult;
import com.sanctionsentinel.service.download.Downloader;
import com.sanctionsentinel.service.ledger.ConflictException;
import com.sanctionsentinel.service.ledger.InvalidStateException;
import com.sanctionsentinel.service.ledger.RunLedger;
import com.sanctionsentinel.service.notify.NotificationDispatcher;
import com.sanctionsentinel.service.store.PayloadArchive;
import com.sanctionsentinel.service.store.SanctionsRepository;
import com.sanctionsentinel.sources.api.ParseException;
import com.sanctionsentinel.sources.api.ParseResult;
import com.sanctionsentinel.sources.api.SourceAdapter;
import com.sanctionsentinel.sources.api.SourceRegistry;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives one run per source through download, deduplication, parsing, diffing, classification,
 * persistence and notification. Stages are strictly sequential; each transition is published as
 * a {@link RunStageChanged} event.
 */
public class Orchestrator implements RunTrigger {
    private static final Logger LOGGER = Logger.getLogger(Orchestrator.class.getName());
    private static final String SHUTDOWN_REASON = "service shutting down";
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    private final SourceRegistry registry;
    private final Downloader downloader;
    private final ContentDeduplicator deduplicator;
    private final ChangeDetector detector;
    private final RiskClassifier classifier;
    private final RunLedger ledger;
    private final SanctionsRepository repository;
    private final NotificationDispatcher dispatcher;
    private final PayloadArchive archive;
    private final EventBus eventBus;
    private final Clock clock;
    private final OrchestratorSettings settings;
    private final ExecutorService workers;
    private final Map<SanctionsSource, RunHandle> handles = new ConcurrentHashMap<>();
    private volatile boolean shuttingDown;

    public Orchestrator(
            SourceRegistry registry,
            Downloader downloader,
            ContentDeduplicator deduplicator,
            ChangeDetector detector,
            RiskClassifier classifier,
            RunLedger ledger,
            SanctionsRepository repository,
            NotificationDispatcher dispatcher,
            PayloadArchive archive,
            EventBus eventBus,
            Clock clock,
            OrchestratorSettings settings
    ) {
        this.registry = registry;
        this.downloader = downloader;
        this.deduplicator = deduplicator;
        this.detector = detector;
        this.classifier = classifier;
        this.ledger = ledger;
        this.repository = repository;
        this.dispatcher = dispatcher;
        this.archive = archive;
        this.eventBus = eventBus;
        this.clock = clock;
        this.settings = settings;
        AtomicInteger threadCounter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(settings.workerThreads(), runnable -> {
            Thread thread = new Thread(runnable, "sanctions-run-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public String runSource(SanctionsSource source, boolean forceRefresh) {
        SourceAdapter adapter = registry.require(source);
        RunHandle handle = acquire(source);
        ScraperRun run = begin(source, handle);
        try {
            workers.submit(() -> execute(run, adapter, forceRefresh, handle));
        } catch (RejectedExecutionException e) {
            fail(run, RunMetrics.empty(), 0, "run rejected: worker pool is shut down", handle);
            throw new IllegalStateException("Worker pool is shut down", e);
        }
        return run.runId();
    }

    @Override
    public ScraperRun runSourceAndWait(SanctionsSource source, boolean forceRefresh) {
        SourceAdapter adapter = registry.require(source);
        RunHandle handle = acquire(source);
        ScraperRun run = begin(source, handle);
        execute(run, adapter, forceRefresh, handle);
        return ledger.findRun(run.runId()).orElse(run);
    }

    @Override
    public void sweepStaleRuns() {
        for (ScraperRun expired : ledger.expireStaleRuns(settings.maxRunLifetime())) {
            RunHandle handle = handles.get(expired.source());
            if (handle != null && expired.runId().equals(handle.runId)) {
                handle.abort("exceeded maximum lifetime of " + settings.maxRunLifetime());
                handles.remove(expired.source(), handle);
            }
            publishStage(expired, RunStage.FAILED, expired.errorMessage());
            eventBus.publish(new RunCompleted(clock.instant(), expired.source(), expired.runId(), RunStatus.FAILED,
                    expired.duration().toMillis(), 0, expired.errorMessage()));
            eventBus.publish(new AlertRaised(clock.instant(), "run_expired",
                    "Run " + expired.runId() + " exceeded its maximum lifetime",
                    Map.of("source", expired.source().name(), "runId", expired.runId())));
        }
        for (ScraperRun recorded : ledger.retryAbandonedRuns()) {
            LOGGER.info(() -> "Recorded abandoned run " + recorded.runId() + " as FAILED");
            finish(recorded, RunStage.FAILED, recorded.errorMessage());
        }
    }

    public Optional<ScraperRun> getRunStatus(String runId) {
        return ledger.findRun(runId);
    }

    public SourceStatus getSourceStatus(SanctionsSource source, int windowHours) {
        Instant windowStart = clock.instant().minus(Duration.ofHours(Math.max(1, windowHours)));
        List<ScraperRun> runs = ledger.recentRuns(source, windowStart);
        Map<RunStatus, Integer> byStatus = new EnumMap<>(RunStatus.class);
        int totalChanges = 0;
        for (ScraperRun run : runs) {
            byStatus.merge(run.status(), 1, Integer::sum);
            totalChanges += run.metrics().totalChanges();
        }
        ScraperRun lastRun = runs.isEmpty() ? null : runs.get(0);
        ScraperRun lastSuccessful = runs.stream()
                .filter(run -> run.status() == RunStatus.SUCCESS || run.status() == RunStatus.PARTIAL)
                .findFirst()
                .orElse(null);
        boolean running = handles.containsKey(source) || ledger.isRunning(source);
        return new SourceStatus(source, windowStart, running, byStatus, lastRun, lastSuccessful, totalChanges,
                repository.getLatestEntities(source).size());
    }

    public boolean isRunning(SanctionsSource source) {
        return handles.containsKey(source);
    }

    public void shutdown() {
        shutdown(SHUTDOWN_GRACE);
    }

    /**
     * Aborts in-flight and queued runs and stops the worker pool. Workers get {@code grace} to
     * reach an abort point before they are interrupted; every run still unfinished afterwards is
     * recorded as FAILED.
     */
    public void shutdown(Duration grace) {
        shuttingDown = true;
        handles.values().forEach(handle -> handle.abort(SHUTDOWN_REASON));
        workers.shutdown();
        try {
            if (!workers.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = workers.shutdownNow();
                LOGGER.warning("Interrupted run workers; " + dropped.size() + " queued runs never started");
                if (!workers.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    LOGGER.warning("Run workers still busy after interrupt");
                }
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            failUnfinished();
        }
    }

    private void failUnfinished() {
        for (RunHandle handle : List.copyOf(handles.values())) {
            ScraperRun run = handle.run;
            if (run != null) {
                fail(run, handle.progress, 0, "run aborted: " + SHUTDOWN_REASON, handle);
            }
        }
    }

    private RunHandle acquire(SanctionsSource source) {
        if (shuttingDown) {
            throw new IllegalStateException("Orchestrator is shutting down");
        }
        RunHandle handle = new RunHandle();
        RunHandle existing = handles.putIfAbsent(source, handle);
        if (existing != null) {
            throw new ConflictException(source, existing.runId);
        }
        return handle;
    }

    private ScraperRun begin(SanctionsSource source, RunHandle handle) {
        try {
            ScraperRun run = ledger.beginRun(source);
            handle.runId = run.runId();
            handle.run = run;
            publishStage(run, RunStage.IDLE, "started");
            return run;
        } catch (RuntimeException e) {
            handles.remove(source, handle);
            throw e;
        }
    }

    private void execute(ScraperRun run, SourceAdapter adapter, boolean forceRefresh, RunHandle handle) {
        MetricsBuilder metrics = new MetricsBuilder();
        int retries = 0;
        try {
            checkAbort(handle);
            publishStage(run, RunStage.DOWNLOADING, "started");
            long downloadStart = System.nanoTime();
            DownloadResult download = downloader.fetch(adapter.fetchConfig());
            metrics.downloadMillis = elapsedMillis(downloadStart);
            metrics.sizeBytes = download.sizeBytes();
            retries = download.retryCount();
            checkpoint(run, handle, metrics);

            publishStage(run, RunStage.DEDUPLICATING, "started");
            String digest = deduplicator.digest(download.body());
            metrics.contentHash = digest;
            if (!forceRefresh && deduplicator.shouldSkip(run.source(), digest)) {
                ScraperRun skipped = ledger.completeRun(run.runId(), RunStatus.SKIPPED, metrics.build(), null, retries);
                finish(skipped, RunStage.SKIPPED, "content unchanged");
                return;
            }
            Optional<Path> archived = archive.store(run.source(), run.runId(), download.body());
            checkpoint(run, handle, metrics);

            publishStage(run, RunStage.PARSING, "started");
            long parseStart = System.nanoTime();
            ParseResult parsed = adapter.parse(download.body());
            metrics.parseMillis = elapsedMillis(parseStart);
            metrics.recordsSkipped = parsed.recordsSkipped();
            if (parsed.entities().isEmpty()) {
                throw ParseException.format("payload contained no usable entities ("
                        + parsed.recordsSkipped() + " records skipped)");
            }
            parsed.recordErrors().forEach(error -> LOGGER.warning("Skipped record in run " + run.runId() + ": "
                    + error.recordRef() + " " + error.field() + " - " + error.reason()));
            List<CanonicalEntity> entities = parsed.entities().stream()
                    .map(entity -> entity.withLastSeen(run.startedAt()))
                    .toList();
            metrics.entitiesProcessed = entities.size();
            checkpoint(run, handle, metrics);

            publishStage(run, RunStage.DIFFING, "started");
            long diffStart = System.nanoTime();
            boolean baseline = repository.getLatestSnapshot(run.source()).isEmpty();
            List<CanonicalEntity> previous = repository.getLatestEntities(run.source());
            List<ChangeEvent> detected = detector.detectChanges(previous, entities, run.runId(), clock.instant());
            metrics.diffMillis = elapsedMillis(diffStart);
            checkpoint(run, handle, metrics);

            publishStage(run, RunStage.CLASSIFYING, "started");
            List<ChangeEvent> classified = classifier.classifyAll(detected);
            DetectionSummary summary = DetectionSummary.of(classified);
            metrics.apply(summary);
            checkpoint(run, handle, metrics);

            publishStage(run, RunStage.PERSISTING, "started");
            long storeStart = System.nanoTime();
            ContentSnapshot snapshot = ledger.recordSnapshot(run.source(), digest, download.sizeBytes(), run.runId(),
                    archived.map(Path::toString).orElse(null));
            RunStatus status = parsed.hasRecordErrors() ? RunStatus.PARTIAL : RunStatus.SUCCESS;
            metrics.storeMillis = elapsedMillis(storeStart);
            ScraperRun committed = ledger.commitRun(run.runId(), status, metrics.build(), retries, entities,
                    classified, snapshot);
            eventBus.publish(new ChangesDetected(clock.instant(), run.source(), run.runId(),
                    summary.added(), summary.modified(), summary.removed()));

            publishStage(run, RunStage.NOTIFYING, "started");
            notifyChanges(committed, classified, baseline);
            finish(committed, RunStage.COMPLETED, status.name().toLowerCase(java.util.Locale.ROOT));
        } catch (DownloadException e) {
            fail(run, metrics.build(), e.retryCount(), "download failed: " + e.getMessage(), handle);
        } catch (ParseException e) {
            fail(run, metrics.build(), retries, "parse failed: " + e.getMessage(), handle);
        } catch (RunAbortedException e) {
            fail(run, metrics.build(), retries, e.getMessage(), handle);
        } catch (RuntimeException e) {
            String reason = handle.abortReason;
            if (reason != null) {
                LOGGER.log(Level.FINE, "Run " + run.runId() + " interrupted while aborting", e);
                fail(run, metrics.build(), retries, "run aborted: " + reason, handle);
            } else {
                LOGGER.log(Level.SEVERE, "Run " + run.runId() + " failed unexpectedly", e);
                fail(run, metrics.build(), retries, e.getClass().getSimpleName() + ": " + e.getMessage(), handle);
            }
        } finally {
            handles.remove(run.source(), handle);
        }
    }

    private void notifyChanges(ScraperRun run, List<ChangeEvent> events, boolean baseline) {
        if (events.isEmpty()) {
            return;
        }
        if (baseline && settings.suppressBaselineNotifications()) {
            LOGGER.info(() -> "Baseline run " + run.runId() + " recorded " + events.size()
                    + " changes without notifying");
            return;
        }
        try {
            dispatcher.dispatch(events);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Notification dispatch failed for run " + run.runId(), e);
            eventBus.publish(new AlertRaised(clock.instant(), "notification",
                    "Notification dispatch failed for run " + run.runId() + ": " + e.getMessage(),
                    Map.of("source", run.source().name(), "runId", run.runId())));
        }
    }

    /**
     * Records the run as FAILED and raises an alert. A run already completed elsewhere, by the
     * stale-run sweep or a concurrent shutdown, is left alone.
     */
    private void fail(ScraperRun run, RunMetrics metrics, int retries, String error, RunHandle handle) {
        LOGGER.warning("Run " + run.runId() + " for " + run.source() + " failed: " + error);
        try {
            ScraperRun failed = ledger.completeRun(run.runId(), RunStatus.FAILED, metrics, error, retries);
            finish(failed, RunStage.FAILED, error);
        } catch (InvalidStateException e) {
            LOGGER.info(() -> "Run " + run.runId() + " was already completed elsewhere: " + e.getMessage());
            return;
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Unable to record run " + run.runId() + " as FAILED", e);
            ledger.abandonRun(run, metrics, error, retries);
            publishStage(run, RunStage.FAILED, error);
        } finally {
            handles.remove(run.source(), handle);
        }
        eventBus.publish(new AlertRaised(clock.instant(), "run_failed", "Run " + run.runId() + " failed: " + error,
                Map.of("source", run.source().name(), "runId", run.runId())));
    }

    private void finish(ScraperRun done, RunStage stage, String outcome) {
        publishStage(done, stage, outcome);
        eventBus.publish(new RunCompleted(clock.instant(), done.source(), done.runId(), done.status(),
                done.duration().toMillis(), done.metrics().totalChanges(), done.errorMessage()));
    }

    private void publishStage(ScraperRun run, RunStage stage, String outcome) {
        eventBus.publish(new RunStageChanged(clock.instant(), run.source(), run.runId(), stage, outcome));
    }

    private void checkpoint(ScraperRun run, RunHandle handle, MetricsBuilder metrics) {
        RunMetrics reached = metrics.build();
        handle.progress = reached;
        ledger.recordProgress(run.runId(), reached);
        checkAbort(handle);
    }

    private void checkAbort(RunHandle handle) {
        String reason = handle.abortReason;
        if (reason != null) {
            throw new RunAbortedException(reason);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static final class RunHandle {
        private volatile String runId;
        private volatile ScraperRun run;
        private volatile RunMetrics progress = RunMetrics.empty();
        private volatile String abortReason;

        void abort(String reason) {
            if (abortReason == null) {
                abortReason = reason;
            }
        }
    }

    private static final class MetricsBuilder {
        private int entitiesProcessed;
        private int recordsSkipped;
        private DetectionSummary summary = new DetectionSummary(0, 0, 0, 0, 0, 0, 0);
        private long downloadMillis;
        private long parseMillis;
        private long diffMillis;
        private long storeMillis;
        private String contentHash;
        private long sizeBytes;

        void apply(DetectionSummary detection) {
            this.summary = detection;
        }

        RunMetrics build() {
            return new RunMetrics(entitiesProcessed, summary.added(), summary.modified(), summary.removed(),
                    recordsSkipped, summary.critical(), summary.high(), summary.medium(), summary.low(),
                    downloadMillis, parseMillis, diffMillis, storeMillis, contentHash, sizeBytes);
        }
    }
}
