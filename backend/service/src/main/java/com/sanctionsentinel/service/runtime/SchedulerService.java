package com.sanctionsentinel.service.runtime;

import com.sanctionsentinel.core.bus.EventBus;
import com.sanctionsentinel.core.events.AlertRaised;
import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.core.model.ScraperRun;
import com.sanctionsentinel.service.ledger.ConflictException;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final List<ScheduledSource> sources;
    private final RunTrigger trigger;
    private final EventBus eventBus;
    private final Clock clock;
    private final Duration sweepInterval;
    private final long minIntervalMillis;
    private final List<MaintenanceTask> maintenanceTasks = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor();

    public SchedulerService(List<ScheduledSource> sources, RunTrigger trigger, EventBus eventBus, Clock clock,
                            Duration sweepInterval) {
        this(sources, trigger, eventBus, clock, sweepInterval, 100);
    }

    SchedulerService(List<ScheduledSource> sources, RunTrigger trigger, EventBus eventBus, Clock clock,
                     Duration sweepInterval, long minIntervalMillis) {
        this.sources = List.copyOf(sources);
        this.trigger = trigger;
        this.eventBus = eventBus;
        this.clock = clock;
        this.sweepInterval = sweepInterval;
        this.minIntervalMillis = minIntervalMillis;
    }

    public void start() {
        for (ScheduledSource scheduled : sources) {
            if (!scheduled.enabled()) {
                continue;
            }
            long intervalMillis = Math.max(minIntervalMillis, scheduled.interval().toMillis());
            timerExecutor.scheduleAtFixedRate(
                    () -> trigger(scheduled.source()),
                    0,
                    intervalMillis,
                    TimeUnit.MILLISECONDS
            );
        }
        long sweepMillis = Math.max(minIntervalMillis, sweepInterval.toMillis());
        timerExecutor.scheduleAtFixedRate(this::sweep, sweepMillis, sweepMillis, TimeUnit.MILLISECONDS);
        for (MaintenanceTask task : maintenanceTasks) {
            long intervalMillis = Math.max(minIntervalMillis, task.interval().toMillis());
            timerExecutor.scheduleAtFixedRate(() -> runMaintenance(task), 0, intervalMillis, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Registers a housekeeping job run once at {@link #start()} and then every {@code interval}.
     * Must be called before {@code start}.
     */
    public void scheduleMaintenance(String name, Duration interval, Runnable job) {
        maintenanceTasks.add(new MaintenanceTask(name, interval, job));
    }

    /**
     * Runs every enabled source once, in parallel, and waits for all of them.
     */
    public List<ScraperRun> runOnceAllSources() {
        List<ScheduledSource> enabled = sources.stream().filter(ScheduledSource::enabled).toList();
        if (enabled.isEmpty()) {
            return List.of();
        }
        ExecutorService pool = Executors.newFixedThreadPool(enabled.size());
        try {
            List<Callable<Optional<ScraperRun>>> tasks = new ArrayList<>();
            for (ScheduledSource scheduled : enabled) {
                tasks.add(() -> runAndWait(scheduled.source()));
            }
            List<ScraperRun> results = new ArrayList<>();
            for (Future<Optional<ScraperRun>> future : pool.invokeAll(tasks)) {
                future.get().ifPresent(results::add);
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Scheduled run failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    public void shutdown() {
        timerExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public List<ScheduledSource> scheduledSources() {
        return sources;
    }

    private void trigger(SanctionsSource source) {
        try {
            String runId = trigger.runSource(source, false);
            LOGGER.fine(() -> "Scheduled run " + runId + " for " + source);
        } catch (ConflictException e) {
            LOGGER.info(e.getMessage() + "; skipping scheduled trigger");
        } catch (RuntimeException e) {
            alert(source, e);
        }
    }

    private Optional<ScraperRun> runAndWait(SanctionsSource source) {
        try {
            return Optional.of(trigger.runSourceAndWait(source, false));
        } catch (ConflictException e) {
            LOGGER.info(e.getMessage() + "; skipping");
            return Optional.empty();
        } catch (RuntimeException e) {
            alert(source, e);
            return Optional.empty();
        }
    }

    private void sweep() {
        try {
            trigger.sweepStaleRuns();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Stale run sweep failed", e);
            eventBus.publish(new AlertRaised(clock.instant(), "scheduler",
                    "Stale run sweep failed: " + e.getMessage(), Map.of()));
        }
    }

    private void runMaintenance(MaintenanceTask task) {
        try {
            task.job().run();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Maintenance task " + task.name() + " failed", e);
            eventBus.publish(new AlertRaised(clock.instant(), "scheduler",
                    "Maintenance task " + task.name() + " failed: " + e.getMessage(), Map.of("task", task.name())));
        }
    }

    private void alert(SanctionsSource source, RuntimeException e) {
        LOGGER.log(Level.WARNING, "Scheduled run failed for " + source, e);
        eventBus.publish(new AlertRaised(
                clock.instant(),
                "scheduler",
                "Scheduled run failed: " + source + " - " + e.getMessage(),
                Map.of("source", source.name())
        ));
    }

    private record MaintenanceTask(String name, Duration interval, Runnable job) {
        MaintenanceTask {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(interval, "interval is required");
            Objects.requireNonNull(job, "job is required");
        }
    }

    public record ScheduledSource(SanctionsSource source, Duration interval, boolean enabled) {
        public ScheduledSource {
            Objects.requireNonNull(source, "source is required");
            Objects.requireNonNull(interval, "interval is required");
        }
    }
}
