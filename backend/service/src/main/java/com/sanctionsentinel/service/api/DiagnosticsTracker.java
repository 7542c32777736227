package com.sanctionsentinel.service.api;

import com.sanctionsentinel.core.bus.EventBus;
import com.sanctionsentinel.core.events.AlertRaised;
import com.sanctionsentinel.core.events.Event;
import com.sanctionsentinel.core.events.NotificationDelivered;
import com.sanctionsentinel.core.events.NotificationFailed;
import com.sanctionsentinel.core.events.RunCompleted;
import com.sanctionsentinel.core.events.RunStageChanged;
import com.sanctionsentinel.core.model.RunStage;
import com.sanctionsentinel.core.model.RunStatus;
import com.sanctionsentinel.service.store.EventCodec;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Folds bus events into the counters served by {@code /api/metrics}.
 */
public final class DiagnosticsTracker {
    private final Clock clock;
    private final EventBus eventBus;
    private final LongAdder eventsEmittedTotal = new LongAdder();
    private final LongAdder notificationsDelivered = new LongAdder();
    private final LongAdder notificationsFailed = new LongAdder();
    private final LongAdder alertsRaised = new LongAdder();
    private final ArrayDeque<Instant> recentEventTimestamps = new ArrayDeque<>();
    private final Object recentLock = new Object();
    private final ConcurrentHashMap<String, SourceDiagnostics> sourceStatuses = new ConcurrentHashMap<>();

    public DiagnosticsTracker(EventBus eventBus, Clock clock) {
        this(clock, eventBus);
        EventCodec.subscribeAll(eventBus, this::onAnyEvent);
        eventBus.subscribe(RunStageChanged.class, this::onStageChanged);
        eventBus.subscribe(RunCompleted.class, this::onRunCompleted);
        eventBus.subscribe(NotificationDelivered.class, event -> notificationsDelivered.increment());
        eventBus.subscribe(NotificationFailed.class, event -> notificationsFailed.increment());
        eventBus.subscribe(AlertRaised.class, this::onAlertRaised);
    }

    private DiagnosticsTracker(Clock clock, EventBus eventBus) {
        this.clock = clock;
        this.eventBus = eventBus;
    }

    public static DiagnosticsTracker empty() {
        return new DiagnosticsTracker(Clock.systemUTC(), null);
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("eventsEmittedTotal", eventsEmittedTotal.longValue());
        metrics.put("recentEventsPerMinute", recentEventsPerMinute());
        metrics.put("notificationsDelivered", notificationsDelivered.longValue());
        metrics.put("notificationsFailed", notificationsFailed.longValue());
        metrics.put("alertsRaised", alertsRaised.longValue());
        metrics.put("eventHandlerFailures", eventBus == null ? 0L : eventBus.handlerFailures());
        metrics.put("sources", sourcesSnapshot());
        return metrics;
    }

    public Map<String, Object> sourcesSnapshot() {
        Map<String, Object> sources = new TreeMap<>();
        for (Map.Entry<String, SourceDiagnostics> entry : sourceStatuses.entrySet()) {
            sources.put(entry.getKey(), entry.getValue().toMap());
        }
        return sources;
    }

    private void onAnyEvent(Event event) {
        eventsEmittedTotal.increment();
        Instant now = clock.instant();
        synchronized (recentLock) {
            recentEventTimestamps.addLast(now);
            trimOld(now);
        }
    }

    private int recentEventsPerMinute() {
        synchronized (recentLock) {
            trimOld(clock.instant());
            return recentEventTimestamps.size();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentEventTimestamps.isEmpty()) {
            Instant first = recentEventTimestamps.peekFirst();
            if (first != null && first.isBefore(threshold)) {
                recentEventTimestamps.removeFirst();
            } else {
                break;
            }
        }
    }

    private void onStageChanged(RunStageChanged event) {
        if (event.source() == null || event.stage() != RunStage.IDLE) {
            return;
        }
        sourceStatuses.compute(event.source().name(), (name, current) -> {
            SourceDiagnostics status = current == null ? SourceDiagnostics.empty() : current;
            return status.withStarted(event.runId(), event.timestamp());
        });
    }

    private void onRunCompleted(RunCompleted event) {
        if (event.source() == null) {
            return;
        }
        sourceStatuses.compute(event.source().name(), (name, current) -> {
            SourceDiagnostics status = current == null ? SourceDiagnostics.empty() : current;
            return status.withCompletion(event);
        });
    }

    private void onAlertRaised(AlertRaised event) {
        alertsRaised.increment();
        if (event.details() == null) {
            return;
        }
        Object source = event.details().get("source");
        if (!(source instanceof String sourceName) || sourceName.isBlank()) {
            return;
        }
        sourceStatuses.compute(sourceName, (name, current) -> {
            SourceDiagnostics status = current == null ? SourceDiagnostics.empty() : current;
            return status.withLastErrorMessage(event.message());
        });
    }

    private record SourceDiagnostics(
            String lastRunId,
            Instant lastRunAt,
            RunStatus lastStatus,
            Long lastDurationMillis,
            Integer lastChangeCount,
            String lastErrorMessage
    ) {
        private static SourceDiagnostics empty() {
            return new SourceDiagnostics(null, null, null, null, null, null);
        }

        private SourceDiagnostics withStarted(String runId, Instant startedAt) {
            return new SourceDiagnostics(runId, startedAt, RunStatus.RUNNING, lastDurationMillis, lastChangeCount,
                    lastErrorMessage);
        }

        private SourceDiagnostics withCompletion(RunCompleted event) {
            String error = event.status() == RunStatus.FAILED ? event.errorMessage() : null;
            return new SourceDiagnostics(event.runId(), lastRunAt, event.status(), event.durationMillis(),
                    event.changeCount(), error);
        }

        private SourceDiagnostics withLastErrorMessage(String message) {
            return new SourceDiagnostics(lastRunId, lastRunAt, lastStatus, lastDurationMillis, lastChangeCount, message);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("lastRunId", lastRunId);
            map.put("lastRunAt", lastRunAt == null ? null : lastRunAt.toString());
            map.put("lastStatus", lastStatus == null ? null : lastStatus.name());
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("lastChangeCount", lastChangeCount);
            map.put("lastErrorMessage", lastErrorMessage);
            return map;
        }
    }
}
