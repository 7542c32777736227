package com.sanctionsentinel.service.notify;

import com.sanctionsentinel.core.bus.EventBus;
import com.sanctionsentinel.core.events.NotificationDelivered;
import com.sanctionsentinel.core.events.NotificationFailed;
import com.sanctionsentinel.core.model.ChangeEvent;
import com.sanctionsentinel.core.model.ChangeType;
import com.sanctionsentinel.core.model.ContentSnapshot;
import com.sanctionsentinel.core.model.RiskLevel;
import com.sanctionsentinel.core.model.RunStatus;
import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.core.model.ScraperRun;
import com.sanctionsentinel.service.download.RetryPolicy;
import com.sanctionsentinel.service.store.InMemorySanctionsRepository;
import com.sanctionsentinel.service.store.RunCommit;
import com.sanctionsentinel.service.support.EventCapture;
import com.sanctionsentinel.service.support.MutableClock;
import com.sanctionsentinel.service.support.RecordingChannel;
import com.sanctionsentinel.service.support.RecordingSleeper;
import com.sanctionsentinel.service.support.TestEntities;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationDispatcherTest {
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final RetryPolicy RETRY = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(1), 0);

    private final MutableClock clock = new MutableClock(T0);
    private final EventBus bus = new EventBus();
    private final EventCapture capture = new EventCapture(bus);
    private final InMemorySanctionsRepository repository = new InMemorySanctionsRepository();
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final ScraperRun run = ScraperRun.started(SanctionsSource.OFAC, T0);

    @Test
    void criticalEventsGoOutImmediatelyOthersWaitForFlush() {
        RecordingChannel channel = new RecordingChannel("log");
        NotificationDispatcher dispatcher = dispatcher(List.of(channel));
        List<ChangeEvent> events = persist(
                TestEntities.event("c1", run.runId(), ChangeType.REMOVED, RiskLevel.CRITICAL),
                TestEntities.event("h1", run.runId(), ChangeType.ADDED, RiskLevel.HIGH),
                TestEntities.event("l1", run.runId(), ChangeType.MODIFIED, RiskLevel.LOW),
                TestEntities.event("h2", run.runId(), ChangeType.ADDED, RiskLevel.HIGH));

        List<NotificationDispatcher.DeliveryOutcome> immediate = dispatcher.dispatch(events);

        assertEquals(1, immediate.size());
        assertEquals(List.of("c1"), immediate.get(0).eventIds());
        assertEquals(1, channel.delivered().size());
        assertEquals(2, dispatcher.pending(RiskLevel.HIGH));
        assertEquals(1, dispatcher.pending(RiskLevel.LOW));
        assertNull(stored("h1").notificationSentAt());

        List<NotificationDispatcher.DeliveryOutcome> digests = dispatcher.flush();

        assertEquals(2, digests.size());
        assertEquals(RiskLevel.HIGH, digests.get(0).riskLevel());
        assertEquals(RiskLevel.LOW, digests.get(1).riskLevel());
        assertEquals(3, channel.delivered().size());
        assertEquals(0, dispatcher.pending(RiskLevel.HIGH));
        assertEquals(Set.of("log"), stored("h2").notificationChannels());
        assertEquals(T0, stored("c1").notificationSentAt());
    }

    @Test
    void retryableFailuresAreRetriedWithBackoff() {
        RecordingChannel flaky = new RecordingChannel("webhook")
                .failNext(new NotificationException("HTTP 503", true))
                .failNext(new NotificationException("HTTP 503", true));
        NotificationDispatcher dispatcher = dispatcher(List.of(flaky));

        dispatcher.dispatch(persist(TestEntities.event("c1", run.runId(), ChangeType.REMOVED, RiskLevel.CRITICAL)));

        assertEquals(3, flaky.attempts());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeper.sleeps());
        NotificationDelivered delivered = capture.of(NotificationDelivered.class).get(0);
        assertEquals(3, delivered.attempts());
        assertTrue(stored("c1").notified());
    }

    @Test
    void nonRetryableFailureStopsThatChannelOnly() {
        RecordingChannel rejected = new RecordingChannel("chat").failAlways(new NotificationException("HTTP 400", false));
        RecordingChannel healthy = new RecordingChannel("log");
        NotificationDispatcher dispatcher = dispatcher(List.of(rejected, healthy));

        NotificationDispatcher.DeliveryOutcome outcome = dispatcher.dispatch(
                persist(TestEntities.event("c1", run.runId(), ChangeType.REMOVED, RiskLevel.CRITICAL))).get(0);

        assertEquals(1, rejected.attempts());
        assertEquals(Set.of("log"), outcome.succeededChannels());
        assertEquals("HTTP 400", outcome.failedChannels().get("chat"));
        assertEquals(Set.of("log"), stored("c1").notificationChannels());
        NotificationFailed failed = capture.of(NotificationFailed.class).get(0);
        assertEquals("chat", failed.channel());
        assertEquals(1, failed.attempts());
    }

    @Test
    void eventsStayUnstampedWhenEveryChannelFails() {
        RecordingChannel down = new RecordingChannel("webhook").failAlways(new NotificationException("timeout", true));
        NotificationDispatcher dispatcher = dispatcher(List.of(down));

        NotificationDispatcher.DeliveryOutcome outcome = dispatcher.dispatch(
                persist(TestEntities.event("c1", run.runId(), ChangeType.REMOVED, RiskLevel.CRITICAL))).get(0);

        assertFalse(outcome.delivered());
        assertFalse(outcome.stamped());
        assertEquals(3, down.attempts());
        assertNull(stored("c1").notificationSentAt());
        assertEquals(3, capture.of(NotificationFailed.class).get(0).attempts());
    }

    @Test
    void unclassifiedEventsAreRejected() {
        NotificationDispatcher dispatcher = dispatcher(List.of(new RecordingChannel("log")));
        ChangeEvent unclassified = TestEntities.event("u1", run.runId(), ChangeType.ADDED, null);

        assertThrows(IllegalArgumentException.class, () -> dispatcher.dispatch(List.of(unclassified)));
        assertEquals(0, dispatcher.pending(RiskLevel.HIGH));
    }

    @Test
    void closeFlushesBufferedDigests() {
        RecordingChannel channel = new RecordingChannel("log");
        NotificationDispatcher dispatcher = dispatcher(List.of(channel));
        dispatcher.dispatch(persist(TestEntities.event("m1", run.runId(), ChangeType.MODIFIED, RiskLevel.MEDIUM)));

        dispatcher.close();

        assertEquals(1, channel.delivered().size());
        assertEquals(NotificationPayload.Kind.DIGEST, channel.delivered().get(0).kind());
        assertTrue(stored("m1").notified());
    }

    @Test
    void tickerFlushesAfterBatchWindow() throws Exception {
        RecordingChannel channel = new RecordingChannel("log");
        NotificationDispatcher dispatcher = new NotificationDispatcher(List.of(channel), repository, bus, clock, RETRY,
                sleeper, () -> 0.5, Duration.ofMillis(20), new NotificationFormatter());
        dispatcher.dispatch(persist(TestEntities.event("h1", run.runId(), ChangeType.ADDED, RiskLevel.HIGH)));

        dispatcher.start();
        try {
            long deadline = System.currentTimeMillis() + 2_000;
            while (channel.delivered().isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
        } finally {
            dispatcher.close();
        }

        assertEquals(1, channel.delivered().size());
    }

    private NotificationDispatcher dispatcher(List<NotificationChannel> channels) {
        return new NotificationDispatcher(channels, repository, bus, clock, RETRY, sleeper, () -> 0.5,
                Duration.ofMinutes(5), new NotificationFormatter());
    }

    private List<ChangeEvent> persist(ChangeEvent... events) {
        List<ChangeEvent> list = List.of(events);
        if (repository.findRun(run.runId()).isEmpty()) {
            repository.upsertRun(run);
        }
        ScraperRun done = run.complete(T0, RunStatus.SUCCESS, null, null, 0);
        repository.commitRun(new RunCommit(done, List.of(), list,
                new ContentSnapshot(SanctionsSource.OFAC, "h", 1, T0, run.runId(), null)));
        return list;
    }

    private ChangeEvent stored(String eventId) {
        return repository.findChangeEvents(run.runId()).stream()
                .filter(event -> event.eventId().equals(eventId))
                .findFirst()
                .orElseThrow();
    }
}
