package com.sanctionsentinel.core.bus;

import com.sanctionsentinel.core.events.AlertRaised;
import com.sanctionsentinel.core.events.Event;
import com.sanctionsentinel.core.events.RunStageChanged;
import com.sanctionsentinel.core.model.RunStage;
import com.sanctionsentinel.core.model.SanctionsSource;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void publishNotifiesMultipleSubscribersForSameType() {
        EventBus bus = new EventBus();
        AtomicInteger hitsA = new AtomicInteger();
        AtomicInteger hitsB = new AtomicInteger();

        bus.subscribe(RunStageChanged.class, event -> hitsA.incrementAndGet());
        bus.subscribe(RunStageChanged.class, event -> hitsB.incrementAndGet());

        bus.publish(stage(RunStage.DOWNLOADING));

        assertEquals(1, hitsA.get());
        assertEquals(1, hitsB.get());
    }

    @Test
    void publishRoutesToCorrectEventType() {
        EventBus bus = new EventBus();
        AtomicInteger stageHits = new AtomicInteger();
        AtomicInteger alertHits = new AtomicInteger();

        bus.subscribe(RunStageChanged.class, event -> stageHits.incrementAndGet());
        bus.subscribe(AlertRaised.class, event -> alertHits.incrementAndGet());

        bus.publish(stage(RunStage.PARSING));
        bus.publish(new AlertRaised(NOW, "run", "boom", Map.of()));
        bus.publish(new AlertRaised(NOW, "run", "boom again", Map.of()));

        assertEquals(1, stageHits.get());
        assertEquals(2, alertHits.get());
    }

    @Test
    void wildcardSubscriberSeesEveryEventType() {
        EventBus bus = new EventBus();
        List<Event> seen = new CopyOnWriteArrayList<>();
        bus.subscribeAll(seen::add);

        bus.publish(stage(RunStage.DIFFING));
        bus.publish(new AlertRaised(NOW, "run", "x", Map.of()));

        assertEquals(2, seen.size());
        assertEquals("RunStageChanged", seen.get(0).type());
        assertEquals("AlertRaised", seen.get(1).type());
    }

    @Test
    void publishContinuesWhenHandlerThrows() {
        AtomicReference<Exception> capturedError = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> capturedError.set(error));
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(RunStageChanged.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(RunStageChanged.class, event -> safeHits.incrementAndGet());
        bus.subscribeAll(event -> safeHits.incrementAndGet());

        bus.publish(stage(RunStage.PERSISTING));

        assertEquals(2, safeHits.get());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
    }

    @Test
    void cancelledSubscriptionStopsReceiving() {
        EventBus bus = new EventBus();
        AtomicInteger hits = new AtomicInteger();
        EventBus.Subscription subscription = bus.subscribe(RunStageChanged.class, event -> hits.incrementAndGet());

        bus.publish(stage(RunStage.DOWNLOADING));
        subscription.cancel();
        bus.publish(stage(RunStage.PARSING));

        assertEquals(1, hits.get());
    }

    @Test
    void supertypeSubscriptionReceivesSubtypesInSubscriptionOrder() {
        EventBus bus = new EventBus();
        List<String> order = new CopyOnWriteArrayList<>();
        bus.subscribe(Event.class, event -> order.add("any:" + event.type()));
        bus.subscribe(AlertRaised.class, event -> order.add("alert:" + event.category()));

        bus.publish(new AlertRaised(NOW, "run_failed", "x", Map.of()));

        assertEquals(List.of("any:AlertRaised", "alert:run_failed"), order);
    }

    @Test
    void handlerFailuresAreCounted() {
        EventBus bus = new EventBus((event, error) -> { });
        bus.subscribeAll(event -> {
            throw new IllegalStateException("disk full");
        });

        bus.publish(stage(RunStage.PERSISTING));
        bus.publish(stage(RunStage.NOTIFYING));

        assertEquals(2, bus.handlerFailures());
    }

    private RunStageChanged stage(RunStage stage) {
        return new RunStageChanged(NOW, SanctionsSource.OFAC, "ofac_1", stage, "entered");
    }
}
