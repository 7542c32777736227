package com.sanctionsentinel.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sanctionsentinel.core.bus.EventBus;
import com.sanctionsentinel.core.events.AlertRaised;
import com.sanctionsentinel.core.events.ChangesDetected;
import com.sanctionsentinel.core.events.Event;
import com.sanctionsentinel.core.events.NotificationDelivered;
import com.sanctionsentinel.core.events.NotificationFailed;
import com.sanctionsentinel.core.events.RunCompleted;
import com.sanctionsentinel.core.events.RunStageChanged;
import com.sanctionsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * JSONL envelope {@code {"type", "timestamp", "event"}} for every observability event.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "RunStageChanged", RunStageChanged.class,
            "RunCompleted", RunCompleted.class,
            "ChangesDetected", ChangesDetected.class,
            "NotificationDelivered", NotificationDelivered.class,
            "NotificationFailed", NotificationFailed.class,
            "AlertRaised", AlertRaised.class
    );

    private EventCodec() {
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static boolean isKnownType(String type) {
        return TYPES.containsKey(type);
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize " + event.type(), e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    /** Forwards every event of a known type to {@code consumer}. */
    public static void subscribeAll(EventBus bus, Consumer<Event> consumer) {
        bus.subscribeAll(event -> {
            if (TYPES.containsKey(event.type())) {
                consumer.accept(event);
            }
        });
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
