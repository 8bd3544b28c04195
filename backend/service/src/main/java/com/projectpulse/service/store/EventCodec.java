package com.projectpulse.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectpulse.core.bus.EventBus;
import com.projectpulse.core.events.ActivityAdmitted;
import com.projectpulse.core.events.AlertRaised;
import com.projectpulse.core.events.CollectorTickCompleted;
import com.projectpulse.core.events.CollectorTickStarted;
import com.projectpulse.core.events.CycleCompleted;
import com.projectpulse.core.events.CycleStarted;
import com.projectpulse.core.events.Event;
import com.projectpulse.core.events.PublishAttempted;
import com.projectpulse.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * One audit log line per event: {@code {"type": ..., "timestamp": ..., "event": {...}}}.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "CollectorTickStarted", CollectorTickStarted.class,
            "CollectorTickCompleted", CollectorTickCompleted.class,
            "ActivityAdmitted", ActivityAdmitted.class,
            "CycleStarted", CycleStarted.class,
            "CycleCompleted", CycleCompleted.class,
            "PublishAttempted", PublishAttempted.class,
            "AlertRaised", AlertRaised.class
    );

    private EventCodec() {
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
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

    /**
     * Forwards every event type the codec knows to {@code consumer}.
     */
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
