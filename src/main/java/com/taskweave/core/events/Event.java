package com.taskweave.core.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable notification delivered to the subscribers of its type.
 *
 * @param type      event type tag (see {@link EventTypes})
 * @param data      arbitrary key-value data
 * @param priority  advisory priority
 * @param timestamp when the event occurred; stamped on publish when null
 * @param source    publishing component (nullable)
 * @param id        event identifier (nullable)
 */
public record Event(
    String type,
    Map<String, Object> data,
    EventPriority priority,
    Instant timestamp,
    String source,
    String id
) {

    public Event {
        Objects.requireNonNull(type, "type must not be null");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        priority = priority == null ? EventPriority.NORMAL : priority;
    }

    public static Event of(String type, Map<String, Object> data, EventPriority priority, String source) {
        return new Event(type, data, priority, null, source, null);
    }

    public Event withTimestamp(Instant at) {
        return new Event(type, data, priority, at, source, id);
    }
}
