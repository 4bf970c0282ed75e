/* (C)2026 */
package com.ammann.funnel.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A single timestamped event performed by an actor.
 *
 * <p>Events are owned by the event source; the engine only reads them. Property lookups are
 * plain map lookups.
 *
 * @param name       event name
 * @param timestamp  UTC instant the event happened at
 * @param properties event properties, never null
 */
public record Event(String name, Instant timestamp, Map<String, Object> properties) {

    public Event {
        Objects.requireNonNull(timestamp, "timestamp");
        properties = properties == null ? Map.of() : properties;
    }

    /**
     * Creates an event without properties.
     */
    public static Event of(String name, Instant timestamp) {
        return new Event(name, timestamp, Map.of());
    }

    /**
     * Creates an event with properties.
     */
    public static Event of(String name, Instant timestamp, Map<String, Object> properties) {
        return new Event(name, timestamp, properties);
    }

    public Object property(String key) {
        return properties.get(key);
    }
}
