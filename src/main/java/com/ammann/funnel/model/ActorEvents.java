/* (C)2026 */
package com.ammann.funnel.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One actor's slice of the event stream as handed over by an event source.
 *
 * <p>{@code events} must be sorted ascending by timestamp.
 *
 * @param actorId         opaque actor identifier (person, group or session id)
 * @param properties      actor properties, never null
 * @param groupProperties properties of the groups the actor belongs to, keyed by group type
 * @param events          the actor's events in ascending timestamp order
 */
public record ActorEvents(
        String actorId,
        Map<String, Object> properties,
        Map<String, Map<String, Object>> groupProperties,
        List<Event> events) {

    public ActorEvents {
        Objects.requireNonNull(actorId, "actorId");
        properties = properties == null ? Map.of() : properties;
        groupProperties = groupProperties == null ? Map.of() : groupProperties;
        events = events == null ? List.of() : events;
    }

    /**
     * Creates an actor without actor or group properties.
     */
    public static ActorEvents of(String actorId, List<Event> events) {
        return new ActorEvents(actorId, Map.of(), Map.of(), events);
    }

    /**
     * Creates an actor with actor properties.
     */
    public static ActorEvents of(String actorId, Map<String, Object> properties, List<Event> events) {
        return new ActorEvents(actorId, properties, Map.of(), events);
    }

    /**
     * Returns a copy of this actor holding a different event list.
     */
    public ActorEvents withEvents(List<Event> newEvents) {
        return new ActorEvents(actorId, properties, groupProperties, newEvents);
    }

    public Object groupProperty(String groupType, String key) {
        Map<String, Object> group = groupProperties.get(groupType);
        return group == null ? null : group.get(key);
    }
}
