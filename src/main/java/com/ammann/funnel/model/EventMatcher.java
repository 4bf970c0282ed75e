/* (C)2026 */
package com.ammann.funnel.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether an event satisfies a funnel step or an exclusion.
 *
 * <p>Three shapes are supported: a plain event name, any event ({@code eventName == null}
 * and no action), and an action whose alternatives are matched by membership.
 *
 * @param eventName   event name for plain matchers
 * @param actionId    action id, or null for plain matchers
 * @param actionName  display name of the action
 * @param actionSteps alternatives making up the action
 */
public record EventMatcher(
        String eventName, Long actionId, String actionName, List<ActionStep> actionSteps) {

    public EventMatcher {
        actionSteps = actionSteps == null ? List.of() : List.copyOf(actionSteps);
    }

    public static EventMatcher event(String eventName) {
        return new EventMatcher(eventName, null, null, List.of());
    }

    public static EventMatcher anyEvent() {
        return new EventMatcher(null, null, null, List.of());
    }

    public static EventMatcher action(long actionId, String actionName, List<ActionStep> steps) {
        return new EventMatcher(null, actionId, actionName, steps);
    }

    public boolean isAction() {
        return actionId != null;
    }

    public boolean matchesAnyEvent() {
        return actionId == null && eventName == null;
    }

    /**
     * Tests an event against this matcher.
     *
     * @param event the candidate event
     * @param actor the actor owning the event
     * @return true on match
     */
    public boolean matches(Event event, ActorEvents actor) {
        if (isAction()) {
            for (ActionStep step : actionSteps) {
                if (step.matches(event, actor)) {
                    return true;
                }
            }
            return false;
        }
        return eventName == null || eventName.equals(event.name());
    }

    /**
     * Returns the event names this matcher can match, or null if it can match any event.
     */
    public Set<String> referencedEventNames() {
        if (matchesAnyEvent()) {
            return null;
        }
        Set<String> names = new LinkedHashSet<>();
        if (!isAction()) {
            names.add(eventName);
            return names;
        }
        for (ActionStep step : actionSteps) {
            if (step.eventName() == null) {
                return null;
            }
            names.add(step.eventName());
        }
        return names;
    }

    /**
     * Display name used in results.
     */
    public String displayName() {
        if (isAction()) {
            return actionName != null ? actionName : "action " + actionId;
        }
        return eventName != null ? eventName : "All events";
    }
}
