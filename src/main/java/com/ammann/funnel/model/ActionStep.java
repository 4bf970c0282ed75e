/* (C)2026 */
package com.ammann.funnel.model;

/**
 * One alternative of an action definition: an event name plus an optional filter.
 *
 * @param eventName event name, or null for any event
 * @param filter    additional filter, or null
 */
public record ActionStep(String eventName, PropertyFilterExpr filter) {

    boolean matches(Event event, ActorEvents actor) {
        if (eventName != null && !eventName.equals(event.name())) {
            return false;
        }
        return filter == null || filter.test(event, actor);
    }
}
