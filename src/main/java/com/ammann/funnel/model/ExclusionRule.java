/* (C)2026 */
package com.ammann.funnel.model;

/**
 * Invalidates an actor's progress if a matching event happens between two steps.
 *
 * @param matcher  excluded event / action
 * @param filter   optional property filter on the excluded event
 * @param fromStep zero-based step opening the exclusion range
 * @param toStep   zero-based step closing the exclusion range
 */
public record ExclusionRule(EventMatcher matcher, PropertyFilterExpr filter, int fromStep, int toStep) {

    public static ExclusionRule of(String eventName, int fromStep, int toStep) {
        return new ExclusionRule(EventMatcher.event(eventName), null, fromStep, toStep);
    }

    public boolean matches(Event event, ActorEvents actor) {
        return matcher.matches(event, actor) && (filter == null || filter.test(event, actor));
    }
}
