/* (C)2026 */
package com.ammann.funnel.model;

import com.ammann.funnel.enumeration.AggregationKind;

/**
 * One funnel step.
 *
 * @param index            zero-based position in the funnel
 * @param matcher          event / action matcher
 * @param propertiesFilter additional filter, or null
 * @param math             display aggregation, defaults to TOTAL
 * @param customName       optional label shown instead of the matcher name
 */
public record StepDefinition(
        int index,
        EventMatcher matcher,
        PropertyFilterExpr propertiesFilter,
        AggregationKind math,
        String customName) {

    public StepDefinition {
        math = math == null ? AggregationKind.TOTAL : math;
    }

    public static StepDefinition of(int index, String eventName) {
        return new StepDefinition(index, EventMatcher.event(eventName), null, AggregationKind.TOTAL, null);
    }

    public static StepDefinition of(int index, EventMatcher matcher, PropertyFilterExpr filter) {
        return new StepDefinition(index, matcher, filter, AggregationKind.TOTAL, null);
    }

    public boolean matches(Event event, ActorEvents actor) {
        return matcher.matches(event, actor)
                && (propertiesFilter == null || propertiesFilter.test(event, actor));
    }

    public String name() {
        return matcher.displayName();
    }
}
