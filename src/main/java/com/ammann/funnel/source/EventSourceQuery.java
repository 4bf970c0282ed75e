/* (C)2026 */
package com.ammann.funnel.source;

import com.ammann.funnel.model.DateRange;
import com.ammann.funnel.model.EventMatcher;
import com.ammann.funnel.model.ExclusionRule;
import com.ammann.funnel.model.FunnelSpec;
import com.ammann.funnel.model.StepDefinition;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Parameters an event source receives when asked for actor streams.
 *
 * @param actorIds   actors to return, or null for all actors in scope
 * @param dateRange  date range, or null for no time restriction
 * @param eventNames event names of interest, or null for every event
 */
public record EventSourceQuery(Set<String> actorIds, DateRange dateRange, Set<String> eventNames) {

    public EventSourceQuery {
        actorIds = actorIds == null ? null : Set.copyOf(actorIds);
        eventNames = eventNames == null ? null : Set.copyOf(eventNames);
    }

    /**
     * Builds the query needed to evaluate a funnel.
     *
     * <p>Strict funnels and correlation analyses need the full stream because unrelated events
     * matter to them; otherwise only events referenced by steps and exclusions are requested.
     *
     * @param spec              the funnel
     * @param needsEveryEvent   true to request the unfiltered stream
     * @return the query
     */
    public static EventSourceQuery forSpec(FunnelSpec spec, boolean needsEveryEvent) {
        if (needsEveryEvent) {
            return new EventSourceQuery(null, spec.dateRange(), null);
        }

        Set<String> names = new LinkedHashSet<>();
        for (StepDefinition step : spec.steps()) {
            if (!collect(step.matcher(), names)) {
                return new EventSourceQuery(null, spec.dateRange(), null);
            }
        }
        for (ExclusionRule rule : spec.exclusions()) {
            if (!collect(rule.matcher(), names)) {
                return new EventSourceQuery(null, spec.dateRange(), null);
            }
        }
        return new EventSourceQuery(null, spec.dateRange(), names);
    }

    /**
     * Returns a copy restricted to the given actors.
     */
    public EventSourceQuery withActorIds(Set<String> ids) {
        return new EventSourceQuery(ids, dateRange, eventNames);
    }

    private static boolean collect(EventMatcher matcher, Set<String> names) {
        Set<String> referenced = matcher.referencedEventNames();
        if (referenced == null) {
            return false;
        }
        names.addAll(referenced);
        return true;
    }
}
