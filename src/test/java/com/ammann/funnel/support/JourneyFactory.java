/* (C)2026 */
package com.ammann.funnel.support;

import com.ammann.funnel.model.ActorEvents;
import com.ammann.funnel.model.Event;
import com.ammann.funnel.service.BreakdownResolver;
import com.ammann.funnel.service.CorrelationAnalyzer;
import com.ammann.funnel.service.ExclusionFilter;
import com.ammann.funnel.service.FunnelAggregator;
import com.ammann.funnel.service.FunnelEngine;
import com.ammann.funnel.service.FunnelSpecValidator;
import com.ammann.funnel.service.StepMatcher;
import com.ammann.funnel.service.TrendBucketizer;
import com.ammann.funnel.service.WindowEvaluator;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

public final class JourneyFactory {

    public static final Instant BASE = Instant.parse("2021-05-01T00:00:00Z");

    private JourneyFactory() {}

    public static Instant at(int year, int month, int day, int hour) {
        return LocalDateTime.of(year, month, day, hour, 0).toInstant(ZoneOffset.UTC);
    }

    /** Instant on the given day of May 2021. */
    public static Instant may(int day, int hour) {
        return at(2021, 5, day, hour);
    }

    public static Event event(String name, Instant timestamp) {
        return Event.of(name, timestamp);
    }

    public static Event event(String name, Instant timestamp, Map<String, Object> properties) {
        return Event.of(name, timestamp, properties);
    }

    public static ActorEvents actor(String actorId, Event... events) {
        return ActorEvents.of(actorId, Arrays.asList(events));
    }

    public static ActorEvents actor(String actorId, Map<String, Object> properties, Event... events) {
        return ActorEvents.of(actorId, properties, Arrays.asList(events));
    }

    /**
     * Actor performing the given events one after another, {@code gap} apart, starting at
     * {@code start}.
     */
    public static ActorEvents journey(String actorId, Instant start, Duration gap, String... eventNames) {
        List<Event> events = new ArrayList<>(eventNames.length);
        for (int i = 0; i < eventNames.length; i++) {
            events.add(Event.of(eventNames[i], start.plus(gap.multipliedBy(i))));
        }
        return ActorEvents.of(actorId, events);
    }

    /**
     * {@code count} actors named {@code prefix_i} performing the same journey.
     */
    public static List<ActorEvents> cohort(
            String prefix, int count, Instant start, Duration gap, String... eventNames) {
        List<ActorEvents> actors = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            actors.add(journey(prefix + "_" + i, start, gap, eventNames));
        }
        return actors;
    }

    // Component graphs wired without CDI

    public static BreakdownResolver breakdownResolver() {
        return new BreakdownResolver();
    }

    public static StepMatcher stepMatcher() {
        return new StepMatcher(new WindowEvaluator(), new ExclusionFilter(), breakdownResolver());
    }

    public static FunnelAggregator aggregator() {
        return new FunnelAggregator(breakdownResolver(), new FunnelSpecValidator());
    }

    public static TrendBucketizer trendBucketizer() {
        return new TrendBucketizer(breakdownResolver());
    }

    public static FunnelEngine engine(ExecutorService executor) {
        BreakdownResolver resolver = breakdownResolver();
        return new FunnelEngine(
                new FunnelSpecValidator(),
                new StepMatcher(new WindowEvaluator(), new ExclusionFilter(), resolver),
                new FunnelAggregator(resolver, new FunnelSpecValidator()),
                new TrendBucketizer(resolver),
                new CorrelationAnalyzer(),
                resolver,
                executor);
    }
}
