/* (C)2026 */
package com.ammann.funnel.service;

import com.ammann.funnel.dto.CorrelationEventDTO;
import com.ammann.funnel.dto.FunnelCorrelationResultDTO;
import com.ammann.funnel.enumeration.CorrelationOutcome;
import com.ammann.funnel.model.ActorEvents;
import com.ammann.funnel.model.ActorFunnelProgress;
import com.ammann.funnel.model.CorrelationSpec;
import com.ammann.funnel.model.Event;
import com.ammann.funnel.model.FunnelSpec;
import com.ammann.funnel.model.StepDefinition;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Measures how strongly events or property values are associated with funnel conversion.
 *
 * <p>Actors that entered the funnel are split into <em>converted</em> (reached the last step)
 * and <em>dropped</em> (did not). Excluded actors belong to neither side. For each candidate the
 * odds ratio with a +1 prior on all four cells is computed:
 *
 * <pre>
 *   ((s + 1) * (D - f + 1)) / ((f + 1) * (C - s + 1))
 * </pre>
 *
 * where {@code s}/{@code f} are converted/dropped actors exhibiting the candidate and
 * {@code C}/{@code D} the side totals. Each candidate counts at most once per actor.
 */
@ApplicationScoped
public class CorrelationAnalyzer {

    private static final Logger LOG = Logger.getLogger(CorrelationAnalyzer.class);

    static final double DEFAULT_SKEW_MIN_SHARE = 0.1;
    static final int DEFAULT_RESULT_LIMIT = 10;

    @ConfigProperty(name = "funnel.correlation.skew-min-share", defaultValue = "0.1")
    double skewMinShare = DEFAULT_SKEW_MIN_SHARE;

    @ConfigProperty(name = "funnel.correlation.result-limit", defaultValue = "10")
    int resultLimit = DEFAULT_RESULT_LIMIT;

    @ConfigProperty(name = "funnel.correlation.min-actor-count", defaultValue = "0")
    long minActorCount = 0;

    /**
     * Correlates candidates of already matched actors.
     *
     * @param actors      actor records, paired with {@code progresses} by actor id
     * @param progresses  matched actors
     * @param spec        the funnel
     * @param correlation candidate configuration
     * @return the correlation result
     */
    public FunnelCorrelationResultDTO correlate(
            List<ActorEvents> actors,
            List<ActorFunnelProgress> progresses,
            FunnelSpec spec,
            CorrelationSpec correlation) {
        Map<String, ActorEvents> byId = new HashMap<>();
        for (ActorEvents actor : actors) {
            byId.put(actor.actorId(), actor);
        }
        CorrelationTally tally = newTally(spec, correlation);
        for (ActorFunnelProgress progress : progresses) {
            ActorEvents actor = byId.get(progress.actorId());
            if (actor != null) {
                tally.add(progress, actor);
            }
        }
        return finish(tally);
    }

    public CorrelationTally newTally(FunnelSpec spec, CorrelationSpec correlation) {
        return new CorrelationTally(spec, correlation);
    }

    /**
     * Turns merged tallies into the ranked correlation result.
     */
    public FunnelCorrelationResultDTO finish(CorrelationTally tally) {
        long successTotal = tally.successTotal;
        long failureTotal = tally.failureTotal;

        List<CorrelationEventDTO> success = new ArrayList<>();
        List<CorrelationEventDTO> failure = new ArrayList<>();
        tally.counts.forEach((candidate, counts) -> {
            long s = counts[0];
            long f = counts[1];
            if (s + f < minActorCount) {
                return;
            }
            double odds = oddsRatio(s, f, successTotal, failureTotal);
            CorrelationOutcome outcome = CorrelationOutcome.fromOddsRatio(odds);
            CorrelationEventDTO dto = new CorrelationEventDTO(candidate, s, f, odds, outcome);
            if (outcome == CorrelationOutcome.SUCCESS) {
                success.add(dto);
            } else {
                failure.add(dto);
            }
        });

        success.sort(Comparator.comparing(CorrelationEventDTO::oddsRatio, Comparator.reverseOrder())
                .thenComparing(CorrelationEventDTO::event));
        failure.sort(Comparator.comparing(CorrelationEventDTO::oddsRatio)
                .thenComparing(CorrelationEventDTO::event));

        int limit = resultLimit > 0 ? resultLimit : DEFAULT_RESULT_LIMIT;
        List<CorrelationEventDTO> events = new ArrayList<>();
        events.addAll(success.subList(0, Math.min(limit, success.size())));
        events.addAll(failure.subList(0, Math.min(limit, failure.size())));

        boolean skewed = isSkewed(successTotal, failureTotal);
        if (skewed) {
            LOG.warnf("Correlation sample is skewed: %d converted vs %d dropped actors",
                    successTotal, failureTotal);
        }
        LOG.debugf("Correlation: %d candidates, %d success, %d failure reported",
                tally.counts.size(), Math.min(limit, success.size()), Math.min(limit, failure.size()));

        return new FunnelCorrelationResultDTO(events, skewed, successTotal, failureTotal);
    }

    /**
     * Odds ratio of a candidate with a +1 prior on every cell of the contingency table.
     *
     * @param successCount converted actors exhibiting the candidate
     * @param failureCount dropped actors exhibiting the candidate
     * @param successTotal converted actors
     * @param failureTotal dropped actors
     * @return the odds ratio, always finite and positive
     */
    public static double oddsRatio(long successCount, long failureCount, long successTotal, long failureTotal) {
        double numerator = (successCount + 1.0) * (failureTotal - failureCount + 1.0);
        double denominator = (failureCount + 1.0) * (successTotal - successCount + 1.0);
        return numerator / denominator;
    }

    /**
     * Whether the smaller side holds less than the configured share of all actors.
     */
    public boolean isSkewed(long successTotal, long failureTotal) {
        long total = successTotal + failureTotal;
        if (total == 0) {
            return false;
        }
        return (double) Math.min(successTotal, failureTotal) / total < skewMinShare;
    }

    /**
     * Converted/dropped totals and per-candidate counts.
     */
    public static final class CorrelationTally {
        private final FunnelSpec spec;
        private final CorrelationSpec correlation;
        private final Set<String> ignoredEvents;
        long successTotal;
        long failureTotal;
        final Map<String, long[]> counts = new HashMap<>();

        CorrelationTally(FunnelSpec spec, CorrelationSpec correlation) {
            this.spec = spec;
            this.correlation = correlation;
            this.ignoredEvents = new HashSet<>(correlation.excludedEventNames());
            for (StepDefinition step : spec.steps()) {
                Set<String> names = step.matcher().referencedEventNames();
                if (names != null) {
                    ignoredEvents.addAll(names);
                }
            }
        }

        /**
         * Accumulates one actor. Actors that never entered the funnel or were excluded are
         * ignored.
         */
        public void add(ActorFunnelProgress progress, ActorEvents actor) {
            if (progress.excluded() || progress.furthestStep() == 0) {
                return;
            }
            boolean converted = progress.reached(spec.stepCount());
            if (converted) {
                successTotal++;
            } else {
                failureTotal++;
            }

            int side = converted ? 0 : 1;
            for (String candidate : candidates(progress, actor, converted)) {
                counts.computeIfAbsent(candidate, c -> new long[2])[side]++;
            }
        }

        public void merge(CorrelationTally other) {
            successTotal += other.successTotal;
            failureTotal += other.failureTotal;
            other.counts.forEach((candidate, c) -> {
                long[] target = counts.computeIfAbsent(candidate, k -> new long[2]);
                target[0] += c[0];
                target[1] += c[1];
            });
        }

        private Set<String> candidates(ActorFunnelProgress progress, ActorEvents actor, boolean converted) {
            Set<String> candidates = new LinkedHashSet<>();
            switch (correlation.type()) {
                case PROPERTIES -> {
                    for (Map.Entry<String, Object> property : actor.properties().entrySet()) {
                        if (selected(property.getKey()) && property.getValue() != null) {
                            candidates.add(property.getKey() + "::" + property.getValue());
                        }
                    }
                }
                case EVENTS -> {
                    for (Event event : eventsInWindow(progress, actor, converted)) {
                        if (!ignoredEvents.contains(event.name())) {
                            candidates.add(event.name());
                        }
                    }
                }
                case EVENT_WITH_PROPERTIES -> {
                    for (Event event : eventsInWindow(progress, actor, converted)) {
                        if (!event.name().equals(correlation.eventName())) {
                            continue;
                        }
                        for (Map.Entry<String, Object> property : event.properties().entrySet()) {
                            if (selected(property.getKey()) && property.getValue() != null) {
                                candidates.add(event.name() + "::" + property.getKey() + "::" + property.getValue());
                            }
                        }
                    }
                }
            }
            return candidates;
        }

        private boolean selected(String propertyName) {
            return correlation.includesAllProperties() || correlation.propertyNames().contains(propertyName);
        }

        /**
         * Events from funnel entry up to the last step for converted actors, or up to the end of
         * the conversion window for dropped ones.
         */
        private List<Event> eventsInWindow(ActorFunnelProgress progress, ActorEvents actor, boolean converted) {
            Instant start = progress.stepTime(0).orElse(null);
            if (start == null) {
                return List.of();
            }
            Instant end = converted
                    ? progress.stepTime(spec.stepCount() - 1).orElse(start)
                    : start.plus(spec.window().asDuration());

            List<Event> inWindow = new ArrayList<>();
            for (Event event : actor.events()) {
                Instant ts = event.timestamp();
                if (!ts.isBefore(start) && !ts.isAfter(end)) {
                    inWindow.add(event);
                }
            }
            return inWindow;
        }
    }
}
