/* (C)2026 */
package com.ammann.funnel.service;

import com.ammann.funnel.enumeration.BreakdownKind;
import com.ammann.funnel.model.ActorEvents;
import com.ammann.funnel.model.ActorFunnelProgress;
import com.ammann.funnel.model.BreakdownDimension;
import com.ammann.funnel.model.BreakdownSpec;
import com.ammann.funnel.model.BreakdownValue;
import com.ammann.funnel.model.Event;
import com.ammann.funnel.model.FunnelSpec;
import jakarta.enterprise.context.ApplicationScoped;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Partitions actors by breakdown property values.
 *
 * <p>Values are extracted per actor while matching (see {@link #extractValue}) and ranked once
 * all actors are known (see {@link #rank}): descending actor count, ties broken lexically, top N
 * kept, the remainder folded into {@value BreakdownValue#OTHER_LABEL}. A multi-dimension
 * breakdown ranks the combined key as a whole.
 */
@ApplicationScoped
public class BreakdownResolver {

    private static final Logger LOG = Logger.getLogger(BreakdownResolver.class);

    static final int DEFAULT_LIMIT = 25;

    @ConfigProperty(name = "funnel.breakdown.limit", defaultValue = "25")
    int defaultLimit = DEFAULT_LIMIT;

    /**
     * Extracts the raw breakdown key of one actor.
     *
     * @param actor         the actor record
     * @param stepEvents    event that satisfied each step slot, null for unreached slots
     * @param furthestStep  number of steps reached
     * @param breakdown     breakdown configuration, may be null
     * @return the raw key, {@link BreakdownValue#NONE} without breakdown
     */
    public BreakdownValue extractValue(
            ActorEvents actor, List<Event> stepEvents, int furthestStep, BreakdownSpec breakdown) {
        if (breakdown == null || breakdown.dimensions().isEmpty()) {
            return BreakdownValue.NONE;
        }

        Event attributed = attributedEvent(stepEvents, furthestStep, breakdown);
        List<String> labels = new ArrayList<>(breakdown.dimensions().size());
        for (BreakdownDimension dimension : breakdown.dimensions()) {
            Object raw = switch (dimension.propertySource()) {
                case EVENT -> attributed == null ? null : attributed.property(dimension.propertyName());
                case ACTOR -> actor.properties().get(dimension.propertyName());
                case GROUP -> actor.groupProperty(dimension.groupType(), dimension.propertyName());
            };
            labels.add(render(raw, dimension.kind()));
        }
        return new BreakdownValue(labels);
    }

    /**
     * Ranks raw keys by actor count.
     *
     * @param actorCounts actors per raw key
     * @param limit       number of keys kept
     * @param dimensions  number of breakdown dimensions
     * @return the ranking
     */
    public BreakdownRanking rank(Map<BreakdownValue, Long> actorCounts, int limit, int dimensions) {
        if (dimensions == 0) {
            return BreakdownRanking.NONE;
        }

        List<BreakdownValue> ordered = actorCounts.entrySet().stream()
                .sorted(Map.Entry.<BreakdownValue, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .map(Map.Entry::getKey)
                .toList();

        List<BreakdownValue> kept = ordered.subList(0, Math.min(limit, ordered.size()));
        Set<BreakdownValue> folded = new HashSet<>(ordered.subList(kept.size(), ordered.size()));

        LOG.debugf("Breakdown ranking: %d distinct values, %d kept, %d folded into %s",
                ordered.size(), kept.size(), folded.size(), BreakdownValue.OTHER_LABEL);

        return new BreakdownRanking(kept, folded, dimensions);
    }

    /**
     * Ranks using the funnel's breakdown limit or the configured default.
     */
    public BreakdownRanking rank(Map<BreakdownValue, Long> actorCounts, FunnelSpec spec) {
        if (!spec.hasBreakdown()) {
            return BreakdownRanking.NONE;
        }
        return rank(actorCounts, effectiveLimit(spec.breakdown()), spec.breakdown().dimensions().size());
    }

    /**
     * Groups matched actors by resolved breakdown bucket.
     *
     * <p>Only actors that entered the funnel and were not excluded count towards the ranking and
     * appear in a bucket. Buckets are returned in rank order with "other" last.
     *
     * @param progresses matched actors carrying raw breakdown keys
     * @param spec       the funnel
     * @return actors per reported bucket
     */
    public Map<BreakdownValue, List<ActorFunnelProgress>> resolveBreakdowns(
            List<ActorFunnelProgress> progresses, FunnelSpec spec) {
        Map<BreakdownValue, Long> counts = new HashMap<>();
        for (ActorFunnelProgress progress : progresses) {
            if (progress.furthestStep() > 0 && !progress.excluded()) {
                counts.merge(progress.breakdownValue(), 1L, Long::sum);
            }
        }
        BreakdownRanking ranking = rank(counts, spec);

        Map<BreakdownValue, List<ActorFunnelProgress>> grouped = new LinkedHashMap<>();
        for (BreakdownValue bucket : ranking.buckets()) {
            grouped.put(bucket, new ArrayList<>());
        }
        for (ActorFunnelProgress progress : progresses) {
            if (progress.furthestStep() == 0 || progress.excluded()) {
                continue;
            }
            BreakdownValue bucket = ranking.resolve(progress.breakdownValue());
            grouped.get(bucket).add(progress.withBreakdownValue(bucket));
        }
        return grouped;
    }

    int effectiveLimit(BreakdownSpec breakdown) {
        if (breakdown != null && breakdown.limit() != null) {
            return breakdown.limit();
        }
        return defaultLimit > 0 ? defaultLimit : DEFAULT_LIMIT;
    }

    /**
     * Renders a raw property value as a breakdown label.
     */
    static String render(Object raw, BreakdownKind kind) {
        if (raw == null) {
            return BreakdownValue.UNDEFINED_LABEL;
        }
        return switch (kind) {
            case STRING -> String.valueOf(raw);
            case NUMERIC -> renderNumeric(raw);
            case BOOLEAN -> renderBoolean(raw);
        };
    }

    private static String renderNumeric(Object raw) {
        BigDecimal number;
        try {
            number = raw instanceof Number n ? new BigDecimal(n.toString()) : new BigDecimal(raw.toString().trim());
        } catch (NumberFormatException e) {
            return String.valueOf(raw);
        }
        BigDecimal stripped = number.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            return stripped.toBigInteger().toString();
        }
        return stripped.toPlainString();
    }

    private static String renderBoolean(Object raw) {
        if (raw instanceof Boolean b) {
            return b.toString();
        }
        if (raw instanceof Number n) {
            return Boolean.toString(n.doubleValue() != 0.0);
        }
        return Boolean.toString(Boolean.parseBoolean(raw.toString().trim()));
    }

    private static Event attributedEvent(List<Event> stepEvents, int furthestStep, BreakdownSpec breakdown) {
        if (furthestStep == 0 || stepEvents == null) {
            return null;
        }
        int slot = switch (breakdown.attribution()) {
            case FIRST_TOUCH -> 0;
            case LAST_TOUCH -> furthestStep - 1;
            case STEP -> breakdown.attributionStep() == null ? 0 : breakdown.attributionStep();
        };
        return slot < stepEvents.size() ? stepEvents.get(slot) : null;
    }
}
