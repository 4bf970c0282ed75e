/* (C)2026 */
package com.ammann.funnel.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Result of matching one actor against a funnel. Never mutated after creation.
 *
 * <p>{@code stepTimestamps} has one slot per funnel step; slot {@code i} is non-null iff
 * {@code i < furthestStep}. In UNORDERED funnels slots hold the times steps were satisfied in
 * satisfaction order, not step index order.
 *
 * @param actorId        the actor
 * @param furthestStep   number of steps reached, in {@code [0, steps]}
 * @param stepTimestamps per-step reach times, null for unreached slots
 * @param excluded       whether an exclusion rule fired
 * @param breakdownValue raw (unranked) breakdown key
 */
public record ActorFunnelProgress(
        String actorId,
        int furthestStep,
        List<Instant> stepTimestamps,
        boolean excluded,
        BreakdownValue breakdownValue) {

    public ActorFunnelProgress {
        stepTimestamps = stepTimestamps == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(stepTimestamps));
        breakdownValue = breakdownValue == null ? BreakdownValue.NONE : breakdownValue;
    }

    /**
     * Progress of an actor that reached no step.
     */
    public static ActorFunnelProgress empty(String actorId, int stepCount, BreakdownValue breakdownValue) {
        return new ActorFunnelProgress(
                actorId, 0, Arrays.asList(new Instant[stepCount]), false, breakdownValue);
    }

    public Optional<Instant> stepTime(int index) {
        if (index < 0 || index >= stepTimestamps.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(stepTimestamps.get(index));
    }

    /**
     * Whether the actor reached at least {@code stepCount} steps and was not excluded.
     */
    public boolean reached(int stepCount) {
        return !excluded && furthestStep >= stepCount;
    }

    /**
     * Time between two reached step slots, or empty if either is missing.
     */
    public Optional<Duration> durationBetween(int fromIndex, int toIndex) {
        Optional<Instant> from = stepTime(fromIndex);
        Optional<Instant> to = stepTime(toIndex);
        if (from.isEmpty() || to.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(from.get(), to.get()));
    }

    /**
     * Returns a copy with the breakdown key replaced.
     */
    public ActorFunnelProgress withBreakdownValue(BreakdownValue value) {
        return new ActorFunnelProgress(actorId, furthestStep, stepTimestamps, excluded, value);
    }
}
