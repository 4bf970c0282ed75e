/* (C)2026 */
package com.ammann.funnel.service;

import com.ammann.funnel.model.ActorFunnelProgress;
import com.ammann.funnel.model.BreakdownValue;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Tallies keyed by raw breakdown value.
 *
 * <p>Ranking needs the full actor population, so partials are kept per raw value and only
 * {@link #fold folded} into the reported buckets after every partial has been merged.
 * Actors that never entered the funnel or were excluded are ignored.
 *
 * @param <T> tally type
 */
public final class BreakdownTallies<T extends Tally<T>> {

    private final Supplier<T> factory;
    private final Map<BreakdownValue, T> tallies = new HashMap<>();
    private final Map<BreakdownValue, Long> actorCounts = new HashMap<>();

    public BreakdownTallies(Supplier<T> factory) {
        this.factory = factory;
    }

    public void add(ActorFunnelProgress progress) {
        if (progress.furthestStep() == 0 || progress.excluded()) {
            return;
        }
        tallies.computeIfAbsent(progress.breakdownValue(), k -> factory.get()).add(progress);
        actorCounts.merge(progress.breakdownValue(), 1L, Long::sum);
    }

    public void merge(BreakdownTallies<T> other) {
        other.tallies.forEach((value, tally) ->
                tallies.computeIfAbsent(value, k -> factory.get()).merge(tally));
        other.actorCounts.forEach((value, count) -> actorCounts.merge(value, count, Long::sum));
    }

    /**
     * Entered actors per raw value, the input of {@link BreakdownResolver#rank}.
     */
    public Map<BreakdownValue, Long> actorCounts() {
        return Map.copyOf(actorCounts);
    }

    /**
     * Combines raw tallies into the ranking's reported buckets, in bucket order. Every bucket is
     * present, holding an empty tally if no actor fell into it.
     */
    public Map<BreakdownValue, T> fold(BreakdownRanking ranking) {
        Map<BreakdownValue, T> folded = new LinkedHashMap<>();
        for (BreakdownValue bucket : ranking.buckets()) {
            folded.put(bucket, factory.get());
        }
        tallies.forEach((raw, tally) -> {
            T target = folded.get(ranking.resolve(raw));
            if (target != null) {
                target.merge(tally);
            }
        });
        return folded;
    }
}
