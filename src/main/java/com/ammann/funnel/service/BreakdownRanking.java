/* (C)2026 */
package com.ammann.funnel.service;

import com.ammann.funnel.model.BreakdownValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Outcome of ranking raw breakdown values: the kept top-N values in rank order and whether
 * anything was folded into the "other" bucket.
 *
 * @param kept       kept values, highest actor count first
 * @param folded     raw values folded into "other"
 * @param dimensions number of breakdown dimensions
 */
public record BreakdownRanking(List<BreakdownValue> kept, Set<BreakdownValue> folded, int dimensions) {

    /** Ranking used when no breakdown is configured. */
    public static final BreakdownRanking NONE =
            new BreakdownRanking(List.of(BreakdownValue.NONE), Set.of(), 0);

    public BreakdownRanking {
        kept = List.copyOf(kept);
        folded = Set.copyOf(folded);
    }

    /**
     * Maps a raw breakdown value to the bucket it is reported under.
     */
    public BreakdownValue resolve(BreakdownValue raw) {
        return folded.contains(raw) ? BreakdownValue.other(dimensions) : raw;
    }

    public boolean hasOther() {
        return !folded.isEmpty();
    }

    /**
     * Reported buckets in output order: kept values by rank, then "other" if present.
     */
    public List<BreakdownValue> buckets() {
        if (!hasOther()) {
            return kept;
        }
        List<BreakdownValue> buckets = new ArrayList<>(kept);
        buckets.add(BreakdownValue.other(dimensions));
        return List.copyOf(buckets);
    }
}
