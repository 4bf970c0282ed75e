/* (C)2026 */
package com.ammann.funnel.service;

import com.ammann.funnel.model.ActorFunnelProgress;

/**
 * Mergeable partial aggregate over matched actors.
 *
 * <p>Workers fill private tallies without synchronization; partial tallies are combined with
 * {@link #merge} once all workers are done. Merging is associative and commutative, so results
 * never depend on how actors were sharded.
 *
 * @param <T> concrete tally type
 */
public interface Tally<T extends Tally<T>> {

    /**
     * Accumulates one matched actor.
     */
    void add(ActorFunnelProgress progress);

    /**
     * Adds another partial tally of the same funnel into this one.
     */
    void merge(T other);
}
