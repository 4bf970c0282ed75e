/* (C)2026 */
package com.ammann.funnel.source;

import com.ammann.funnel.model.ActorEvents;
import java.util.stream.Stream;

/**
 * Boundary to whatever store supplies raw events.
 *
 * <p>Implementations own scoping (team, project, pre-existing property constraints) and must
 * return each actor's events sorted ascending by timestamp. The engine neither re-sorts nor
 * re-filters what it receives. The returned stream is consumed once and closed by the engine.
 */
public interface EventSource {

    /**
     * Streams the actors matching a query.
     *
     * @param query actor ids, date range and event names of interest
     * @return lazily produced actor streams
     */
    Stream<ActorEvents> stream(EventSourceQuery query);
}
