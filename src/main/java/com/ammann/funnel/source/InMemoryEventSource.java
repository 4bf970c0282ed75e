/* (C)2026 */
package com.ammann.funnel.source;

import com.ammann.funnel.model.ActorEvents;
import com.ammann.funnel.model.Event;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.jboss.logging.Logger;

/**
 * Event source over actors held in memory.
 *
 * <p>Applies the query's actor, date range and event name filters and returns every actor's
 * events ordered by timestamp. Actors left with no events are still returned so they show up
 * with zero progress.
 */
public class InMemoryEventSource implements EventSource {

    private static final Logger LOG = Logger.getLogger(InMemoryEventSource.class);

    private final List<ActorEvents> actors;

    public InMemoryEventSource(Collection<ActorEvents> actors) {
        this.actors = List.copyOf(actors);
    }

    public static InMemoryEventSource of(ActorEvents... actors) {
        return new InMemoryEventSource(List.of(actors));
    }

    @Override
    public Stream<ActorEvents> stream(EventSourceQuery query) {
        LOG.debugf("Streaming %d in-memory actors (actorFilter=%s, eventFilter=%s)",
                (Object) Integer.valueOf(actors.size()),
                query.actorIds() == null ? "none" : query.actorIds().size(),
                query.eventNames() == null ? "none" : query.eventNames());

        return actors.stream()
                .filter(actor -> query.actorIds() == null || query.actorIds().contains(actor.actorId()))
                .map(actor -> actor.withEvents(filterEvents(actor.events(), query)));
    }

    private static List<Event> filterEvents(List<Event> events, EventSourceQuery query) {
        List<Event> kept = new ArrayList<>(events.size());
        for (Event event : events) {
            if (query.dateRange() != null && !query.dateRange().contains(event.timestamp())) {
                continue;
            }
            if (query.eventNames() != null && !query.eventNames().contains(event.name())) {
                continue;
            }
            kept.add(event);
        }
        kept.sort(Comparator.comparing(Event::timestamp));
        return kept;
    }
}
