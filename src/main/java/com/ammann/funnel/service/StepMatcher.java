/* (C)2026 */
package com.ammann.funnel.service;

import com.ammann.funnel.enumeration.FunnelStepReference;
import com.ammann.funnel.enumeration.OrderMode;
import com.ammann.funnel.enumeration.StrictOutOfOrderPolicy;
import com.ammann.funnel.exception.PreconditionViolationException;
import com.ammann.funnel.model.ActorEvents;
import com.ammann.funnel.model.ActorFunnelProgress;
import com.ammann.funnel.model.BreakdownValue;
import com.ammann.funnel.model.Event;
import com.ammann.funnel.model.FunnelSpec;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Matches one actor's event stream against a funnel and produces its {@link ActorFunnelProgress}.
 *
 * <p>Every event that can open the funnel is a candidate anchor and the run reaching the most
 * steps wins, the earliest anchor on ties. A single event advances at most one step, so
 * repeated steps such as {@code A -> A} need two distinct events.
 *
 * <ul>
 *   <li><b>ORDERED</b>: later steps may occur any time after the previous one, other events in
 *       between are skipped. With a PREVIOUS window reference a repeated occurrence of the last
 *       reached step restarts the clock for the next one.</li>
 *   <li><b>STRICT</b>: each step must be the very next event. What happens to an event matching
 *       a different funnel step is governed by {@code funnel.strict.out-of-order-policy}.</li>
 *   <li><b>UNORDERED</b>: the steps satisfied from an anchor are the largest set of distinct
 *       steps the events inside the anchor's window can cover, one event per step. The window is
 *       always measured from the anchor. Step times are recorded in satisfaction order.</li>
 * </ul>
 *
 * <p>All anchors are evaluated in one forward pass over the events. Ordered and strict runs that
 * reached the same number of steps are kept together in a queue per step, oldest anchor first,
 * and move on as a group. Unordered anchors slide a window over the stream and keep per-window
 * counts. Only the winning anchor is replayed to recover its step times.
 *
 * <p>Exclusions are applied after the scan. The matcher reads no cross-actor state and is safe
 * to call from concurrent workers.
 */
@ApplicationScoped
public class StepMatcher {

    private static final Logger LOG = Logger.getLogger(StepMatcher.class);

    @ConfigProperty(name = "funnel.strict.out-of-order-policy", defaultValue = "BREAK_RUN")
    StrictOutOfOrderPolicy outOfOrderPolicy = StrictOutOfOrderPolicy.BREAK_RUN;

    @ConfigProperty(name = "funnel.events.sort-unsorted", defaultValue = "false")
    boolean sortUnsorted = false;

    private final WindowEvaluator windowEvaluator;
    private final ExclusionFilter exclusionFilter;
    private final BreakdownResolver breakdownResolver;

    @Inject
    public StepMatcher(
            WindowEvaluator windowEvaluator,
            ExclusionFilter exclusionFilter,
            BreakdownResolver breakdownResolver) {
        this.windowEvaluator = windowEvaluator;
        this.exclusionFilter = exclusionFilter;
        this.breakdownResolver = breakdownResolver;
    }

    /**
     * Matches one actor.
     *
     * @param actor the actor and its events, sorted ascending by timestamp
     * @param spec  a validated funnel
     * @return the actor's progress with exclusions applied and a raw breakdown key
     * @throws PreconditionViolationException if events are unsorted and defensive sorting is off
     */
    public ActorFunnelProgress matchActor(ActorEvents actor, FunnelSpec spec) {
        ActorEvents sorted = ensureSorted(actor);
        List<Event> events = sorted.events();
        int stepCount = spec.stepCount();

        if (events.isEmpty()) {
            return ActorFunnelProgress.empty(
                    actor.actorId(), stepCount,
                    breakdownResolver.extractValue(sorted, null, 0, spec.breakdown()));
        }

        boolean[][] hits = new boolean[events.size()][stepCount];
        for (int e = 0; e < events.size(); e++) {
            Event event = events.get(e);
            for (int s = 0; s < stepCount; s++) {
                hits[e][s] = spec.steps().get(s).matches(event, sorted);
            }
        }

        Duration window = spec.window().asDuration();
        MatchRun best = switch (spec.orderMode()) {
            case ORDERED, STRICT -> replay(events, hits, sequential(events, hits, spec, window), spec, window);
            case UNORDERED -> unordered(events, hits, spec, window);
        };

        BreakdownValue breakdownValue = breakdownResolver.extractValue(
                sorted, Arrays.asList(best.events), best.reached, spec.breakdown());
        ActorFunnelProgress progress = new ActorFunnelProgress(
                actor.actorId(), best.reached, Arrays.asList(best.times), false, breakdownValue);

        return exclusionFilter.apply(progress, sorted, spec);
    }

    /**
     * Finds the winning anchor of an ordered or strict funnel in a single pass.
     *
     * <p>{@code waiting.get(k)} holds the open runs that reached {@code k} steps and wait for
     * step index {@code k}, sorted by anchor. An earlier open anchor never trails a later one,
     * so a group that advances is appended behind the runs already waiting one step further.
     * Ordered runs with a PREVIOUS reference share their clock per step, so only the oldest run
     * of a group is kept.
     */
    private Outcome sequential(List<Event> events, boolean[][] hits, FunnelSpec spec, Duration window) {
        int stepCount = spec.stepCount();
        boolean strict = spec.orderMode() == OrderMode.STRICT;
        boolean fromPrevious = spec.windowReference() == FunnelStepReference.PREVIOUS;
        boolean shared = !strict && fromPrevious;

        List<ArrayDeque<OpenRun>> waiting = new ArrayList<>(stepCount);
        for (int k = 0; k < stepCount; k++) {
            waiting.add(new ArrayDeque<>());
        }
        Instant[] lastHit = new Instant[stepCount];
        Outcome outcome = new Outcome();

        for (int e = 0; e < events.size(); e++) {
            Instant ts = events.get(e).timestamp();

            if (!strict && !fromPrevious) {
                for (int k = 1; k < stepCount; k++) {
                    ArrayDeque<OpenRun> runs = waiting.get(k);
                    while (!runs.isEmpty()
                            && !windowEvaluator.withinWindow(runs.peekFirst().anchorTime, ts, window)) {
                        outcome.close(runs.pollFirst(), k);
                    }
                }
            }

            // highest step first so one event never advances a run twice
            for (int k = stepCount - 1; k >= 1; k--) {
                ArrayDeque<OpenRun> runs = waiting.get(k);
                if (runs.isEmpty()) {
                    continue;
                }
                if (!hits[e][k]) {
                    if (strict && (outOfOrderPolicy == StrictOutOfOrderPolicy.BREAK_RUN || !anyStep(hits[e]))) {
                        closeAll(runs, k, outcome);
                    }
                    continue;
                }
                if (strict) {
                    while (!runs.isEmpty() && !windowEvaluator.withinWindow(
                            fromPrevious ? runs.peekFirst().reachedAt : runs.peekFirst().anchorTime, ts, window)) {
                        outcome.close(runs.pollFirst(), k);
                    }
                    if (runs.isEmpty()) {
                        continue;
                    }
                } else if (fromPrevious && !windowEvaluator.withinWindow(lastHit[k - 1], ts, window)) {
                    continue;
                }

                if (k + 1 == stepCount) {
                    outcome.close(runs.peekFirst(), stepCount);
                    return outcome;
                }
                ArrayDeque<OpenRun> next = waiting.get(k + 1);
                for (OpenRun run : runs) {
                    run.reachedAt = ts;
                    if (!shared || next.isEmpty()) {
                        next.addLast(run);
                    }
                }
                runs.clear();
            }

            if (hits[e][0] && (!shared || waiting.get(1).isEmpty())) {
                waiting.get(1).addLast(new OpenRun(e, ts));
            }
            for (int s = 0; s < stepCount; s++) {
                if (hits[e][s]) {
                    lastHit[s] = ts;
                }
            }
        }

        for (int k = 1; k < stepCount; k++) {
            closeAll(waiting.get(k), k, outcome);
        }
        return outcome;
    }

    private static void closeAll(ArrayDeque<OpenRun> runs, int reached, Outcome outcome) {
        for (OpenRun run : runs) {
            outcome.close(run, reached);
        }
        runs.clear();
    }

    private MatchRun replay(
            List<Event> events, boolean[][] hits, Outcome outcome, FunnelSpec spec, Duration window) {
        if (outcome.anchor < 0) {
            return new MatchRun(spec.stepCount());
        }
        return spec.orderMode() == OrderMode.STRICT
                ? strict(events, hits, outcome.anchor, spec, window)
                : ordered(events, hits, outcome.anchor, spec, window);
    }

    private MatchRun ordered(
            List<Event> events, boolean[][] hits, int anchor, FunnelSpec spec, Duration window) {
        int stepCount = spec.stepCount();
        boolean fromPrevious = spec.windowReference() == FunnelStepReference.PREVIOUS;
        Instant anchorTime = events.get(anchor).timestamp();

        MatchRun run = new MatchRun(stepCount);
        run.advance(events.get(anchor));
        Instant latestPredecessor = anchorTime;

        for (int e = anchor + 1; e < events.size() && run.reached < stepCount; e++) {
            Instant ts = events.get(e).timestamp();
            if (!fromPrevious && !windowEvaluator.withinWindow(anchorTime, ts, window)) {
                break;
            }
            Instant reference = fromPrevious ? latestPredecessor : anchorTime;
            if (hits[e][run.reached] && windowEvaluator.withinWindow(reference, ts, window)) {
                run.advance(events.get(e));
                latestPredecessor = ts;
            } else if (fromPrevious && hits[e][run.reached - 1]) {
                latestPredecessor = ts;
            }
        }
        return run;
    }

    private MatchRun strict(
            List<Event> events, boolean[][] hits, int anchor, FunnelSpec spec, Duration window) {
        int stepCount = spec.stepCount();
        boolean fromPrevious = spec.windowReference() == FunnelStepReference.PREVIOUS;
        Instant anchorTime = events.get(anchor).timestamp();

        MatchRun run = new MatchRun(stepCount);
        run.advance(events.get(anchor));

        for (int e = anchor + 1; e < events.size() && run.reached < stepCount; e++) {
            Instant ts = events.get(e).timestamp();
            if (hits[e][run.reached]) {
                Instant reference = fromPrevious ? run.times[run.reached - 1] : anchorTime;
                if (!windowEvaluator.withinWindow(reference, ts, window)) {
                    break;
                }
                run.advance(events.get(e));
            } else if (outOfOrderPolicy == StrictOutOfOrderPolicy.BREAK_RUN || !anyStep(hits[e])) {
                break;
            }
        }
        return run;
    }

    private MatchRun unordered(List<Event> events, boolean[][] hits, FunnelSpec spec, Duration window) {
        int stepCount = spec.stepCount();
        List<BitSet> signatures = new ArrayList<>(events.size());
        for (boolean[] eventHits : hits) {
            BitSet signature = new BitSet(stepCount);
            for (int s = 0; s < stepCount; s++) {
                if (eventHits[s]) {
                    signature.set(s);
                }
            }
            signatures.add(signature);
        }

        // events in [anchor, end) grouped by the set of steps they match
        Map<BitSet, Integer> inWindow = new HashMap<>();
        int end = 0;
        int bestAnchor = -1;
        int bestReached = 0;
        for (int anchor = 0; anchor < events.size() && bestReached < stepCount; anchor++) {
            Instant anchorTime = events.get(anchor).timestamp();
            while (end < events.size()
                    && windowEvaluator.withinWindow(anchorTime, events.get(end).timestamp(), window)) {
                if (!signatures.get(end).isEmpty()) {
                    inWindow.merge(signatures.get(end), 1, Integer::sum);
                }
                end++;
            }
            BitSet anchorSignature = signatures.get(anchor);
            if (anchorSignature.isEmpty()) {
                continue;
            }
            int reached = coveredSteps(inWindow, stepCount);
            if (reached > bestReached) {
                bestReached = reached;
                bestAnchor = anchor;
            }
            inWindow.computeIfPresent(anchorSignature, (k, count) -> count == 1 ? null : count - 1);
        }

        if (bestAnchor < 0) {
            return new MatchRun(stepCount);
        }
        return assignUnordered(events, signatures, bestAnchor, bestReached, stepCount, window);
    }

    /**
     * Size of the largest step assignment the grouped events allow, each event covering one step.
     */
    private static int coveredSteps(Map<BitSet, Integer> inWindow, int stepCount) {
        List<BitSet> groups = new ArrayList<>(inWindow.keySet());
        int[] capacity = new int[groups.size()];
        for (int g = 0; g < groups.size(); g++) {
            capacity[g] = Math.min(inWindow.get(groups.get(g)), stepCount);
        }
        int[] load = new int[groups.size()];
        int[] assigned = new int[stepCount];
        Arrays.fill(assigned, -1);

        int covered = 0;
        for (int step = 0; step < stepCount; step++) {
            if (assignStep(step, groups, capacity, load, assigned, new boolean[groups.size()])) {
                covered++;
            }
        }
        return covered;
    }

    private static boolean assignStep(
            int step, List<BitSet> groups, int[] capacity, int[] load, int[] assigned, boolean[] visited) {
        for (int g = 0; g < groups.size(); g++) {
            if (visited[g] || !groups.get(g).get(step)) {
                continue;
            }
            visited[g] = true;
            if (load[g] < capacity[g]) {
                assigned[step] = g;
                load[g]++;
                return true;
            }
            for (int other = 0; other < assigned.length; other++) {
                if (assigned[other] == g && assignStep(other, groups, capacity, load, assigned, visited)) {
                    assigned[step] = g;
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Picks the events covering {@code reached} steps from the anchor, earliest events first.
     */
    private MatchRun assignUnordered(
            List<Event> events, List<BitSet> signatures, int anchor, int reached, int stepCount, Duration window) {
        Instant anchorTime = events.get(anchor).timestamp();
        int[] owner = new int[stepCount];
        Arrays.fill(owner, -1);

        int covered = 0;
        for (int e = anchor; e < events.size() && covered < reached; e++) {
            if (!windowEvaluator.withinWindow(anchorTime, events.get(e).timestamp(), window)) {
                break;
            }
            if (!signatures.get(e).isEmpty() && claim(e, signatures, owner, new boolean[stepCount])) {
                covered++;
            }
        }

        int[] chosen = Arrays.stream(owner).filter(index -> index >= 0).sorted().toArray();
        MatchRun run = new MatchRun(stepCount);
        for (int index : chosen) {
            run.advance(events.get(index));
        }
        return run;
    }

    private static boolean claim(int event, List<BitSet> signatures, int[] owner, boolean[] visited) {
        BitSet signature = signatures.get(event);
        for (int s = signature.nextSetBit(0); s >= 0; s = signature.nextSetBit(s + 1)) {
            if (visited[s]) {
                continue;
            }
            visited[s] = true;
            if (owner[s] < 0 || claim(owner[s], signatures, owner, visited)) {
                owner[s] = event;
                return true;
            }
        }
        return false;
    }

    ActorEvents ensureSorted(ActorEvents actor) {
        List<Event> events = actor.events();
        for (int i = 1; i < events.size(); i++) {
            Instant previous = events.get(i - 1).timestamp();
            Instant current = events.get(i).timestamp();
            if (current.isBefore(previous)) {
                if (!sortUnsorted) {
                    throw PreconditionViolationException.unsortedEvents(actor.actorId(), i, previous, current);
                }
                LOG.warnf("Events of actor '%s' are not sorted by timestamp, sorting %d events defensively",
                        actor.actorId(), events.size());
                List<Event> copy = new ArrayList<>(events);
                copy.sort(Comparator.comparing(Event::timestamp));
                return actor.withEvents(copy);
            }
        }
        return actor;
    }

    private static boolean anyStep(boolean[] stepHits) {
        for (boolean hit : stepHits) {
            if (hit) {
                return true;
            }
        }
        return false;
    }

    /**
     * Mutable scratch state of one candidate run. Never escapes the matcher.
     */
    private static final class MatchRun {
        private final Instant[] times;
        private final Event[] events;
        private int reached;

        MatchRun(int stepCount) {
            this.times = new Instant[stepCount];
            this.events = new Event[stepCount];
        }

        void advance(Event event) {
            times[reached] = event.timestamp();
            events[reached] = event;
            reached++;
        }
    }

    /**
     * An anchor still able to advance during the single pass.
     */
    private static final class OpenRun {
        private final int anchor;
        private final Instant anchorTime;
        private Instant reachedAt;

        OpenRun(int anchor, Instant anchorTime) {
            this.anchor = anchor;
            this.anchorTime = anchorTime;
            this.reachedAt = anchorTime;
        }
    }

    /**
     * Best closed run so far: most steps, then earliest anchor.
     */
    private static final class Outcome {
        private int anchor = -1;
        private int reached;

        void close(OpenRun run, int runReached) {
            if (runReached > reached || (runReached == reached && anchor >= 0 && run.anchor < anchor)) {
                reached = runReached;
                anchor = run.anchor;
            }
        }
    }
}
