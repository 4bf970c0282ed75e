/* (C)2026 */
package com.ammann.funnel.service;

import com.ammann.funnel.model.ActorEvents;
import com.ammann.funnel.model.ActorFunnelProgress;
import com.ammann.funnel.model.Event;
import com.ammann.funnel.model.ExclusionRule;
import com.ammann.funnel.model.FunnelSpec;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Invalidates actor progress when an excluded event occurs inside a rule's step range.
 *
 * <p>The range of a rule is the open interval between the reach times of its {@code fromStep}
 * and {@code toStep}. When {@code toStep} was never reached the range ends one conversion window
 * after {@code fromStep}. A firing rule marks the actor excluded and clamps the furthest step to
 * the rule's {@code fromStep}; the most restrictive firing rule wins. Exclusions never add steps.
 */
@ApplicationScoped
public class ExclusionFilter {

    /**
     * Applies every exclusion rule of the funnel.
     *
     * @param progress matched progress
     * @param actor    the actor whose events are scanned
     * @param spec     the funnel
     * @return the input progress when no rule fires, otherwise a downgraded copy
     */
    public ActorFunnelProgress apply(ActorFunnelProgress progress, ActorEvents actor, FunnelSpec spec) {
        if (spec.exclusions().isEmpty() || progress.furthestStep() == 0) {
            return progress;
        }

        int clamp = Integer.MAX_VALUE;
        for (ExclusionRule rule : spec.exclusions()) {
            if (rule.fromStep() < clamp && fires(rule, progress, actor, spec)) {
                clamp = rule.fromStep();
            }
        }
        if (clamp == Integer.MAX_VALUE) {
            return progress;
        }

        int furthest = Math.min(progress.furthestStep(), clamp);
        List<Instant> timestamps = new ArrayList<>(progress.stepTimestamps());
        for (int i = furthest; i < timestamps.size(); i++) {
            timestamps.set(i, null);
        }
        return new ActorFunnelProgress(
                progress.actorId(), furthest, timestamps, true, progress.breakdownValue());
    }

    private boolean fires(ExclusionRule rule, ActorFunnelProgress progress, ActorEvents actor, FunnelSpec spec) {
        Instant from = progress.stepTime(rule.fromStep()).orElse(null);
        if (from == null) {
            return false;
        }
        Instant to = progress.stepTime(rule.toStep())
                .orElseGet(() -> from.plus(spec.window().asDuration()));

        for (Event event : actor.events()) {
            Instant ts = event.timestamp();
            if (!ts.isAfter(from)) {
                continue;
            }
            if (!ts.isBefore(to)) {
                break;
            }
            if (rule.matches(event, actor)) {
                return true;
            }
        }
        return false;
    }
}
