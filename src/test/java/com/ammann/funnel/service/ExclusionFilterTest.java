/* (C)2026 */
package com.ammann.funnel.service;

import static com.ammann.funnel.support.JourneyFactory.actor;
import static com.ammann.funnel.support.JourneyFactory.event;
import static com.ammann.funnel.support.JourneyFactory.may;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.funnel.enumeration.PropertyOperator;
import com.ammann.funnel.model.ActorEvents;
import com.ammann.funnel.model.ActorFunnelProgress;
import com.ammann.funnel.model.BreakdownValue;
import com.ammann.funnel.model.ConversionWindow;
import com.ammann.funnel.model.EventMatcher;
import com.ammann.funnel.model.ExclusionRule;
import com.ammann.funnel.model.FunnelSpec;
import com.ammann.funnel.model.PropertyFilter;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExclusionFilterTest
{

    private final ExclusionFilter filter = new ExclusionFilter();

    private static ActorFunnelProgress progress(Instant... times)
    {
        int reached = (int) Arrays.stream(times).filter(t -> t != null).count();
        return new ActorFunnelProgress("u1", reached, Arrays.asList(times), false, BreakdownValue.NONE);
    }

    private static FunnelSpec funnel(ExclusionRule... rules)
    {
        FunnelSpec.Builder builder = FunnelSpec.builder().events("A", "B", "C").window(ConversionWindow.days(2));
        for (ExclusionRule rule : rules) {
            builder.exclusion(rule);
        }
        return builder.build();
    }

    @Test
    void noMatchingEventKeepsProgressUntouched()
    {
        ActorFunnelProgress matched = progress(may(1, 0), may(1, 2), may(1, 4));
        ActorEvents actor = actor("u1", event("A", may(1, 0)), event("Y", may(1, 1)), event("B", may(1, 2)));

        assertThat(filter.apply(matched, actor, funnel(ExclusionRule.of("X", 0, 1)))).isSameAs(matched);
    }

    @Test
    void excludedEventClampsToFromStep()
    {
        ActorFunnelProgress matched = progress(may(1, 0), may(1, 2), may(1, 4));
        ActorEvents actor = actor("u1",
                event("A", may(1, 0)), event("B", may(1, 2)), event("X", may(1, 3)), event("C", may(1, 4)));

        ActorFunnelProgress result = filter.apply(matched, actor, funnel(ExclusionRule.of("X", 1, 2)));

        assertThat(result.excluded()).isTrue();
        assertThat(result.furthestStep()).isEqualTo(1);
        assertThat(result.stepTimestamps()).containsExactly(may(1, 0), null, null);
    }

    @Test
    void boundariesAreExclusive()
    {
        ActorFunnelProgress matched = progress(may(1, 0), may(1, 2), null);
        ActorEvents actor = actor("u1",
                event("X", may(1, 0)), event("A", may(1, 0)), event("B", may(1, 2)), event("X", may(1, 2)));

        assertThat(filter.apply(matched, actor, funnel(ExclusionRule.of("X", 0, 1))).excluded()).isFalse();
    }

    @Test
    void unreachedToStepUsesWindowEndAsRangeEnd()
    {
        ActorFunnelProgress matched = progress(may(1, 0), null, null);
        ActorEvents inWindow = actor("u1", event("A", may(1, 0)), event("X", may(2, 12)));
        ActorEvents afterWindow = actor("u1", event("A", may(1, 0)), event("X", may(3, 1)));
        FunnelSpec spec = funnel(ExclusionRule.of("X", 0, 1));

        assertThat(filter.apply(matched, inWindow, spec).excluded()).isTrue();
        assertThat(filter.apply(matched, afterWindow, spec).excluded()).isFalse();
    }

    @Test
    void mostRestrictiveFiringRuleWins()
    {
        ActorFunnelProgress matched = progress(may(1, 0), may(1, 2), may(1, 4));
        ActorEvents actor = actor("u1",
                event("A", may(1, 0)), event("X", may(1, 1)), event("B", may(1, 2)),
                event("Y", may(1, 3)), event("C", may(1, 4)));

        ActorFunnelProgress result = filter.apply(matched, actor,
                funnel(ExclusionRule.of("Y", 1, 2), ExclusionRule.of("X", 0, 2)));

        assertThat(result.furthestStep()).isZero();
    }

    @Test
    void exclusionFilterRestrictsMatchingEvents()
    {
        ActorFunnelProgress matched = progress(may(1, 0), may(1, 2), may(1, 4));
        ExclusionRule onlyRefunds = new ExclusionRule(
                EventMatcher.event("payment"),
                PropertyFilter.event("status", PropertyOperator.EXACT, "refunded"),
                0, 2);
        ActorEvents paid = actor("u1", event("payment", may(1, 1), Map.of("status", "ok")));
        ActorEvents refunded = actor("u1", event("payment", may(1, 1), Map.of("status", "refunded")));

        assertThat(filter.apply(matched, paid, funnel(onlyRefunds)).excluded()).isFalse();
        assertThat(filter.apply(matched, refunded, funnel(onlyRefunds)).excluded()).isTrue();
    }

    @Test
    void actorsThatNeverEnteredAreNotExcluded()
    {
        ActorFunnelProgress none = ActorFunnelProgress.empty("u1", 3, BreakdownValue.NONE);
        ActorEvents actor = actor("u1", event("X", may(1, 1)));

        assertThat(filter.apply(none, actor, funnel(ExclusionRule.of("X", 0, 1)))).isSameAs(none);
    }
}
