/* (C)2026 */
package com.ammann.funnel.service;

import static com.ammann.funnel.support.JourneyFactory.actor;
import static com.ammann.funnel.support.JourneyFactory.at;
import static com.ammann.funnel.support.JourneyFactory.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.funnel.dto.CorrelationEventDTO;
import com.ammann.funnel.dto.FunnelCorrelationResultDTO;
import com.ammann.funnel.enumeration.CorrelationOutcome;
import com.ammann.funnel.enumeration.CorrelationType;
import com.ammann.funnel.enumeration.PropertyOperator;
import com.ammann.funnel.model.ActionStep;
import com.ammann.funnel.model.ActorEvents;
import com.ammann.funnel.model.ActorFunnelProgress;
import com.ammann.funnel.model.ConversionWindow;
import com.ammann.funnel.model.CorrelationSpec;
import com.ammann.funnel.model.Event;
import com.ammann.funnel.model.EventMatcher;
import com.ammann.funnel.model.FunnelSpec;
import com.ammann.funnel.model.PropertyFilter;
import com.ammann.funnel.support.JourneyFactory;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Unit tests for {@link CorrelationAnalyzer}.
 */
class CorrelationAnalyzerTest
{

    private static final Instant SIGNED_UP = at(2020, 1, 2, 14);
    private static final Instant MIDDLE = at(2020, 1, 3, 14);
    private static final Instant PAID = at(2020, 1, 4, 14);

    private static final FunnelSpec SIGNUP_TO_PAID = FunnelSpec.builder().events("user signed up", "paid").build();

    private final StepMatcher matcher = JourneyFactory.stepMatcher();
    private final CorrelationAnalyzer analyzer = new CorrelationAnalyzer();

    private FunnelCorrelationResultDTO correlate(List<ActorEvents> actors, FunnelSpec spec, CorrelationSpec correlation)
    {
        List<ActorFunnelProgress> progresses = actors.stream().map(a -> matcher.matchActor(a, spec)).toList();
        return analyzer.correlate(actors, progresses, spec, correlation);
    }

    /** Ten converting actors, half of them firing a related event, and ten dropping actors likewise. */
    private static List<ActorEvents> relatedEventPopulation()
    {
        List<ActorEvents> actors = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            List<Event> events = new ArrayList<>();
            events.add(event("user signed up", SIGNED_UP));
            if (i % 2 == 0) {
                events.add(event("positively_related", MIDDLE));
            }
            events.add(event("paid", PAID));
            actors.add(ActorEvents.of("user_" + i, events));
        }
        for (int i = 10; i < 20; i++) {
            List<Event> events = new ArrayList<>();
            events.add(event("user signed up", SIGNED_UP));
            if (i % 2 == 0) {
                events.add(event("negatively_related", MIDDLE));
            }
            actors.add(ActorEvents.of("user_" + i, events));
        }
        return actors;
    }

    private static CorrelationEventDTO entry(FunnelCorrelationResultDTO result, String candidate)
    {
        return result.events().stream()
                .filter(e -> e.event().equals(candidate))
                .findFirst()
                .orElseThrow(() -> new AssertionError("missing candidate " + candidate));
    }

    @Test
    void relatedEventsAreSplitBySuccessAndFailure()
    {
        FunnelCorrelationResultDTO result =
                correlate(relatedEventPopulation(), SIGNUP_TO_PAID, CorrelationSpec.events());

        assertThat(result.events()).extracting(CorrelationEventDTO::event)
                .containsExactly("positively_related", "negatively_related");
        assertThat(result.events().get(0).oddsRatio()).isCloseTo(11.0, within(1e-9));
        assertThat(result.events().get(0).successCount()).isEqualTo(5);
        assertThat(result.events().get(0).failureCount()).isZero();
        assertThat(result.events().get(0).correlationType()).isEqualTo(CorrelationOutcome.SUCCESS);
        assertThat(result.events().get(1).oddsRatio()).isCloseTo(1.0 / 11, within(1e-9));
        assertThat(result.events().get(1).correlationType()).isEqualTo(CorrelationOutcome.FAILURE);
        assertThat(result.successTotal()).isEqualTo(10);
        assertThat(result.failureTotal()).isEqualTo(10);
        assertThat(result.skewed()).isFalse();
    }

    @Test
    void callerExclusionsAreNeverReported()
    {
        CorrelationSpec withoutNegative = new CorrelationSpec(
                CorrelationType.EVENTS, List.of(), Set.of("negatively_related"), null);

        FunnelCorrelationResultDTO result = correlate(relatedEventPopulation(), SIGNUP_TO_PAID, withoutNegative);

        assertThat(result.events()).extracting(CorrelationEventDTO::event).containsExactly("positively_related");
    }

    @Test
    void actionEventsAreExcludedFromCandidates()
    {
        PropertyFilter keyIsVal = PropertyFilter.event("key", PropertyOperator.EXACT, "val");
        FunnelSpec actions = FunnelSpec.builder()
                .step(EventMatcher.action(1, "user signed up", List.of(new ActionStep("user signed up", keyIsVal))), null)
                .step(EventMatcher.action(2, "paid", List.of(new ActionStep("paid", keyIsVal))), null)
                .build();
        Map<String, Object> val = Map.of("key", "val");
        List<ActorEvents> actors = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            List<Event> events = new ArrayList<>();
            events.add(event("user signed up", SIGNED_UP, val));
            events.add(event("user signed up", SIGNED_UP.plusSeconds(600)));
            if (i % 2 == 0) {
                events.add(event("positively_related", MIDDLE));
            }
            events.add(event("paid", PAID, val));
            actors.add(ActorEvents.of("user_" + i, events));
        }
        actors.add(actor("failure", event("user signed up", SIGNED_UP, val)));

        FunnelCorrelationResultDTO result = correlate(actors, actions, CorrelationSpec.events());

        assertThat(result.events()).hasSize(1);
        assertThat(result.events().get(0).event()).isEqualTo("positively_related");
        assertThat(result.events().get(0).successCount()).isEqualTo(2);
        assertThat(result.events().get(0).oddsRatio()).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void propertyValuesAreCorrelated()
    {
        List<ActorEvents> actors = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            actors.add(actor("pos_" + i, Map.of("$browser", "Positive"),
                    event("user signed up", SIGNED_UP), event("paid", PAID)));
            actors.add(actor("neg_" + i, Map.of("$browser", "Negative"), event("user signed up", SIGNED_UP)));
        }
        actors.add(actor("user_fail", Map.of("$browser", "Positive"), event("user signed up", SIGNED_UP)));
        actors.add(actor("user_succ", Map.of("$browser", "Negative"),
                event("user signed up", SIGNED_UP), event("paid", PAID)));

        FunnelCorrelationResultDTO result =
                correlate(actors, SIGNUP_TO_PAID, CorrelationSpec.properties("$browser"));

        assertThat(entry(result, "$browser::Positive").oddsRatio()).isCloseTo(121.0 / 4, within(1e-9));
        assertThat(entry(result, "$browser::Positive").successCount()).isEqualTo(10);
        assertThat(entry(result, "$browser::Positive").failureCount()).isEqualTo(1);
        assertThat(entry(result, "$browser::Negative").oddsRatio()).isCloseTo(4.0 / 121, within(1e-9));
    }

    @Test
    void unselectedPropertiesAreIgnored()
    {
        List<ActorEvents> actors = List.of(
                actor("a", Map.of("$browser", "Chrome", "plan", "pro"),
                        event("user signed up", SIGNED_UP), event("paid", PAID)),
                actor("b", Map.of("$browser", "Safari", "plan", "free"), event("user signed up", SIGNED_UP)));

        FunnelCorrelationResultDTO result = correlate(actors, SIGNUP_TO_PAID, CorrelationSpec.properties("plan"));

        assertThat(result.events()).extracting(CorrelationEventDTO::event)
                .containsExactlyInAnyOrder("plan::pro", "plan::free");
    }

    @Test
    void eventPropertiesOfTheChosenEventAreCorrelated()
    {
        List<ActorEvents> actors = List.of(
                actor("a", event("user signed up", SIGNED_UP),
                        event("checkout", MIDDLE, Map.of("coupon", "yes")), event("paid", PAID)),
                actor("b", event("user signed up", SIGNED_UP),
                        event("checkout", MIDDLE, Map.of("coupon", "no"))),
                actor("c", event("user signed up", SIGNED_UP),
                        event("browse", MIDDLE, Map.of("coupon", "no"))));

        FunnelCorrelationResultDTO result =
                correlate(actors, SIGNUP_TO_PAID, CorrelationSpec.eventProperties("checkout", "coupon"));

        assertThat(result.events()).extracting(CorrelationEventDTO::event)
                .containsExactly("checkout::coupon::yes", "checkout::coupon::no");
        assertThat(entry(result, "checkout::coupon::no").failureCount()).isEqualTo(1);
    }

    @Test
    void droppedActorsOnlyContributeEventsInsideTheWindow()
    {
        FunnelSpec oneDay = SIGNUP_TO_PAID.toBuilder()
                .window(ConversionWindow.days(1))
                .build();
        List<ActorEvents> actors = List.of(
                actor("a", event("user signed up", SIGNED_UP), event("paid", SIGNED_UP.plusSeconds(60))),
                actor("b", event("user signed up", SIGNED_UP), event("late", PAID)));

        FunnelCorrelationResultDTO result = correlate(actors, oneDay, CorrelationSpec.events());

        assertThat(result.events()).isEmpty();
        assertThat(result.failureTotal()).isEqualTo(1);
    }

    @Test
    void candidatesBelowMinimumActorCountAreDropped()
    {
        analyzer.minActorCount = 6;

        FunnelCorrelationResultDTO result =
                correlate(relatedEventPopulation(), SIGNUP_TO_PAID, CorrelationSpec.events());

        assertThat(result.events()).isEmpty();
    }

    @Test
    void eachSideIsCappedByResultLimit()
    {
        analyzer.resultLimit = 1;
        List<ActorEvents> actors = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            actors.add(actor("win_" + i, event("user signed up", SIGNED_UP),
                    event(i < 3 ? "strong" : "weak", MIDDLE), event("paid", PAID)));
            actors.add(actor("lose_" + i, event("user signed up", SIGNED_UP), event("bad_" + i % 2, MIDDLE)));
        }

        FunnelCorrelationResultDTO result = correlate(actors, SIGNUP_TO_PAID, CorrelationSpec.events());

        assertThat(result.events()).extracting(CorrelationEventDTO::event).containsExactly("strong", "bad_0");
    }

    @Test
    void smallSideBelowShareIsSkewed()
    {
        List<ActorEvents> actors = new ArrayList<>();
        actors.add(actor("winner", event("user signed up", SIGNED_UP), event("paid", PAID)));
        for (int i = 0; i < 19; i++) {
            actors.add(actor("loser_" + i, event("user signed up", SIGNED_UP)));
        }

        FunnelCorrelationResultDTO result = correlate(actors, SIGNUP_TO_PAID, CorrelationSpec.events());

        assertThat(result.skewed()).isTrue();
    }

    @Test
    void actorsOutsideTheFunnelAreIgnored()
    {
        List<ActorEvents> actors = List.of(
                actor("a", event("user signed up", SIGNED_UP), event("paid", PAID)),
                actor("stranger", event("positively_related", MIDDLE)));

        FunnelCorrelationResultDTO result = correlate(actors, SIGNUP_TO_PAID, CorrelationSpec.events());

        assertThat(result.successTotal()).isEqualTo(1);
        assertThat(result.failureTotal()).isZero();
        assertThat(result.events()).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
        "5, 0, 10, 10, 11.0",
        "0, 5, 10, 10, 0.0909090909",
        "2, 2, 2, 2, 1.0",
        "10, 1, 11, 11, 30.25",
        "0, 0, 0, 0, 1.0"
    })
    void oddsRatioUsesPriorOnEveryCell(long s, long f, long c, long d, double expected)
    {
        assertThat(CorrelationAnalyzer.oddsRatio(s, f, c, d)).isCloseTo(expected, within(1e-9));
    }

    @Test
    void oddsRatioIsSymmetric()
    {
        double forward = CorrelationAnalyzer.oddsRatio(3, 7, 12, 9);
        double swapped = CorrelationAnalyzer.oddsRatio(7, 3, 9, 12);

        assertThat(forward * swapped).isCloseTo(1.0, within(1e-9));
    }

    @ParameterizedTest
    @CsvSource({
        "2, 2, false",
        "1, 9, false",
        "1, 10, true",
        "0, 0, false",
        "0, 5, true"
    })
    void skewUsesConfiguredShare(long converted, long dropped, boolean expected)
    {
        assertThat(analyzer.isSkewed(converted, dropped)).isEqualTo(expected);
    }

    @Test
    void mergedTalliesEqualOneTally()
    {
        List<ActorEvents> actors = relatedEventPopulation();
        CorrelationAnalyzer.CorrelationTally whole = analyzer.newTally(SIGNUP_TO_PAID, CorrelationSpec.events());
        CorrelationAnalyzer.CorrelationTally left = analyzer.newTally(SIGNUP_TO_PAID, CorrelationSpec.events());
        CorrelationAnalyzer.CorrelationTally right = analyzer.newTally(SIGNUP_TO_PAID, CorrelationSpec.events());
        for (int i = 0; i < actors.size(); i++) {
            ActorFunnelProgress progress = matcher.matchActor(actors.get(i), SIGNUP_TO_PAID);
            whole.add(progress, actors.get(i));
            (i % 3 == 0 ? left : right).add(progress, actors.get(i));
        }
        left.merge(right);

        assertThat(analyzer.finish(left)).isEqualTo(analyzer.finish(whole));
    }
}
