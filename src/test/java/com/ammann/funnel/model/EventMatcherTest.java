/* (C)2026 */
package com.ammann.funnel.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.funnel.enumeration.PropertyOperator;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EventMatcherTest {

    private static final Instant TS = Instant.parse("2021-05-01T00:00:00Z");
    private static final ActorEvents ACTOR = ActorEvents.of("u1", List.of());

    @Test
    void namedMatcherComparesEventName() {
        EventMatcher matcher = EventMatcher.event("sign up");

        assertThat(matcher.matches(Event.of("sign up", TS), ACTOR)).isTrue();
        assertThat(matcher.matches(Event.of("Sign Up", TS), ACTOR)).isFalse();
        assertThat(matcher.referencedEventNames()).containsExactly("sign up");
        assertThat(matcher.displayName()).isEqualTo("sign up");
    }

    @Test
    void anyEventMatcherMatchesEverythingAndReferencesNothing() {
        EventMatcher matcher = EventMatcher.anyEvent();

        assertThat(matcher.matches(Event.of("whatever", TS), ACTOR)).isTrue();
        assertThat(matcher.referencedEventNames()).isNull();
        assertThat(matcher.displayName()).isEqualTo("All events");
    }

    @Test
    void actionMatchesAnyOfItsStepsWithFilters() {
        EventMatcher checkout = EventMatcher.action(7, "checkout", List.of(
                new ActionStep("buy", PropertyFilter.event("amount", PropertyOperator.GT, 0)),
                new ActionStep("subscribe", null)));

        assertThat(checkout.matches(Event.of("buy", TS, Map.of("amount", 10)), ACTOR)).isTrue();
        assertThat(checkout.matches(Event.of("buy", TS, Map.of("amount", 0)), ACTOR)).isFalse();
        assertThat(checkout.matches(Event.of("subscribe", TS), ACTOR)).isTrue();
        assertThat(checkout.matches(Event.of("refund", TS), ACTOR)).isFalse();
        assertThat(checkout.referencedEventNames()).containsExactly("buy", "subscribe");
        assertThat(checkout.displayName()).isEqualTo("checkout");
    }

    @Test
    void actionWithWildcardStepReferencesEveryEvent() {
        EventMatcher anything = EventMatcher.action(8, null, List.of(new ActionStep(null, null)));

        assertThat(anything.referencedEventNames()).isNull();
        assertThat(anything.displayName()).isEqualTo("action 8");
    }
}
