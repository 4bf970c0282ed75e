/* (C)2026 */
package com.ammann.funnel.model;

import com.ammann.funnel.enumeration.CorrelationType;
import java.util.List;
import java.util.Set;

/**
 * Candidate dimensions for a correlation analysis.
 *
 * @param type               candidate family
 * @param propertyNames      actor properties (PROPERTIES) or event properties
 *                           (EVENT_WITH_PROPERTIES); {@code $all} or empty means every property
 * @param excludedEventNames event names never reported (EVENTS)
 * @param eventName          the event whose properties are analysed (EVENT_WITH_PROPERTIES)
 */
public record CorrelationSpec(
        CorrelationType type,
        List<String> propertyNames,
        Set<String> excludedEventNames,
        String eventName) {

    /** Wildcard selecting every property. */
    public static final String ALL_PROPERTIES = "$all";

    public CorrelationSpec {
        type = type == null ? CorrelationType.EVENTS : type;
        propertyNames = propertyNames == null ? List.of() : List.copyOf(propertyNames);
        excludedEventNames = excludedEventNames == null ? Set.of() : Set.copyOf(excludedEventNames);
    }

    public static CorrelationSpec events() {
        return new CorrelationSpec(CorrelationType.EVENTS, List.of(), Set.of(), null);
    }

    public static CorrelationSpec properties(String... names) {
        return new CorrelationSpec(CorrelationType.PROPERTIES, List.of(names), Set.of(), null);
    }

    public static CorrelationSpec eventProperties(String eventName, String... names) {
        return new CorrelationSpec(
                CorrelationType.EVENT_WITH_PROPERTIES, List.of(names), Set.of(), eventName);
    }

    public boolean includesAllProperties() {
        return propertyNames.isEmpty() || propertyNames.contains(ALL_PROPERTIES);
    }
}
