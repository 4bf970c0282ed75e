/* (C)2026 */
package com.ammann.funnel.enumeration;

/**
 * Candidate dimension family for correlation analysis.
 */
public enum CorrelationType {
    /** Names of events performed inside the funnel window. */
    EVENTS,

    /** Actor property values, labelled {@code property::value}. */
    PROPERTIES,

    /** Property values of one chosen event, labelled {@code event::property::value}. */
    EVENT_WITH_PROPERTIES
}
