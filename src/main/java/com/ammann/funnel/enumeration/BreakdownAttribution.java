/* (C)2026 */
package com.ammann.funnel.enumeration;

/**
 * Selects which matched event supplies an event-property breakdown value.
 */
public enum BreakdownAttribution {
    /** The event that satisfied the first step. */
    FIRST_TOUCH,

    /** The event that satisfied the furthest reached step. */
    LAST_TOUCH,

    /** The event that satisfied a specific step. */
    STEP
}
