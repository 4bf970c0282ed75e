/* (C)2026 */
package com.ammann.funnel.enumeration;

/**
 * How a step's count is interpreted for display. Does not change step reachability.
 */
public enum AggregationKind {
    /** Every occurrence counts. */
    TOTAL,

    /** Only the actor's first ever occurrence counts. */
    FIRST_TIME_FOR_USER
}
