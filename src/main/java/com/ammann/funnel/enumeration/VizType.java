/* (C)2026 */
package com.ammann.funnel.enumeration;

/**
 * Result shape requested from a funnel computation.
 */
public enum VizType {
    /** Per-step conversion counts. */
    STEPS,

    /** Per-period started/ended cohorts. */
    TRENDS,

    /** Histogram of conversion durations. */
    TIME_TO_CONVERT
}
