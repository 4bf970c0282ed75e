/* (C)2026 */
package com.ammann.funnel.enumeration;

/**
 * Reference point for conversion windows and conversion rates.
 */
public enum FunnelStepReference {
    /** Relative to the first step of the funnel. */
    TOTAL,

    /** Relative to the immediately preceding step. */
    PREVIOUS
}
