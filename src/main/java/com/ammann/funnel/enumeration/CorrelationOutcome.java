/* (C)2026 */
package com.ammann.funnel.enumeration;

/**
 * Direction of a correlation: whether a candidate is associated with converting or dropping off.
 */
public enum CorrelationOutcome {
    /** Odds ratio above one. */
    SUCCESS,

    /** Odds ratio of one or below. */
    FAILURE;

    /**
     * Classifies an odds ratio.
     *
     * @param oddsRatio odds ratio of a candidate
     * @return SUCCESS for ratios strictly above 1, FAILURE otherwise
     */
    public static CorrelationOutcome fromOddsRatio(double oddsRatio) {
        return oddsRatio > 1.0 ? SUCCESS : FAILURE;
    }
}
