/* (C)2026 */
package com.ammann.funnel.enumeration;

/**
 * Strict-mode handling of an event that matches a funnel step other than the one expected next.
 */
public enum StrictOutOfOrderPolicy {
    /** Any event other than the expected step ends the current run. */
    BREAK_RUN,

    /**
     * Events matching some other funnel step are skipped; events matching no step still end
     * the run.
     */
    IGNORE
}
