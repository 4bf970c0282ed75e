/* (C)2026 */
package com.ammann.funnel.service;

import com.ammann.funnel.model.ConversionWindow;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.time.Instant;

/**
 * Evaluates the conversion window constraint between two instants.
 *
 * <p>Windows are exact durations on the UTC instant line; see
 * {@link com.ammann.funnel.enumeration.WindowUnit}.
 */
@ApplicationScoped
public class WindowEvaluator {

    /**
     * Returns true if {@code candidate} lies in {@code [anchor, anchor + window]}.
     *
     * @param anchor    window start
     * @param candidate instant being tested
     * @param window    conversion window
     * @return whether the candidate is inside the window
     */
    public boolean withinWindow(Instant anchor, Instant candidate, ConversionWindow window) {
        return withinWindow(anchor, candidate, window.asDuration());
    }

    /**
     * Duration variant of {@link #withinWindow(Instant, Instant, ConversionWindow)} used by the
     * hot matching loop, which converts the window once per funnel.
     */
    public boolean withinWindow(Instant anchor, Instant candidate, Duration window) {
        if (candidate.isBefore(anchor)) {
            return false;
        }
        return Duration.between(anchor, candidate).compareTo(window) <= 0;
    }

    /**
     * Returns the last instant still inside the window opened at {@code anchor}.
     */
    public Instant windowEnd(Instant anchor, ConversionWindow window) {
        return anchor.plus(window.asDuration());
    }
}
