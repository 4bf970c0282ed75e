/* (C)2026 */
package com.ammann.funnel.model;

import com.ammann.funnel.enumeration.WindowUnit;
import java.time.Duration;

/**
 * Maximum time allowed for conversion, expressed as an amount of fixed-length units.
 *
 * @param amount number of units, must be positive
 * @param unit   window unit
 */
public record ConversionWindow(int amount, WindowUnit unit) {

    /** Fourteen days. */
    public static final ConversionWindow DEFAULT = new ConversionWindow(14, WindowUnit.DAY);

    public static ConversionWindow of(int amount, WindowUnit unit) {
        return new ConversionWindow(amount, unit);
    }

    public static ConversionWindow days(int amount) {
        return new ConversionWindow(amount, WindowUnit.DAY);
    }

    public Duration asDuration() {
        return unit.toDuration(amount);
    }
}
