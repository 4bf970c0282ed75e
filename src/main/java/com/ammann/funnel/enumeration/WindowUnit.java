/* (C)2026 */
package com.ammann.funnel.enumeration;

import java.time.Duration;

/**
 * Units for conversion windows.
 *
 * <p>Every unit maps to a fixed duration with no calendar arithmetic: a day is always
 * 24 hours, a week 7 days and a month 30 days, independent of time zone or DST.
 */
public enum WindowUnit {
    SECOND(Duration.ofSeconds(1)),
    MINUTE(Duration.ofMinutes(1)),
    HOUR(Duration.ofHours(1)),
    DAY(Duration.ofDays(1)),
    WEEK(Duration.ofDays(7)),
    MONTH(Duration.ofDays(30));

    private final Duration unitDuration;

    WindowUnit(Duration unitDuration) {
        this.unitDuration = unitDuration;
    }

    /**
     * Returns {@code amount} units as a fixed duration.
     *
     * @param amount number of units
     * @return the total duration
     */
    public Duration toDuration(long amount) {
        return unitDuration.multipliedBy(amount);
    }

    public Duration getUnitDuration() { return unitDuration; }
}
