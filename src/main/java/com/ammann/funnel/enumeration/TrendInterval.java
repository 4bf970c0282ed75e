/* (C)2026 */
package com.ammann.funnel.enumeration;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Calendar granularity of funnel trend periods.
 *
 * <p>Periods are calendar aligned in the date range's zone. Weeks start on Sunday.
 */
public enum TrendInterval {
    HOUR,
    DAY,
    WEEK,
    MONTH;

    /**
     * Returns the start of the period containing {@code instant}.
     *
     * @param instant point in time
     * @param zone    zone used for calendar alignment
     * @return period start as an instant
     */
    public Instant truncate(Instant instant, ZoneId zone) {
        ZonedDateTime local = instant.atZone(zone);
        ZonedDateTime start = switch (this) {
            case HOUR -> local.truncatedTo(ChronoUnit.HOURS);
            case DAY -> local.truncatedTo(ChronoUnit.DAYS);
            case WEEK -> local.truncatedTo(ChronoUnit.DAYS)
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
            case MONTH -> local.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
        };
        return start.toInstant();
    }

    /**
     * Returns the start of the period following the one starting at {@code periodStart}.
     *
     * @param periodStart an aligned period start
     * @param zone        zone used for calendar arithmetic
     * @return start of the next period
     */
    public Instant next(Instant periodStart, ZoneId zone) {
        ZonedDateTime local = periodStart.atZone(zone);
        ZonedDateTime next = switch (this) {
            case HOUR -> local.plusHours(1);
            case DAY -> local.plusDays(1);
            case WEEK -> local.plusWeeks(1);
            case MONTH -> local.plusMonths(1);
        };
        return next.toInstant();
    }

    /**
     * Case-insensitive conversion from string.
     *
     * @param value interval name
     * @return TrendInterval enum value
     * @throws IllegalArgumentException if value is null or unknown
     */
    public static TrendInterval fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("TrendInterval value cannot be null");
        }
        for (TrendInterval interval : values()) {
            if (interval.name().equalsIgnoreCase(value)) {
                return interval;
            }
        }
        throw new IllegalArgumentException(
                "Invalid interval: " + value + ". Must be HOUR, DAY, WEEK or MONTH.");
    }
}
