/* (C)2026 */
package com.ammann.funnel.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Inclusive date range of a funnel query.
 *
 * <p>The zone is used only to align trend periods to calendar boundaries.
 *
 * @param dateFrom inclusive start
 * @param dateTo   inclusive end
 * @param zone     calendar zone, UTC when null
 */
public record DateRange(Instant dateFrom, Instant dateTo, ZoneId zone) {

    public DateRange {
        zone = zone == null ? ZoneOffset.UTC : zone;
    }

    public static DateRange of(Instant dateFrom, Instant dateTo) {
        return new DateRange(dateFrom, dateTo, ZoneOffset.UTC);
    }

    /**
     * UTC range from the start of {@code from} to the start of {@code to}.
     */
    public static DateRange ofDays(LocalDate from, LocalDate to) {
        return new DateRange(
                from.atStartOfDay(ZoneOffset.UTC).toInstant(),
                to.atStartOfDay(ZoneOffset.UTC).toInstant(),
                ZoneOffset.UTC);
    }

    public boolean contains(Instant instant) {
        return (dateFrom == null || !instant.isBefore(dateFrom))
                && (dateTo == null || !instant.isAfter(dateTo));
    }
}
