/* (C)2026 */
package com.ammann.funnel.model;

import com.ammann.funnel.enumeration.BreakdownAttribution;
import java.util.List;

/**
 * Breakdown configuration: up to three dimensions plus ranking and attribution options.
 *
 * @param dimensions      ordered breakdown dimensions
 * @param limit           number of top values kept, null for the configured default
 * @param attribution     which matched event supplies event-property values
 * @param attributionStep step index for {@link BreakdownAttribution#STEP}
 */
public record BreakdownSpec(
        List<BreakdownDimension> dimensions,
        Integer limit,
        BreakdownAttribution attribution,
        Integer attributionStep) {

    /** Maximum number of breakdown dimensions. */
    public static final int MAX_DIMENSIONS = 3;

    public BreakdownSpec {
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        attribution = attribution == null ? BreakdownAttribution.FIRST_TOUCH : attribution;
    }

    public static BreakdownSpec of(BreakdownDimension... dimensions) {
        return new BreakdownSpec(List.of(dimensions), null, BreakdownAttribution.FIRST_TOUCH, null);
    }

    public BreakdownSpec withLimit(int newLimit) {
        return new BreakdownSpec(dimensions, newLimit, attribution, attributionStep);
    }

    public BreakdownSpec withAttribution(BreakdownAttribution newAttribution, Integer step) {
        return new BreakdownSpec(dimensions, limit, newAttribution, step);
    }
}
