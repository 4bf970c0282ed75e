/* (C)2026 */
package com.ammann.funnel.dto;

import com.ammann.funnel.enumeration.AggregationKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One step of a funnel result.
 *
 * <p>Conversion rates are ratios in [0, 1]; a zero denominator yields 0.
 */
@Schema(description = "Conversion statistics for a single funnel step")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FunnelStepDTO(
        @Schema(description = "Zero-based step index")
        Integer order,

        @Schema(description = "Event or action name")
        String name,

        @Schema(description = "User supplied label")
        String customName,

        @Schema(description = "Actors that reached at least this step")
        Long count,

        @Schema(description = "Conversion rate relative to the configured step reference")
        Double conversionRate,

        @Schema(description = "Conversion rate relative to the first step")
        Double conversionRateFromBasis,

        @Schema(description = "Conversion rate relative to the previous step")
        Double conversionRateFromPrevious,

        @Schema(description = "Mean seconds from the previous step, null for the first step")
        Double averageConversionTime,

        @Schema(description = "Median seconds from the previous step, null for the first step")
        Double medianConversionTime,

        @Schema(description = "Display aggregation of the step")
        AggregationKind math
) {}
