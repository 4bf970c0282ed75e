/* (C)2026 */
package com.ammann.funnel.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * All funnel results computed from a single pass over the event source.
 */
@Schema(description = "Combined funnel analysis")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FunnelAnalysisDTO(
        @Schema(description = "Step results, one per breakdown value")
        List<FunnelResultDTO> steps,

        @Schema(description = "Trend periods, grouped by breakdown value")
        List<FunnelTrendsResultDTO> trends,

        @Schema(description = "Time-to-convert histograms, one per breakdown value")
        List<FunnelTimeToConvertResultDTO> timeToConvert,

        @Schema(description = "Correlation result, absent when not requested")
        FunnelCorrelationResultDTO correlation,

        @Schema(description = "Actors pulled from the event source")
        Long actorsProcessed
) {}
