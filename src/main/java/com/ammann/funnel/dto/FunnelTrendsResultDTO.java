/* (C)2026 */
package com.ammann.funnel.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Cohort of actors that entered the funnel within one trend period.
 */
@Schema(description = "Started/ended cohort for one trend period")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FunnelTrendsResultDTO(
        @Schema(description = "Period start")
        Instant timestamp,

        @Schema(description = "Actors entering the funnel in this period")
        Long startedCount,

        @Schema(description = "Entered actors that converted")
        Long endedCount,

        @Schema(description = "endedCount / startedCount, 0 when nothing started")
        Double percentEnded,

        @Schema(description = "Conversion rate as a percentage rounded to two decimals")
        Double conversionRate,

        @Schema(description = "Ids of started actors, possibly capped")
        List<String> personIdsStarted,

        @Schema(description = "Ids of converted actors, possibly capped")
        List<String> personIdsEnded,

        @JsonProperty("isPeriodFinal")
        @Schema(description = "False while the conversion window of this period is still open")
        Boolean isPeriodFinal,

        @Schema(description = "Breakdown labels; absent without breakdown")
        List<String> breakdownValue
) {}
