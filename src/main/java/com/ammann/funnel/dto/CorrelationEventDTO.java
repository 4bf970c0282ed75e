/* (C)2026 */
package com.ammann.funnel.dto;

import com.ammann.funnel.enumeration.CorrelationOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Correlation statistics of one candidate event or property value.
 */
@Schema(description = "Odds ratio of a candidate against funnel conversion")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CorrelationEventDTO(
        @Schema(description = "Candidate label (event, property::value or event::property::value)")
        String event,

        @Schema(description = "Converted actors exhibiting the candidate")
        Long successCount,

        @Schema(description = "Dropped actors exhibiting the candidate")
        Long failureCount,

        @Schema(description = "Odds ratio with +1 prior on each cell")
        Double oddsRatio,

        @Schema(description = "Whether the candidate is associated with success or failure")
        CorrelationOutcome correlationType
) {}
