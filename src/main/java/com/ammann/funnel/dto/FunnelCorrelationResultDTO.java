/* (C)2026 */
package com.ammann.funnel.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Correlation of candidates with funnel conversion.
 */
@Schema(description = "Funnel correlation result")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FunnelCorrelationResultDTO(
        @Schema(description = "Success correlations (descending odds) followed by failure correlations (ascending odds)")
        List<CorrelationEventDTO> events,

        @Schema(description = "True when one outcome's sample is disproportionately small")
        Boolean skewed,

        @Schema(description = "Number of converted actors")
        Long successTotal,

        @Schema(description = "Number of dropped actors")
        Long failureTotal
) {
    public static FunnelCorrelationResultDTO empty() {
        return new FunnelCorrelationResultDTO(List.of(), false, 0L, 0L);
    }
}
