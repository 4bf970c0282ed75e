/* (C)2026 */
package com.ammann.funnel.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Distribution of conversion durations between two funnel steps.
 */
@Schema(description = "Time-to-convert histogram")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FunnelTimeToConvertResultDTO(
        @Schema(description = "Mean conversion time in seconds, null when nobody converted")
        Double averageConversionTime,

        @Schema(description = "Bins in ascending lower-bound order")
        List<TimeToConvertBinDTO> bins,

        @Schema(description = "Breakdown labels; absent without breakdown")
        List<String> breakdownValue
) {
    /**
     * Total number of converted actors across all bins.
     */
    public long totalCount() {
        return bins.stream().mapToLong(TimeToConvertBinDTO::count).sum();
    }
}
