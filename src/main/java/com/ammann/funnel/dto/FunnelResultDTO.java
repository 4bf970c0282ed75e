/* (C)2026 */
package com.ammann.funnel.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Step conversion result for one funnel (or one breakdown value of a funnel).
 */
@Schema(description = "Step counts of a funnel, optionally for a single breakdown value")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FunnelResultDTO(
        @Schema(description = "Steps in ascending order")
        List<FunnelStepDTO> steps,

        @Schema(description = "Breakdown labels, one per dimension; absent without breakdown")
        List<String> breakdownValue,

        @Schema(description = "Actors that entered the funnel")
        Long totalActors
) {
    /**
     * Returns the step counts in step order.
     */
    public List<Long> counts() {
        return steps.stream().map(FunnelStepDTO::count).toList();
    }
}
