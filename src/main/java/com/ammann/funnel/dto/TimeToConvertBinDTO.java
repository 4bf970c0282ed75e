/* (C)2026 */
package com.ammann.funnel.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Single time-to-convert histogram bin, serialized as {@code [lowerBound, count]}.
 */
@Schema(description = "Histogram bin as [lower bound in seconds, actor count]")
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
public record TimeToConvertBinDTO(
        @Schema(description = "Bin lower bound (inclusive) in seconds")
        Long lowerBound,

        @Schema(description = "Actors whose conversion time falls in this bin")
        Long count
) {}
