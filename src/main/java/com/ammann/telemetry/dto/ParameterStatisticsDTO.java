package com.ammann.telemetry.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Descriptive statistics of one numeric telemetry column.
 *
 * <p>Quantiles are read from the sorted values at index {@code floor(n * p)}, so the median
 * of an even-sized column is its upper middle value. Mean and standard deviation are
 * rounded to four decimals.
 */
@Schema(description = "Descriptive statistics of a telemetry parameter")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParameterStatisticsDTO(
        @Schema(description = "Parameter name")
        String parameter,

        @Schema(description = "Number of numeric samples")
        Integer count,

        @Schema(description = "Smallest sample")
        Double min,

        @Schema(description = "Largest sample")
        Double max,

        @Schema(description = "Arithmetic mean")
        Double mean,

        @Schema(description = "Population standard deviation")
        Double std,

        @Schema(description = "Median (upper middle for even counts)")
        Double median,

        @Schema(description = "First quartile")
        Double q1,

        @Schema(description = "Third quartile")
        Double q3,

        @Schema(description = "Interquartile range (q3 - q1)")
        Double iqr
) {}
