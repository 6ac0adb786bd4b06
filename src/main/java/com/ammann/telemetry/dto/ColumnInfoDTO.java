/* (C)2026 */
package com.ammann.telemetry.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Description of one column of the loaded telemetry dataset.
 *
 * @param name raw column name
 * @param label display label from the redline table, or the title-cased column name
 * @param unit display unit, empty when unknown
 * @param numeric whether the first record holds a numeric value for the column
 * @param hasRedline whether the column is monitored by a redline
 */
@Schema(description = "Telemetry column metadata")
public record ColumnInfoDTO(
        @Schema(description = "Raw column name") String name,
        @Schema(description = "Display label") String label,
        @Schema(description = "Display unit") String unit,
        @Schema(description = "Whether the column is numeric") boolean numeric,
        @Schema(description = "Whether the column has a redline") boolean hasRedline) {}
