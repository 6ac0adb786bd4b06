/* (C)2026 */
package com.ammann.telemetry.model;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Static safe operating envelope for one parameter.
 *
 * @param min   lowest acceptable value
 * @param max   highest acceptable value
 * @param unit  display unit, empty for dimensionless parameters
 * @param label human-readable parameter name
 */
@Schema(description = "Safe operating envelope for a telemetry parameter")
public record RedlineLimit(
        @Schema(description = "Lowest acceptable value") double min,
        @Schema(description = "Highest acceptable value") double max,
        @Schema(description = "Display unit") String unit,
        @Schema(description = "Human-readable parameter name") String label) {

    public RedlineLimit {
        if (min > max) {
            throw new IllegalArgumentException(
                    String.format("Redline min %s exceeds max %s for %s", min, max, label));
        }
        unit = unit == null ? "" : unit;
    }

    public static RedlineLimit of(double min, double max, String unit, String label) {
        return new RedlineLimit(min, max, unit, label);
    }
}
