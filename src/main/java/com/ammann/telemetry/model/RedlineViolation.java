package com.ammann.telemetry.model;

import com.ammann.telemetry.enumeration.AnomalyType;
import com.ammann.telemetry.enumeration.RedlineDirection;
import com.ammann.telemetry.enumeration.Severity;

/**
 * Sample outside the static redline envelope of its parameter.
 *
 * @param redlineLimit the bound that was crossed
 * @param exceedance   distance beyond the bound, always positive
 * @param direction    which bound was crossed
 * @param percentOver  exceedance relative to the magnitude of the bound
 */
public record RedlineViolation(
        Severity severity,
        String parameter,
        String parameterLabel,
        String unit,
        double missionTime,
        int sampleIndex,
        double value,
        double redlineLimit,
        double exceedance,
        RedlineDirection direction,
        double percentOver,
        String description
) implements Anomaly {

    @Override
    public AnomalyType type() {
        return AnomalyType.REDLINE_VIOLATION;
    }
}
