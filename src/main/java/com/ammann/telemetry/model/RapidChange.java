package com.ammann.telemetry.model;

import com.ammann.telemetry.enumeration.AnomalyType;
import com.ammann.telemetry.enumeration.Severity;

/**
 * Step between two consecutive samples larger than the rate-of-change threshold.
 *
 * @param previousValue value of the preceding sample
 * @param rateOfChange  absolute step size
 * @param averageStep   average absolute step of the parameter over the run
 */
public record RapidChange(
        Severity severity,
        String parameter,
        String parameterLabel,
        String unit,
        double missionTime,
        int sampleIndex,
        double value,
        double previousValue,
        double rateOfChange,
        double averageStep,
        String description
) implements Anomaly {

    @Override
    public AnomalyType type() {
        return AnomalyType.RAPID_CHANGE;
    }
}
