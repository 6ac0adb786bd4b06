package com.ammann.telemetry.model;

import com.ammann.telemetry.enumeration.AnomalyType;
import com.ammann.telemetry.enumeration.Severity;

/**
 * Rolling-window mean drifting from the baseline by more than the sigma threshold.
 * {@link #value()} holds the window mean.
 *
 * @param expected       baseline mean
 * @param deviationSigma distance of the window mean from baseline, in standard deviations
 * @param windowSize     number of samples in the window
 */
public record SustainedDeviation(
        Severity severity,
        String parameter,
        String parameterLabel,
        String unit,
        double missionTime,
        int sampleIndex,
        double value,
        double expected,
        double deviationSigma,
        int windowSize,
        String description
) implements Anomaly {

    @Override
    public AnomalyType type() {
        return AnomalyType.SUSTAINED_DEVIATION;
    }
}
