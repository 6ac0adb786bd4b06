package com.ammann.telemetry.model;

import com.ammann.telemetry.enumeration.AnomalyType;
import com.ammann.telemetry.enumeration.Severity;

/**
 * Sample lying more than the z-score threshold away from its baseline mean.
 *
 * @param expected baseline mean, rounded for reporting
 * @param zScore   absolute z-score, rounded for reporting
 */
public record ZScoreOutlier(
        Severity severity,
        String parameter,
        String parameterLabel,
        String unit,
        double missionTime,
        int sampleIndex,
        double value,
        double expected,
        double zScore,
        String description
) implements Anomaly {

    @Override
    public AnomalyType type() {
        return AnomalyType.Z_SCORE_OUTLIER;
    }
}
