package com.ammann.telemetry.model;

import com.ammann.telemetry.enumeration.AnomalyType;
import com.ammann.telemetry.enumeration.Severity;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single flag raised by one of the detectors.
 *
 * <p>Each detector kind has its own variant carrying only the fields that kind produces.
 * Anomalies are immutable; their relative order is established later by mission time.
 */
public sealed interface Anomaly
        permits ZScoreOutlier, RapidChange, RedlineViolation, SustainedDeviation
{
    @JsonProperty("type")
    AnomalyType type();

    Severity severity();

    /** Raw parameter name, e.g. {@code velocity_ms}. */
    String parameter();

    /** Human-readable parameter name used for grouping in reports. */
    String parameterLabel();

    String unit();

    double missionTime();

    /** Position of the triggering sample within the working set. */
    int sampleIndex();

    /** Observed value, or the window mean for sustained deviations. */
    double value();

    String description();
}
