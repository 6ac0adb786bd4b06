package com.ammann.telemetry.detection;

/**
 * Tunable thresholds of the detection pipeline.
 *
 * @param zScoreThreshold         z-score above which a sample is an outlier
 * @param rateMultiplier          multiple of the average step that counts as a rapid change
 * @param sustainedWindow         rolling window length in samples
 * @param sustainedSigma          window-mean deviation, in standard deviations, that is flagged
 * @param sustainedMinCoverage    fraction of the window that must hold valid samples
 * @param clusterWindowSeconds    distance from an event's start time within which anomalies join it
 */
public record DetectionSettings(
        double zScoreThreshold,
        double rateMultiplier,
        int sustainedWindow,
        double sustainedSigma,
        double sustainedMinCoverage,
        double clusterWindowSeconds
) {
    public static final double DEFAULT_Z_SCORE_THRESHOLD = 3.0;
    public static final double DEFAULT_RATE_MULTIPLIER = 5.0;
    public static final int DEFAULT_SUSTAINED_WINDOW = 20;
    public static final double DEFAULT_SUSTAINED_SIGMA = 2.0;
    public static final double DEFAULT_SUSTAINED_MIN_COVERAGE = 0.8;
    public static final double DEFAULT_CLUSTER_WINDOW_SECONDS = 10.0;

    public DetectionSettings {
        if (zScoreThreshold <= 0) {
            throw new IllegalArgumentException("zScoreThreshold must be positive");
        }
        if (rateMultiplier <= 0) {
            throw new IllegalArgumentException("rateMultiplier must be positive");
        }
        if (sustainedWindow <= 0) {
            throw new IllegalArgumentException("sustainedWindow must be positive");
        }
        if (sustainedSigma <= 0) {
            throw new IllegalArgumentException("sustainedSigma must be positive");
        }
        if (sustainedMinCoverage <= 0 || sustainedMinCoverage > 1) {
            throw new IllegalArgumentException("sustainedMinCoverage must be in (0, 1]");
        }
        if (clusterWindowSeconds <= 0) {
            throw new IllegalArgumentException("clusterWindowSeconds must be positive");
        }
    }

    public static DetectionSettings defaults() {
        return new DetectionSettings(
                DEFAULT_Z_SCORE_THRESHOLD,
                DEFAULT_RATE_MULTIPLIER,
                DEFAULT_SUSTAINED_WINDOW,
                DEFAULT_SUSTAINED_SIGMA,
                DEFAULT_SUSTAINED_MIN_COVERAGE,
                DEFAULT_CLUSTER_WINDOW_SECONDS);
    }
}
