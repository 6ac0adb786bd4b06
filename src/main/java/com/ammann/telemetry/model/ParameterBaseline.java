package com.ammann.telemetry.model;

/**
 * Per-parameter statistics computed from the finite samples of one detection run.
 *
 * @param parameter parameter name
 * @param count     number of finite samples
 * @param mean      arithmetic mean
 * @param std       population standard deviation
 * @param min       smallest sample
 * @param max       largest sample
 */
public record ParameterBaseline(
        String parameter,
        int count,
        double mean,
        double std,
        double min,
        double max
) {
    /**
     * Whether the parameter varies at all. Constant series have no meaningful
     * normalisation and are excluded from sigma-based detectors.
     */
    public boolean hasVariance() {
        return std > 0;
    }
}
