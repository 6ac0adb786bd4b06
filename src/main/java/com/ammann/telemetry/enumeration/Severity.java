package com.ammann.telemetry.enumeration;

/**
 * Severity tiers shared by individual anomalies and clustered events.
 *
 * <p>Declaration order is significant: a later constant outranks an earlier one,
 * so {@code CRITICAL > WARNING > CAUTION}.
 */
public enum Severity
{
    CAUTION,
    WARNING,
    CRITICAL;

    /**
     * Returns the more severe of the two tiers.
     *
     * @param other tier to compare against, may be {@code null}
     * @return the higher-ranked tier
     */
    public Severity max(Severity other) {
        if (other == null) return this;
        return compareTo(other) >= 0 ? this : other;
    }

    /**
     * Maps a ratio of observed magnitude to its flagging threshold onto a tier.
     * Both bounds are strict, so a value exactly on a bound stays in the lower tier.
     *
     * @param value         observed magnitude
     * @param warningAbove  value above which the tier is at least WARNING
     * @param criticalAbove value above which the tier is CRITICAL
     * @return the resulting tier
     */
    public static Severity classify(double value, double warningAbove, double criticalAbove) {
        if (value > criticalAbove) return CRITICAL;
        if (value > warningAbove) return WARNING;
        return CAUTION;
    }

    /**
     * Case-insensitive lookup used by query filters.
     *
     * @param name tier name such as {@code "critical"}
     * @return the matching tier
     * @throws IllegalArgumentException if the name matches no tier
     */
    public static Severity fromName(String name) {
        for (Severity severity : values()) {
            if (severity.name().equalsIgnoreCase(name.trim())) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + name);
    }
}
