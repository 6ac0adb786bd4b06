package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of detector that produced an anomaly.
 *
 * <p>Serialized using the human-readable label so reports read
 * {@code "Z-Score Outlier"} rather than the constant name.
 */
public enum AnomalyType
{
    /** Single sample far from the parameter baseline mean. */
    Z_SCORE_OUTLIER("Z-Score Outlier"),
    /** Sample-to-sample jump well above the average step size. */
    RAPID_CHANGE("Rapid Change"),
    /** Sample outside the static safe operating envelope. */
    REDLINE_VIOLATION("Redline Violation"),
    /** Rolling-window mean drifting persistently from baseline. */
    SUSTAINED_DEVIATION("Sustained Deviation");

    private final String label;

    AnomalyType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() { return label; }

    /**
     * Resolves a type from either its label ({@code "Rapid Change"}) or its
     * constant name ({@code "RAPID_CHANGE"}), ignoring case.
     *
     * @param value label or constant name
     * @return the matching type
     * @throws IllegalArgumentException if nothing matches
     */
    public static AnomalyType fromValue(String value) {
        String candidate = value.trim();
        for (AnomalyType type : values()) {
            if (type.label.equalsIgnoreCase(candidate) || type.name().equalsIgnoreCase(candidate)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown anomaly type: " + value);
    }
}
