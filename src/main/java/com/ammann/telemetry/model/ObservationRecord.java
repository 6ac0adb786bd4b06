package com.ammann.telemetry.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One telemetry sample: the mission time it was taken at, an optional flight phase,
 * numeric parameter readings and any non-numeric columns that came with the row.
 *
 * <p>Instances are read-only. A reading may be absent or {@code NaN}; detectors treat both
 * as "no value" rather than failing.
 *
 * @param missionTime seconds since the mission reference epoch, {@code null} when the
 *                    source row had no usable time
 * @param phase       flight phase label, may be {@code null}
 * @param values      numeric readings keyed by parameter name, in source column order
 * @param attributes  non-numeric columns keyed by column name, in source column order
 */
public record ObservationRecord(
        Double missionTime,
        String phase,
        Map<String, Double> values,
        Map<String, String> attributes
) {
    public ObservationRecord {
        values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public ObservationRecord(Double missionTime, Map<String, Double> values) {
        this(missionTime, null, values, null);
    }

    /**
     * Whether this record belongs to the working set used by every detector.
     *
     * @return {@code true} when the mission time is a finite, non-negative number
     */
    public boolean hasValidMissionTime() {
        return missionTime != null && Double.isFinite(missionTime) && missionTime >= 0;
    }

    /**
     * Returns the reading for a parameter.
     *
     * @param parameter parameter name
     * @return the reading, or {@code NaN} when it is absent
     */
    public double value(String parameter) {
        Double value = values.get(parameter);
        return value == null ? Double.NaN : value;
    }

    /**
     * Whether the parameter carries a usable numeric reading.
     *
     * @param parameter parameter name
     * @return {@code true} for finite readings
     */
    public boolean hasFiniteValue(String parameter) {
        Double value = values.get(parameter);
        return value != null && Double.isFinite(value);
    }
}
