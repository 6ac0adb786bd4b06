/* (C)2026 */
package com.ammann.telemetry.support;

import com.ammann.telemetry.enumeration.Severity;
import com.ammann.telemetry.model.MissionProfile;
import com.ammann.telemetry.model.ObservationRecord;
import com.ammann.telemetry.model.RedlineLimit;
import com.ammann.telemetry.model.ZScoreOutlier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class TestDataFactory {

    private TestDataFactory() {}

    public static ObservationRecord record(Double missionTime, String parameter, Double value) {
        Map<String, Double> values = new LinkedHashMap<>();
        if (value != null) {
            values.put(parameter, value);
        }
        return new ObservationRecord(missionTime, values);
    }

    /** One record per value, one second apart starting at mission time zero. */
    public static List<ObservationRecord> series(String parameter, double... values) {
        List<ObservationRecord> records = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            records.add(record((double) i, parameter, values[i]));
        }
        return records;
    }

    public static double[] constant(int count, double value) {
        double[] values = new double[count];
        java.util.Arrays.fill(values, value);
        return values;
    }

    /** Zeros with {@code value} written over the closed index range {@code [from, to]}. */
    public static double[] plateau(int count, int from, int to, double value) {
        double[] values = new double[count];
        for (int i = from; i <= to; i++) {
            values[i] = value;
        }
        return values;
    }

    public static MissionProfile profile(String parameter, double min, double max) {
        return new MissionProfile(
                Map.of(parameter, RedlineLimit.of(min, max, "u", "Test Parameter")),
                Map.of("ignition", 0.0));
    }

    public static ZScoreOutlier outlier(double missionTime, Severity severity, String parameter) {
        return new ZScoreOutlier(
                severity,
                parameter,
                parameter.toUpperCase(),
                "",
                missionTime,
                (int) missionTime,
                1.0,
                0.0,
                4.0,
                "test outlier");
    }

    public static String csv(String... lines) {
        return String.join("\n", lines) + "\n";
    }
}
