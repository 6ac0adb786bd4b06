package com.ammann.telemetry.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one detection run.
 *
 * @param workingSetSize number of records with a valid mission time
 * @param baselines      per-parameter baselines, absent for parameters without samples
 * @param anomalies      all anomalies sorted by mission time
 * @param events         clustered events in creation order
 */
public record DetectionResult(
        int workingSetSize,
        Map<String, ParameterBaseline> baselines,
        List<Anomaly> anomalies,
        List<AnomalyEvent> events
) {
    public DetectionResult {
        baselines = Collections.unmodifiableMap(new LinkedHashMap<>(baselines));
        anomalies = List.copyOf(anomalies);
        events = List.copyOf(events);
    }

    public static DetectionResult empty() {
        return new DetectionResult(0, Map.of(), List.of(), List.of());
    }
}
