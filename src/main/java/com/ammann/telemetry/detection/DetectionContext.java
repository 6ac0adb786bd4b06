package com.ammann.telemetry.detection;

import com.ammann.telemetry.model.MissionProfile;
import com.ammann.telemetry.model.ObservationRecord;
import com.ammann.telemetry.model.ParameterBaseline;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared, read-only input of every detector during one run.
 *
 * @param workingSet records with a valid mission time, in source order
 * @param baselines  per-parameter baselines computed from the working set, in redline-table
 *                   order; detectors emit anomalies in this order
 * @param profile    static mission configuration
 * @param settings   detection thresholds
 */
public record DetectionContext(
        List<ObservationRecord> workingSet,
        Map<String, ParameterBaseline> baselines,
        MissionProfile profile,
        DetectionSettings settings
) {
    public DetectionContext {
        workingSet = List.copyOf(workingSet);
        baselines = Collections.unmodifiableMap(new LinkedHashMap<>(baselines));
    }
}
