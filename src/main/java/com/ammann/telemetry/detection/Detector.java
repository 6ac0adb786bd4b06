package com.ammann.telemetry.detection;

import com.ammann.telemetry.model.Anomaly;
import java.util.List;

/**
 * One statistical heuristic. Implementations are stateless: all input arrives through
 * the context and the returned list is freshly built on every call.
 */
public interface Detector
{
    /**
     * Scans the working set and returns the anomalies this heuristic flags,
     * grouped by parameter and in working-set order within a parameter.
     *
     * @param context shared run input
     * @return new list of anomalies, empty when nothing is flagged
     */
    List<Anomaly> detect(DetectionContext context);
}
