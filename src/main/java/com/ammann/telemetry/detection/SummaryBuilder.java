package com.ammann.telemetry.detection;

import com.ammann.telemetry.enumeration.Severity;
import com.ammann.telemetry.model.Anomaly;
import com.ammann.telemetry.model.AnomalyEvent;
import com.ammann.telemetry.model.AnomalySummary;
import com.ammann.telemetry.model.MissionProfile;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates anomaly counts and packages the static mission tables for reporting.
 */
public class SummaryBuilder
{
    public AnomalySummary build(List<Anomaly> anomalies, List<AnomalyEvent> events, MissionProfile profile)
    {
        Map<Severity, Integer> bySeverity = new LinkedHashMap<>();
        bySeverity.put(Severity.CRITICAL, 0);
        bySeverity.put(Severity.WARNING, 0);
        bySeverity.put(Severity.CAUTION, 0);
        Map<String, Integer> byType = new LinkedHashMap<>();
        Map<String, Integer> byParameter = new LinkedHashMap<>();

        for (Anomaly anomaly : anomalies) {
            bySeverity.merge(anomaly.severity(), 1, Integer::sum);
            byType.merge(anomaly.type().getLabel(), 1, Integer::sum);
            byParameter.merge(anomaly.parameterLabel(), 1, Integer::sum);
        }

        return new AnomalySummary(
                anomalies.size(),
                events.size(),
                Collections.unmodifiableMap(bySeverity),
                Collections.unmodifiableMap(byType),
                Collections.unmodifiableMap(byParameter),
                List.copyOf(events),
                profile.redlines(),
                profile.missionEvents());
    }
}
