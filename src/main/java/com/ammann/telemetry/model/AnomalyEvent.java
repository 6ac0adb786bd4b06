/* (C)2026 */
package com.ammann.telemetry.model;

import com.ammann.telemetry.enumeration.AnomalyType;
import com.ammann.telemetry.enumeration.Severity;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Group of anomalies close together in mission time, reported as one incident.
 *
 * @param id                 sequential identifier such as {@code EVT-001}
 * @param startTime          mission time of the seed anomaly
 * @param endTime            latest mission time among members
 * @param severity           highest member severity
 * @param anomalies          members in mission-time order
 * @param affectedParameters distinct member parameter labels in first-seen order
 * @param anomalyTypes       distinct member types in first-seen order
 * @param count              number of members
 */
@Schema(description = "Temporally clustered group of anomalies")
public record AnomalyEvent(
        @Schema(description = "Event identifier") String id,
        @Schema(description = "Mission time of the first anomaly in seconds") double startTime,
        @Schema(description = "Mission time of the last anomaly in seconds") double endTime,
        @Schema(description = "Highest severity among members") Severity severity,
        @Schema(description = "Member anomalies") List<Anomaly> anomalies,
        @Schema(description = "Distinct affected parameter labels") Set<String> affectedParameters,
        @Schema(description = "Distinct anomaly types") Set<AnomalyType> anomalyTypes,
        @Schema(description = "Number of member anomalies") int count) {

    public AnomalyEvent {
        anomalies = List.copyOf(anomalies);
        affectedParameters = Collections.unmodifiableSet(new LinkedHashSet<>(affectedParameters));
        anomalyTypes = Collections.unmodifiableSet(new LinkedHashSet<>(anomalyTypes));
    }

    /**
     * Formats the sequential event identifier, zero padded to three digits.
     *
     * @param sequence one-based creation order
     * @return identifier such as {@code EVT-007}
     */
    public static String formatId(int sequence) {
        return String.format("EVT-%03d", sequence);
    }
}
