/* (C)2026 */
package com.ammann.telemetry.model;

import com.ammann.telemetry.enumeration.Severity;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Aggregated counts of one detection run together with its events and the static
 * mission configuration, for reporting.
 *
 * @param totalAnomalies number of anomalies
 * @param totalEvents    number of events
 * @param bySeverity     anomaly count per severity, every tier present
 * @param byType         anomaly count per type label
 * @param byParameter    anomaly count per parameter label
 * @param events         clustered events
 * @param redlineLimits  redline table
 * @param missionEvents  mission event markers in seconds
 */
@Schema(description = "Anomaly detection summary")
public record AnomalySummary(
        @Schema(description = "Total number of anomalies") int totalAnomalies,
        @Schema(description = "Total number of events") int totalEvents,
        @Schema(description = "Anomaly count per severity") Map<Severity, Integer> bySeverity,
        @Schema(description = "Anomaly count per type") Map<String, Integer> byType,
        @Schema(description = "Anomaly count per parameter label") Map<String, Integer> byParameter,
        @Schema(description = "Clustered events") List<AnomalyEvent> events,
        @Schema(description = "Redline table") Map<String, RedlineLimit> redlineLimits,
        @Schema(description = "Mission event markers in seconds") Map<String, Double> missionEvents) {}
