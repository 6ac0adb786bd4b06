package com.ammann.telemetry.detection;

import com.ammann.telemetry.enumeration.AnomalyType;
import com.ammann.telemetry.enumeration.Severity;
import com.ammann.telemetry.model.Anomaly;
import com.ammann.telemetry.model.AnomalyEvent;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Groups time-sorted anomalies into events.
 *
 * <p>Greedy single linkage anchored on the event start: each unvisited anomaly seeds a new
 * event, and every later unvisited anomaly strictly closer than the time window to the
 * seed's start joins it. Measuring against the start rather than the latest member keeps
 * an event from drifting indefinitely along a dense run of anomalies.
 */
public class EventClusterer
{
    /** Orders anomalies by mission time; the sort is stable, so ties keep detector order. */
    public static final Comparator<Anomaly> BY_MISSION_TIME = Comparator.comparingDouble(Anomaly::missionTime);

    private final double timeWindowSeconds;

    public EventClusterer(double timeWindowSeconds)
    {
        this.timeWindowSeconds = timeWindowSeconds;
    }

    /**
     * Clusters anomalies into events.
     *
     * @param sortedAnomalies anomalies in ascending mission-time order
     * @return events in creation order with ids {@code EVT-001}, {@code EVT-002}, ...
     */
    public List<AnomalyEvent> cluster(List<Anomaly> sortedAnomalies)
    {
        List<AnomalyEvent> events = new ArrayList<>();
        boolean[] visited = new boolean[sortedAnomalies.size()];

        for (int i = 0; i < sortedAnomalies.size(); i++) {
            if (visited[i]) {
                continue;
            }
            visited[i] = true;

            Anomaly seed = sortedAnomalies.get(i);
            double startTime = seed.missionTime();
            double endTime = startTime;
            List<Anomaly> members = new ArrayList<>();
            members.add(seed);

            for (int j = i + 1; j < sortedAnomalies.size(); j++) {
                if (visited[j]) {
                    continue;
                }
                Anomaly candidate = sortedAnomalies.get(j);
                if (Math.abs(candidate.missionTime() - startTime) < timeWindowSeconds) {
                    members.add(candidate);
                    endTime = Math.max(endTime, candidate.missionTime());
                    visited[j] = true;
                }
            }

            events.add(toEvent(events.size() + 1, startTime, endTime, members));
        }

        return events;
    }

    private static AnomalyEvent toEvent(int sequence, double startTime, double endTime, List<Anomaly> members)
    {
        Severity severity = Severity.CAUTION;
        Set<String> parameters = new LinkedHashSet<>();
        Set<AnomalyType> types = new LinkedHashSet<>();
        for (Anomaly member : members) {
            severity = severity.max(member.severity());
            parameters.add(member.parameterLabel());
            types.add(member.type());
        }

        return new AnomalyEvent(
                AnomalyEvent.formatId(sequence),
                startTime,
                endTime,
                severity,
                members,
                parameters,
                types,
                members.size());
    }
}
