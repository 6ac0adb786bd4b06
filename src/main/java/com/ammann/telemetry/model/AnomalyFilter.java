package com.ammann.telemetry.model;

import com.ammann.telemetry.enumeration.AnomalyType;
import com.ammann.telemetry.enumeration.Severity;
import java.util.List;
import java.util.function.Predicate;

/**
 * Read-only query over an already produced anomaly list. Every criterion is optional;
 * {@code null} matches everything.
 *
 * @param severity  required severity
 * @param type      required anomaly type
 * @param parameter required raw parameter name
 */
public record AnomalyFilter(Severity severity, AnomalyType type, String parameter)
        implements Predicate<Anomaly>
{
    public static AnomalyFilter none() {
        return new AnomalyFilter(null, null, null);
    }

    @Override
    public boolean test(Anomaly anomaly) {
        return (severity == null || anomaly.severity() == severity)
                && (type == null || anomaly.type() == type)
                && (parameter == null || parameter.equals(anomaly.parameter()));
    }

    /**
     * Applies the filter without touching the source list.
     *
     * @param anomalies anomalies to filter
     * @return matching anomalies in source order
     */
    public List<Anomaly> apply(List<Anomaly> anomalies) {
        return anomalies.stream().filter(this).toList();
    }
}
