package com.ammann.telemetry.detection;

import com.ammann.telemetry.enumeration.RedlineDirection;
import com.ammann.telemetry.enumeration.Severity;
import com.ammann.telemetry.model.Anomaly;
import com.ammann.telemetry.model.ObservationRecord;
import com.ammann.telemetry.model.RedlineLimit;
import com.ammann.telemetry.model.RedlineViolation;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flags samples outside the static redline envelope. Works directly on the working set
 * and does not need a baseline.
 *
 * <p>{@code percentOver = 100 * exceedance / |limit|}. The percentage is taken against the
 * bound itself, not the operating range, so bounds close to zero inflate it sharply; a
 * bound of exactly zero divides by one instead.
 * Severity is CRITICAL above 10 percent and WARNING above 5 percent, both strict.
 */
public class RedlineDetector implements Detector
{
    static final double WARNING_PERCENT = 5.0;
    static final double CRITICAL_PERCENT = 10.0;

    @Override
    public List<Anomaly> detect(DetectionContext context)
    {
        List<Anomaly> anomalies = new ArrayList<>();
        List<ObservationRecord> data = context.workingSet();

        for (Map.Entry<String, RedlineLimit> entry : context.profile().redlines().entrySet()) {
            String parameter = entry.getKey();
            RedlineLimit limit = entry.getValue();

            for (int i = 0; i < data.size(); i++) {
                ObservationRecord record = data.get(i);
                if (!record.hasFiniteValue(parameter)) {
                    continue;
                }
                double value = record.value(parameter);

                RedlineDirection direction;
                double bound;
                double exceedance;
                if (value > limit.max()) {
                    direction = RedlineDirection.HIGH;
                    bound = limit.max();
                    exceedance = ReportFormat.round2(value - limit.max());
                } else if (value < limit.min()) {
                    direction = RedlineDirection.LOW;
                    bound = limit.min();
                    exceedance = ReportFormat.round2(limit.min() - value);
                } else {
                    continue;
                }

                double percentOver = percentOver(exceedance, bound);

                String description = String.format("%s %s redline: %s (limit %s, %s%% over)",
                        limit.label(),
                        direction,
                        ReportFormat.withUnit(ReportFormat.oneDecimal(value), limit.unit()),
                        ReportFormat.withUnit(ReportFormat.limit(bound), limit.unit()),
                        ReportFormat.oneDecimal(percentOver));

                anomalies.add(new RedlineViolation(
                        Severity.classify(percentOver, WARNING_PERCENT, CRITICAL_PERCENT),
                        parameter,
                        limit.label(),
                        limit.unit(),
                        record.missionTime(),
                        i,
                        ReportFormat.round2(value),
                        bound,
                        exceedance,
                        direction,
                        ReportFormat.round2(percentOver),
                        description));
            }
        }

        return anomalies;
    }

    static double percentOver(double exceedance, double bound)
    {
        double divisor = bound == 0 ? 1.0 : Math.abs(bound);
        return 100 * exceedance / divisor;
    }
}
