package com.ammann.telemetry.detection;

import com.ammann.telemetry.enumeration.Severity;
import com.ammann.telemetry.model.Anomaly;
import com.ammann.telemetry.model.MissionProfile;
import com.ammann.telemetry.model.ObservationRecord;
import com.ammann.telemetry.model.ParameterBaseline;
import com.ammann.telemetry.model.RapidChange;
import java.util.ArrayList;
import java.util.List;

/**
 * Flags sample-to-sample jumps far above a parameter's average step size.
 *
 * <p>The average absolute step is taken over consecutive working-set pairs where both
 * samples are finite. The flagging threshold is that average times the configured
 * multiplier (5 by default). A zero threshold means the parameter never moves and it is
 * skipped. Severity is CRITICAL above three thresholds, WARNING above two.
 */
public class RateOfChangeDetector implements Detector
{
    static final double WARNING_FACTOR = 2.0;
    static final double CRITICAL_FACTOR = 3.0;

    @Override
    public List<Anomaly> detect(DetectionContext context)
    {
        List<Anomaly> anomalies = new ArrayList<>();
        MissionProfile profile = context.profile();
        List<ObservationRecord> data = context.workingSet();

        for (ParameterBaseline baseline : context.baselines().values()) {
            String parameter = baseline.parameter();

            double averageStep = averageStep(data, parameter);
            if (Double.isNaN(averageStep)) {
                continue;
            }
            double threshold = averageStep * context.settings().rateMultiplier();
            if (threshold == 0) {
                continue;
            }

            String label = profile.labelOf(parameter);
            String unit = profile.unitOf(parameter);

            for (int i = 1; i < data.size(); i++) {
                ObservationRecord previous = data.get(i - 1);
                ObservationRecord current = data.get(i);
                if (!previous.hasFiniteValue(parameter) || !current.hasFiniteValue(parameter)) {
                    continue;
                }
                double a = previous.value(parameter);
                double b = current.value(parameter);
                double rate = Math.abs(b - a);
                if (rate <= threshold) {
                    continue;
                }

                String description = String.format("Rapid %s in %s: delta %s/s (avg %s)",
                        b > a ? "increase" : "decrease",
                        label,
                        ReportFormat.withUnit(ReportFormat.oneDecimal(rate), unit),
                        ReportFormat.twoDecimals(averageStep));

                anomalies.add(new RapidChange(
                        Severity.classify(rate, threshold * WARNING_FACTOR, threshold * CRITICAL_FACTOR),
                        parameter,
                        label,
                        unit,
                        current.missionTime(),
                        i,
                        ReportFormat.round2(b),
                        ReportFormat.round2(a),
                        ReportFormat.round2(rate),
                        ReportFormat.round2(averageStep),
                        description));
            }
        }

        return anomalies;
    }

    /**
     * Mean absolute difference between consecutive finite samples.
     *
     * @return the mean step, or {@code NaN} when no consecutive pair exists
     */
    static double averageStep(List<ObservationRecord> data, String parameter)
    {
        double sum = 0.0;
        int pairs = 0;
        for (int i = 1; i < data.size(); i++) {
            ObservationRecord previous = data.get(i - 1);
            ObservationRecord current = data.get(i);
            if (previous.hasFiniteValue(parameter) && current.hasFiniteValue(parameter)) {
                sum += Math.abs(current.value(parameter) - previous.value(parameter));
                pairs++;
            }
        }
        return pairs == 0 ? Double.NaN : sum / pairs;
    }
}
