package com.ammann.telemetry.detection;

import com.ammann.telemetry.enumeration.Severity;
import com.ammann.telemetry.model.Anomaly;
import com.ammann.telemetry.model.MissionProfile;
import com.ammann.telemetry.model.ObservationRecord;
import com.ammann.telemetry.model.ParameterBaseline;
import com.ammann.telemetry.model.ZScoreOutlier;
import java.util.ArrayList;
import java.util.List;

/**
 * Flags individual samples lying far from their parameter's baseline mean.
 *
 * <p>{@code z = |value - mean| / std}; a sample is flagged when {@code z} exceeds the
 * configured threshold (3.0 by default). Severity is CRITICAL above 5, WARNING above 4.
 * Constant parameters ({@code std == 0}) are skipped; only the redline detector can
 * catch deviations there.
 */
public class ZScoreDetector implements Detector
{
    static final double WARNING_Z = 4.0;
    static final double CRITICAL_Z = 5.0;

    @Override
    public List<Anomaly> detect(DetectionContext context)
    {
        List<Anomaly> anomalies = new ArrayList<>();
        double threshold = context.settings().zScoreThreshold();
        MissionProfile profile = context.profile();
        List<ObservationRecord> data = context.workingSet();

        for (ParameterBaseline baseline : context.baselines().values()) {
            if (!baseline.hasVariance()) {
                continue;
            }
            String parameter = baseline.parameter();
            String label = profile.labelOf(parameter);
            String unit = profile.unitOf(parameter);

            for (int i = 0; i < data.size(); i++) {
                ObservationRecord record = data.get(i);
                if (!record.hasFiniteValue(parameter)) {
                    continue;
                }
                double value = record.value(parameter);
                double z = Math.abs((value - baseline.mean()) / baseline.std());
                if (z <= threshold) {
                    continue;
                }

                String description = String.format("%s z-score %s (value %s, nominal %s)",
                        label,
                        ReportFormat.oneDecimal(z),
                        ReportFormat.withUnit(ReportFormat.oneDecimal(value), unit),
                        ReportFormat.withUnit(ReportFormat.oneDecimal(baseline.mean()), unit));

                anomalies.add(new ZScoreOutlier(
                        Severity.classify(z, WARNING_Z, CRITICAL_Z),
                        parameter,
                        label,
                        unit,
                        record.missionTime(),
                        i,
                        ReportFormat.round2(value),
                        ReportFormat.round2(baseline.mean()),
                        ReportFormat.round2(z),
                        description));
            }
        }

        return anomalies;
    }
}
