package com.ammann.telemetry.detection;

import com.ammann.telemetry.enumeration.Severity;
import com.ammann.telemetry.model.Anomaly;
import com.ammann.telemetry.model.MissionProfile;
import com.ammann.telemetry.model.ObservationRecord;
import com.ammann.telemetry.model.ParameterBaseline;
import com.ammann.telemetry.model.SustainedDeviation;
import java.util.ArrayList;
import java.util.List;

/**
 * Flags rolling-window means that drift persistently away from the baseline.
 *
 * <p>For every index {@code i >= W} the window covers the {@code W} samples before
 * {@code i}. Windows with less than the minimum coverage of finite samples are skipped.
 * A window is flagged when {@code |windowMean - mean| / std} exceeds the sigma threshold;
 * severity is CRITICAL above 4 sigma and WARNING above 3 sigma.
 *
 * <p>One excursion keeps triggering while the window slides across it, so a new flag is
 * only raised once the index has moved at least {@code W} samples past the previous flag
 * for the same parameter.
 */
public class SustainedDeviationDetector implements Detector
{
    static final double WARNING_SIGMA = 3.0;
    static final double CRITICAL_SIGMA = 4.0;

    @Override
    public List<Anomaly> detect(DetectionContext context)
    {
        List<Anomaly> anomalies = new ArrayList<>();
        DetectionSettings settings = context.settings();
        int window = settings.sustainedWindow();
        double requiredSamples = window * settings.sustainedMinCoverage();
        MissionProfile profile = context.profile();
        List<ObservationRecord> data = context.workingSet();

        for (ParameterBaseline baseline : context.baselines().values()) {
            if (!baseline.hasVariance()) {
                continue;
            }
            String parameter = baseline.parameter();
            String label = profile.labelOf(parameter);
            String unit = profile.unitOf(parameter);
            int lastFlagged = Integer.MIN_VALUE;

            for (int i = window; i < data.size(); i++) {
                double sum = 0.0;
                int valid = 0;
                for (int j = i - window; j < i; j++) {
                    ObservationRecord record = data.get(j);
                    if (record.hasFiniteValue(parameter)) {
                        sum += record.value(parameter);
                        valid++;
                    }
                }
                if (valid < requiredSamples) {
                    continue;
                }

                double windowMean = sum / valid;
                double deviation = Math.abs(windowMean - baseline.mean()) / baseline.std();
                if (deviation <= settings.sustainedSigma()) {
                    continue;
                }
                if (lastFlagged != Integer.MIN_VALUE && i - lastFlagged < window) {
                    continue;
                }

                String description = String.format(
                        "Sustained %s sigma deviation in %s over %d-sample window (mean %s, nominal %s)",
                        ReportFormat.oneDecimal(deviation),
                        label,
                        window,
                        ReportFormat.oneDecimal(windowMean),
                        ReportFormat.oneDecimal(baseline.mean()));

                anomalies.add(new SustainedDeviation(
                        Severity.classify(deviation, WARNING_SIGMA, CRITICAL_SIGMA),
                        parameter,
                        label,
                        unit,
                        data.get(i).missionTime(),
                        i,
                        ReportFormat.round2(windowMean),
                        ReportFormat.round2(baseline.mean()),
                        ReportFormat.round2(deviation),
                        window,
                        description));
                lastFlagged = i;
            }
        }

        return anomalies;
    }
}
