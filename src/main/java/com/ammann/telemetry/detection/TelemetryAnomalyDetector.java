package com.ammann.telemetry.detection;

import com.ammann.telemetry.model.Anomaly;
import com.ammann.telemetry.model.AnomalyEvent;
import com.ammann.telemetry.model.AnomalyFilter;
import com.ammann.telemetry.model.AnomalySummary;
import com.ammann.telemetry.model.DetectionResult;
import com.ammann.telemetry.model.MissionProfile;
import com.ammann.telemetry.model.ObservationRecord;
import com.ammann.telemetry.model.ParameterBaseline;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Runs the full detection pipeline over one materialised telemetry sequence.
 *
 * <p>Pipeline: working-set filter, baselines, the four detectors in a fixed order
 * (z-score, rate of change, redline, sustained deviation), a stable sort by mission
 * time and finally event clustering. Each {@link #detect(List)} call rebuilds every list
 * from empty and replaces the previous result, so repeated runs over the same input give
 * content-equal output.
 *
 * <p>Instances are not thread-safe; callers that share one must confine it to a thread or
 * publish its {@link DetectionResult} instead.
 */
public class TelemetryAnomalyDetector
{
    private static final Logger LOG = Logger.getLogger(TelemetryAnomalyDetector.class);

    private final MissionProfile profile;
    private final DetectionSettings settings;
    private final StatisticsAggregator aggregator = new StatisticsAggregator();
    private final List<Detector> detectors;
    private final EventClusterer clusterer;
    private final SummaryBuilder summaryBuilder = new SummaryBuilder();

    private DetectionResult lastResult;

    public TelemetryAnomalyDetector(MissionProfile profile, DetectionSettings settings)
    {
        this.profile = profile;
        this.settings = settings;
        this.detectors = List.of(
                new ZScoreDetector(),
                new RateOfChangeDetector(),
                new RedlineDetector(),
                new SustainedDeviationDetector());
        this.clusterer = new EventClusterer(settings.clusterWindowSeconds());
    }

    public TelemetryAnomalyDetector(MissionProfile profile)
    {
        this(profile, DetectionSettings.defaults());
    }

    /**
     * Runs every detector over the records and keeps the result for later queries.
     *
     * @param records telemetry records in source order
     * @return all anomalies sorted by mission time
     */
    public List<Anomaly> detect(List<ObservationRecord> records)
    {
        return run(records).anomalies();
    }

    /**
     * Same as {@link #detect(List)} but returns the complete result including baselines
     * and events.
     *
     * @param records telemetry records in source order
     * @return the result of this run
     */
    public DetectionResult run(List<ObservationRecord> records)
    {
        List<ObservationRecord> workingSet = records.stream()
                .filter(ObservationRecord::hasValidMissionTime)
                .toList();

        if (workingSet.isEmpty()) {
            LOG.debugf("No records with a valid mission time among %d input records", records.size());
            lastResult = DetectionResult.empty();
            return lastResult;
        }

        Map<String, ParameterBaseline> baselines = aggregator.compute(workingSet, profile.redlines().keySet());
        DetectionContext context = new DetectionContext(workingSet, baselines, profile, settings);

        List<Anomaly> anomalies = new ArrayList<>();
        for (Detector detector : detectors) {
            List<Anomaly> found = detector.detect(context);
            LOG.debugf("%s flagged %d anomalies", detector.getClass().getSimpleName(), found.size());
            anomalies.addAll(found);
        }
        anomalies.sort(EventClusterer.BY_MISSION_TIME);

        List<AnomalyEvent> events = clusterer.cluster(anomalies);

        LOG.debugf("Detection over %d of %d records: %d anomalies in %d events",
                workingSet.size(), records.size(), anomalies.size(), events.size());

        lastResult = new DetectionResult(workingSet.size(), baselines, anomalies, events);
        return lastResult;
    }

    /**
     * Result of the most recent run.
     *
     * @return the result, or empty when nothing has been detected yet
     */
    public Optional<DetectionResult> lastResult()
    {
        return Optional.ofNullable(lastResult);
    }

    /**
     * Summarises the most recent run.
     *
     * @return the summary, or empty when nothing has been detected yet
     */
    public Optional<AnomalySummary> summarize()
    {
        return lastResult().map(result -> summaryBuilder.build(result.anomalies(), result.events(), profile));
    }

    /**
     * Filters the anomalies of the most recent run without recomputing anything.
     *
     * @param filter criteria to apply
     * @return matching anomalies, or empty when nothing has been detected yet
     */
    public Optional<List<Anomaly>> filter(AnomalyFilter filter)
    {
        return lastResult().map(result -> filter.apply(result.anomalies()));
    }

    public MissionProfile profile()
    {
        return profile;
    }

    public DetectionSettings settings()
    {
        return settings;
    }
}
