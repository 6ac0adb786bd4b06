/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.detection.DetectionSettings;
import com.ammann.telemetry.detection.TelemetryAnomalyDetector;
import com.ammann.telemetry.dto.ParameterStatisticsDTO;
import com.ammann.telemetry.dto.StatusResponseDTO;
import com.ammann.telemetry.enumeration.Severity;
import com.ammann.telemetry.exception.NoDataAvailableException;
import com.ammann.telemetry.model.Anomaly;
import com.ammann.telemetry.model.AnomalyEvent;
import com.ammann.telemetry.model.AnomalyFilter;
import com.ammann.telemetry.model.AnomalySummary;
import com.ammann.telemetry.model.DetectionResult;
import com.ammann.telemetry.model.MissionProfile;
import com.ammann.telemetry.model.TelemetryDataset;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.jboss.logging.Logger;

/**
 * Holds the currently loaded telemetry dataset together with its detection result.
 *
 * <p>Loading a dataset runs a fresh {@link TelemetryAnomalyDetector} over it and then
 * publishes dataset, result, summary and column statistics as one immutable snapshot, so
 * concurrent readers never observe a half-updated state. All query methods are pure reads
 * of the current snapshot and throw {@link NoDataAvailableException} while nothing is
 * loaded.
 */
@ApplicationScoped
public class AnomalyDetectionService {

    private static final Logger LOG = Logger.getLogger(AnomalyDetectionService.class);

    private final MissionProfile profile;
    private final DetectionSettings settings;
    private final TelemetryStatisticsService statisticsService;
    private final MeterRegistry meterRegistry;

    private final AtomicReference<LoadedDataset> current = new AtomicReference<>();

    private Counter detectionRunCounter;
    private Counter anomalyCounter;
    private Timer detectionTimer;

    @Inject
    public AnomalyDetectionService(
            MissionProfile profile,
            DetectionSettings settings,
            TelemetryStatisticsService statisticsService,
            MeterRegistry meterRegistry) {
        this.profile = profile;
        this.settings = settings;
        this.statisticsService = statisticsService;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void initMetrics() {
        detectionRunCounter =
                Counter.builder("telemetry_detection_runs_total")
                        .description("Completed detection runs")
                        .register(meterRegistry);
        anomalyCounter =
                Counter.builder("telemetry_anomalies_detected_total")
                        .description("Anomalies flagged across all detection runs")
                        .register(meterRegistry);
        detectionTimer =
                Timer.builder("telemetry_detection_duration")
                        .description("Duration of a full detection run")
                        .register(meterRegistry);
    }

    /**
     * Runs detection over a dataset and makes it the current one.
     *
     * @param dataset fully materialised telemetry
     * @return the detection result for the dataset
     */
    public DetectionResult load(TelemetryDataset dataset) {
        TelemetryAnomalyDetector detector = new TelemetryAnomalyDetector(profile, settings);

        DetectionResult result = detectionTimer.record(() -> detector.run(dataset.records()));
        AnomalySummary summary =
                detector.summarize().orElseThrow(NoDataAvailableException::new);
        Map<String, ParameterStatisticsDTO> statistics = statisticsService.statisticsFor(dataset);

        detectionRunCounter.increment();
        anomalyCounter.increment(result.anomalies().size());

        if (result.workingSetSize() < dataset.records().size()) {
            LOG.warnf(
                    "%d of %d records in %s have no valid mission time and were ignored",
                    dataset.records().size() - result.workingSetSize(),
                    dataset.records().size(),
                    dataset.filename());
        }

        current.set(new LoadedDataset(dataset, result, summary, statistics));

        LOG.infof(
                "Loaded %s: %d records, %d anomalies in %d events (critical=%d)",
                dataset.filename(),
                dataset.records().size(),
                summary.totalAnomalies(),
                summary.totalEvents(),
                summary.bySeverity().get(Severity.CRITICAL));

        return result;
    }

    public boolean isLoaded() {
        return current.get() != null;
    }

    public StatusResponseDTO status() {
        LoadedDataset loaded = current.get();
        if (loaded == null) {
            return StatusResponseDTO.notLoaded();
        }
        return new StatusResponseDTO(
                true,
                loaded.dataset().filename(),
                loaded.dataset().records().size(),
                loaded.result().anomalies().size(),
                loaded.result().events().size());
    }

    public TelemetryDataset dataset() {
        return require().dataset();
    }

    /**
     * Filters the anomalies of the current dataset.
     *
     * @param filter criteria, use {@link AnomalyFilter#none()} for all anomalies
     * @return matching anomalies in mission-time order
     * @throws NoDataAvailableException if no dataset is loaded
     */
    public List<Anomaly> anomalies(AnomalyFilter filter) {
        return filter.apply(require().result().anomalies());
    }

    public AnomalySummary summary() {
        return require().summary();
    }

    public List<AnomalyEvent> events() {
        return require().result().events();
    }

    public Map<String, ParameterStatisticsDTO> statistics() {
        return require().statistics();
    }

    public MissionProfile profile() {
        return profile;
    }

    private LoadedDataset require() {
        LoadedDataset loaded = current.get();
        if (loaded == null) {
            throw new NoDataAvailableException();
        }
        return loaded;
    }

    /** Everything derived from one dataset, published atomically. */
    private record LoadedDataset(
            TelemetryDataset dataset,
            DetectionResult result,
            AnomalySummary summary,
            Map<String, ParameterStatisticsDTO> statistics) {}
}
