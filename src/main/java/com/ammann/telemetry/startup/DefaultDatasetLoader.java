/* (C)2026 */
package com.ammann.telemetry.startup;

import com.ammann.telemetry.exception.ValidationException;
import com.ammann.telemetry.model.TelemetryDataset;
import com.ammann.telemetry.service.AnomalyDetectionService;
import com.ammann.telemetry.service.TelemetryCsvParser;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Loads the default telemetry dataset on application startup.
 * <p>
 * The path comes from {@code telemetry.dataset.default-path}. A missing property or file
 * simply leaves the service without data until the first upload; an unreadable file is
 * logged and likewise leaves the service empty.
 */
@ApplicationScoped
public class DefaultDatasetLoader {

    private static final Logger LOG = Logger.getLogger(DefaultDatasetLoader.class);

    @Inject TelemetryCsvParser csvParser;

    @Inject AnomalyDetectionService detectionService;

    @ConfigProperty(name = "telemetry.dataset.default-path")
    Optional<String> defaultPath;

    /**
     * Executed on application startup.
     *
     * @param event Quarkus startup event
     */
    void onStart(@Observes StartupEvent event) {
        loadDefault();
    }

    boolean loadDefault() {
        if (defaultPath == null || defaultPath.isEmpty()) {
            LOG.info("No default telemetry dataset configured");
            return false;
        }

        Path file = Path.of(defaultPath.get());
        if (!Files.isRegularFile(file)) {
            LOG.warnf("Default telemetry dataset %s not found, starting without data", file);
            return false;
        }

        try {
            TelemetryDataset dataset = csvParser.parseFile(file);
            detectionService.load(dataset);
            LOG.infof("Loaded default dataset: %d records", dataset.records().size());
            return true;
        } catch (ValidationException e) {
            LOG.errorf(e, "Default telemetry dataset %s could not be loaded", file);
            return false;
        }
    }
}
