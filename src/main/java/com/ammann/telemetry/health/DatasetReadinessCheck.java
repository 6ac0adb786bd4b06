/* (C)2026 */
package com.ammann.telemetry.health;

import com.ammann.telemetry.dto.StatusResponseDTO;
import com.ammann.telemetry.service.AnomalyDetectionService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness check reporting the loaded dataset.
 *
 * <p>The service can accept uploads without a dataset, so the check is always UP; the
 * response data tells operators whether a dataset is loaded and how large it is.
 */
@Readiness
@ApplicationScoped
public class DatasetReadinessCheck implements HealthCheck {

    @Inject AnomalyDetectionService detectionService;

    @Override
    public HealthCheckResponse call() {
        StatusResponseDTO status = detectionService.status();
        return HealthCheckResponse.named("dataset")
                .up()
                .withData("loaded", status.loaded())
                .withData("records", status.records())
                .withData("anomalies", status.anomalies())
                .build();
    }
}
