/* (C)2026 */
package com.ammann.telemetry.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.telemetry.dto.StatusResponseDTO;
import com.ammann.telemetry.service.AnomalyDetectionService;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.Test;

class DatasetReadinessCheckTest {

    @Test
    void reportsLoadedDataset() {
        AnomalyDetectionService service = mock(AnomalyDetectionService.class);
        when(service.status()).thenReturn(new StatusResponseDTO(true, "crs16.csv", 500, 12, 3));

        DatasetReadinessCheck check = new DatasetReadinessCheck();
        check.detectionService = service;

        HealthCheckResponse response = check.call();

        assertThat(response.getName()).isEqualTo("dataset");
        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).isPresent();
        assertThat(response.getData().get().get("loaded")).isEqualTo(true);
        assertThat(response.getData().get().get("records")).isEqualTo(500L);
        assertThat(response.getData().get().get("anomalies")).isEqualTo(12L);
    }

    @Test
    void staysUpWithoutDataset() {
        AnomalyDetectionService service = mock(AnomalyDetectionService.class);
        when(service.status()).thenReturn(StatusResponseDTO.notLoaded());

        DatasetReadinessCheck check = new DatasetReadinessCheck();
        check.detectionService = service;

        HealthCheckResponse response = check.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData().get().get("loaded")).isEqualTo(false);
    }
}
