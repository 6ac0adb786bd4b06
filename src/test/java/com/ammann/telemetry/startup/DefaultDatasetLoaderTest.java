/* (C)2026 */
package com.ammann.telemetry.startup;

import static com.ammann.telemetry.support.TestDataFactory.csv;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.ammann.telemetry.service.AnomalyDetectionService;
import com.ammann.telemetry.service.TelemetryCsvParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DefaultDatasetLoaderTest {

    @TempDir Path dir;

    private AnomalyDetectionService detectionService;
    private DefaultDatasetLoader loader;

    @BeforeEach
    void setUp() {
        detectionService = mock(AnomalyDetectionService.class);
        loader = new DefaultDatasetLoader();
        loader.csvParser = new TelemetryCsvParser();
        loader.detectionService = detectionService;
    }

    @Test
    void loadsConfiguredFile() throws IOException {
        Path file = dir.resolve("default.csv");
        Files.writeString(file, csv("mission_time_s,velocity_ms", "0,1", "1,2", "2,3"));
        loader.defaultPath = Optional.of(file.toString());

        assertThat(loader.loadDefault()).isTrue();
        verify(detectionService)
                .load(argThat(dataset -> dataset.filename().equals("default.csv")
                        && dataset.records().size() == 3));
    }

    @Test
    void skipsWhenNotConfigured() {
        loader.defaultPath = Optional.empty();

        assertThat(loader.loadDefault()).isFalse();
        verify(detectionService, never()).load(any());
    }

    @Test
    void skipsMissingFile() {
        loader.defaultPath = Optional.of(dir.resolve("absent.csv").toString());

        assertThat(loader.loadDefault()).isFalse();
        verify(detectionService, never()).load(any());
    }

    @Test
    void malformedFileLeavesServiceEmpty() throws IOException {
        Path file = dir.resolve("broken.csv");
        Files.writeString(file, csv("mission_time_s,velocity_ms", "0,1,2"));
        loader.defaultPath = Optional.of(file.toString());

        assertThat(loader.loadDefault()).isFalse();
        verify(detectionService, never()).load(any());
    }
}
