/* (C)2026 */
package com.ammann.telemetry.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Snapshot of the currently loaded dataset and its detection result.
 *
 * @param loaded whether a dataset is loaded
 * @param filename name of the loaded dataset, absent when nothing is loaded
 * @param records number of records in the dataset
 * @param anomalies number of detected anomalies
 * @param events number of clustered events
 */
@Schema(description = "Dataset and detection status")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusResponseDTO(
        @Schema(description = "Whether a dataset is loaded") boolean loaded,
        @Schema(description = "Name of the loaded dataset") String filename,
        @Schema(description = "Number of records") int records,
        @Schema(description = "Number of anomalies") int anomalies,
        @Schema(description = "Number of events") int events) {

    /** Status reported before any dataset has been loaded. */
    public static StatusResponseDTO notLoaded() {
        return new StatusResponseDTO(false, null, 0, 0, 0);
    }
}
