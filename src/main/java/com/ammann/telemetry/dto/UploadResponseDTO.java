/* (C)2026 */
package com.ammann.telemetry.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Result of loading a telemetry upload and running detection over it.
 *
 * @param success always {@code true}; failures are reported as error responses
 * @param filename name of the uploaded dataset
 * @param records number of parsed records
 * @param columns column names in source order
 * @param anomalies number of detected anomalies
 * @param events number of clustered events
 */
@Schema(description = "Telemetry upload result")
public record UploadResponseDTO(
        @Schema(description = "Whether the upload was processed") boolean success,
        @Schema(description = "Name of the uploaded dataset") String filename,
        @Schema(description = "Number of records") int records,
        @Schema(description = "Column names") List<String> columns,
        @Schema(description = "Number of anomalies") int anomalies,
        @Schema(description = "Number of events") int events) {}
