/* (C)2026 */
package com.ammann.telemetry.resource;

import com.ammann.telemetry.dto.ColumnInfoDTO;
import com.ammann.telemetry.dto.ParameterStatisticsDTO;
import com.ammann.telemetry.dto.StatusResponseDTO;
import com.ammann.telemetry.dto.UploadResponseDTO;
import com.ammann.telemetry.exception.ValidationException;
import com.ammann.telemetry.model.DetectionResult;
import com.ammann.telemetry.model.ObservationRecord;
import com.ammann.telemetry.model.TelemetryDataset;
import com.ammann.telemetry.properties.ApiProperties;
import com.ammann.telemetry.service.AnomalyDetectionService;
import com.ammann.telemetry.service.TelemetryCsvParser;
import com.ammann.telemetry.service.TelemetryStatisticsService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for loading telemetry and reading it back.
 *
 * <p>Provides the dataset status, CSV upload (which re-runs anomaly detection), filtered
 * and downsampled telemetry rows, column metadata and per-column statistics.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Telemetry API", description = "Telemetry upload, access and statistics")
@Produces(MediaType.APPLICATION_JSON)
public class TelemetryResource {

    private static final Logger LOG = Logger.getLogger(TelemetryResource.class);
    private static final int MAX_POINTS_LIMIT = 100_000;

    @Inject AnomalyDetectionService detectionService;

    @Inject TelemetryStatisticsService statisticsService;

    @Inject TelemetryCsvParser csvParser;

    @ConfigProperty(name = "telemetry.api.max-points-default", defaultValue = "1000")
    int defaultMaxPoints = 1000;

    @GET
    @Path(ApiProperties.STATUS)
    @Operation(
            summary = "Get Dataset Status",
            description = "Returns whether a dataset is loaded and how many anomalies it produced")
    @APIResponse(
            responseCode = "200",
            description = "Status retrieved successfully",
            content = @Content(schema = @Schema(implementation = StatusResponseDTO.class)))
    public Response getStatus() {
        return Response.ok(detectionService.status()).build();
    }

    @POST
    @Path(ApiProperties.Telemetry.UPLOAD)
    @Consumes({"text/csv", MediaType.TEXT_PLAIN})
    @Operation(
            summary = "Upload Telemetry CSV",
            description =
                    "Parses a telemetry CSV with a header row, replaces the current dataset and"
                            + " runs anomaly detection over it")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Dataset loaded and analysed",
                content = @Content(schema = @Schema(implementation = UploadResponseDTO.class))),
        @APIResponse(responseCode = "400", description = "Empty or malformed CSV"),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response upload(
            @Parameter(description = "Name to report for the uploaded dataset")
                    @QueryParam("filename")
                    @DefaultValue("upload.csv")
                    String filename,
            String body) {

        if (body == null || body.isBlank()) {
            throw new ValidationException("No file uploaded");
        }
        if (!filename.endsWith(".csv")) {
            throw ValidationException.invalidParameter("filename", filename, "a .csv file name");
        }

        TelemetryDataset dataset = csvParser.parse(filename, body);
        if (dataset.records().isEmpty()) {
            throw new ValidationException("Uploaded CSV contains no records");
        }

        DetectionResult result = detectionService.load(dataset);

        LOG.infof("Upload %s processed: %d records", filename, dataset.records().size());
        return Response.ok(
                        new UploadResponseDTO(
                                true,
                                dataset.filename(),
                                dataset.records().size(),
                                dataset.columns(),
                                result.anomalies().size(),
                                result.events().size()))
                .build();
    }

    @GET
    @Path(ApiProperties.Telemetry.BASE)
    @Operation(
            summary = "Get Telemetry Rows",
            description =
                    "Returns telemetry rows, optionally restricted to a mission-time range and a"
                            + " set of parameters, downsampled to at most maxPoints rows")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Telemetry rows retrieved successfully"),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "404", description = "No dataset loaded")
    })
    public Response getTelemetry(
            @Parameter(description = "Maximum number of rows to return") @QueryParam("maxPoints")
                    Integer maxPoints,
            @Parameter(description = "Comma-separated parameter names to include")
                    @QueryParam("params")
                    String params,
            @Parameter(description = "Inclusive lower mission-time bound in seconds")
                    @QueryParam("startTime")
                    Double startTime,
            @Parameter(description = "Inclusive upper mission-time bound in seconds")
                    @QueryParam("endTime")
                    Double endTime) {

        int limit = maxPoints != null ? maxPoints : defaultMaxPoints;
        if (limit <= 0 || limit > MAX_POINTS_LIMIT) {
            throw ValidationException.invalidParameter(
                    "maxPoints", limit, "value between 1 and " + MAX_POINTS_LIMIT);
        }

        TelemetryDataset dataset = detectionService.dataset();
        List<ObservationRecord> records = dataset.records();
        if (startTime != null || endTime != null) {
            records =
                    records.stream()
                            .filter(r -> r.missionTime() != null)
                            .filter(r -> startTime == null || r.missionTime() >= startTime)
                            .filter(r -> endTime == null || r.missionTime() <= endTime)
                            .toList();
        }
        records = statisticsService.downsample(records, limit);

        List<String> selected =
                params == null || params.isBlank()
                        ? null
                        : Arrays.stream(params.split(",")).map(String::trim).filter(p -> !p.isEmpty()).toList();

        List<Map<String, Object>> rows =
                records.stream()
                        .map(r -> statisticsService.toRow(r, dataset.columns(), selected))
                        .toList();

        LOG.debugf("Returned %d telemetry rows (maxPoints=%d, params=%s)", rows.size(), limit, params);
        return Response.ok(rows).build();
    }

    @GET
    @Path(ApiProperties.Telemetry.COLUMNS)
    @Operation(summary = "Get Telemetry Columns", description = "Describes the columns of the loaded dataset")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Columns retrieved successfully",
                content = @Content(schema = @Schema(implementation = ColumnInfoDTO.class))),
        @APIResponse(responseCode = "404", description = "No dataset loaded")
    })
    public Response getColumns() {
        TelemetryDataset dataset = detectionService.dataset();
        return Response.ok(statisticsService.columnInfo(dataset, detectionService.profile())).build();
    }

    @GET
    @Path(ApiProperties.STATS)
    @Operation(
            summary = "Get Column Statistics",
            description = "Returns descriptive statistics for every numeric column")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Statistics retrieved successfully",
                content = @Content(schema = @Schema(implementation = ParameterStatisticsDTO.class))),
        @APIResponse(responseCode = "404", description = "No dataset loaded")
    })
    public Response getStatistics() {
        return Response.ok(detectionService.statistics()).build();
    }
}
