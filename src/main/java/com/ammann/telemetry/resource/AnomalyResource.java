/* (C)2026 */
package com.ammann.telemetry.resource;

import com.ammann.telemetry.enumeration.AnomalyType;
import com.ammann.telemetry.enumeration.Severity;
import com.ammann.telemetry.exception.ValidationException;
import com.ammann.telemetry.model.Anomaly;
import com.ammann.telemetry.model.AnomalyEvent;
import com.ammann.telemetry.model.AnomalyFilter;
import com.ammann.telemetry.model.AnomalySummary;
import com.ammann.telemetry.properties.ApiProperties;
import com.ammann.telemetry.service.AnomalyDetectionService;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Arrays;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource exposing the anomalies, events and summary of the loaded dataset.
 *
 * <p>All endpoints read the result of the last detection run; none of them triggers
 * detection.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Anomalies API", description = "Detected anomalies, events and summary")
@Produces(MediaType.APPLICATION_JSON)
public class AnomalyResource {

    private static final Logger LOG = Logger.getLogger(AnomalyResource.class);

    @Inject AnomalyDetectionService detectionService;

    @GET
    @Path(ApiProperties.Anomalies.BASE)
    @Operation(
            summary = "Get Anomalies",
            description = "Returns detected anomalies, optionally filtered by severity, type or parameter")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Anomalies retrieved successfully"),
        @APIResponse(responseCode = "400", description = "Unknown severity or type"),
        @APIResponse(responseCode = "404", description = "No dataset loaded")
    })
    public Response getAnomalies(
            @Parameter(description = "Severity to keep (CAUTION, WARNING, CRITICAL)")
                    @QueryParam("severity")
                    String severity,
            @Parameter(description = "Anomaly type to keep, e.g. 'Rapid Change'") @QueryParam("type")
                    String type,
            @Parameter(description = "Raw parameter name to keep, e.g. velocity_ms")
                    @QueryParam("param")
                    String parameter) {

        AnomalyFilter filter =
                new AnomalyFilter(parseSeverity(severity), parseType(type), blankToNull(parameter));
        List<Anomaly> anomalies = detectionService.anomalies(filter);

        LOG.debugf("Anomaly query %s returned %d anomalies", filter, anomalies.size());
        return Response.ok(anomalies).build();
    }

    @GET
    @Path(ApiProperties.Anomalies.SUMMARY)
    @Operation(
            summary = "Get Anomaly Summary",
            description = "Returns anomaly counts by severity, type and parameter with events and static tables")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Summary retrieved successfully",
                content = @Content(schema = @Schema(implementation = AnomalySummary.class))),
        @APIResponse(responseCode = "404", description = "No dataset loaded")
    })
    public Response getSummary() {
        return Response.ok(detectionService.summary()).build();
    }

    @GET
    @Path(ApiProperties.Anomalies.EVENTS)
    @Operation(summary = "Get Anomaly Events", description = "Returns anomalies clustered into events")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Events retrieved successfully",
                content = @Content(schema = @Schema(implementation = AnomalyEvent.class))),
        @APIResponse(responseCode = "404", description = "No dataset loaded")
    })
    public Response getEvents() {
        return Response.ok(detectionService.events()).build();
    }

    private static Severity parseSeverity(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Severity.fromName(value);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidParameter(
                    "severity", value, "one of " + Arrays.toString(Severity.values()));
        }
    }

    private static AnomalyType parseType(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return AnomalyType.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidParameter(
                    "type",
                    value,
                    "one of "
                            + Arrays.stream(AnomalyType.values()).map(AnomalyType::getLabel).toList());
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
