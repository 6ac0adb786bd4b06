/* (C)2026 */
package com.ammann.telemetry.resource;

import com.ammann.telemetry.model.MissionProfile;
import com.ammann.telemetry.properties.ApiProperties;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * REST resource for the static mission configuration. Available whether or not a dataset
 * is loaded.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Mission API", description = "Redline table and mission event markers")
@Produces(MediaType.APPLICATION_JSON)
public class MissionResource {

    @Inject MissionProfile profile;

    @GET
    @Path(ApiProperties.Mission.REDLINES)
    @Operation(summary = "Get Redlines", description = "Returns the redline table keyed by parameter")
    @APIResponse(responseCode = "200", description = "Redline table")
    public Response getRedlines() {
        return Response.ok(profile.redlines()).build();
    }

    @GET
    @Path(ApiProperties.Mission.EVENTS)
    @Operation(
            summary = "Get Mission Events",
            description = "Returns mission event markers in seconds keyed by event name")
    @APIResponse(responseCode = "200", description = "Mission event markers")
    public Response getMissionEvents() {
        return Response.ok(profile.missionEvents()).build();
    }
}
