/* (C)2026 */
package com.ammann.telemetry.resource;

import com.ammann.telemetry.dto.CorrelationResponseDTO;
import com.ammann.telemetry.exception.ValidationException;
import com.ammann.telemetry.properties.ApiProperties;
import com.ammann.telemetry.service.MetricCorrelationService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for cross-entity metric correlations.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Correlation API", description = "Pearson correlation between entity metric series")
@Produces(MediaType.APPLICATION_JSON)
public class CorrelationResource {

    private static final Logger LOG = Logger.getLogger(CorrelationResource.class);

    @Inject
    MetricCorrelationService correlationService;

    @GET
    @Path(ApiProperties.Correlations.BASE)
    @Operation(
            summary = "Find Correlated Entities",
            description = "Correlates bucketed metric series of all entities and returns the strongly related pairs"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Correlated pairs sorted by |r|",
                    content = @Content(schema = @Schema(implementation = CorrelationResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid parameters"),
            @APIResponse(responseCode = "503", description = "Metrics store unavailable or run cancelled")
    })
    public Response getCorrelations(
            @Parameter(description = "Lookback window in hours, clamped to [1, 168] (default: 24)")
            @QueryParam("hours") @DefaultValue("24") int hours,
            @Parameter(description = "Minimum |r|, clamped to [0.5, 1] (default: configured minimum)")
            @QueryParam("minCorrelation") Double minCorrelation) {

        LOG.debugf("Correlation request: hours=%d, minCorrelation=%s", hours, minCorrelation);

        if (minCorrelation != null && !Double.isFinite(minCorrelation)) {
            throw ValidationException.invalidParameter("minCorrelation", minCorrelation, "finite number");
        }

        CorrelationResponseDTO response = minCorrelation != null
                ? correlationService.findCorrelatedEntities(hours, minCorrelation)
                : correlationService.findCorrelatedEntities(hours);

        return Response.ok(response).build();
    }
}
