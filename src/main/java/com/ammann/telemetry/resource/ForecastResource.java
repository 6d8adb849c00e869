/* (C)2026 */
package com.ammann.telemetry.resource;

import com.ammann.telemetry.dto.CapacityForecastDTO;
import com.ammann.telemetry.properties.ApiProperties;
import com.ammann.telemetry.service.CapacityForecastService;
import com.ammann.telemetry.service.FleetForecastService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.enums.SchemaType;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * REST resource for capacity forecasts.
 *
 * <p>The fleet overview is served from a short-lived cache; the single-entity forecast
 * always reads the metrics store.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Forecast API", description = "Linear capacity forecasts and time to threshold")
@Produces(MediaType.APPLICATION_JSON)
public class ForecastResource {

    private static final Logger LOG = Logger.getLogger(ForecastResource.class);
    private static final int MAX_HOURS = 168;

    @Inject
    FleetForecastService fleetForecastService;

    @Inject
    CapacityForecastService capacityForecastService;

    @GET
    @Path(ApiProperties.Forecasts.BASE)
    @Operation(
            summary = "Fleet Capacity Forecasts",
            description = "Returns the entities whose resource usage approaches the capacity threshold soonest"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Forecasts with increasing trends first",
                    content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = CapacityForecastDTO.class))),
            @APIResponse(responseCode = "503", description = "Metrics store unavailable or run cancelled")
    })
    public Response getForecasts(
            @Parameter(description = "Number of forecasts, clamped to [1, 50] (default: 10)")
            @QueryParam("limit") @DefaultValue("10") int limit) {

        LOG.debugf("Fleet forecast request: limit=%d", limit);

        List<CapacityForecastDTO> forecasts = fleetForecastService.getForecasts(limit);
        return Response.ok(forecasts).build();
    }

    @GET
    @Path(ApiProperties.Forecasts.ENTITY)
    @Operation(
            summary = "Entity Capacity Forecast",
            description = "Fits a linear trend to one entity metric and projects it over the given horizon"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Forecast computed",
                    content = @Content(schema = @Schema(implementation = CapacityForecastDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid parameters"),
            @APIResponse(responseCode = "404", description = "Fewer than five samples in the lookback window"),
            @APIResponse(responseCode = "503", description = "Metrics store unavailable")
    })
    public Response getForecast(
            @Parameter(description = "Entity identifier", required = true)
            @PathParam("entityId") String entityId,
            @Parameter(description = "Metric type key (default: cpu)")
            @QueryParam("metric") @DefaultValue("cpu") String metric,
            @Parameter(description = "Lookback and horizon in hours, clamped to [1, 168] (default: 24)")
            @QueryParam("hours") @DefaultValue("24") int hours) {

        int safeHours = Math.max(1, Math.min(MAX_HOURS, hours));
        LOG.debugf("Forecast request: entity=%s, metric=%s, hours=%d", entityId, metric, safeHours);

        CapacityForecastDTO forecast = capacityForecastService.forecast(entityId, metric, safeHours);
        if (forecast == null) {
            throw new NotFoundException("Not enough samples for " + entityId + "/" + metric);
        }

        return Response.ok(forecast).build();
    }

    @DELETE
    @Path(ApiProperties.Forecasts.CACHE)
    @Operation(summary = "Invalidate Forecast Cache", description = "Drops the cached fleet forecast overview")
    @APIResponse(responseCode = "204", description = "Cache invalidated")
    public Response invalidateCache() {
        fleetForecastService.invalidateCache();
        LOG.info("Fleet forecast cache invalidated on request");
        return Response.noContent().build();
    }
}
