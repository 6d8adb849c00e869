/* (C)2026 */
package com.ammann.telemetry.resource;

import com.ammann.telemetry.dto.AnomalyVerdictDTO;
import com.ammann.telemetry.dto.CompositeAnomalyDTO;
import com.ammann.telemetry.enumeration.DetectionMethod;
import com.ammann.telemetry.exception.ValidationException;
import com.ammann.telemetry.properties.ApiProperties;
import com.ammann.telemetry.service.AnomalyDetectionService;
import com.ammann.telemetry.service.CompositeScoringService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.enums.SchemaType;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;

/**
 * REST resource for per-metric anomaly verdicts and composite multi-metric scoring.
 *
 * <p>Single-entity verdicts read the recent window from the metrics store. Composite
 * scoring takes verdicts computed by the caller, keyed by entity id.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Anomaly API", description = "Statistical anomaly detection on entity metrics")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AnomalyResource {

    private static final Logger LOG = Logger.getLogger(AnomalyResource.class);

    @Inject
    AnomalyDetectionService anomalyDetectionService;

    @Inject
    CompositeScoringService compositeScoringService;

    @GET
    @Path(ApiProperties.Anomalies.ENTITY)
    @Operation(
            summary = "Evaluate Metric Anomaly",
            description = "Evaluates the latest value of one entity metric against its recent window"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Verdict computed",
                    content = @Content(schema = @Schema(implementation = AnomalyVerdictDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid parameters"),
            @APIResponse(responseCode = "404", description = "Not enough samples for a verdict"),
            @APIResponse(responseCode = "503", description = "Metrics store unavailable")
    })
    public Response getAnomaly(
            @Parameter(description = "Entity identifier", required = true)
            @PathParam("entityId") String entityId,
            @Parameter(description = "Metric type key (default: cpu)")
            @QueryParam("metric") @DefaultValue("cpu") String metric,
            @Parameter(description = "Detection method: zscore, bollinger or adaptive (default: zscore)")
            @QueryParam("method") String method) {

        LOG.debugf("Anomaly request: entity=%s, metric=%s, method=%s", entityId, metric, method);

        DetectionMethod detectionMethod = null;
        if (method != null && !method.isBlank()) {
            detectionMethod = DetectionMethod.fromLabel(method)
                    .orElseThrow(() -> ValidationException.invalidParameter(
                            "method", method, "one of zscore, bollinger, adaptive"));
        }

        AnomalyVerdictDTO verdict = anomalyDetectionService.evaluate(entityId, metric, detectionMethod);
        if (verdict == null) {
            throw new NotFoundException("Not enough samples for " + entityId + "/" + metric);
        }

        return Response.ok(verdict).build();
    }

    @POST
    @Path(ApiProperties.Anomalies.COMPOSITE)
    @Operation(
            summary = "Score Composite Anomalies",
            description = "Combines per-metric verdicts of each entity into a composite score, severity and pattern"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Composite anomalies sorted by score",
                    content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = CompositeAnomalyDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid parameters")
    })
    public Response scoreComposite(
            @Parameter(description = "Minimum composite score (default: configured minimum)")
            @QueryParam("minScore") Double minScore,
            Map<String, List<AnomalyVerdictDTO>> verdictsByEntity) {

        if (minScore != null && (!Double.isFinite(minScore) || minScore < 0)) {
            throw ValidationException.invalidParameter("minScore", minScore, "non-negative number");
        }

        List<CompositeAnomalyDTO> anomalies = minScore != null
                ? compositeScoringService.scoreAll(verdictsByEntity, minScore)
                : compositeScoringService.scoreAll(verdictsByEntity);

        LOG.debugf("Composite scoring returned %d anomalies", anomalies.size());
        return Response.ok(anomalies).build();
    }
}
