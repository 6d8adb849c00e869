/* (C)2026 */
package com.ammann.telemetry.dto;

import com.ammann.telemetry.enumeration.Severity;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Composite diagnosis aggregating the simultaneously elevated metrics of one entity.
 *
 * @param entityId           monitored entity
 * @param entityName         display name of the entity
 * @param metrics            elevated metrics in input order
 * @param compositeScore     root-mean-square of the elevated absolute z-scores
 * @param pattern            recognized pattern label, or {@code null}
 * @param patternDescription explanation of the recognized pattern, or {@code null}
 * @param severity           severity bucket of the composite score
 * @param timestamp          time of scoring
 */
@Schema(description = "Composite multi-metric anomaly for one entity")
public record CompositeAnomalyDTO(
        @Schema(description = "Entity identifier") String entityId,
        @Schema(description = "Entity display name") String entityName,
        @Schema(description = "Elevated metrics") List<MetricDeviationDTO> metrics,
        @Schema(description = "RMS of elevated |z-scores|, two decimals") double compositeScore,
        @Schema(description = "Recognized pattern label", nullable = true) String pattern,
        @Schema(description = "Pattern explanation", nullable = true) String patternDescription,
        @Schema(description = "Severity derived from the composite score") Severity severity,
        @Schema(description = "Scoring timestamp") Instant timestamp) {

    public CompositeAnomalyDTO {
        metrics = List.copyOf(metrics);
    }
}
