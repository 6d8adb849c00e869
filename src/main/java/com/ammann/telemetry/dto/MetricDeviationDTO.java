/* (C)2026 */
package com.ammann.telemetry.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One elevated metric contributing to a composite anomaly.
 */
@Schema(description = "Elevated metric within a composite anomaly")
public record MetricDeviationDTO(
        @Schema(description = "Metric type") String type,
        @Schema(description = "Current value") double currentValue,
        @Schema(description = "Window mean") double mean,
        @Schema(description = "Signed z-score") double zScore) {

    public static MetricDeviationDTO from(AnomalyVerdictDTO verdict) {
        return new MetricDeviationDTO(
                verdict.metricType(), verdict.currentValue(), verdict.mean(), verdict.zScore());
    }
}
