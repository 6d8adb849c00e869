/* (C)2026 */
package com.ammann.telemetry.dto;

import com.ammann.telemetry.enumeration.DetectionMethod;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Result of evaluating one metric value against the recent window of its series.
 *
 * @param entityId     monitored entity
 * @param metricType   metric type key
 * @param currentValue value under evaluation
 * @param mean         window mean
 * @param stdDev       window population standard deviation
 * @param zScore       (current - mean) / stdDev rounded to two decimals, 0 when stdDev is 0
 * @param anomalous    whether the value is flagged by the detection method
 * @param threshold    gate applied by the detection method
 * @param method       detection method that produced the verdict
 * @param timestamp    evaluation time
 */
@Schema(description = "Per-metric anomaly verdict")
public record AnomalyVerdictDTO(
        @Schema(description = "Entity identifier") String entityId,
        @Schema(description = "Metric type, e.g. cpu or memory") String metricType,
        @Schema(description = "Value under evaluation") double currentValue,
        @Schema(description = "Window mean") double mean,
        @Schema(description = "Window population standard deviation") double stdDev,
        @Schema(description = "Z-score rounded to two decimals") double zScore,
        @JsonProperty("isAnomalous")
        @Schema(description = "Whether the value is anomalous") boolean anomalous,
        @Schema(description = "Threshold applied by the detection method") double threshold,
        @Schema(description = "Detection method") DetectionMethod method,
        @Schema(description = "Evaluation timestamp") Instant timestamp) {}
