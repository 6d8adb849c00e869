/* (C)2026 */
package com.ammann.telemetry.dto;

import com.ammann.telemetry.enumeration.CorrelationDirection;
import com.ammann.telemetry.enumeration.CorrelationStrength;
import com.ammann.telemetry.model.EntityRef;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Pair of entities whose bucketed series of one metric type move together.
 */
@Schema(description = "Correlated entity pair")
public record CorrelationPairDTO(
        @Schema(description = "First entity") EntityRef entityA,
        @Schema(description = "Second entity") EntityRef entityB,
        @Schema(description = "Metric type") String metricType,
        @Schema(description = "Pearson r rounded to three decimals", minimum = "-1", maximum = "1")
        double correlation,
        @Schema(description = "Strength classification of |r|") CorrelationStrength strength,
        @Schema(description = "Sign of r") CorrelationDirection direction,
        @Schema(description = "Number of aligned buckets") int sampleCount) {}
