/* (C)2026 */
package com.ammann.telemetry.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Correlated pairs computed over a lookback window.
 */
@Schema(description = "Cross-entity correlation result")
public record CorrelationResponseDTO(
        @Schema(description = "Lookback window in hours") int hours,
        @Schema(description = "Minimum |r| applied") double minCorrelation,
        @Schema(description = "Pairs sorted by |r| descending") List<CorrelationPairDTO> pairs) {}
