/* (C)2026 */
package com.ammann.telemetry.dto;

import com.ammann.telemetry.enumeration.ForecastConfidence;
import com.ammann.telemetry.enumeration.Trend;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Linear capacity projection for one (entity, metric) series.
 *
 * @param entityId             monitored entity
 * @param entityName           display name of the entity
 * @param metricType           metric type key
 * @param currentValue         newest observed value
 * @param trend                direction of the fitted slope
 * @param slope                fitted slope in units per hour
 * @param intercept            fitted value at the first sample
 * @param rSquared             coefficient of determination in [0, 1]
 * @param forecastPoints       recent actual points followed by projected points
 * @param timeToThresholdHours hours until the threshold is crossed, or {@code null}
 * @param confidence           confidence bucket
 */
@Schema(description = "Capacity forecast")
public record CapacityForecastDTO(
        @Schema(description = "Entity identifier") String entityId,
        @Schema(description = "Entity display name") String entityName,
        @Schema(description = "Metric type") String metricType,
        @Schema(description = "Newest observed value") double currentValue,
        @Schema(description = "Trend direction") Trend trend,
        @Schema(description = "Slope in units per hour") double slope,
        @Schema(description = "Intercept at the first sample") double intercept,
        @Schema(description = "Coefficient of determination", minimum = "0", maximum = "1")
        double rSquared,
        @Schema(description = "Actual and projected points") List<ForecastPointDTO> forecastPoints,
        @Schema(description = "Hours until threshold, null when not approaching", nullable = true)
        Double timeToThresholdHours,
        @Schema(description = "Forecast confidence") ForecastConfidence confidence) {

    public CapacityForecastDTO {
        forecastPoints = List.copyOf(forecastPoints);
    }

    @JsonIgnore
    public boolean isIncreasing() {
        return trend == Trend.INCREASING;
    }
}
