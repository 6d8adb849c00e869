/* (C)2026 */
package com.ammann.telemetry.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Actual or projected point of a capacity forecast.
 */
@Schema(description = "Forecast series point")
public record ForecastPointDTO(
        @Schema(description = "Point timestamp") Instant timestamp,
        @Schema(description = "Observed or projected value") double value,
        @JsonProperty("isProjected")
        @Schema(description = "True for projected points") boolean projected) {

    public static ForecastPointDTO actual(Instant timestamp, double value) {
        return new ForecastPointDTO(timestamp, value, false);
    }

    public static ForecastPointDTO projected(Instant timestamp, double value) {
        return new ForecastPointDTO(timestamp, value, true);
    }
}
