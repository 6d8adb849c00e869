/* (C)2026 */
package com.ammann.telemetry.health;

import com.ammann.telemetry.service.FleetForecastCache;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness check describing the fleet forecast cache.
 *
 * <p>A cold cache is not a failure: the next overview request recomputes it. The check
 * is UP whenever the cache bean is available and reports whether it is warm, the limit
 * of the live entry and the metric types the fleet overview tracks.
 */
@Readiness
@ApplicationScoped
public class ForecastCacheHealthCheck implements HealthCheck {

    private static final String HEALTH_CHECK_NAME = "fleet-forecast-cache";

    @Inject FleetForecastCache cache;

    @ConfigProperty(name = "analytics.forecast.fleet.metric-types", defaultValue = "cpu,memory")
    List<String> metricTypes = List.of("cpu", "memory");

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named(HEALTH_CHECK_NAME)
                .withData("metric-types", String.join(",", metricTypes));

        if (cache == null) {
            return builder.withData("error", "Forecast cache not available").down().build();
        }

        int cachedLimit = cache.cachedLimit();
        return builder
                .withData("warm", cachedLimit > 0)
                .withData("cached-limit", cachedLimit)
                .withData("ttl-seconds", cache.getTtl().toSeconds())
                .up()
                .build();
    }
}
