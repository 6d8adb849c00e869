/* (C)2026 */
package com.ammann.telemetry.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.telemetry.dto.AnomalyVerdictDTO;
import com.ammann.telemetry.dto.CapacityForecastDTO;
import com.ammann.telemetry.dto.CorrelationResponseDTO;
import com.ammann.telemetry.enumeration.CorrelationDirection;
import com.ammann.telemetry.enumeration.Trend;
import com.ammann.telemetry.health.ForecastCacheHealthCheck;
import com.ammann.telemetry.store.InMemoryMetricsStore;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Boots the application and runs every analytics component against the bundled
 * in-memory store with configuration from {@code application.properties}.
 */
@QuarkusTest
class AnalyticsWiringIntegrationTest {

    @Inject InMemoryMetricsStore store;

    @Inject AnomalyDetectionService anomalyDetectionService;

    @Inject MetricCorrelationService correlationService;

    @Inject FleetForecastService fleetForecastService;

    @Inject CapacityForecastService capacityForecastService;

    @Inject @Readiness ForecastCacheHealthCheck cacheHealthCheck;

    @BeforeEach
    void setUp() {
        store.clear();
        fleetForecastService.invalidateCache();

        Instant start = Instant.now().truncatedTo(ChronoUnit.HOURS).minus(Duration.ofHours(3));
        for (int i = 0; i < 30; i++) {
            Instant ts = start.plus(Duration.ofMinutes(5L * i));
            double wave = 40 + (i % 7) * 3;
            store.record("web-1", "Web 1", "cpu", ts, wave);
            store.record("web-2", "Web 2", "cpu", ts, 100 - wave);
            store.record("db-1", "Database", "memory", ts, 50 + i);
        }
        store.record("web-1", "Web 1", "cpu", start.plus(Duration.ofMinutes(151)), 95.0);
    }

    @Test
    void detectsSpikeFromStore() {
        AnomalyVerdictDTO verdict = anomalyDetectionService.evaluate("web-1", "cpu", null);

        assertThat(verdict).isNotNull();
        assertThat(verdict.currentValue()).isEqualTo(95.0);
        assertThat(verdict.anomalous()).isTrue();
    }

    @Test
    void correlatesMirroredEntities() {
        CorrelationResponseDTO response = correlationService.findCorrelatedEntities(24, 0.7);

        assertThat(response.pairs()).isNotEmpty();
        assertThat(response.pairs().get(0).direction()).isEqualTo(CorrelationDirection.NEGATIVE);
    }

    @Test
    void forecastsRisingMemoryFirstAndWarmsCache() {
        List<CapacityForecastDTO> forecasts = fleetForecastService.getForecasts(10);

        assertThat(forecasts).isNotEmpty();
        assertThat(forecasts.get(0).entityId()).isEqualTo("db-1");
        assertThat(forecasts.get(0).trend()).isEqualTo(Trend.INCREASING);

        HealthCheckResponse health = cacheHealthCheck.call();
        assertThat(health.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(health.getData().get().get("warm")).isEqualTo(true);
    }

    @Test
    void singleEntityForecastReadsLookback() {
        CapacityForecastDTO forecast = capacityForecastService.forecast("db-1", "memory");

        assertThat(forecast).isNotNull();
        assertThat(forecast.slope()).isGreaterThan(0.0);
    }
}
