/* (C)2026 */
package com.ammann.telemetry.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.telemetry.dto.CapacityForecastDTO;
import com.ammann.telemetry.enumeration.ForecastConfidence;
import com.ammann.telemetry.enumeration.Trend;
import com.ammann.telemetry.service.CapacityForecastService;
import com.ammann.telemetry.service.FleetForecastService;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.junit.jupiter.api.Test;

class ForecastResourceTest {

    @Test
    void fleetOverviewDelegatesLimit() {
        ForecastResource resource = buildResource();
        List<CapacityForecastDTO> forecasts = List.of(forecast("db-1"));
        when(resource.fleetForecastService.getForecasts(5)).thenReturn(forecasts);

        Response response = resource.getForecasts(5);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getEntity()).isEqualTo(forecasts);
    }

    @Test
    void entityForecastClampsHours() {
        ForecastResource resource = buildResource();
        CapacityForecastDTO forecast = forecast("db-1");
        when(resource.capacityForecastService.forecast("db-1", "memory", 168)).thenReturn(forecast);

        Response response = resource.getForecast("db-1", "memory", 1000);

        assertThat(response.getEntity()).isEqualTo(forecast);
    }

    @Test
    void entityForecastWithoutDataIsNotFound() {
        ForecastResource resource = buildResource();

        assertThatThrownBy(() -> resource.getForecast("db-1", "cpu", 24))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void deletingCacheReturnsNoContent() {
        ForecastResource resource = buildResource();

        Response response = resource.invalidateCache();

        assertThat(response.getStatus()).isEqualTo(204);
        verify(resource.fleetForecastService).invalidateCache();
    }

    private static CapacityForecastDTO forecast(String entityId) {
        return new CapacityForecastDTO(entityId, entityId, "cpu", 70.0, Trend.INCREASING, 1.0, 60.0, 0.9,
                List.of(), 20.0, ForecastConfidence.HIGH);
    }

    private ForecastResource buildResource() {
        ForecastResource resource = new ForecastResource();
        resource.fleetForecastService = mock(FleetForecastService.class);
        resource.capacityForecastService = mock(CapacityForecastService.class);
        return resource;
    }
}
