/* (C)2026 */
package com.ammann.telemetry.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.telemetry.dto.CorrelationResponseDTO;
import com.ammann.telemetry.exception.ValidationException;
import com.ammann.telemetry.service.MetricCorrelationService;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.junit.jupiter.api.Test;

class CorrelationResourceTest {

    @Test
    void passesExplicitMinimum() {
        CorrelationResource resource = buildResource();
        CorrelationResponseDTO expected = new CorrelationResponseDTO(12, 0.8, List.of());
        when(resource.correlationService.findCorrelatedEntities(12, 0.8)).thenReturn(expected);

        Response response = resource.getCorrelations(12, 0.8);

        assertThat(response.getEntity()).isEqualTo(expected);
    }

    @Test
    void usesConfiguredMinimumWhenAbsent() {
        CorrelationResource resource = buildResource();
        CorrelationResponseDTO expected = new CorrelationResponseDTO(24, 0.7, List.of());
        when(resource.correlationService.findCorrelatedEntities(24)).thenReturn(expected);

        Response response = resource.getCorrelations(24, null);

        assertThat(response.getEntity()).isEqualTo(expected);
    }

    @Test
    void rejectsNonFiniteMinimum() {
        CorrelationResource resource = buildResource();

        assertThatThrownBy(() -> resource.getCorrelations(24, Double.POSITIVE_INFINITY))
                .isInstanceOf(ValidationException.class);
    }

    private CorrelationResource buildResource() {
        CorrelationResource resource = new CorrelationResource();
        resource.correlationService = mock(MetricCorrelationService.class);
        return resource;
    }
}
