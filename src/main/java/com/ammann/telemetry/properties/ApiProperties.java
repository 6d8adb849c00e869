/* (C)2026 */
package com.ammann.telemetry.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Per-metric and composite anomaly endpoints
     */
    public static final class Anomalies {
        private Anomalies() {}

        public static final String BASE = "/anomalies";
        public static final String ENTITY = BASE + "/{entityId}";
        public static final String COMPOSITE = BASE + "/composite";
    }

    /**
     * Cross-entity correlation endpoints
     */
    public static final class Correlations {
        private Correlations() {}

        public static final String BASE = "/correlations";
    }

    /**
     * Capacity forecast endpoints
     */
    public static final class Forecasts {
        private Forecasts() {}

        public static final String BASE = "/forecasts";
        public static final String ENTITY = BASE + "/{entityId}";
        public static final String CACHE = BASE + "/cache";
    }
}
