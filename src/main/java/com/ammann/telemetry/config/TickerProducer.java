/* (C)2026 */
package com.ammann.telemetry.config;

import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;

/**
 * CDI producer for the time source of the in-memory result caches.
 *
 * <p>Provides the "analytics-cache-ticker" bean used by
 * {@link com.ammann.telemetry.service.FleetForecastCache} to expire entries. Tests
 * construct the cache with a manual ticker instead.
 */
@ApplicationScoped
public class TickerProducer {

    @Produces
    @Named("analytics-cache-ticker")
    @ApplicationScoped
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }
}
