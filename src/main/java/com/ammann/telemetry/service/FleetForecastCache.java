/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.dto.CapacityForecastDTO;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Short-lived cache for the fleet forecast overview.
 *
 * <p>Backed by Caffeine with expire-after-write, so each entry is swapped atomically and
 * concurrent readers never observe a partially written result. An entry computed for
 * {@code n} results only serves requests for at most {@code n} results; readers receive
 * an immutable copy truncated to their limit.
 */
@ApplicationScoped
public class FleetForecastCache
{

    private static final Logger LOG = Logger.getLogger(FleetForecastCache.class);

    private static final String OVERVIEW_KEY = "fleet-overview";

    private final Cache<String, CachedForecasts> cache;
    private final Duration ttl;

    @Inject
    public FleetForecastCache(
            @ConfigProperty(name = "analytics.forecast.cache-ttl", defaultValue = "PT2M") Duration ttl,
            @Named("analytics-cache-ticker") Ticker ticker)
    {
        this.ttl = ttl;
        this.cache = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .build();
    }

    /**
     * Returns the cached forecasts for a request of {@code limit} results.
     *
     * @return the first {@code limit} forecasts, or empty when nothing is cached, the entry
     *         expired, or it was computed for fewer results than requested
     */
    public Optional<List<CapacityForecastDTO>> get(int limit)
    {
        CachedForecasts entry = cache.getIfPresent(OVERVIEW_KEY);
        if (entry == null || entry.limit() < limit) {
            return Optional.empty();
        }
        List<CapacityForecastDTO> forecasts = entry.forecasts();
        return Optional.of(List.copyOf(forecasts.subList(0, Math.min(limit, forecasts.size()))));
    }

    /**
     * Stores a complete result computed for {@code limit} results.
     */
    public void put(int limit, List<CapacityForecastDTO> forecasts)
    {
        cache.put(OVERVIEW_KEY, new CachedForecasts(limit, List.copyOf(forecasts)));
        LOG.debugf("Cached %d fleet forecasts computed for limit %d (ttl %s)", forecasts.size(), limit, ttl);
    }

    /** Drops the cached result so the next request recomputes it. */
    public void invalidate()
    {
        cache.invalidate(OVERVIEW_KEY);
        LOG.debug("Fleet forecast cache invalidated");
    }

    /** Returns the limit of the live entry, or 0 when the cache is cold. */
    public int cachedLimit()
    {
        CachedForecasts entry = cache.getIfPresent(OVERVIEW_KEY);
        return entry == null ? 0 : entry.limit();
    }

    public Duration getTtl()
    {
        return ttl;
    }

    private record CachedForecasts(int limit, List<CapacityForecastDTO> forecasts) {}
}
