/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.dto.CapacityForecastDTO;
import com.ammann.telemetry.model.Sample;
import com.ammann.telemetry.model.Series;
import com.ammann.telemetry.store.MetricsStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.stream.IntStream;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Fleet-wide capacity forecast overview.
 *
 * <p>Reads every tracked series of the short fleet lookback in one batched store call,
 * downsamples long series by fixed stride, forecasts each (entity, metric) pair with
 * {@link CapacityForecastService}, and orders the result so that increasing trends come
 * first, then the nearest threshold crossing.
 *
 * <p>Results are kept in {@link FleetForecastCache}. When the calling thread is
 * interrupted the run ends with a {@link CancellationException} and nothing is cached.
 */
@ApplicationScoped
public class FleetForecastService
{

    private static final Logger LOG = Logger.getLogger(FleetForecastService.class);

    static final int MIN_LIMIT = 1;
    static final int MAX_LIMIT = 50;
    static final int DEFAULT_LIMIT = 10;

    @ConfigProperty(name = "analytics.forecast.fleet.lookback-hours", defaultValue = "6")
    int fleetLookbackHours = 6;

    @ConfigProperty(name = "analytics.forecast.fleet.max-points-per-series", defaultValue = "180")
    int maxPointsPerSeries = 180;

    @ConfigProperty(name = "analytics.forecast.fleet.metric-types", defaultValue = "cpu,memory")
    List<String> metricTypes = List.of("cpu", "memory");

    @Inject MetricsStore metricsStore;

    @Inject CapacityForecastService forecastService;

    @Inject FleetForecastCache cache;

    @Inject MeterRegistry meterRegistry;

    /**
     * Returns the entities with the most concerning capacity trends.
     *
     * @param limit number of forecasts to return, clamped to [1, 50]
     * @return forecasts with increasing trends first, then by ascending time to threshold
     * @throws CancellationException if the calling thread is interrupted
     */
    public List<CapacityForecastDTO> getForecasts(int limit)
    {
        int safeLimit = Math.max(MIN_LIMIT, Math.min(MAX_LIMIT, limit));

        Optional<List<CapacityForecastDTO>> cached = cache.get(safeLimit);
        if (cached.isPresent()) {
            count("analytics_forecast_cache_hits_total");
            LOG.debugf("Fleet forecast cache hit for limit %d", safeLimit);
            return cached.get();
        }
        count("analytics_forecast_cache_misses_total");

        Timer.Sample timer = meterRegistry != null ? Timer.start(meterRegistry) : null;
        long startedAt = System.nanoTime();

        List<Series> fleet = metricsStore.fleetSamples(metricTypes, Duration.ofHours(fleetLookbackHours));
        checkCancelled();

        List<CapacityForecastDTO> forecasts = new ArrayList<>();
        for (List<Series> entitySeries : selectCandidates(fleet, safeLimit * 2)) {
            for (String metricType : metricTypes) {
                entitySeries.stream()
                        .filter(s -> s.metricType().equals(metricType))
                        .findFirst()
                        .map(s -> s.withSamples(downsample(s.samples(), maxPointsPerSeries)))
                        .map(forecastService::forecast)
                        .ifPresent(forecasts::add);
            }
        }

        forecasts.sort(concernOrder());
        List<CapacityForecastDTO> result = List.copyOf(forecasts.subList(0, Math.min(safeLimit, forecasts.size())));

        checkCancelled();
        cache.put(safeLimit, result);

        if (timer != null) {
            timer.stop(meterRegistry.timer("analytics_forecast_runs_seconds"));
        }
        LOG.infof("Computed fleet forecast overview: limit=%d, series=%d, forecasts=%d in %.1fms",
                safeLimit, fleet.size(), result.size(), (System.nanoTime() - startedAt) / 1_000_000.0);

        return result;
    }

    /** Drops the cached overview. */
    public void invalidateCache()
    {
        cache.invalidate();
    }

    /**
     * Groups series by entity and keeps entities with at least one series long enough to
     * forecast, ordered by display name then id, at most {@code maxEntities} of them.
     */
    List<List<Series>> selectCandidates(List<Series> fleet, int maxEntities)
    {
        Map<String, List<Series>> byEntity = new LinkedHashMap<>();
        for (Series series : fleet) {
            byEntity.computeIfAbsent(series.entityId(), id -> new ArrayList<>()).add(series);
        }

        return byEntity.values().stream()
                .filter(list -> list.stream().anyMatch(s -> s.size() >= CapacityForecastService.MIN_POINTS))
                .sorted(Comparator.comparing((List<Series> list) -> list.get(0).displayName())
                        .thenComparing(list -> list.get(0).entityId()))
                .limit(maxEntities)
                .toList();
    }

    /**
     * Keeps every {@code ceil(n / maxPoints)}-th sample, starting with the first, when the
     * series is longer than {@code maxPoints}.
     */
    static List<Sample> downsample(List<Sample> samples, int maxPoints)
    {
        if (maxPoints <= 0 || samples.size() <= maxPoints) {
            return samples;
        }

        int stride = (int) Math.ceil((double) samples.size() / maxPoints);
        LOG.debugf("Downsampling %d samples with stride %d", samples.size(), stride);

        return IntStream.range(0, samples.size())
                .filter(i -> i % stride == 0)
                .mapToObj(samples::get)
                .toList();
    }

    /** Increasing trends first, then ascending time to threshold with unknown last. */
    static Comparator<CapacityForecastDTO> concernOrder()
    {
        return Comparator.comparing((CapacityForecastDTO f) -> !f.isIncreasing())
                .thenComparing(CapacityForecastDTO::timeToThresholdHours,
                        Comparator.nullsLast(Comparator.naturalOrder()));
    }

    private void checkCancelled()
    {
        if (Thread.currentThread().isInterrupted()) {
            LOG.debug("Fleet forecast run interrupted, discarding partial result");
            throw new CancellationException("Fleet forecast run was interrupted");
        }
    }

    private void count(String name)
    {
        if (meterRegistry != null) {
            meterRegistry.counter(name).increment();
        }
    }
}
