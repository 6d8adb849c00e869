/* (C)2026 */
package com.ammann.telemetry.store;

import com.ammann.telemetry.exception.MetricsStoreException;
import com.ammann.telemetry.model.Sample;
import com.ammann.telemetry.model.Series;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import org.jboss.logging.Logger;

/**
 * Embedded, thread-safe {@link MetricsStore} holding samples in memory.
 *
 * <p>Registered as the default bean so that a deployment can replace it with a
 * networked store by declaring its own {@code MetricsStore} bean. Samples are kept in a
 * timestamp-ordered map per (entity, metric type); recording a sample with an existing
 * timestamp replaces the previous value.
 */
@DefaultBean
@ApplicationScoped
public class InMemoryMetricsStore implements MetricsStore {

    private static final Logger LOG = Logger.getLogger(InMemoryMetricsStore.class);

    private final Map<SeriesKey, ConcurrentSkipListMap<Instant, Double>> samples =
            new ConcurrentHashMap<>();
    private final Map<String, String> entityNames = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryMetricsStore() {
        this(Clock.systemUTC());
    }

    public InMemoryMetricsStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Records one sample.
     *
     * @param entityId   monitored entity
     * @param entityName display name, ignored when {@code null}
     * @param metricType metric type key
     * @param timestamp  sample time
     * @param value      sample value
     */
    public void record(
            String entityId, String entityName, String metricType, Instant timestamp, double value) {
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(metricType, "metricType");
        Objects.requireNonNull(timestamp, "timestamp");

        samples.computeIfAbsent(new SeriesKey(entityId, metricType), k -> new ConcurrentSkipListMap<>())
                .put(timestamp, value);
        if (entityName != null) {
            entityNames.put(entityId, entityName);
        }
    }

    /** Records every sample of a series. */
    public void record(Series series) {
        for (Sample sample : series.samples()) {
            record(series.entityId(), series.entityName(), series.metricType(),
                    sample.timestamp(), sample.value());
        }
    }

    /** Removes all stored samples. */
    public void clear() {
        samples.clear();
        entityNames.clear();
    }

    @Override
    public Series recentSamples(String entityId, String metricType, int windowSize) {
        checkInterrupted();
        ConcurrentSkipListMap<Instant, Double> stored = samples.get(new SeriesKey(entityId, metricType));
        if (stored == null || windowSize <= 0) {
            return new Series(entityId, entityNames.get(entityId), metricType, List.of());
        }

        List<Sample> newestFirst = new ArrayList<>(windowSize);
        for (Map.Entry<Instant, Double> entry : stored.descendingMap().entrySet()) {
            if (newestFirst.size() >= windowSize) {
                break;
            }
            newestFirst.add(new Sample(entry.getKey(), entry.getValue()));
        }

        List<Sample> ordered = new ArrayList<>(newestFirst.size());
        for (int i = newestFirst.size() - 1; i >= 0; i--) {
            ordered.add(newestFirst.get(i));
        }
        return new Series(entityId, entityNames.get(entityId), metricType, ordered);
    }

    @Override
    public Series samplesWithin(String entityId, String metricType, Duration lookback) {
        checkInterrupted();
        ConcurrentSkipListMap<Instant, Double> stored = samples.get(new SeriesKey(entityId, metricType));
        List<Sample> window = new ArrayList<>();
        if (stored != null) {
            stored.tailMap(clock.instant().minus(lookback), true)
                    .forEach((ts, value) -> window.add(new Sample(ts, value)));
        }
        return new Series(entityId, entityNames.get(entityId), metricType, window);
    }

    @Override
    public Map<String, Series> bucketedAverages(String metricType, int lookbackHours, Duration bucketWidth) {
        checkInterrupted();
        long bucketMillis = bucketWidth.toMillis();
        if (bucketMillis <= 0) {
            throw new MetricsStoreException("Bucket width must be positive, got " + bucketWidth);
        }
        Instant since = clock.instant().minus(Duration.ofHours(lookbackHours));

        Map<String, Series> result = new TreeMap<>();
        for (Map.Entry<SeriesKey, ConcurrentSkipListMap<Instant, Double>> entry : samples.entrySet()) {
            if (!entry.getKey().metricType().equals(metricType)) {
                continue;
            }

            Map<Long, double[]> buckets = new TreeMap<>();
            for (Map.Entry<Instant, Double> sample : entry.getValue().tailMap(since, true).entrySet()) {
                long bucket = Math.floorDiv(sample.getKey().toEpochMilli(), bucketMillis) * bucketMillis;
                double[] acc = buckets.computeIfAbsent(bucket, b -> new double[2]);
                acc[0] += sample.getValue();
                acc[1]++;
            }
            if (buckets.isEmpty()) {
                continue;
            }

            List<Sample> averaged = new ArrayList<>(buckets.size());
            buckets.forEach((bucket, acc) ->
                    averaged.add(new Sample(Instant.ofEpochMilli(bucket), acc[0] / acc[1])));

            String entityId = entry.getKey().entityId();
            result.put(entityId, new Series(entityId, entityNames.get(entityId), metricType, averaged));
        }

        LOG.debugf("Bucketed %s over %dh into %d series", metricType, lookbackHours, result.size());
        return result;
    }

    @Override
    public Sample latestValue(String entityId, String metricType) {
        checkInterrupted();
        ConcurrentSkipListMap<Instant, Double> stored = samples.get(new SeriesKey(entityId, metricType));
        if (stored == null) {
            return null;
        }
        Map.Entry<Instant, Double> last = stored.lastEntry();
        return last == null ? null : new Sample(last.getKey(), last.getValue());
    }

    @Override
    public List<Series> fleetSamples(Collection<String> metricTypes, Duration lookback) {
        checkInterrupted();
        Instant since = clock.instant().minus(lookback);

        Map<SeriesKey, Series> result = new LinkedHashMap<>();
        samples.entrySet().stream()
                .filter(entry -> metricTypes.contains(entry.getKey().metricType()))
                .sorted(Map.Entry.comparingByKey(
                        Comparator.comparing(SeriesKey::entityId).thenComparing(SeriesKey::metricType)))
                .forEach(entry -> {
                    List<Sample> window = new ArrayList<>();
                    entry.getValue().tailMap(since, true)
                            .forEach((ts, value) -> window.add(new Sample(ts, value)));
                    if (!window.isEmpty()) {
                        String entityId = entry.getKey().entityId();
                        result.put(entry.getKey(), new Series(
                                entityId, entityNames.get(entityId), entry.getKey().metricType(), window));
                    }
                });

        return List.copyOf(result.values());
    }

    private void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new MetricsStoreException("Metrics store read interrupted");
        }
    }

    private record SeriesKey(String entityId, String metricType) {}
}
