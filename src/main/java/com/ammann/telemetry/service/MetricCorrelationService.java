/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.dto.CorrelationPairDTO;
import com.ammann.telemetry.dto.CorrelationResponseDTO;
import com.ammann.telemetry.enumeration.CorrelationDirection;
import com.ammann.telemetry.enumeration.CorrelationStrength;
import com.ammann.telemetry.exception.ValidationException;
import com.ammann.telemetry.model.EntityRef;
import com.ammann.telemetry.model.Sample;
import com.ammann.telemetry.model.Series;
import com.ammann.telemetry.store.MetricsStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Finds entities whose bucketed metric series move together.
 *
 * <p>For each tracked metric type the service:
 * <ol>
 *   <li>reads fixed-width bucket averages for every entity in one batched store call,</li>
 *   <li>keeps the {@code analytics.correlation.max-entities} densest series to bound the
 *       quadratic pair count,</li>
 *   <li>aligns every unordered pair on shared bucket timestamps,</li>
 *   <li>computes the Pearson coefficient and keeps strong and very strong pairs.</li>
 * </ol>
 *
 * <p>Pairs of all metric types are concatenated and sorted by |r| descending.
 */
@ApplicationScoped
public class MetricCorrelationService
{

    private static final Logger LOG = Logger.getLogger(MetricCorrelationService.class);

    static final int DEFAULT_MAX_ENTITIES = 50;
    static final int DEFAULT_MIN_ALIGNED_POINTS = 5;
    static final double DEFAULT_MIN_CORRELATION = 0.7;

    private static final int MIN_POINTS_FOR_PEARSON = 3;
    private static final int MIN_LOOKBACK_HOURS = 1;
    private static final int MAX_LOOKBACK_HOURS = 168;
    private static final double MIN_CORRELATION_FLOOR = 0.5;

    @ConfigProperty(name = "analytics.correlation.max-entities", defaultValue = "50")
    int maxEntities = DEFAULT_MAX_ENTITIES;

    @ConfigProperty(name = "analytics.correlation.min-aligned-points", defaultValue = "5")
    int minAlignedPoints = DEFAULT_MIN_ALIGNED_POINTS;

    @ConfigProperty(name = "analytics.correlation.min-correlation", defaultValue = "0.7")
    double minCorrelation = DEFAULT_MIN_CORRELATION;

    @ConfigProperty(name = "analytics.correlation.bucket-width", defaultValue = "PT5M")
    Duration bucketWidth = Duration.ofMinutes(5);

    @ConfigProperty(name = "analytics.correlation.metric-types", defaultValue = "cpu,memory")
    List<String> metricTypes = List.of("cpu", "memory");

    @Inject MetricsStore metricsStore;

    @Inject MeterRegistry meterRegistry;

    /**
     * Computes the Pearson correlation coefficient of two equally long arrays.
     *
     * <p>r = Σ(x - x̄)(y - ȳ) / sqrt(Σ(x - x̄)² Σ(y - ȳ)²), computed over mean-centered
     * values. Returns 0 when the arrays differ in length, hold fewer than three points,
     * or either side is constant. The result is clamped to [-1, 1].
     */
    public double pearsonCorrelation(double[] x, double[] y)
    {
        int n = x.length;
        if (n < MIN_POINTS_FOR_PEARSON || n != y.length) {
            return 0.0;
        }

        // Constant input has zero variance even when the sums below carry rounding noise.
        if (isFlat(x) || isFlat(y)) {
            return 0.0;
        }

        double sumX = 0, sumY = 0;
        for (int i = 0; i < n; i++) {
            sumX += x[i];
            sumY += y[i];
        }
        double meanX = sumX / n;
        double meanY = sumY / n;

        double covariance = 0, varianceX = 0, varianceY = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            covariance += dx * dy;
            varianceX += dx * dx;
            varianceY += dy * dy;
        }
        if (varianceX <= 0 || varianceY <= 0) {
            return 0.0;
        }

        double denominator = Math.sqrt(varianceX * varianceY);
        if (denominator == 0 || !Double.isFinite(denominator)) {
            return 0.0;
        }

        double r = covariance / denominator;
        if (!Double.isFinite(r)) {
            return 0.0;
        }
        return Math.max(-1.0, Math.min(1.0, r));
    }

    private static boolean isFlat(double[] values)
    {
        double min = values[0];
        double max = values[0];
        for (double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        return max == min;
    }

    /** Classifies an absolute correlation coefficient. */
    public CorrelationStrength classifyStrength(double absR)
    {
        return CorrelationStrength.fromAbsoluteCorrelation(absR);
    }

    /**
     * Correlates the bucketed series of one metric type pairwise.
     *
     * @param metricType     metric type of every series
     * @param seriesByEntity bucketed series keyed by entity id
     * @param minCorrelation minimum |r| a pair must reach
     * @return strong and very strong pairs sorted by |r| descending
     */
    public List<CorrelationPairDTO> correlate(
            String metricType, Map<String, Series> seriesByEntity, double minCorrelation)
    {
        if (seriesByEntity == null || seriesByEntity.size() < 2) {
            return List.of();
        }

        List<Series> candidates = seriesByEntity.values().stream()
                .sorted(Comparator.comparingInt(Series::size).reversed()
                        .thenComparing(Series::entityId))
                .limit(maxEntities)
                .toList();

        List<Map<Instant, Double>> indexed = candidates.stream()
                .map(MetricCorrelationService::indexByTimestamp)
                .toList();

        List<CorrelationPairDTO> pairs = new ArrayList<>();

        for (int i = 0; i < candidates.size(); i++) {
            Series a = candidates.get(i);

            for (int j = i + 1; j < candidates.size(); j++) {
                Series b = candidates.get(j);
                if (a.entityId().equals(b.entityId())) {
                    continue;
                }

                Map<Instant, Double> bValues = indexed.get(j);
                List<double[]> aligned = new ArrayList<>();
                for (Sample sample : a.samples()) {
                    Double other = bValues.get(sample.timestamp());
                    if (other != null && Double.isFinite(sample.value())) {
                        aligned.add(new double[] {sample.value(), other});
                    }
                }

                if (aligned.size() < minAlignedPoints) {
                    continue;
                }

                double[] xs = aligned.stream().mapToDouble(p -> p[0]).toArray();
                double[] ys = aligned.stream().mapToDouble(p -> p[1]).toArray();
                double r = StatisticsSupport.round(pearsonCorrelation(xs, ys), 3);
                double absR = Math.abs(r);

                if (absR < minCorrelation) {
                    continue;
                }
                CorrelationStrength strength = classifyStrength(absR);
                if (!strength.isReportable()) {
                    continue;
                }

                pairs.add(new CorrelationPairDTO(
                        EntityRef.of(a),
                        EntityRef.of(b),
                        metricType,
                        r,
                        strength,
                        CorrelationDirection.of(r),
                        aligned.size()));
            }
        }

        pairs.sort(byAbsoluteCorrelationDescending());
        LOG.debugf("Correlated %s across %d series into %d pairs", metricType, candidates.size(), pairs.size());
        return pairs;
    }

    /**
     * Correlates every tracked metric type across the fleet.
     *
     * <p>The lookback is clamped to [1, 168] hours and the minimum correlation to
     * [0.5, 1]. Metrics store failures propagate.
     *
     * @param hours          lookback window in hours
     * @param minCorrelation minimum |r| a pair must reach
     * @return pairs of all tracked metric types sorted by |r| descending
     */
    public CorrelationResponseDTO findCorrelatedEntities(int hours, double minCorrelation)
    {
        if (!Double.isFinite(minCorrelation)) {
            throw ValidationException.invalidParameter("minCorrelation", minCorrelation, "finite number");
        }
        int safeHours = Math.max(MIN_LOOKBACK_HOURS, Math.min(MAX_LOOKBACK_HOURS, hours));
        double safeMin = Math.max(MIN_CORRELATION_FLOOR, Math.min(1.0, minCorrelation));

        Timer.Sample timer = meterRegistry != null ? Timer.start(meterRegistry) : null;
        long startedAt = System.nanoTime();

        List<CorrelationPairDTO> pairs = new ArrayList<>();
        for (String metricType : metricTypes) {
            Map<String, Series> bucketed = metricsStore.bucketedAverages(metricType, safeHours, bucketWidth);
            pairs.addAll(correlate(metricType, bucketed, safeMin));
        }
        pairs.sort(byAbsoluteCorrelationDescending());

        if (timer != null) {
            timer.stop(meterRegistry.timer("analytics_correlation_runs_seconds"));
        }
        LOG.infof("Computed cross-entity correlations: hours=%d, minCorrelation=%.2f, pairs=%d in %.1fms",
                safeHours, safeMin, pairs.size(), (System.nanoTime() - startedAt) / 1_000_000.0);

        return new CorrelationResponseDTO(safeHours, safeMin, List.copyOf(pairs));
    }

    /** Correlates every tracked metric type with the configured minimum correlation. */
    public CorrelationResponseDTO findCorrelatedEntities(int hours)
    {
        return findCorrelatedEntities(hours, minCorrelation);
    }

    private static Map<Instant, Double> indexByTimestamp(Series series)
    {
        Map<Instant, Double> index = new HashMap<>(series.size() * 2);
        for (Sample sample : series.samples()) {
            if (Double.isFinite(sample.value())) {
                index.put(sample.timestamp(), sample.value());
            }
        }
        return index;
    }

    private static Comparator<CorrelationPairDTO> byAbsoluteCorrelationDescending()
    {
        return Comparator.comparingDouble((CorrelationPairDTO p) -> Math.abs(p.correlation())).reversed();
    }
}
