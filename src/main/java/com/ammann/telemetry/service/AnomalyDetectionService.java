/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.dto.AnomalyVerdictDTO;
import com.ammann.telemetry.enumeration.DetectionMethod;
import com.ammann.telemetry.exception.ValidationException;
import com.ammann.telemetry.model.Sample;
import com.ammann.telemetry.model.Series;
import com.ammann.telemetry.model.WindowStats;
import com.ammann.telemetry.store.MetricsStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Per-metric anomaly detection over the recent window of a series.
 *
 * <p>The default method is a z-score gate: the window's arithmetic mean and population
 * standard deviation give {@code z = (current - mean) / stdDev}, rounded to two decimals,
 * and the value is anomalous when {@code |z|} exceeds {@code analytics.anomaly.threshold}.
 * Bollinger bands and a variance-adaptive threshold are available as alternative methods.
 *
 * <p>Windows with fewer than {@code analytics.anomaly.min-samples} samples produce no
 * verdict ({@code null}); this is the routine state of new or idle entities.
 * A window with zero variance always yields {@code z = 0} and no anomaly.
 */
@ApplicationScoped
public class AnomalyDetectionService
{

    private static final Logger LOG = Logger.getLogger(AnomalyDetectionService.class);

    static final int DEFAULT_WINDOW_SIZE = 30;
    static final int DEFAULT_MIN_SAMPLES = 5;
    static final double DEFAULT_ANOMALY_THRESHOLD = 2.0;

    private static final double BOLLINGER_MULTIPLIER = 2.0;
    private static final int MIN_SAMPLES_FOR_METHOD_SELECTION = 20;

    @ConfigProperty(name = "analytics.anomaly.window-size", defaultValue = "30")
    int windowSize = DEFAULT_WINDOW_SIZE;

    @ConfigProperty(name = "analytics.anomaly.min-samples", defaultValue = "5")
    int minSamples = DEFAULT_MIN_SAMPLES;

    @ConfigProperty(name = "analytics.anomaly.threshold", defaultValue = "2.0")
    double anomalyThreshold = DEFAULT_ANOMALY_THRESHOLD;

    @ConfigProperty(name = "analytics.anomaly.bollinger-enabled", defaultValue = "true")
    boolean bollingerEnabled = true;

    @Inject MetricsStore metricsStore;

    @Inject MeterRegistry meterRegistry;

    Clock clock = Clock.systemUTC();

    /**
     * Computes statistics over the last {@code size} samples.
     *
     * @param samples samples ordered oldest first
     * @param size    maximum window length
     * @return window statistics, or {@code null} when the list holds no finite value
     */
    public WindowStats windowStats(List<Sample> samples, int size)
    {
        if (size < 1) {
            throw ValidationException.invalidParameter("windowSize", size, "positive integer");
        }
        return StatisticsSupport.windowStats(samples, size);
    }

    /**
     * Evaluates the current value with the z-score method.
     *
     * @return the verdict, or {@code null} when the window holds too few samples
     */
    public AnomalyVerdictDTO detect(String entityId, String metricType, List<Sample> window, double currentValue)
    {
        return detect(entityId, metricType, window, currentValue, DetectionMethod.ZSCORE);
    }

    /**
     * Evaluates the current value against the window with the given method.
     *
     * @param entityId     monitored entity
     * @param metricType   metric type key
     * @param window       recent samples ordered oldest first; only the last
     *                     {@code analytics.anomaly.window-size} are used
     * @param currentValue value under evaluation
     * @param method       detection method, {@code null} for z-score
     * @return the verdict, or {@code null} when the window holds too few samples
     */
    public AnomalyVerdictDTO detect(
            String entityId,
            String metricType,
            List<Sample> window,
            double currentValue,
            DetectionMethod method)
    {
        validateIdentity(entityId, metricType);
        if (!Double.isFinite(currentValue)) {
            throw ValidationException.invalidParameter("currentValue", currentValue, "finite number");
        }

        WindowStats stats = StatisticsSupport.windowStats(window, windowSize);
        if (stats == null || stats.sampleCount() < minSamples) {
            LOG.debugf("Insufficient samples for %s/%s: %d (minimum %d)",
                    entityId, metricType, stats == null ? 0 : stats.sampleCount(), minSamples);
            return null;
        }

        return evaluate(entityId, metricType, stats, currentValue,
                method != null ? method : DetectionMethod.ZSCORE);
    }

    /**
     * Evaluates the current value with the method best suited to the window's variance.
     *
     * @return the verdict, or {@code null} when the window holds too few samples
     * @see #selectMethod(WindowStats)
     */
    public AnomalyVerdictDTO detectAuto(String entityId, String metricType, List<Sample> window, double currentValue)
    {
        WindowStats stats = StatisticsSupport.windowStats(window, windowSize);
        DetectionMethod method = stats != null ? selectMethod(stats) : DetectionMethod.ZSCORE;
        return detect(entityId, metricType, window, currentValue, method);
    }

    /**
     * Selects a detection method from the window's coefficient of variation.
     *
     * <p>Windows below 20 samples use the z-score. Low variance (cv &lt; 0.1) uses
     * Bollinger bands when enabled, high variance (cv &gt; 0.3) the adaptive threshold.
     */
    public DetectionMethod selectMethod(WindowStats stats)
    {
        if (stats.sampleCount() < MIN_SAMPLES_FOR_METHOD_SELECTION) {
            return DetectionMethod.ZSCORE;
        }

        double cv = stats.coefficientOfVariation();
        if (cv < 0.1) {
            return bollingerEnabled ? DetectionMethod.BOLLINGER : DetectionMethod.ZSCORE;
        }
        if (cv > 0.3) {
            return DetectionMethod.ADAPTIVE;
        }
        return DetectionMethod.ZSCORE;
    }

    /**
     * Reads the recent window and latest value of a series from the metrics store and
     * evaluates it. Store failures propagate to the caller.
     *
     * @param method detection method, {@code null} for z-score
     * @return the verdict, or {@code null} when the store holds too little data
     */
    public AnomalyVerdictDTO evaluate(String entityId, String metricType, DetectionMethod method)
    {
        validateIdentity(entityId, metricType);

        Sample latest = metricsStore.latestValue(entityId, metricType);
        if (latest == null || !Double.isFinite(latest.value())) {
            LOG.debugf("No current value stored for %s/%s", entityId, metricType);
            return null;
        }

        Series window = metricsStore.recentSamples(entityId, metricType, windowSize);
        return detect(entityId, metricType, window.samples(), latest.value(), method);
    }

    private AnomalyVerdictDTO evaluate(
            String entityId, String metricType, WindowStats stats, double currentValue, DetectionMethod method)
    {
        double mean = stats.mean();
        double stdDev = stats.stdDev();
        double zScore = stdDev > 0
                ? StatisticsSupport.round((currentValue - mean) / stdDev, 2)
                : 0.0;

        double threshold;
        boolean anomalous;

        switch (method) {
            case BOLLINGER -> {
                double upper = mean + BOLLINGER_MULTIPLIER * stdDev;
                double lower = Math.max(0.0, mean - BOLLINGER_MULTIPLIER * stdDev);
                threshold = BOLLINGER_MULTIPLIER;
                anomalous = stdDev > 0 && (currentValue > upper || currentValue < lower);
            }
            case ADAPTIVE -> {
                threshold = adaptiveThreshold(stats.coefficientOfVariation());
                anomalous = Math.abs(zScore) > threshold;
            }
            default -> {
                threshold = anomalyThreshold;
                anomalous = Math.abs(zScore) > threshold;
            }
        }

        if (anomalous) {
            LOG.warnf("Anomaly detected for %s/%s (%s): value=%.2f mean=%.2f z=%.2f threshold=%.2f",
                    entityId, metricType, method.getLabel(), currentValue, mean, zScore, threshold);
            countAnomaly(metricType);
        }

        return new AnomalyVerdictDTO(
                entityId,
                metricType,
                currentValue,
                mean,
                stdDev,
                zScore,
                anomalous,
                threshold,
                method,
                Instant.now(clock));
    }

    /** Higher variance widens the gate to avoid false positives on noisy series. */
    private double adaptiveThreshold(double cv)
    {
        if (cv > 0.5) {
            return anomalyThreshold * 1.5;
        }
        if (cv > 0.2) {
            return anomalyThreshold;
        }
        return anomalyThreshold * 1.2;
    }

    private void countAnomaly(String metricType)
    {
        if (meterRegistry != null) {
            meterRegistry.counter("analytics_anomalies_detected_total", "metric", metricType).increment();
        }
    }

    private static void validateIdentity(String entityId, String metricType)
    {
        if (entityId == null || entityId.isBlank()) {
            throw ValidationException.missingParameter("entityId");
        }
        if (metricType == null || metricType.isBlank()) {
            throw ValidationException.missingParameter("metricType");
        }
    }
}
