/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.dto.CapacityForecastDTO;
import com.ammann.telemetry.dto.ForecastPointDTO;
import com.ammann.telemetry.enumeration.ForecastConfidence;
import com.ammann.telemetry.enumeration.MetricType;
import com.ammann.telemetry.enumeration.Trend;
import com.ammann.telemetry.exception.ValidationException;
import com.ammann.telemetry.model.Sample;
import com.ammann.telemetry.model.Series;
import com.ammann.telemetry.store.MetricsStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * First-order capacity forecasting for a single (entity, metric) series.
 *
 * <p>Fits an ordinary least squares line to the series with x measured in hours since the
 * first sample, which keeps the sums small compared with epoch timestamps. The fit yields
 * the trend, R² (floored at zero), a confidence bucket, a forecast series of recent actual
 * points plus twelve projected points, and the hours until a threshold is crossed.
 *
 * <p>Series with fewer than five points produce no forecast ({@code null}).
 */
@ApplicationScoped
public class CapacityForecastService
{

    private static final Logger LOG = Logger.getLogger(CapacityForecastService.class);

    static final int MIN_POINTS = 5;
    static final int CONTEXT_POINTS = 5;
    static final int PROJECTED_POINTS = 12;
    static final double MAX_THRESHOLD_HORIZON_HOURS = 168.0;
    static final double DEFAULT_THRESHOLD = 90.0;
    static final int DEFAULT_LOOKBACK_HOURS = 24;
    static final double DEFAULT_HORIZON_HOURS = 24.0;

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    @ConfigProperty(name = "analytics.forecast.threshold", defaultValue = "90")
    double threshold = DEFAULT_THRESHOLD;

    @ConfigProperty(name = "analytics.forecast.lookback-hours", defaultValue = "24")
    int lookbackHours = DEFAULT_LOOKBACK_HOURS;

    @ConfigProperty(name = "analytics.forecast.horizon-hours", defaultValue = "24")
    double horizonHours = DEFAULT_HORIZON_HOURS;

    @Inject MetricsStore metricsStore;

    /**
     * Fits y = slope * x + intercept by ordinary least squares.
     *
     * <p>With fewer than two points or identical x values the slope is 0 and the intercept
     * is the mean of y. R² is {@code 1 - SSres/SStot}, 0 when y is constant, and clamped
     * to [0, 1].
     */
    public RegressionResult linearRegression(double[] x, double[] y)
    {
        if (x.length != y.length) {
            throw ValidationException.invalidParameter("y", y.length + " values", x.length + " values");
        }
        int n = x.length;
        if (n == 0) {
            return new RegressionResult(0.0, 0.0, 0.0);
        }

        double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0;
        for (int i = 0; i < n; i++) {
            sumX += x[i];
            sumY += y[i];
            sumXY += x[i] * y[i];
            sumX2 += x[i] * x[i];
        }
        double meanY = sumY / n;

        double denominator = n * sumX2 - sumX * sumX;
        if (n < 2 || denominator == 0 || !Double.isFinite(denominator)) {
            return new RegressionResult(0.0, StatisticsSupport.finiteOrZero(meanY), 0.0);
        }

        double slope = (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;

        double ssTot = 0, ssRes = 0;
        for (int i = 0; i < n; i++) {
            double predicted = slope * x[i] + intercept;
            ssTot += (y[i] - meanY) * (y[i] - meanY);
            ssRes += (y[i] - predicted) * (y[i] - predicted);
        }
        double rSquared = ssTot == 0 ? 0.0 : 1.0 - ssRes / ssTot;

        return new RegressionResult(
                StatisticsSupport.finiteOrZero(slope),
                StatisticsSupport.finiteOrZero(intercept),
                Math.max(0.0, Math.min(1.0, StatisticsSupport.finiteOrZero(rSquared))));
    }

    /**
     * Hours until a linearly rising metric crosses the threshold.
     *
     * @return hours rounded to one decimal, or {@code null} when the slope is not positive,
     *         the value is already at or above the threshold, or the crossing lies beyond
     *         168 hours
     */
    public Double timeToThreshold(double slope, double currentValue, double thresholdValue)
    {
        if (!(slope > 0) || !(currentValue < thresholdValue)) {
            return null;
        }
        double hours = (thresholdValue - currentValue) / slope;
        if (!Double.isFinite(hours) || hours <= 0 || hours > MAX_THRESHOLD_HORIZON_HOURS) {
            return null;
        }
        return StatisticsSupport.round(hours, 1);
    }

    /**
     * Forecasts a series with the configured threshold and horizon.
     *
     * @see #forecast(Series, double, double)
     */
    public CapacityForecastDTO forecast(Series series)
    {
        return forecast(series, threshold, horizonHours);
    }

    /**
     * Forecasts one series.
     *
     * @param series         samples ordered oldest first
     * @param thresholdValue ceiling used for the time-to-threshold estimate
     * @param horizon        projection horizon in hours
     * @return the forecast, or {@code null} when the series holds fewer than five finite points
     */
    public CapacityForecastDTO forecast(Series series, double thresholdValue, double horizon)
    {
        if (series == null) {
            throw ValidationException.missingParameter("series");
        }
        if (!(horizon > 0) || !Double.isFinite(horizon)) {
            throw ValidationException.invalidParameter("horizonHours", horizon, "positive number");
        }
        if (!Double.isFinite(thresholdValue)) {
            throw ValidationException.invalidParameter("threshold", thresholdValue, "finite number");
        }

        List<Sample> points = series.samples().stream()
                .filter(s -> Double.isFinite(s.value()))
                .toList();
        if (points.size() < MIN_POINTS) {
            LOG.debugf("Insufficient data for forecast %s/%s: %d points",
                    series.entityId(), series.metricType(), points.size());
            return null;
        }

        Instant base = points.get(0).timestamp();
        double[] x = new double[points.size()];
        double[] y = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            x[i] = Duration.between(base, points.get(i).timestamp()).toMillis() / MILLIS_PER_HOUR;
            y[i] = points.get(i).value();
        }

        RegressionResult fit = linearRegression(x, y);
        Trend trend = Trend.fromSlope(fit.slope());
        ForecastConfidence confidence = ForecastConfidence.of(fit.rSquared(), points.size());

        Sample last = points.get(points.size() - 1);
        double currentValue = last.value();
        double lastX = x[x.length - 1];

        List<ForecastPointDTO> forecastPoints = new ArrayList<>(CONTEXT_POINTS + PROJECTED_POINTS);
        for (Sample sample : points.subList(points.size() - Math.min(CONTEXT_POINTS, points.size()), points.size())) {
            forecastPoints.add(ForecastPointDTO.actual(sample.timestamp(), sample.value()));
        }

        double stepHours = horizon / PROJECTED_POINTS;
        for (int step = 1; step <= PROJECTED_POINTS; step++) {
            double aheadHours = step * stepHours;
            double projected = MetricType.clamp(series.metricType(), fit.slope() * (lastX + aheadHours) + fit.intercept());
            Instant timestamp = last.timestamp().plusMillis(Math.round(aheadHours * MILLIS_PER_HOUR));
            forecastPoints.add(ForecastPointDTO.projected(timestamp, projected));
        }

        Double hoursToThreshold = timeToThreshold(fit.slope(), currentValue, thresholdValue);
        if (hoursToThreshold != null) {
            LOG.debugf("%s/%s projected to reach %.1f in %.1fh (slope=%.3f/h)",
                    series.entityId(), series.metricType(), thresholdValue, hoursToThreshold, fit.slope());
        }

        return new CapacityForecastDTO(
                series.entityId(),
                series.displayName(),
                series.metricType(),
                currentValue,
                trend,
                fit.slope(),
                fit.intercept(),
                fit.rSquared(),
                forecastPoints,
                hoursToThreshold,
                confidence);
    }

    /**
     * Reads a series from the metrics store and forecasts it. Store failures propagate.
     *
     * @param entityId   monitored entity
     * @param metricType metric type key
     * @param hours      lookback window and projection horizon in hours
     * @return the forecast, or {@code null} when the store holds fewer than five points
     */
    public CapacityForecastDTO forecast(String entityId, String metricType, int hours)
    {
        if (entityId == null || entityId.isBlank()) {
            throw ValidationException.missingParameter("entityId");
        }
        if (metricType == null || metricType.isBlank()) {
            throw ValidationException.missingParameter("metricType");
        }
        if (hours < 1) {
            throw ValidationException.invalidParameter("hours", hours, "positive integer");
        }

        Series series = metricsStore.samplesWithin(entityId, metricType, Duration.ofHours(hours));
        return forecast(series, threshold, hours);
    }

    /** Reads a series over the configured lookback and forecasts it. */
    public CapacityForecastDTO forecast(String entityId, String metricType)
    {
        return forecast(entityId, metricType, lookbackHours);
    }

    /**
     * Ordinary least squares fit of a series.
     *
     * @param slope     units per hour
     * @param intercept fitted value at x = 0
     * @param rSquared  coefficient of determination in [0, 1]
     */
    public record RegressionResult(double slope, double intercept, double rSquared)
    {
    }
}
