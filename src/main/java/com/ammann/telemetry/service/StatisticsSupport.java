/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.model.Sample;
import com.ammann.telemetry.model.WindowStats;
import java.util.List;

/**
 * Numeric helpers shared by the analytics services.
 *
 * <p>Every helper maps degenerate input to a finite fallback so that NaN or infinity
 * never reaches a result object.
 */
final class StatisticsSupport
{

    private StatisticsSupport() {}

    /** Rounds half-up to the given number of decimals; non-finite input yields 0. */
    static double round(double value, int decimals)
    {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }

    /** Returns the value, or 0 when it is NaN or infinite. */
    static double finiteOrZero(double value)
    {
        return Double.isFinite(value) ? value : 0.0;
    }

    /**
     * Computes mean and population standard deviation of the last {@code windowSize}
     * samples. Non-finite sample values are skipped. A constant window always reports a
     * standard deviation of exactly zero.
     *
     * @return window statistics, or {@code null} when no finite sample is available
     */
    static WindowStats windowStats(List<Sample> samples, int windowSize)
    {
        if (samples == null || samples.isEmpty() || windowSize <= 0) {
            return null;
        }

        List<Sample> window = samples.size() > windowSize
                ? samples.subList(samples.size() - windowSize, samples.size())
                : samples;

        double[] values = window.stream()
                .mapToDouble(Sample::value)
                .filter(Double::isFinite)
                .toArray();
        if (values.length == 0) {
            return null;
        }

        double sum = 0.0;
        double min = values[0];
        double max = values[0];
        for (double value : values) {
            sum += value;
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        if (max == min) {
            // Constant window: exact mean, zero deviation regardless of summation error.
            return new WindowStats(min, 0.0, values.length);
        }
        double mean = sum / values.length;

        double squared = 0.0;
        for (double value : values) {
            squared += (value - mean) * (value - mean);
        }
        double stdDev = Math.sqrt(Math.max(0.0, squared / values.length));

        return new WindowStats(mean, finiteOrZero(stdDev), values.length);
    }
}
