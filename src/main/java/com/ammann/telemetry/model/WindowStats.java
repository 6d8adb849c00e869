/* (C)2026 */
package com.ammann.telemetry.model;

/**
 * Descriptive statistics over the most recent samples of a series.
 *
 * @param mean        arithmetic mean of the window
 * @param stdDev      population standard deviation of the window
 * @param sampleCount number of samples in the window
 */
public record WindowStats(double mean, double stdDev, int sampleCount) {

    /**
     * Coefficient of variation of the window, or {@code 0} when the mean is not positive.
     */
    public double coefficientOfVariation() {
        return mean > 0 ? stdDev / mean : 0.0;
    }
}
