/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Confidence in a capacity forecast, based on goodness of fit and sample count.
 */
public enum ForecastConfidence {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String label;

    ForecastConfidence(String label) {
        this.label = label;
    }

    /**
     * High when R² > 0.7 with more than 20 samples, medium when R² > 0.4 with more
     * than 10 samples, low otherwise.
     */
    public static ForecastConfidence of(double rSquared, int sampleCount) {
        if (rSquared > 0.7 && sampleCount > 20) return HIGH;
        if (rSquared > 0.4 && sampleCount > 10) return MEDIUM;
        return LOW;
    }

    @JsonValue
    public String getLabel() { return label; }
}
