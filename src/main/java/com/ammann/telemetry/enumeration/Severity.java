/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a composite anomaly, derived from its composite score.
 */
public enum Severity
{
    /** Composite score of 5 or above. */
    CRITICAL("critical", 5.0),
    /** Composite score of 3.5 or above. */
    HIGH("high", 3.5),
    /** Composite score of 2 or above. */
    MEDIUM("medium", 2.0),
    /** Composite score below 2. */
    LOW("low", 0.0);

    private final String label;
    private final double threshold;

    Severity(String label, double threshold) {
        this.label = label;
        this.threshold = threshold;
    }

    public static Severity fromScore(double compositeScore) {
        if (compositeScore >= CRITICAL.threshold) return CRITICAL;
        if (compositeScore >= HIGH.threshold) return HIGH;
        if (compositeScore >= MEDIUM.threshold) return MEDIUM;
        return LOW;
    }

    @JsonValue
    public String getLabel() { return label; }

    public double getThreshold() { return threshold; }
}
