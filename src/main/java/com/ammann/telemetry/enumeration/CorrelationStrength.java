/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Strength classification of an absolute Pearson correlation coefficient.
 *
 * <p>Each level defines a minimum threshold. A coefficient is classified into the
 * highest level whose threshold it meets or exceeds.
 */
public enum CorrelationStrength
{
    /** |r| of 0.9 or above. */
    VERY_STRONG("very_strong", 0.9),
    /** |r| of 0.7 or above. */
    STRONG("strong", 0.7),
    /** |r| of 0.4 or above. */
    MODERATE("moderate", 0.4),
    /** |r| below 0.4. */
    WEAK("weak", 0.0);

    private final String label;
    private final double threshold;

    CorrelationStrength(String label, double threshold) {
        this.label = label;
        this.threshold = threshold;
    }

    /**
     * Returns the strength corresponding to the given absolute coefficient.
     *
     * @param absR absolute correlation coefficient in [0, 1]
     * @return the highest strength whose threshold the value meets
     */
    public static CorrelationStrength fromAbsoluteCorrelation(double absR) {
        if (absR >= VERY_STRONG.threshold) return VERY_STRONG;
        if (absR >= STRONG.threshold) return STRONG;
        if (absR >= MODERATE.threshold) return MODERATE;
        return WEAK;
    }

    /** Only strong and very strong pairs are reported. */
    public boolean isReportable() {
        return this == VERY_STRONG || this == STRONG;
    }

    @JsonValue
    public String getLabel() { return label; }

    public double getThreshold() { return threshold; }
}
