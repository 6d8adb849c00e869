/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a fitted linear trend.
 */
public enum Trend {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    /** Slopes below this magnitude (units per hour) count as stable. */
    public static final double STABLE_SLOPE_PER_HOUR = 0.1;

    private final String label;

    Trend(String label) {
        this.label = label;
    }

    public static Trend fromSlope(double slopePerHour) {
        if (Math.abs(slopePerHour) < STABLE_SLOPE_PER_HOUR) {
            return STABLE;
        }
        return slopePerHour > 0 ? INCREASING : DECREASING;
    }

    @JsonValue
    public String getLabel() { return label; }
}
