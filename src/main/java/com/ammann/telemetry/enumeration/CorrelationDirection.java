/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Sign of a correlation coefficient.
 */
public enum CorrelationDirection {
    POSITIVE("positive"),
    NEGATIVE("negative");

    private final String label;

    CorrelationDirection(String label) {
        this.label = label;
    }

    /** Positive for r > 0, negative otherwise. */
    public static CorrelationDirection of(double r) {
        return r > 0 ? POSITIVE : NEGATIVE;
    }

    @JsonValue
    public String getLabel() { return label; }
}
