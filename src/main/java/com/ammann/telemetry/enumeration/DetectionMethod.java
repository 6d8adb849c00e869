/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Anomaly detection method applied to a metric window.
 */
public enum DetectionMethod {
    /** |z| compared against the configured anomaly threshold. */
    ZSCORE("zscore"),
    /** Value outside mean ± 2σ, lower band floored at zero. */
    BOLLINGER("bollinger"),
    /** Threshold scaled by the window's coefficient of variation. */
    ADAPTIVE("adaptive");

    private final String label;

    DetectionMethod(String label) {
        this.label = label;
    }

    public static Optional<DetectionMethod> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(method -> method.label.equalsIgnoreCase(label) || method.name().equalsIgnoreCase(label))
                .findFirst();
    }

    @JsonValue
    public String getLabel() { return label; }
}
