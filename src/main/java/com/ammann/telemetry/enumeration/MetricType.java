/* (C)2026 */
package com.ammann.telemetry.enumeration;

import java.util.Arrays;
import java.util.Optional;

/**
 * Known metric types with their family and valid value range.
 *
 * <p>Metric type keys outside this enumeration are accepted everywhere as plain strings;
 * they belong to no family and are treated as non-negative absolute values.
 */
public enum MetricType
{
    CPU("cpu", Family.CPU, 0.0, 100.0),
    MEMORY("memory", Family.MEMORY, 0.0, 100.0),
    MEMORY_BYTES("memory_bytes", Family.MEMORY, 0.0, Double.MAX_VALUE),
    NETWORK_RX_BYTES("network_rx_bytes", Family.NETWORK, 0.0, Double.MAX_VALUE),
    NETWORK_TX_BYTES("network_tx_bytes", Family.NETWORK, 0.0, Double.MAX_VALUE);

    /** Grouping used by composite pattern rules. */
    public enum Family { CPU, MEMORY, NETWORK }

    private final String key;
    private final Family family;
    private final double minValue;
    private final double maxValue;

    MetricType(String key, Family family, double minValue, double maxValue) {
        this.key = key;
        this.family = family;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    public String getKey() { return key; }

    public Family getFamily() { return family; }

    public double getMinValue() { return minValue; }

    public double getMaxValue() { return maxValue; }

    /**
     * Looks up a metric type by its wire key (case-insensitive).
     *
     * @param key metric type key such as {@code cpu}
     * @return the matching type, or empty for unknown keys
     */
    public static Optional<MetricType> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.key.equalsIgnoreCase(key))
                .findFirst();
    }

    /** Returns {@code true} if the key names a metric of the given family. */
    public static boolean isFamily(String key, Family family) {
        return fromKey(key).map(type -> type.family == family).orElse(false);
    }

    /**
     * Clamps a value into the valid range of the metric: [0, 100] for percentage
     * metrics, [0, max) for absolute metrics and unknown keys.
     */
    public static double clamp(String key, double value) {
        double min = fromKey(key).map(MetricType::getMinValue).orElse(0.0);
        double max = fromKey(key).map(MetricType::getMaxValue).orElse(Double.MAX_VALUE);
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
