/* (C)2026 */
package com.ammann.telemetry.model;

import java.util.List;
import java.util.Objects;

/**
 * Timestamp-ascending sequence of samples for one (entity, metric type) pair.
 *
 * <p>The sample list is copied on construction, so a series is an immutable snapshot
 * of caller-owned data.
 *
 * @param entityId   identifier of the monitored entity
 * @param entityName display name of the entity, may be {@code null}
 * @param metricType metric type key such as {@code cpu} or {@code memory}
 * @param samples    samples ordered by ascending timestamp
 */
public record Series(String entityId, String entityName, String metricType, List<Sample> samples) {

    public Series {
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(metricType, "metricType");
        samples = samples == null ? List.of() : List.copyOf(samples);
    }

    public int size() {
        return samples.size();
    }

    /** Returns the display name, falling back to the entity id. */
    public String displayName() {
        return entityName != null && !entityName.isBlank() ? entityName : entityId;
    }

    /** Returns the raw values in sample order. */
    public double[] values() {
        return samples.stream().mapToDouble(Sample::value).toArray();
    }

    /** Returns a copy of this series restricted to the given samples. */
    public Series withSamples(List<Sample> replacement) {
        return new Series(entityId, entityName, metricType, replacement);
    }
}
