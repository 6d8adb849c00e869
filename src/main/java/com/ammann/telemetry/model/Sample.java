/* (C)2026 */
package com.ammann.telemetry.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single metric observation.
 *
 * @param timestamp time the value was sampled (or the start of its bucket)
 * @param value     observed value
 */
public record Sample(Instant timestamp, double value) {

    public Sample {
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static Sample of(Instant timestamp, double value) {
        return new Sample(timestamp, value);
    }
}
