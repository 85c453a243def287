/* (C)2026 */
package com.ammann.biometrics.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One sample of a biomarker series. A {@code null} value marks an explicit gap,
 * e.g. an empty resampling bucket.
 *
 * @param timestamp sample time
 * @param value     sample value, or {@code null} when missing
 */
public record Measurement(Instant timestamp, Double value) {

    public Measurement {
        Objects.requireNonNull(timestamp, "timestamp");
        if (value != null && value.isNaN()) {
            value = null;
        }
    }

    public static Measurement of(Instant timestamp, double value) {
        return new Measurement(timestamp, value);
    }

    public static Measurement missing(Instant timestamp) {
        return new Measurement(timestamp, null);
    }

    public boolean isPresent() {
        return value != null;
    }
}
