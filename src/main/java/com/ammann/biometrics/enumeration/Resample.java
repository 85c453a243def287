/* (C)2026 */
package com.ammann.biometrics.enumeration;

import java.time.temporal.ChronoUnit;

/**
 * Cadence a time-series source resamples to before returning a series.
 */
public enum Resample {
    /** Raw samples, no bucketing */
    NONE(null),
    /** Hourly buckets (UTC) */
    HOURLY(ChronoUnit.HOURS),
    /** Calendar-day buckets (UTC) */
    DAILY(ChronoUnit.DAYS);

    private final ChronoUnit bucketUnit;

    Resample(ChronoUnit bucketUnit) {
        this.bucketUnit = bucketUnit;
    }

    /** Bucket width, or {@code null} for {@link #NONE}. */
    public ChronoUnit getBucketUnit() {
        return bucketUnit;
    }
}
