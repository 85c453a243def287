/* (C)2026 */
package com.ammann.biometrics.model;

import java.time.LocalDate;
import java.util.Map;

/**
 * Composite 0-100 health score over a trailing week.
 *
 * @param date       day the trailing window ends on
 * @param score      weighted average of the present components, {@code null} if none is present
 * @param components score per present component ({@code hrv}, {@code sleep}, {@code glucose}, {@code rhr})
 * @param weights    weight per present component before renormalization
 */
public record HealthScore(
        LocalDate date, Double score, Map<String, Double> components, Map<String, Double> weights) {

    public static final String HRV = "hrv";
    public static final String SLEEP = "sleep";
    public static final String GLUCOSE = "glucose";
    public static final String RESTING_HEART_RATE = "rhr";

    public HealthScore {
        components = Map.copyOf(components);
        weights = Map.copyOf(weights);
    }

    public static HealthScore unavailable(LocalDate date) {
        return new HealthScore(date, null, Map.of(), Map.of());
    }

    public boolean isAvailable() {
        return score != null;
    }
}
