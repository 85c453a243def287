/* (C)2026 */
package com.ammann.biometrics.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered samples of one biomarker for one user.
 *
 * <p>Timestamps must be strictly increasing. The engine never deduplicates samples, so a
 * source that violates the ordering is rejected here instead of producing silently
 * misaligned rolling windows.
 */
public record MeasurementSeries(String biomarker, List<Measurement> measurements) {

    public MeasurementSeries {
        Objects.requireNonNull(biomarker, "biomarker");
        measurements = List.copyOf(measurements);
        for (int i = 1; i < measurements.size(); i++) {
            if (!measurements.get(i).timestamp().isAfter(measurements.get(i - 1).timestamp())) {
                throw new IllegalArgumentException(
                        String.format(
                                "Series %s is not strictly increasing at index %d (%s after %s)",
                                biomarker,
                                i,
                                measurements.get(i).timestamp(),
                                measurements.get(i - 1).timestamp()));
            }
        }
    }

    public static MeasurementSeries empty(String biomarker) {
        return new MeasurementSeries(biomarker, List.of());
    }

    public int size() {
        return measurements.size();
    }

    public boolean isEmpty() {
        return measurements.isEmpty();
    }

    /** Samples with a value, gaps dropped, order preserved. */
    public List<Measurement> present() {
        return measurements.stream().filter(Measurement::isPresent).toList();
    }

    /** Values of {@link #present()} as a primitive array. */
    public double[] presentValues() {
        return measurements.stream()
                .filter(Measurement::isPresent)
                .mapToDouble(Measurement::value)
                .toArray();
    }

    public int presentCount() {
        return (int) measurements.stream().filter(Measurement::isPresent).count();
    }

    /** Values in position order, {@code null} where missing. */
    public List<Double> values() {
        return measurements.stream().map(Measurement::value).toList();
    }
}
