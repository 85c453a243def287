package com.ammann.biometrics.support;

import com.ammann.biometrics.model.Measurement;
import com.ammann.biometrics.model.MeasurementSeries;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

public final class TestSeries {

    public static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    private TestSeries() {}

    /** {@code n} samples spaced by {@code step} from {@link #START}, value per index. */
    public static MeasurementSeries series(String biomarker, int n, Duration step, IntToDoubleFunction value) {
        List<Measurement> measurements = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            measurements.add(Measurement.of(START.plus(step.multipliedBy(i)), value.applyAsDouble(i)));
        }
        return new MeasurementSeries(biomarker, measurements);
    }

    public static MeasurementSeries daily(String biomarker, int days, IntToDoubleFunction value) {
        return series(biomarker, days, Duration.ofDays(1), value);
    }

    public static MeasurementSeries of(String biomarker, Double... values) {
        List<Measurement> measurements = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            measurements.add(new Measurement(START.plus(Duration.ofDays(i)), values[i]));
        }
        return new MeasurementSeries(biomarker, measurements);
    }

    /**
     * Deterministic zero-mean noise with a standard deviation close to {@code std}.
     */
    public static double noise(int i, double std) {
        return std * Math.sqrt(2.0) * Math.sin(i * 2.3);
    }

    /**
     * Deterministic pseudo-random values in [0, 1) from a linear congruential generator.
     */
    public static double[] pseudoRandom(long seed, int n) {
        double[] values = new double[n];
        long state = seed;
        for (int i = 0; i < n; i++) {
            state = (state * 6364136223846793005L + 1442695040888963407L);
            values[i] = ((state >>> 11) & ((1L << 53) - 1)) / (double) (1L << 53);
        }
        return values;
    }
}
