/* (C)2026 */
package com.ammann.biometrics.statistics;

import java.util.List;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * Trailing-window statistics over a series that may contain gaps.
 *
 * <p>This is the one place that defines how rolling windows treat missing values: the
 * window at position {@code i} covers positions {@code [i - window + 1, i]}, including the
 * current sample and including missing positions. A statistic is produced only when the
 * window holds at least {@code minPeriods} present values; a standard deviation additionally
 * needs two. Otherwise the slot is {@code null}.
 */
public final class RollingStatistics {

    private final Double[] means;
    private final Double[] standardDeviations;

    private RollingStatistics(Double[] means, Double[] standardDeviations) {
        this.means = means;
        this.standardDeviations = standardDeviations;
    }

    /**
     * Computes trailing mean and sample standard deviation (n - 1 denominator).
     *
     * @param values     series values in position order, {@code null} where missing
     * @param window     window length in positions
     * @param minPeriods minimum present values per window
     * @return rolling statistics aligned with {@code values}
     */
    public static RollingStatistics compute(List<Double> values, int window, int minPeriods) {
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        if (minPeriods <= 0 || minPeriods > window) {
            throw new IllegalArgumentException(
                    String.format("minPeriods must be in [1, %d]: %d", window, minPeriods));
        }

        int n = values.size();
        Double[] means = new Double[n];
        Double[] stds = new Double[n];

        for (int i = 0; i < n; i++) {
            SummaryStatistics stats = new SummaryStatistics();
            for (int j = Math.max(0, i - window + 1); j <= i; j++) {
                Double v = values.get(j);
                if (v != null) {
                    stats.addValue(v);
                }
            }

            if (stats.getN() >= minPeriods) {
                means[i] = stats.getMean();
                stds[i] = stats.getN() >= 2 ? stats.getStandardDeviation() : null;
            }
        }

        return new RollingStatistics(means, stds);
    }

    public int size() {
        return means.length;
    }

    /** Rolling mean at position {@code i}, or {@code null} if undefined. */
    public Double meanAt(int i) {
        return means[i];
    }

    /** Rolling sample standard deviation at position {@code i}, or {@code null} if undefined. */
    public Double standardDeviationAt(int i) {
        return standardDeviations[i];
    }
}
