/* (C)2026 */
package com.ammann.biometrics.statistics;

import java.util.Arrays;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.inference.TTest;

/**
 * Stateless statistical helpers shared by the detectors and the correlation engine.
 */
public final class SeriesStatistics {

    private SeriesStatistics() {}

    public static double mean(double[] values) {
        return StatUtils.mean(values);
    }

    /** Population standard deviation (n denominator). */
    public static double populationStandardDeviation(double[] values) {
        if (values.length == 0) return Double.NaN;
        return Math.sqrt(StatUtils.populationVariance(values));
    }

    /** Sample standard deviation (n - 1 denominator); 0 for fewer than two values. */
    public static double sampleStandardDeviation(double[] values) {
        if (values.length < 2) return 0.0;
        return Math.sqrt(StatUtils.variance(values));
    }

    public static double[] slice(double[] values, int from, int to) {
        return Arrays.copyOfRange(values, from, to);
    }

    /**
     * Two-sided p-value of the pooled-variance (Student) two-sample t-test.
     *
     * @param a first sample, at least two values
     * @param b second sample, at least two values
     * @return p-value, or {@code NaN} if the statistic is undefined (both samples constant and equal)
     */
    public static double twoSampleTTestPValue(double[] a, double[] b) {
        if (a.length < 2 || b.length < 2) {
            throw new IllegalArgumentException(
                    String.format("t-test needs at least two values per sample, got %d and %d", a.length, b.length));
        }

        double meanA = StatUtils.mean(a);
        double meanB = StatUtils.mean(b);
        double pooledVariance =
                ((a.length - 1) * StatUtils.variance(a) + (b.length - 1) * StatUtils.variance(b))
                        / (a.length + b.length - 2);

        if (pooledVariance == 0.0) {
            // Degenerate: zero spread. Identical means carry no evidence, different means are certain.
            return meanA == meanB ? Double.NaN : 0.0;
        }

        return new TTest().homoscedasticTTest(a, b);
    }

    /**
     * Pearson correlation with its two-sided p-value from the t distribution with
     * {@code n - 2} degrees of freedom.
     *
     * @param x first variable
     * @param y second variable, same length as {@code x}
     * @return the coefficient and p-value, or {@code null} if r is undefined (constant input)
     */
    public static PearsonResult pearson(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException(
                    String.format("Pearson correlation needs equal lengths, got %d and %d", x.length, y.length));
        }
        if (x.length < 3) {
            return null;
        }

        double r = new PearsonsCorrelation().correlation(x, y);
        if (Double.isNaN(r)) {
            return null;
        }
        r = Math.max(-1.0, Math.min(1.0, r));

        int degreesOfFreedom = x.length - 2;
        double pValue;
        if (Math.abs(r) >= 1.0) {
            pValue = 0.0;
        } else {
            double t = Math.abs(r) * Math.sqrt(degreesOfFreedom / (1.0 - r * r));
            pValue = 2.0 * new TDistribution(degreesOfFreedom).cumulativeProbability(-t);
        }

        return new PearsonResult(r, pValue, x.length);
    }

    /**
     * Pearson coefficient, its p-value and the number of pairs it was computed from.
     */
    public record PearsonResult(double r, double pValue, int n) {}
}
