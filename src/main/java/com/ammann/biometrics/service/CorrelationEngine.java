/* (C)2026 */
package com.ammann.biometrics.service;

import com.ammann.biometrics.enumeration.Resample;
import com.ammann.biometrics.exception.TimeSeriesSourceException;
import com.ammann.biometrics.model.CorrelationResult;
import com.ammann.biometrics.model.Measurement;
import com.ammann.biometrics.model.MeasurementSeries;
import com.ammann.biometrics.source.TimeSeriesSource;
import com.ammann.biometrics.statistics.SeriesStatistics;
import com.ammann.biometrics.statistics.SeriesStatistics.PearsonResult;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Discovers lagged Pearson correlations between daily biomarker series.
 *
 * <p>Series are aligned on a continuous UTC calendar-day grid from {@code start} to
 * {@code end}, so a lag of k days shifts one series by exactly k grid positions. Days
 * where either value is missing are dropped after shifting.
 *
 * <p>{@link #discoverAllCorrelations} applies a Bonferroni correction over
 * {@code pairs x (2 * maxLag + 1)} comparisons. Discovery and the matrix leave out a
 * biomarker whose series cannot be loaded; single-pair queries propagate the failure.
 */
public class CorrelationEngine
{
    private static final Logger LOG = Logger.getLogger(CorrelationEngine.class);

    public static final double DEFAULT_SIGNIFICANCE_LEVEL = 0.05;
    public static final int DEFAULT_MIN_SAMPLES = 30;
    public static final int DEFAULT_MAX_LAG_DAYS = 7;

    private static final Comparator<CorrelationResult> BY_MAGNITUDE_DESC =
            Comparator.comparingDouble(CorrelationResult::magnitude).reversed();

    private final TimeSeriesSource source;
    private final double alpha;
    private final int minSamples;
    private final int maxLag;

    public CorrelationEngine(TimeSeriesSource source)
    {
        this(source, DEFAULT_SIGNIFICANCE_LEVEL, DEFAULT_MIN_SAMPLES, DEFAULT_MAX_LAG_DAYS);
    }

    /**
     * @param source            series provider
     * @param significanceLevel uncorrected significance level, in (0, 1)
     * @param minSamples        minimum complete day pairs per correlation, at least 3
     * @param maxLagDays        largest lag swept in either direction, non-negative
     */
    public CorrelationEngine(TimeSeriesSource source, double significanceLevel, int minSamples, int maxLagDays)
    {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        if (!(significanceLevel > 0 && significanceLevel < 1)) {
            throw new IllegalArgumentException("significanceLevel must be in (0, 1): " + significanceLevel);
        }
        if (minSamples < 3) {
            throw new IllegalArgumentException("minSamples must be at least 3: " + minSamples);
        }
        if (maxLagDays < 0) {
            throw new IllegalArgumentException("maxLagDays must not be negative: " + maxLagDays);
        }
        this.source = source;
        this.alpha = significanceLevel;
        this.minSamples = minSamples;
        this.maxLag = maxLagDays;
    }

    /**
     * Correlates two biomarkers at one lag.
     *
     * @param lagDays positive when {@code biomarker1} leads {@code biomarker2}
     * @return the correlation, or {@code null} with fewer than {@code minSamples} complete
     *         pairs or an undefined coefficient
     */
    public CorrelationResult computeCorrelation(
            String userId, String biomarker1, String biomarker2, Instant start, Instant end, int lagDays)
    {
        DailyFrame frame = loadDailyFrame(userId, List.of(biomarker1, biomarker2), start, end, false);
        return correlate(frame, biomarker1, biomarker2, lagDays);
    }

    /**
     * Correlates two biomarkers at every lag in {@code [-maxLag, maxLag]}.
     *
     * @return defined results sorted by |r| descending
     */
    public List<CorrelationResult> findLaggedCorrelations(
            String userId, String biomarker1, String biomarker2, Instant start, Instant end)
    {
        DailyFrame frame = loadDailyFrame(userId, List.of(biomarker1, biomarker2), start, end, false);
        List<CorrelationResult> results = sweepLags(frame, biomarker1, biomarker2);
        results.sort(BY_MAGNITUDE_DESC);
        return results;
    }

    /**
     * Sweeps every unordered biomarker pair across all lags and keeps the results below
     * the (optionally Bonferroni-corrected) significance threshold.
     *
     * @param bonferroni divide the significance level by the number of comparisons
     * @return significant results sorted by |r| descending, each marked significant
     */
    public List<CorrelationResult> discoverAllCorrelations(
            String userId, List<String> biomarkers, Instant start, Instant end, boolean bonferroni)
    {
        return discover(userId, biomarkers, start, end, bonferroni).correlations();
    }

    /**
     * Same sweep as {@link #discoverAllCorrelations}, also naming the biomarkers whose series
     * could not be loaded. Pairs involving such a biomarker are skipped and not counted as
     * comparisons.
     */
    public Discovery discover(
            String userId, List<String> biomarkers, Instant start, Instant end, boolean bonferroni)
    {
        List<String> distinct = List.copyOf(new LinkedHashSet<>(biomarkers));
        if (distinct.size() < 2) {
            return new Discovery(List.of(), Map.of());
        }

        DailyFrame frame = loadDailyFrame(userId, distinct, start, end, true);
        List<String> available = distinct.stream().filter(frame::has).toList();
        int pairs = available.size() * (available.size() - 1) / 2;
        if (pairs == 0) {
            return new Discovery(List.of(), frame.unavailable());
        }

        int comparisons = pairs * (2 * maxLag + 1);
        double threshold = bonferroni ? alpha / comparisons : alpha;

        List<CorrelationResult> significant = new ArrayList<>();
        for (int i = 0; i < available.size(); i++) {
            for (int j = i + 1; j < available.size(); j++) {
                for (CorrelationResult result : sweepLags(frame, available.get(i), available.get(j))) {
                    if (result.pValue() < threshold) {
                        significant.add(result.withSignificant(true));
                    }
                }
            }
        }

        significant.sort(BY_MAGNITUDE_DESC);
        LOG.debugf("Correlation discovery for user %s: %d significant of %d comparisons (threshold %.3g)",
                userId, significant.size(), comparisons, threshold);
        return new Discovery(significant, frame.unavailable());
    }

    /**
     * Pairwise-complete Pearson matrix over the daily grid. A cell is {@code null} when the
     * pair has fewer than {@code minSamples} complete days, r is undefined, or either
     * series could not be loaded.
     *
     * @return rows and columns in the order of {@code biomarkers}
     */
    public Map<String, Map<String, Double>> computeCorrelationMatrix(
            String userId, List<String> biomarkers, Instant start, Instant end)
    {
        List<String> distinct = List.copyOf(new LinkedHashSet<>(biomarkers));
        DailyFrame frame = loadDailyFrame(userId, distinct, start, end, true);

        Map<String, Map<String, Double>> matrix = new LinkedHashMap<>();
        for (String row : distinct) {
            Map<String, Double> cells = new LinkedHashMap<>();
            for (String column : distinct) {
                if (!frame.has(row) || !frame.has(column)) {
                    cells.put(column, null);
                    continue;
                }
                double[][] pairs = frame.completePairs(row, column, 0);
                PearsonResult pearson = pairs[0].length >= minSamples
                        ? SeriesStatistics.pearson(pairs[0], pairs[1])
                        : null;
                cells.put(column, pearson != null ? pearson.r() : null);
            }
            matrix.put(row, cells);
        }
        return matrix;
    }

    /**
     * Loads each biomarker once, resampled to calendar days.
     *
     * @param skipUnavailable leave out a biomarker whose load fails instead of rethrowing
     */
    DailyFrame loadDailyFrame(
            String userId, List<String> biomarkers, Instant start, Instant end, boolean skipUnavailable)
    {
        Instant gridStart = start.truncatedTo(ChronoUnit.DAYS);
        int days = (int) ChronoUnit.DAYS.between(gridStart, end.truncatedTo(ChronoUnit.DAYS)) + 1;

        Map<String, Double[]> columns = new LinkedHashMap<>();
        Map<String, TimeSeriesSourceException> unavailable = new LinkedHashMap<>();
        for (String biomarker : biomarkers) {
            MeasurementSeries daily;
            try {
                daily = source.load(userId, biomarker, start, end, Resample.DAILY);
            } catch (TimeSeriesSourceException e) {
                if (!skipUnavailable) {
                    throw e;
                }
                LOG.warnf("Leaving %s out of correlations for user %s: %s", biomarker, userId, e.getMessage());
                unavailable.put(biomarker, e);
                continue;
            }

            Double[] column = new Double[days];
            for (Measurement m : daily.measurements()) {
                long index = ChronoUnit.DAYS.between(gridStart, m.timestamp().truncatedTo(ChronoUnit.DAYS));
                if (index >= 0 && index < days) {
                    column[(int) index] = m.value();
                }
            }
            columns.put(biomarker, column);
        }
        return new DailyFrame(days, columns, unavailable);
    }

    CorrelationResult correlate(DailyFrame frame, String biomarker1, String biomarker2, int lagDays)
    {
        double[][] pairs = frame.completePairs(biomarker1, biomarker2, lagDays);
        if (pairs[0].length < minSamples) {
            return null;
        }

        PearsonResult pearson = SeriesStatistics.pearson(pairs[0], pairs[1]);
        if (pearson == null) {
            return null;
        }

        return new CorrelationResult(
                biomarker1,
                biomarker2,
                pearson.r(),
                pearson.pValue(),
                lagDays,
                pearson.n(),
                pearson.pValue() < alpha,
                interpret(pearson.r(), biomarker1, biomarker2, lagDays));
    }

    private List<CorrelationResult> sweepLags(DailyFrame frame, String biomarker1, String biomarker2)
    {
        List<CorrelationResult> results = new ArrayList<>();
        for (int lag = -maxLag; lag <= maxLag; lag++) {
            CorrelationResult result = correlate(frame, biomarker1, biomarker2, lag);
            if (result != null) {
                results.add(result);
            }
        }
        return results;
    }

    static String interpret(double r, String biomarker1, String biomarker2, int lagDays)
    {
        double magnitude = Math.abs(r);
        String strength = magnitude > 0.7 ? "Strong" : magnitude > 0.4 ? "Moderate" : "Weak";
        String direction = r > 0 ? "positive" : "negative";

        String timing;
        if (lagDays == 0) {
            timing = "at the same time";
        } else if (lagDays > 0) {
            timing = String.format("%s changes predict %s changes %d day(s) later", biomarker1, biomarker2, lagDays);
        } else {
            timing = String.format("%s changes predict %s changes %d day(s) later", biomarker2, biomarker1, -lagDays);
        }

        return String.format(Locale.ROOT, "%s %s correlation (r=%.2f): %s", strength, direction, r, timing);
    }

    public double getSignificanceLevel() { return alpha; }

    public int getMinSamples() { return minSamples; }

    public int getMaxLagDays() { return maxLag; }

    /**
     * Result of a correlation discovery.
     *
     * @param correlations significant results sorted by |r| descending
     * @param unavailable  biomarkers left out because their series could not be loaded
     */
    public record Discovery(
            List<CorrelationResult> correlations, Map<String, TimeSeriesSourceException> unavailable) {}

    /**
     * Daily values of several biomarkers on one shared calendar grid; {@code null} marks a
     * missing day.
     */
    static final class DailyFrame
    {
        private final int days;
        private final Map<String, Double[]> columns;
        private final Map<String, TimeSeriesSourceException> unavailable;

        DailyFrame(int days, Map<String, Double[]> columns, Map<String, TimeSeriesSourceException> unavailable)
        {
            this.days = days;
            this.columns = columns;
            this.unavailable = Map.copyOf(unavailable);
        }

        int days()
        {
            return days;
        }

        boolean has(String biomarker)
        {
            return columns.containsKey(biomarker);
        }

        Map<String, TimeSeriesSourceException> unavailable()
        {
            return unavailable;
        }

        /**
         * Pairs {@code x[t]} with {@code y[t + lag]} and keeps the days where both exist.
         *
         * @return {@code {xs, ys}} of equal length
         */
        double[][] completePairs(String biomarkerX, String biomarkerY, int lag)
        {
            Double[] x = columns.get(biomarkerX);
            Double[] y = columns.get(biomarkerY);

            int from = Math.max(0, -lag);
            int to = Math.min(days, days - lag);
            List<double[]> pairs = new ArrayList<>();
            for (int t = from; t < to; t++) {
                Double xv = x[t];
                Double yv = y[t + lag];
                if (xv != null && yv != null) {
                    pairs.add(new double[] {xv, yv});
                }
            }

            double[] xs = new double[pairs.size()];
            double[] ys = new double[pairs.size()];
            for (int i = 0; i < pairs.size(); i++) {
                xs[i] = pairs.get(i)[0];
                ys[i] = pairs.get(i)[1];
            }
            return new double[][] {xs, ys};
        }
    }
}
