/* (C)2026 */
package com.ammann.biometrics.service;

import com.ammann.biometrics.enumeration.TrendDirection;
import com.ammann.biometrics.model.ChangePoint;
import com.ammann.biometrics.model.Measurement;
import com.ammann.biometrics.model.MeasurementSeries;
import com.ammann.biometrics.model.TrendResult;
import com.ammann.biometrics.statistics.SeriesStatistics;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Fits linear trends to biomarker series and finds change points in their local mean.
 *
 * <p>Both operations work on the present samples only. Too little data yields
 * {@code null} or an empty list, never an exception.
 */
public class TrendAnalyzer
{
    private static final Logger LOG = Logger.getLogger(TrendAnalyzer.class);

    public static final double DEFAULT_SIGNIFICANCE_LEVEL = 0.05;
    public static final int DEFAULT_MIN_SEGMENT_SIZE = 7;
    public static final double DEFAULT_THRESHOLD_STD = 2.0;
    public static final int DEFAULT_MAX_GAP_DAYS = 3;

    static final int MIN_TREND_SAMPLES = 7;
    static final double MIN_CHANGE_POINT_CONFIDENCE = 0.95;

    private static final double SECONDS_PER_DAY = 86_400.0;

    private final double alpha;

    public TrendAnalyzer()
    {
        this(DEFAULT_SIGNIFICANCE_LEVEL);
    }

    /**
     * @param significanceLevel p-value below which a slope counts as significant, in (0, 1)
     */
    public TrendAnalyzer(double significanceLevel)
    {
        if (!(significanceLevel > 0 && significanceLevel < 1)) {
            throw new IllegalArgumentException("significanceLevel must be in (0, 1): " + significanceLevel);
        }
        this.alpha = significanceLevel;
    }

    /**
     * Fits an ordinary least-squares line of value against fractional days since the first
     * present sample.
     *
     * @param series        series to fit
     * @param biomarkerName name reported in the result
     * @return the fitted trend, or {@code null} with fewer than seven present samples or
     *         when all samples share one timestamp
     */
    public TrendResult computeTrend(MeasurementSeries series, String biomarkerName)
    {
        List<Measurement> present = series.present();
        if (present.size() < MIN_TREND_SAMPLES) {
            return null;
        }

        Instant start = present.get(0).timestamp();
        Instant end = present.get(present.size() - 1).timestamp();
        if (!end.isAfter(start)) {
            return null;
        }

        SimpleRegression regression = new SimpleRegression();
        double lastX = 0.0;
        for (Measurement m : present) {
            lastX = dayOffset(start, m.timestamp());
            regression.addData(lastX, m.value());
        }

        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        double rSquared = regression.getRSquare();
        double pValue = regression.getSignificance();

        // Constant series: no variance to explain.
        if (Double.isNaN(rSquared)) rSquared = 0.0;
        if (Double.isNaN(pValue)) pValue = 1.0;

        double endValue = intercept + slope * lastX;
        double percentChange = intercept != 0.0 ? (endValue - intercept) / Math.abs(intercept) * 100.0 : 0.0;
        boolean significant = pValue < alpha;

        LOG.debugf("Trend for %s: slope=%.4f/day, r2=%.3f, p=%.4g over %d samples",
                biomarkerName, slope, rSquared, pValue, present.size());

        return new TrendResult(
                biomarkerName,
                start,
                end,
                slope,
                slope,
                rSquared,
                pValue,
                TrendDirection.of(slope, significant),
                significant,
                percentChange);
    }

    public List<ChangePoint> detectChangePoints(MeasurementSeries series)
    {
        return detectChangePoints(series, DEFAULT_MIN_SEGMENT_SIZE, DEFAULT_THRESHOLD_STD);
    }

    /**
     * Finds shifts of the local mean by comparing the {@code minSegmentSize} samples before
     * and after every position. A candidate needs a mean difference above
     * {@code thresholdStd} global (population) standard deviations and a t-test confidence
     * above 0.95. Candidates within {@value #DEFAULT_MAX_GAP_DAYS} days are merged.
     *
     * @param series         series to segment
     * @param minSegmentSize samples on each side of a candidate, at least 2
     * @param thresholdStd   required mean difference in units of the global standard deviation
     * @return merged change points in time order
     */
    public List<ChangePoint> detectChangePoints(MeasurementSeries series, int minSegmentSize, double thresholdStd)
    {
        if (minSegmentSize < 2) {
            throw new IllegalArgumentException("minSegmentSize must be at least 2: " + minSegmentSize);
        }
        if (!(thresholdStd >= 0)) {
            throw new IllegalArgumentException("thresholdStd must not be negative: " + thresholdStd);
        }

        List<Measurement> present = series.present();
        if (present.size() < 2 * minSegmentSize) {
            return List.of();
        }

        double[] values = series.presentValues();
        double globalStd = SeriesStatistics.populationStandardDeviation(values);
        List<ChangePoint> candidates = new ArrayList<>();

        for (int i = minSegmentSize; i <= values.length - minSegmentSize; i++) {
            double[] before = SeriesStatistics.slice(values, i - minSegmentSize, i);
            double[] after = SeriesStatistics.slice(values, i, i + minSegmentSize);
            double beforeMean = SeriesStatistics.mean(before);
            double afterMean = SeriesStatistics.mean(after);
            double change = afterMean - beforeMean;

            if (Math.abs(change) <= thresholdStd * globalStd) {
                continue;
            }

            double pValue = SeriesStatistics.twoSampleTTestPValue(before, after);
            if (Double.isNaN(pValue)) {
                continue;
            }
            double confidence = 1.0 - pValue;
            if (confidence <= MIN_CHANGE_POINT_CONFIDENCE) {
                continue;
            }

            double changePercent = beforeMean != 0.0 ? change / Math.abs(beforeMean) * 100.0 : 0.0;
            candidates.add(new ChangePoint(
                    present.get(i).timestamp(), beforeMean, afterMean, change, changePercent, confidence));
        }

        List<ChangePoint> merged = mergeNearbyChangePoints(candidates, DEFAULT_MAX_GAP_DAYS);
        LOG.debugf("Change points for %s: %d candidates merged into %d",
                series.biomarker(), candidates.size(), merged.size());
        return merged;
    }

    /**
     * Collapses change points closer than {@code maxGapDays} whole days, keeping the one with
     * higher confidence. Each point is compared with the last kept point.
     */
    public List<ChangePoint> mergeNearbyChangePoints(List<ChangePoint> changePoints, int maxGapDays)
    {
        if (changePoints.isEmpty()) {
            return List.of();
        }

        List<ChangePoint> sorted = new ArrayList<>(changePoints);
        sorted.sort(Comparator.comparing(ChangePoint::timestamp));

        List<ChangePoint> merged = new ArrayList<>();
        merged.add(sorted.get(0));
        for (ChangePoint cp : sorted.subList(1, sorted.size())) {
            int lastIndex = merged.size() - 1;
            ChangePoint last = merged.get(lastIndex);
            long gapDays = Duration.between(last.timestamp(), cp.timestamp()).toDays();

            if (gapDays <= maxGapDays) {
                if (cp.confidence() > last.confidence()) {
                    merged.set(lastIndex, cp);
                }
            } else {
                merged.add(cp);
            }
        }
        return merged;
    }

    public double getSignificanceLevel()
    {
        return alpha;
    }

    private static double dayOffset(Instant start, Instant t)
    {
        return Duration.between(start, t).toMillis() / 1000.0 / SECONDS_PER_DAY;
    }
}
