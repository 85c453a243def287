/* (C)2026 */
package com.ammann.biometrics.service;

import com.ammann.biometrics.enumeration.AlertPriority;
import com.ammann.biometrics.enumeration.AnomalyType;
import com.ammann.biometrics.model.Anomaly;
import com.ammann.biometrics.model.ClinicalThresholdTable;
import com.ammann.biometrics.model.ClinicalThresholds;
import com.ammann.biometrics.model.Measurement;
import com.ammann.biometrics.model.MeasurementSeries;
import com.ammann.biometrics.model.ValueRange;
import com.ammann.biometrics.statistics.RollingStatistics;
import com.ammann.biometrics.statistics.SeriesStatistics;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scans one biomarker series for anomalies.
 *
 * <p>Three strategies run independently and their results are concatenated:
 * <ul>
 *   <li>clinical threshold violations (CRITICAL / HIGH point anomalies)</li>
 *   <li>rolling z-score outliers (MEDIUM point anomalies)</li>
 *   <li>level shifts against the initial baseline, confirmed by a t-test (HIGH)</li>
 * </ul>
 *
 * <p>A strategy without enough data yields nothing. Instances are immutable and
 * safe to share across threads.
 */
public class AnomalyDetector
{
    private static final Logger LOG = Logger.getLogger(AnomalyDetector.class);

    public static final int DEFAULT_WINDOW_SIZE = 30;
    public static final double DEFAULT_Z_THRESHOLD = 3.0;
    public static final double DEFAULT_IQR_MULTIPLIER = 1.5;
    public static final double DEFAULT_MIN_SHIFT_PERCENT = 15.0;

    static final double LEVEL_SHIFT_MAX_P_VALUE = 0.01;
    static final String CRITICAL_CONTEXT = "Immediate medical attention may be required";

    private final ClinicalThresholdTable thresholds;
    private final int windowSize;
    private final double zThreshold;
    private final double iqrMultiplier;
    private final double minShiftPercent;

    public AnomalyDetector(ClinicalThresholdTable thresholds)
    {
        this(thresholds, DEFAULT_WINDOW_SIZE, DEFAULT_Z_THRESHOLD, DEFAULT_IQR_MULTIPLIER, DEFAULT_MIN_SHIFT_PERCENT);
    }

    /**
     * @param thresholds      clinical cutoffs per biomarker
     * @param windowSize      rolling and level-shift window length in samples, at least 2
     * @param zThreshold      z-score above which a sample is an outlier
     * @param iqrMultiplier   IQR fence multiplier; validated, reserved for an IQR strategy
     * @param minShiftPercent minimum mean change versus baseline, in percent, before a t-test runs
     * @throws IllegalArgumentException on non-positive settings
     */
    public AnomalyDetector(
            ClinicalThresholdTable thresholds,
            int windowSize,
            double zThreshold,
            double iqrMultiplier,
            double minShiftPercent)
    {
        if (thresholds == null) {
            throw new IllegalArgumentException("thresholds must not be null");
        }
        if (windowSize < 2) {
            throw new IllegalArgumentException("windowSize must be at least 2: " + windowSize);
        }
        if (!(zThreshold > 0)) {
            throw new IllegalArgumentException("zThreshold must be positive: " + zThreshold);
        }
        if (!(iqrMultiplier > 0)) {
            throw new IllegalArgumentException("iqrMultiplier must be positive: " + iqrMultiplier);
        }
        if (!(minShiftPercent >= 0)) {
            throw new IllegalArgumentException("minShiftPercent must not be negative: " + minShiftPercent);
        }
        this.thresholds = thresholds;
        this.windowSize = windowSize;
        this.zThreshold = zThreshold;
        this.iqrMultiplier = iqrMultiplier;
        this.minShiftPercent = minShiftPercent;
    }

    /**
     * Runs all strategies over {@code series}, naming anomalies after the series' biomarker.
     */
    public List<Anomaly> detect(MeasurementSeries series)
    {
        return detect(series, series.biomarker());
    }

    /**
     * Runs all strategies over {@code series}.
     *
     * @param series        samples in time order, gaps as missing values
     * @param biomarkerName name used for threshold lookup and descriptions
     * @return clinical, statistical and level-shift anomalies, in that order
     */
    public List<Anomaly> detect(MeasurementSeries series, String biomarkerName)
    {
        List<Anomaly> anomalies = new ArrayList<>();
        anomalies.addAll(detectClinicalViolations(series, biomarkerName));
        anomalies.addAll(detectStatisticalOutliers(series, biomarkerName));
        anomalies.addAll(detectLevelShifts(series, biomarkerName));

        LOG.debugf("Detected %d anomalies in %d samples of %s", anomalies.size(), series.size(), biomarkerName);
        return anomalies;
    }

    List<Anomaly> detectClinicalViolations(MeasurementSeries series, String biomarkerName)
    {
        ClinicalThresholds t = thresholds.forBiomarker(biomarkerName).orElse(null);
        if (t == null) {
            return List.of();
        }

        List<Anomaly> anomalies = new ArrayList<>();
        for (Measurement m : series.present()) {
            double value = m.value();

            if (t.criticalLow() != null && value < t.criticalLow()) {
                anomalies.add(clinical(m, biomarkerName, AlertPriority.CRITICAL,
                        new ValueRange(t.criticalLow(), upperOrInfinity(t.criticalHigh())),
                        Math.abs(value - t.criticalLow()) / t.criticalLow(),
                        "Critically low", CRITICAL_CONTEXT));
            } else if (t.criticalHigh() != null && value > t.criticalHigh()) {
                anomalies.add(clinical(m, biomarkerName, AlertPriority.CRITICAL,
                        new ValueRange(lowerOrZero(t.criticalLow()), t.criticalHigh()),
                        (value - t.criticalHigh()) / t.criticalHigh(),
                        "Critically high", CRITICAL_CONTEXT));
            } else if (t.low() != null && value < t.low()) {
                anomalies.add(clinical(m, biomarkerName, AlertPriority.HIGH,
                        new ValueRange(t.low(), upperOrInfinity(t.high())),
                        Math.abs(value - t.low()) / t.low(),
                        "Low", null));
            } else if (t.high() != null && value > t.high()) {
                anomalies.add(clinical(m, biomarkerName, AlertPriority.HIGH,
                        new ValueRange(lowerOrZero(t.low()), t.high()),
                        (value - t.high()) / t.high(),
                        "High", null));
            }
        }
        return anomalies;
    }

    List<Anomaly> detectStatisticalOutliers(MeasurementSeries series, String biomarkerName)
    {
        if (series.size() < windowSize) {
            return List.of();
        }

        RollingStatistics rolling = RollingStatistics.compute(series.values(), windowSize, windowSize / 2);
        List<Anomaly> anomalies = new ArrayList<>();

        for (int i = 0; i < series.size(); i++) {
            Measurement m = series.measurements().get(i);
            Double mean = rolling.meanAt(i);
            Double std = rolling.standardDeviationAt(i);
            if (!m.isPresent() || mean == null || std == null || std == 0.0) {
                continue;
            }

            double z = Math.abs(m.value() - mean) / std;
            if (z > zThreshold) {
                anomalies.add(new Anomaly(
                        m.timestamp(),
                        biomarkerName,
                        AnomalyType.POINT,
                        AlertPriority.MEDIUM,
                        m.value(),
                        new ValueRange(mean - 2 * std, mean + 2 * std),
                        z,
                        String.format(Locale.ROOT, "Unusual %s value: %.1f (z-score: %.1f)", biomarkerName, m.value(), z),
                        null));
            }
        }
        return anomalies;
    }

    List<Anomaly> detectLevelShifts(MeasurementSeries series, String biomarkerName)
    {
        List<Measurement> present = series.present();
        if (present.size() < 2 * windowSize) {
            return List.of();
        }

        double[] values = series.presentValues();
        double[] baseline = SeriesStatistics.slice(values, 0, windowSize);
        double baselineMean = SeriesStatistics.mean(baseline);
        double baselineStd = SeriesStatistics.populationStandardDeviation(baseline);

        if (baselineMean == 0.0 || baselineStd == 0.0) {
            LOG.debugf("Skipping level-shift detection for %s: degenerate baseline (mean=%.3f, std=%.3f)",
                    biomarkerName, baselineMean, baselineStd);
            return List.of();
        }

        ValueRange expected = new ValueRange(baselineMean - 2 * baselineStd, baselineMean + 2 * baselineStd);
        int step = windowSize / 2;
        List<Anomaly> anomalies = new ArrayList<>();

        for (int i = windowSize; i + windowSize <= values.length; i += step) {
            double[] window = SeriesStatistics.slice(values, i, i + windowSize);
            double windowMean = SeriesStatistics.mean(window);
            double percentChange = (windowMean - baselineMean) / Math.abs(baselineMean) * 100.0;

            if (Math.abs(percentChange) <= minShiftPercent) {
                continue;
            }

            double pValue = SeriesStatistics.twoSampleTTestPValue(baseline, window);
            if (!(pValue < LEVEL_SHIFT_MAX_P_VALUE)) {
                continue;
            }

            String direction = percentChange > 0 ? "increased" : "decreased";
            anomalies.add(new Anomaly(
                    present.get(i).timestamp(),
                    biomarkerName,
                    AnomalyType.LEVEL_SHIFT,
                    AlertPriority.HIGH,
                    windowMean,
                    expected,
                    Math.abs(percentChange),
                    String.format(Locale.ROOT, "%s has %s by %.1f%% from baseline",
                            biomarkerName, direction, Math.abs(percentChange)),
                    String.format(Locale.ROOT, "Baseline mean: %.1f, Current: %.1f", baselineMean, windowMean)));
        }
        return anomalies;
    }

    public int getWindowSize() { return windowSize; }

    public double getZThreshold() { return zThreshold; }

    public double getIqrMultiplier() { return iqrMultiplier; }

    public double getMinShiftPercent() { return minShiftPercent; }

    private static Anomaly clinical(
            Measurement m,
            String biomarkerName,
            AlertPriority priority,
            ValueRange expected,
            double deviation,
            String label,
            String context)
    {
        return new Anomaly(
                m.timestamp(),
                biomarkerName,
                AnomalyType.POINT,
                priority,
                m.value(),
                expected,
                deviation,
                String.format(Locale.ROOT, "%s %s: %s", label, biomarkerName, formatValue(m.value())),
                context);
    }

    private static double upperOrInfinity(Double bound)
    {
        return bound != null ? bound : Double.POSITIVE_INFINITY;
    }

    private static double lowerOrZero(Double bound)
    {
        return bound != null ? bound : 0.0;
    }

    private static String formatValue(double value)
    {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
