/* (C)2026 */
package com.ammann.biometrics.service;

import com.ammann.biometrics.model.Biomarkers;
import com.ammann.biometrics.model.HealthScore;
import com.ammann.biometrics.statistics.SeriesStatistics;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scores the health components of a trailing week on a 0-100 scale and combines them.
 *
 * <p>Each component method returns {@code null} when it has no input, so the caller can
 * omit that component; {@link #combine} renormalizes over the components present.
 */
public class HealthScoreCalculator
{
    public static final double COMPONENT_WEIGHT = 0.25;

    static final double SLEEP_TARGET_MIN_MINUTES = 420.0;
    static final double SLEEP_TARGET_MAX_MINUTES = 540.0;
    static final double MAX_GLUCOSE_VARIABILITY_PENALTY = 30.0;

    /**
     * HRV component from RMSSD samples (ms): 100 at a mean of 50 or more, linear 70-100
     * between 30 and 50, linear 0-70 below 30.
     */
    public Double hrvScore(double[] rmssd)
    {
        if (rmssd.length == 0) return null;
        double mean = SeriesStatistics.mean(rmssd);

        if (mean >= 50) return 100.0;
        if (mean >= 30) return 70.0 + (mean - 30) * 1.5;
        return Math.max(0.0, mean * 2.3);
    }

    /**
     * Sleep component: mean of the duration score and the mean efficiency percentage.
     * Duration scores 100 inside 7-9 hours. Without efficiency data the duration score
     * stands alone.
     *
     * @param totalMinutes  total sleep per night
     * @param efficiencyPct efficiency per night, may be empty
     */
    public Double sleepScore(double[] totalMinutes, double[] efficiencyPct)
    {
        if (totalMinutes.length == 0) return null;
        double duration = SeriesStatistics.mean(totalMinutes);

        double durationScore;
        if (duration >= SLEEP_TARGET_MIN_MINUTES && duration <= SLEEP_TARGET_MAX_MINUTES) {
            durationScore = 100.0;
        } else if (duration < SLEEP_TARGET_MIN_MINUTES) {
            durationScore = Math.max(0.0, duration / SLEEP_TARGET_MIN_MINUTES * 100.0);
        } else {
            durationScore = Math.max(0.0, 100.0 - (duration - SLEEP_TARGET_MAX_MINUTES) / 2.0);
        }

        if (efficiencyPct.length == 0) {
            return durationScore;
        }
        return (durationScore + SeriesStatistics.mean(efficiencyPct)) / 2.0;
    }

    /**
     * Glucose component: time in range (%) minus the coefficient of variation (%), the
     * penalty capped at 30, clamped to [0, 100].
     */
    public Double glucoseScore(double[] glucose)
    {
        if (glucose.length == 0) return null;

        double mean = SeriesStatistics.mean(glucose);
        double cv = glucose.length >= 2 && mean != 0.0
                ? SeriesStatistics.sampleStandardDeviation(glucose) / mean * 100.0
                : 0.0;

        double score = timeInRangePercent(glucose) - Math.min(cv, MAX_GLUCOSE_VARIABILITY_PENALTY);
        return Math.max(0.0, Math.min(100.0, score));
    }

    /**
     * Resting heart rate component from daily mean heart rates; the lowest day stands in
     * for the resting rate. 100 at or below 60 bpm, 60 at 80 bpm, then falling to 0 at 110.
     */
    public Double restingHeartRateScore(double[] dailyMeanHeartRate)
    {
        if (dailyMeanHeartRate.length == 0) return null;
        double rhr = Arrays.stream(dailyMeanHeartRate).min().getAsDouble();

        if (rhr <= 60) return 100.0;
        if (rhr <= 80) return 100.0 - (rhr - 60) * 2;
        return Math.max(0.0, 60.0 - (rhr - 80) * 2);
    }

    /**
     * Share of glucose samples within the healthy band, in percent.
     */
    public static double timeInRangePercent(double[] glucose)
    {
        if (glucose.length == 0) return 0.0;
        long inRange = Arrays.stream(glucose)
                .filter(v -> v >= Biomarkers.GLUCOSE_RANGE_LOW && v <= Biomarkers.GLUCOSE_RANGE_HIGH)
                .count();
        return inRange * 100.0 / glucose.length;
    }

    /**
     * Weighted average of the present components, each weighted {@value #COMPONENT_WEIGHT}
     * and renormalized. Score and components are rounded to one decimal.
     *
     * @param components component name to score; {@code null} scores are skipped
     * @return the composite, or an unavailable score when no component is present
     */
    public HealthScore combine(LocalDate date, Map<String, Double> components)
    {
        Map<String, Double> rounded = new LinkedHashMap<>();
        Map<String, Double> weights = new LinkedHashMap<>();
        double weighted = 0.0;
        double totalWeight = 0.0;

        for (Map.Entry<String, Double> entry : components.entrySet()) {
            if (entry.getValue() == null) continue;
            weighted += entry.getValue() * COMPONENT_WEIGHT;
            totalWeight += COMPONENT_WEIGHT;
            rounded.put(entry.getKey(), round1(entry.getValue()));
            weights.put(entry.getKey(), COMPONENT_WEIGHT);
        }

        if (totalWeight == 0.0) {
            return HealthScore.unavailable(date);
        }
        return new HealthScore(date, round1(weighted / totalWeight), rounded, weights);
    }

    private static double round1(double value)
    {
        return Math.round(value * 10.0) / 10.0;
    }
}
