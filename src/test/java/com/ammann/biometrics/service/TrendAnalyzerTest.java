package com.ammann.biometrics.service;

import com.ammann.biometrics.enumeration.TrendDirection;
import com.ammann.biometrics.model.Biomarkers;
import com.ammann.biometrics.model.ChangePoint;
import com.ammann.biometrics.model.MeasurementSeries;
import com.ammann.biometrics.model.TrendResult;
import com.ammann.biometrics.support.TestSeries;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link TrendAnalyzer}.
 *
 * <p>Checks the least-squares trend fit and its significance handling, change-point
 * detection on a stepped series and the merging of nearby change points.
 */
class TrendAnalyzerTest
{

    private final TrendAnalyzer analyzer = new TrendAnalyzer();

    @Test
    void perfectLinearSeriesIsSignificantIncrease()
    {
        MeasurementSeries series = TestSeries.daily(Biomarkers.GLUCOSE, 30, i -> 100.0 + i);

        TrendResult trend = analyzer.computeTrend(series, Biomarkers.GLUCOSE);

        assertThat(trend).isNotNull();
        assertThat(trend.slope()).isCloseTo(1.0, within(1e-9));
        assertThat(trend.slopePerDay()).isEqualTo(trend.slope());
        assertThat(trend.rSquared()).isCloseTo(1.0, within(1e-9));
        assertThat(trend.pValue()).isLessThan(0.001);
        assertThat(trend.isSignificant()).isTrue();
        assertThat(trend.direction()).isEqualTo(TrendDirection.INCREASING);
        assertThat(trend.percentChange()).isCloseTo(29.0, within(1e-6));
        assertThat(trend.startDate()).isEqualTo(TestSeries.START);
        assertThat(trend.endDate()).isEqualTo(TestSeries.START.plus(Duration.ofDays(29)));
    }

    @Test
    void noisyDeclineIsSignificantDecrease()
    {
        MeasurementSeries series = TestSeries.daily(Biomarkers.HRV_SDNN, 30,
                i -> 80.0 - 1.5 * i + TestSeries.noise(i, 2.0));

        TrendResult trend = analyzer.computeTrend(series, Biomarkers.HRV_SDNN);

        assertThat(trend.direction()).isEqualTo(TrendDirection.DECREASING);
        assertThat(trend.slope()).isCloseTo(-1.5, within(0.2));
    }

    @Test
    void slopeIsExpressedPerDayForSubDailySamples()
    {
        MeasurementSeries series = TestSeries.series(Biomarkers.HEART_RATE, 48, Duration.ofHours(1),
                i -> 60.0 + i / 24.0 * 3.0);

        TrendResult trend = analyzer.computeTrend(series, Biomarkers.HEART_RATE);

        assertThat(trend.slope()).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void constantSeriesIsStable()
    {
        TrendResult trend = analyzer.computeTrend(TestSeries.daily(Biomarkers.STEPS, 14, i -> 5000.0),
                Biomarkers.STEPS);

        assertThat(trend.direction()).isEqualTo(TrendDirection.STABLE);
        assertThat(trend.isSignificant()).isFalse();
        assertThat(trend.rSquared()).isZero();
        assertThat(trend.pValue()).isEqualTo(1.0);
    }

    @Test
    void tooFewSamplesYieldNoTrend()
    {
        MeasurementSeries series = TestSeries.of(Biomarkers.GLUCOSE, 1.0, 2.0, null, 3.0, 4.0, 5.0, 6.0, null);

        assertThat(analyzer.computeTrend(series, Biomarkers.GLUCOSE)).isNull();
    }

    @Test
    void rejectsSignificanceLevelOutsideUnitInterval()
    {
        assertThatThrownBy(() -> new TrendAnalyzer(0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TrendAnalyzer(1.0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void offCenterStepIsFoundWithDefaults()
    {
        MeasurementSeries series = TestSeries.daily(Biomarkers.GLUCOSE, 60,
                i -> (i < 45 ? 100.0 : 130.0) + TestSeries.noise(i, 5.0));

        List<ChangePoint> changePoints = analyzer.detectChangePoints(series);

        assertThat(changePoints).hasSize(1);
        ChangePoint cp = changePoints.get(0);
        assertThat(cp.timestamp()).isEqualTo(TestSeries.START.plus(Duration.ofDays(45)));
        assertThat(cp.afterMean()).isCloseTo(130.0, within(5.0));
        assertThat(cp.confidence()).isGreaterThan(TrendAnalyzer.MIN_CHANGE_POINT_CONFIDENCE);
    }

    @Test
    void centeredStepStaysBelowDefaultThreshold()
    {
        // a step in the middle makes the global std at least half the step, so 2 std exceed it
        MeasurementSeries series = TestSeries.daily(Biomarkers.GLUCOSE, 60,
                i -> (i < 30 ? 100.0 : 130.0) + TestSeries.noise(i, 5.0));

        assertThat(analyzer.detectChangePoints(series)).isEmpty();
    }

    @Test
    void centeredStepIsFoundWithLoweredThreshold()
    {
        MeasurementSeries series = TestSeries.daily(Biomarkers.GLUCOSE, 60,
                i -> (i < 30 ? 100.0 : 130.0) + TestSeries.noise(i, 5.0));

        // 1.5 std instead of the default 2.0
        List<ChangePoint> changePoints = analyzer.detectChangePoints(series, 7, 1.5);

        assertThat(changePoints).hasSize(1);
        ChangePoint cp = changePoints.get(0);
        assertThat(cp.timestamp()).isEqualTo(TestSeries.START.plus(Duration.ofDays(30)));
        assertThat(cp.beforeMean()).isCloseTo(100.0, within(5.0));
        assertThat(cp.afterMean()).isCloseTo(130.0, within(5.0));
        assertThat(cp.changeMagnitude()).isPositive();
        assertThat(cp.confidence()).isGreaterThan(TrendAnalyzer.MIN_CHANGE_POINT_CONFIDENCE);
    }

    @Test
    void stationarySeriesHasNoChangePoints()
    {
        MeasurementSeries series = TestSeries.daily(Biomarkers.GLUCOSE, 60, i -> 100.0 + TestSeries.noise(i, 5.0));

        assertThat(analyzer.detectChangePoints(series)).isEmpty();
    }

    @Test
    void shortSeriesHasNoChangePoints()
    {
        MeasurementSeries series = TestSeries.daily(Biomarkers.GLUCOSE, 13, i -> i < 6 ? 100.0 : 200.0);

        assertThat(analyzer.detectChangePoints(series)).isEmpty();
    }

    @Test
    void rejectsInvalidChangePointSettings()
    {
        MeasurementSeries series = TestSeries.daily(Biomarkers.GLUCOSE, 30, i -> 100.0);

        assertThatThrownBy(() -> analyzer.detectChangePoints(series, 1, 2.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> analyzer.detectChangePoints(series, 7, -1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nearbyChangePointsKeepHigherConfidence()
    {
        ChangePoint first = changePoint(TestSeries.START, 0.96);
        ChangePoint second = changePoint(TestSeries.START.plus(Duration.ofDays(1)), 0.99);

        List<ChangePoint> merged = analyzer.mergeNearbyChangePoints(List.of(second, first), 3);

        assertThat(merged).containsExactly(second);
    }

    @Test
    void gapIsCountedInWholeDays()
    {
        ChangePoint first = changePoint(TestSeries.START, 0.99);
        ChangePoint almostFourDays = changePoint(TestSeries.START.plus(Duration.ofHours(95)), 0.97);
        ChangePoint farAway = changePoint(TestSeries.START.plus(Duration.ofDays(10)), 0.96);

        List<ChangePoint> merged = analyzer.mergeNearbyChangePoints(List.of(first, almostFourDays, farAway), 3);

        assertThat(merged).containsExactly(first, farAway);
    }

    @Test
    void equalConfidenceKeepsEarlierPoint()
    {
        ChangePoint first = changePoint(TestSeries.START, 0.99);
        ChangePoint second = changePoint(TestSeries.START.plus(Duration.ofDays(2)), 0.99);

        assertThat(analyzer.mergeNearbyChangePoints(List.of(first, second), 3)).containsExactly(first);
        assertThat(analyzer.mergeNearbyChangePoints(List.of(), 3)).isEmpty();
    }

    private static ChangePoint changePoint(Instant at, double confidence)
    {
        return new ChangePoint(at, 100.0, 120.0, 20.0, 20.0, confidence);
    }
}
