package com.ammann.biometrics.service;

import com.ammann.biometrics.enumeration.AlertPriority;
import com.ammann.biometrics.enumeration.AnomalyType;
import com.ammann.biometrics.model.Anomaly;
import com.ammann.biometrics.model.Biomarkers;
import com.ammann.biometrics.model.ClinicalThresholdTable;
import com.ammann.biometrics.model.MeasurementSeries;
import com.ammann.biometrics.support.TestSeries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link AnomalyDetector}.
 *
 * <p>Covers the three detection strategies (clinical thresholds, rolling z-score
 * outliers and level shifts) and the behavior on thin or degenerate input.
 */
class AnomalyDetectorTest
{

    private final AnomalyDetector detector = new AnomalyDetector(ClinicalThresholdTable.defaults());

    @ParameterizedTest
    @ValueSource(doubles = {10.0, 40.0, 53.9})
    void glucoseBelowCriticalLowIsCritical(double value)
    {
        MeasurementSeries series = TestSeries.of(Biomarkers.GLUCOSE, value);

        List<Anomaly> anomalies = detector.detect(series);

        assertThat(anomalies).hasSize(1);
        Anomaly anomaly = anomalies.get(0);
        assertThat(anomaly.priority()).isEqualTo(AlertPriority.CRITICAL);
        assertThat(anomaly.type()).isEqualTo(AnomalyType.POINT);
        assertThat(anomaly.clinicalContext()).isEqualTo(AnomalyDetector.CRITICAL_CONTEXT);
        assertThat(anomaly.expectedRange().low()).isEqualTo(54.0);
        assertThat(anomaly.expectedRange().high()).isEqualTo(250.0);
        assertThat(anomaly.deviationScore()).isCloseTo((54.0 - value) / 54.0, within(1e-9));
    }

    @Test
    void criticalDescriptionNamesBiomarkerAndValue()
    {
        List<Anomaly> anomalies = detector.detect(TestSeries.of(Biomarkers.GLUCOSE, 50.0, 300.0));

        assertThat(anomalies).extracting(Anomaly::description)
                .containsExactly("Critically low glucose: 50.0", "Critically high glucose: 300.0");
    }

    @Test
    void valueOutsideNormalBandButInsideCriticalBandIsHigh()
    {
        List<Anomaly> anomalies = detector.detect(TestSeries.of(Biomarkers.GLUCOSE, 200.0, 65.0));

        assertThat(anomalies).extracting(Anomaly::priority)
                .containsExactly(AlertPriority.HIGH, AlertPriority.HIGH);
        assertThat(anomalies).extracting(Anomaly::description)
                .containsExactly("High glucose: 200.0", "Low glucose: 65.0");
        assertThat(anomalies).allMatch(a -> a.clinicalContext() == null);
    }

    @Test
    void lowerOnlyThresholdsNeverFlagHighValues()
    {
        List<Anomaly> anomalies = detector.detect(TestSeries.of(Biomarkers.HRV_SDNN, 250.0, 25.0));

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).value()).isEqualTo(25.0);
        assertThat(anomalies.get(0).expectedRange().high()).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    void biomarkerWithoutThresholdsProducesNoClinicalAnomalies()
    {
        assertThat(detector.detect(TestSeries.of(Biomarkers.STEPS, 0.0, 100_000.0))).isEmpty();
    }

    @Test
    void missingSamplesAreIgnored()
    {
        List<Anomaly> anomalies = detector.detect(TestSeries.of(Biomarkers.GLUCOSE, null, 40.0, null));

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).timestamp()).isEqualTo(TestSeries.START.plus(Duration.ofDays(1)));
    }

    @Test
    void spikeWithinClinicalRangeIsStatisticalOutlier()
    {
        MeasurementSeries series = TestSeries.series(Biomarkers.HEART_RATE, 40, Duration.ofHours(1),
                i -> i == 35 ? 95.0 : 70.0 + TestSeries.noise(i, 1.0));

        List<Anomaly> anomalies = detector.detect(series);

        assertThat(anomalies).hasSize(1);
        Anomaly outlier = anomalies.get(0);
        assertThat(outlier.type()).isEqualTo(AnomalyType.POINT);
        assertThat(outlier.priority()).isEqualTo(AlertPriority.MEDIUM);
        assertThat(outlier.value()).isEqualTo(95.0);
        assertThat(outlier.timestamp()).isEqualTo(TestSeries.START.plus(Duration.ofHours(35)));
        assertThat(outlier.deviationScore()).isGreaterThan(AnomalyDetector.DEFAULT_Z_THRESHOLD);
        assertThat(outlier.description()).startsWith("Unusual heart_rate value: 95.0 (z-score: ");
    }

    @Test
    void seriesShorterThanWindowHasNoStatisticalOutliers()
    {
        MeasurementSeries series = TestSeries.series(Biomarkers.STEPS, 20, Duration.ofHours(1),
                i -> i == 15 ? 10_000.0 : 100.0);

        assertThat(detector.detectStatisticalOutliers(series, Biomarkers.STEPS)).isEmpty();
        assertThat(detector.detectLevelShifts(series, Biomarkers.STEPS)).isEmpty();
    }

    @Test
    void sustainedIncreaseIsLevelShift()
    {
        MeasurementSeries series = TestSeries.daily(Biomarkers.GLUCOSE, 60,
                i -> (i < 30 ? 100.0 : 130.0) + TestSeries.noise(i, 5.0));

        List<Anomaly> shifts = detector.detect(series).stream()
                .filter(a -> a.type() == AnomalyType.LEVEL_SHIFT)
                .toList();

        assertThat(shifts).hasSize(1);
        Anomaly shift = shifts.get(0);
        assertThat(shift.priority()).isEqualTo(AlertPriority.HIGH);
        assertThat(shift.timestamp()).isEqualTo(TestSeries.START.plus(Duration.ofDays(30)));
        assertThat(shift.value()).isCloseTo(130.0, within(3.0));
        assertThat(shift.deviationScore()).isCloseTo(30.0, within(5.0));
        assertThat(shift.description()).startsWith("glucose has increased by ");
        assertThat(shift.clinicalContext()).startsWith("Baseline mean: ");
    }

    @Test
    void shiftBelowMinimumPercentIsIgnored()
    {
        MeasurementSeries series = TestSeries.daily(Biomarkers.GLUCOSE, 60,
                i -> (i < 30 ? 100.0 : 110.0) + TestSeries.noise(i, 1.0));

        assertThat(detector.detectLevelShifts(series, Biomarkers.GLUCOSE)).isEmpty();
    }

    @Test
    void constantBaselineSkipsLevelShiftDetection()
    {
        MeasurementSeries series = TestSeries.daily(Biomarkers.STEPS, 60, i -> i < 30 ? 1000.0 : 5000.0);

        assertThat(detector.detectLevelShifts(series, Biomarkers.STEPS)).isEmpty();
    }

    @Test
    void emptySeriesYieldsNothing()
    {
        assertThat(detector.detect(MeasurementSeries.empty(Biomarkers.GLUCOSE))).isEmpty();
    }

    @Test
    void rejectsInvalidConfiguration()
    {
        ClinicalThresholdTable table = ClinicalThresholdTable.defaults();

        assertThatThrownBy(() -> new AnomalyDetector(table, 1, 3.0, 1.5, 15.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowSize");
        assertThatThrownBy(() -> new AnomalyDetector(table, 30, 0.0, 1.5, 15.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("zThreshold");
        assertThatThrownBy(() -> new AnomalyDetector(table, 30, 3.0, -1.0, 15.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AnomalyDetector(table, 30, 3.0, 1.5, -0.1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AnomalyDetector(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
