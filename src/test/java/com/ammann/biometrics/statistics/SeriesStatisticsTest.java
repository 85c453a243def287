package com.ammann.biometrics.statistics;

import com.ammann.biometrics.statistics.SeriesStatistics.PearsonResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link SeriesStatistics}, focused on the degenerate inputs the detectors
 * rely on being handled without exceptions.
 */
class SeriesStatisticsTest
{

    @Test
    void standardDeviationsUseTheirDenominators()
    {
        double[] values = {2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0};

        assertThat(SeriesStatistics.populationStandardDeviation(values)).isCloseTo(2.0, within(1e-12));
        assertThat(SeriesStatistics.sampleStandardDeviation(values)).isCloseTo(Math.sqrt(32.0 / 7.0), within(1e-12));
        assertThat(SeriesStatistics.sampleStandardDeviation(new double[] {3.0})).isZero();
    }

    @Test
    void tTestOnConstantSamples()
    {
        assertThat(SeriesStatistics.twoSampleTTestPValue(new double[] {5, 5, 5}, new double[] {5, 5})).isNaN();
        assertThat(SeriesStatistics.twoSampleTTestPValue(new double[] {5, 5, 5}, new double[] {8, 8})).isZero();
    }

    @Test
    void tTestSeparatesDistinctSamples()
    {
        double[] a = {10, 11, 9, 10, 10, 11, 9};
        double[] b = {20, 21, 19, 20, 20, 21, 19};

        assertThat(SeriesStatistics.twoSampleTTestPValue(a, b)).isLessThan(1e-6);
        assertThat(SeriesStatistics.twoSampleTTestPValue(a, a.clone())).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void tTestNeedsTwoValuesPerSample()
    {
        assertThatThrownBy(() -> SeriesStatistics.twoSampleTTestPValue(new double[] {1}, new double[] {1, 2}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void perfectNegativeCorrelationIsHighlySignificant()
    {
        PearsonResult result = SeriesStatistics.pearson(new double[] {1, 2, 3, 4}, new double[] {8, 6, 4, 2});

        assertThat(result.r()).isCloseTo(-1.0, within(1e-12));
        assertThat(result.pValue()).isLessThan(1e-6);
        assertThat(result.n()).isEqualTo(4);
    }

    @Test
    void pearsonIsUndefinedForShortOrConstantInput()
    {
        assertThat(SeriesStatistics.pearson(new double[] {1, 2}, new double[] {3, 4})).isNull();
        assertThat(SeriesStatistics.pearson(new double[] {1, 2, 3}, new double[] {4, 4, 4})).isNull();
        assertThatThrownBy(() -> SeriesStatistics.pearson(new double[] {1, 2, 3}, new double[] {1, 2}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
