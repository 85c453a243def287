package com.ammann.biometrics.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MeasurementSeriesTest
{

    private static final Instant T0 = Instant.parse("2026-03-09T00:00:00Z");

    @Test
    void rejectsNonIncreasingTimestamps()
    {
        List<Measurement> duplicated = List.of(Measurement.of(T0, 1.0), Measurement.of(T0, 2.0));

        assertThatThrownBy(() -> new MeasurementSeries("glucose", duplicated))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not strictly increasing at index 1");
    }

    @Test
    void presentViewsDropGaps()
    {
        MeasurementSeries series = new MeasurementSeries("glucose", List.of(
                Measurement.of(T0, 1.0),
                Measurement.missing(T0.plusSeconds(60)),
                new Measurement(T0.plusSeconds(120), Double.NaN),
                Measurement.of(T0.plusSeconds(180), 4.0)));

        assertThat(series.size()).isEqualTo(4);
        assertThat(series.presentCount()).isEqualTo(2);
        assertThat(series.presentValues()).containsExactly(1.0, 4.0);
        assertThat(series.values()).containsExactly(1.0, null, null, 4.0);
    }
}
