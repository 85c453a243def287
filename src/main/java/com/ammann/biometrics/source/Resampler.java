/* (C)2026 */
package com.ammann.biometrics.source;

import com.ammann.biometrics.enumeration.Resample;
import com.ammann.biometrics.model.Measurement;
import com.ammann.biometrics.model.MeasurementSeries;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Buckets a raw series onto a continuous UTC grid.
 *
 * <p>The grid runs from the bucket containing {@code start} to the bucket containing
 * {@code end}. Each bucket is stamped with its start and holds the mean of the present
 * values that fall into it; a bucket without values becomes an explicit missing measurement.
 */
public final class Resampler {

    private Resampler() {}

    public static MeasurementSeries resample(
            MeasurementSeries raw, Instant start, Instant end, Resample resample) {
        ChronoUnit unit = resample.getBucketUnit();
        if (unit == null) {
            return raw;
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end " + end + " is before start " + start);
        }

        Instant first = start.truncatedTo(unit);
        int buckets = (int) unit.between(first, end.truncatedTo(unit)) + 1;
        double[] sums = new double[buckets];
        int[] counts = new int[buckets];

        for (Measurement m : raw.measurements()) {
            if (!m.isPresent()) continue;
            long index = unit.between(first, m.timestamp().truncatedTo(unit));
            if (index < 0 || index >= buckets) continue;
            sums[(int) index] += m.value();
            counts[(int) index]++;
        }

        List<Measurement> grid = new ArrayList<>(buckets);
        for (int i = 0; i < buckets; i++) {
            Instant bucketStart = first.plus(i, unit);
            grid.add(counts[i] > 0
                    ? Measurement.of(bucketStart, sums[i] / counts[i])
                    : Measurement.missing(bucketStart));
        }
        return new MeasurementSeries(raw.biomarker(), grid);
    }
}
