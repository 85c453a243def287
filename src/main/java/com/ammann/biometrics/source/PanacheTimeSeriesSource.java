/* (C)2026 */
package com.ammann.biometrics.source;

import com.ammann.biometrics.enumeration.Resample;
import com.ammann.biometrics.exception.TimeSeriesSourceException;
import com.ammann.biometrics.model.BiomarkerReading;
import com.ammann.biometrics.model.Measurement;
import com.ammann.biometrics.model.MeasurementSeries;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/**
 * {@link TimeSeriesSource} backed by the {@code biomarker_readings} table.
 *
 * <p>Readings that share a timestamp are averaged so the returned series is strictly
 * increasing. Each call runs in its own request context, so concurrent analysis phases
 * never share a persistence session.
 */
@ApplicationScoped
public class PanacheTimeSeriesSource implements TimeSeriesSource {

    private static final Logger LOG = Logger.getLogger(PanacheTimeSeriesSource.class);

    @Override
    @ActivateRequestContext
    public MeasurementSeries load(
            String userId, String biomarker, Instant start, Instant end, Resample resample) {
        List<BiomarkerReading> readings;
        try {
            readings = BiomarkerReading.findSeries(userId, biomarker, start, end);
        } catch (RuntimeException e) {
            throw new TimeSeriesSourceException(userId, biomarker, e);
        }

        MeasurementSeries raw = new MeasurementSeries(biomarker, collapseDuplicates(readings));
        LOG.debugf("Loaded %d readings of %s for user %s in [%s, %s]",
                readings.size(), biomarker, userId, start, end);

        return Resampler.resample(raw, start, end, resample);
    }

    @Override
    @ActivateRequestContext
    public List<String> findActiveUsers(Instant since) {
        try {
            return BiomarkerReading.findActiveUserIds(since);
        } catch (RuntimeException e) {
            throw new TimeSeriesSourceException("*", "active users", e);
        }
    }

    static List<Measurement> collapseDuplicates(List<BiomarkerReading> readings) {
        Map<Instant, double[]> byTimestamp = new TreeMap<>();
        for (BiomarkerReading reading : readings) {
            // [sum, presentCount]
            double[] acc = byTimestamp.computeIfAbsent(reading.timestamp, t -> new double[2]);
            if (reading.value != null && !reading.value.isNaN()) {
                acc[0] += reading.value;
                acc[1]++;
            }
        }

        List<Measurement> measurements = new ArrayList<>(byTimestamp.size());
        byTimestamp.forEach((ts, acc) -> measurements.add(acc[1] > 0
                ? Measurement.of(ts, acc[0] / acc[1])
                : Measurement.missing(ts)));
        return measurements;
    }
}
