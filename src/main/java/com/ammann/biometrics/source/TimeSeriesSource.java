/* (C)2026 */
package com.ammann.biometrics.source;

import com.ammann.biometrics.enumeration.Resample;
import com.ammann.biometrics.exception.TimeSeriesSourceException;
import com.ammann.biometrics.model.MeasurementSeries;
import java.time.Instant;
import java.util.List;

/**
 * Read-only access to per-user biomarker time series.
 *
 * <p>Implementations return strictly increasing timestamps inside {@code [start, end]} and
 * represent gaps explicitly as missing measurements. Every failure surfaces as a
 * {@link TimeSeriesSourceException} so callers can contain it per biomarker.
 */
public interface TimeSeriesSource {

    /**
     * Loads one biomarker series.
     *
     * @param userId    user to load for
     * @param biomarker canonical biomarker name
     * @param start     window start, inclusive
     * @param end       window end, inclusive
     * @param resample  target cadence, {@link Resample#NONE} for raw samples
     * @return the series, empty when no data exists
     * @throws TimeSeriesSourceException if the backing store cannot be read
     */
    MeasurementSeries load(String userId, String biomarker, Instant start, Instant end, Resample resample);

    /**
     * Users with at least one sample at or after {@code since}.
     *
     * @throws TimeSeriesSourceException if the backing store cannot be read
     */
    List<String> findActiveUsers(Instant since);
}
