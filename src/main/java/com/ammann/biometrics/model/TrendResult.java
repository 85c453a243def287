/* (C)2026 */
package com.ammann.biometrics.model;

import com.ammann.biometrics.enumeration.TrendDirection;
import java.time.Instant;

/**
 * Linear trend fitted to one biomarker series.
 *
 * @param biomarker     biomarker name
 * @param startDate     first present sample
 * @param endDate       last present sample
 * @param slope         fitted slope, value units per day
 * @param slopePerDay   same as {@code slope}; kept as a separate field for API consumers
 * @param rSquared      coefficient of determination
 * @param pValue        two-sided p-value of the slope
 * @param direction     increasing, decreasing or stable
 * @param isSignificant whether {@code pValue} is below the significance level
 * @param percentChange fitted change over the window relative to the intercept
 */
public record TrendResult(
        String biomarker,
        Instant startDate,
        Instant endDate,
        double slope,
        double slopePerDay,
        double rSquared,
        double pValue,
        TrendDirection direction,
        boolean isSignificant,
        double percentChange) {}
