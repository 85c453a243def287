/* (C)2026 */
package com.ammann.biometrics.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Pearson correlation between two daily biomarker series at a given lag.
 *
 * @param biomarker1     first biomarker
 * @param biomarker2     second biomarker
 * @param correlation    Pearson r in [-1, 1]
 * @param pValue         two-sided p-value
 * @param lagDays        positive when {@code biomarker1} leads {@code biomarker2}
 * @param nObservations  number of complete day pairs
 * @param isSignificant  whether the result passed the applicable significance threshold
 * @param interpretation human-readable summary, may be {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CorrelationResult(
        String biomarker1,
        String biomarker2,
        double correlation,
        double pValue,
        int lagDays,
        int nObservations,
        boolean isSignificant,
        String interpretation) {

    /** Returns a copy with the significance flag replaced. */
    public CorrelationResult withSignificant(boolean significant) {
        return new CorrelationResult(
                biomarker1, biomarker2, correlation, pValue, lagDays, nObservations, significant, interpretation);
    }

    public double magnitude() {
        return Math.abs(correlation);
    }
}
