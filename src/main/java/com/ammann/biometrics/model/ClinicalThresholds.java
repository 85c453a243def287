/* (C)2026 */
package com.ammann.biometrics.model;

/**
 * Static cutoffs for one biomarker. Any bound may be {@code null} when the biomarker has
 * no clinically meaningful limit on that side.
 *
 * @param criticalLow  below this a sample is a CRITICAL anomaly
 * @param low          below this a sample is a HIGH anomaly
 * @param high         above this a sample is a HIGH anomaly
 * @param criticalHigh above this a sample is a CRITICAL anomaly
 */
public record ClinicalThresholds(Double criticalLow, Double low, Double high, Double criticalHigh) {

    public ClinicalThresholds {
        requireOrdered(criticalLow, low, "criticalLow", "low");
        requireOrdered(low, high, "low", "high");
        requireOrdered(high, criticalHigh, "high", "criticalHigh");
        requireOrdered(criticalLow, criticalHigh, "criticalLow", "criticalHigh");
    }

    public static ClinicalThresholds of(double criticalLow, double low, double high, double criticalHigh) {
        return new ClinicalThresholds(criticalLow, low, high, criticalHigh);
    }

    public static ClinicalThresholds lowerOnly(double criticalLow, double low) {
        return new ClinicalThresholds(criticalLow, low, null, null);
    }

    private static void requireOrdered(Double lower, Double upper, String lowerName, String upperName) {
        if (lower != null && upper != null && lower > upper) {
            throw new IllegalArgumentException(
                    String.format("%s (%s) must not exceed %s (%s)", lowerName, lower, upperName, upper));
        }
    }
}
