/* (C)2026 */
package com.ammann.biometrics.model;

import java.util.Map;
import java.util.Optional;

/**
 * Immutable biomarker-to-threshold lookup. Built once at startup and shared by reference
 * with every {@link com.ammann.biometrics.service.AnomalyDetector}.
 */
public final class ClinicalThresholdTable {

    private final Map<String, ClinicalThresholds> thresholds;

    public ClinicalThresholdTable(Map<String, ClinicalThresholds> thresholds) {
        this.thresholds = Map.copyOf(thresholds);
    }

    /**
     * Default table: glucose (mg/dL), resting heart rate (bpm), SDNN (ms) and systolic
     * blood pressure (mmHg).
     */
    public static ClinicalThresholdTable defaults() {
        return new ClinicalThresholdTable(
                Map.of(
                        Biomarkers.GLUCOSE, ClinicalThresholds.of(54, 70, 180, 250),
                        Biomarkers.HEART_RATE, ClinicalThresholds.of(40, 50, 100, 150),
                        Biomarkers.HRV_SDNN, ClinicalThresholds.lowerOnly(20, 30),
                        Biomarkers.BLOOD_PRESSURE_SYSTOLIC, ClinicalThresholds.of(90, 100, 140, 180)));
    }

    public Optional<ClinicalThresholds> forBiomarker(String biomarker) {
        return Optional.ofNullable(thresholds.get(biomarker));
    }

    public Map<String, ClinicalThresholds> asMap() {
        return thresholds;
    }
}
