/* (C)2026 */
package com.ammann.biometrics.model;

import java.util.List;

/**
 * Canonical biomarker names shared by the time-series source, the detectors and the REST API.
 */
public final class Biomarkers {

    private Biomarkers() {}

    public static final String HEART_RATE = "heart_rate";
    public static final String HRV_SDNN = "hrv_sdnn";
    public static final String HRV_RMSSD = "hrv_rmssd";
    public static final String GLUCOSE = "glucose";
    public static final String BLOOD_PRESSURE_SYSTOLIC = "blood_pressure_systolic";
    public static final String STEPS = "steps";

    /** Total sleep of one night, in minutes. One sample per night at session start. */
    public static final String SLEEP_TOTAL = "sleep_total";

    /** Deep sleep of one night, in minutes. */
    public static final String SLEEP_DEEP = "sleep_deep";

    /** Sleep efficiency of one night, in percent. */
    public static final String SLEEP_EFFICIENCY = "sleep_efficiency";

    public static final List<String> ALL =
            List.of(
                    HEART_RATE,
                    HRV_SDNN,
                    HRV_RMSSD,
                    GLUCOSE,
                    BLOOD_PRESSURE_SYSTOLIC,
                    STEPS,
                    SLEEP_TOTAL,
                    SLEEP_DEEP,
                    SLEEP_EFFICIENCY);

    /** Lower bound of the healthy glucose band in mg/dL (inclusive). */
    public static final double GLUCOSE_RANGE_LOW = 70.0;

    /** Upper bound of the healthy glucose band in mg/dL (inclusive). */
    public static final double GLUCOSE_RANGE_HIGH = 180.0;

    public static boolean isKnown(String biomarker) {
        return ALL.contains(biomarker);
    }
}
