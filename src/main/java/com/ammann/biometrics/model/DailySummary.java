/* (C)2026 */
package com.ammann.biometrics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * Descriptive statistics for one analysed day.
 *
 * @param biomarkers            per-biomarker statistics over the day window
 * @param glucoseTimeInRangePct share of glucose samples in [70, 180] mg/dL, {@code null} without glucose data
 * @param sleep                 latest night of sleep, {@code null} without sleep data
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DailySummary(
        Map<String, BiomarkerSummary> biomarkers, Double glucoseTimeInRangePct, SleepSummary sleep) {

    public DailySummary {
        biomarkers = Map.copyOf(biomarkers);
    }

    public static DailySummary empty() {
        return new DailySummary(Map.of(), null, null);
    }

    /** Mean, extremes and sample count of one biomarker. */
    public record BiomarkerSummary(double mean, double min, double max, long count) {}

    /**
     * One night of sleep.
     *
     * @param totalMinutes  total sleep in minutes
     * @param deepMinutes   deep sleep in minutes, {@code null} if not reported
     * @param efficiencyPct sleep efficiency in percent, {@code null} if not reported
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SleepSummary(Double totalMinutes, Double deepMinutes, Double efficiencyPct) {}
}
