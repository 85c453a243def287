/* (C)2026 */
package com.ammann.biometrics.model;

import com.ammann.biometrics.dto.AlertDTO;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Result of one user's daily analysis. Possibly partial: every sub-analysis that failed is
 * named in {@code failures} and contributes nothing to the other fields.
 *
 * @param userId       analysed user
 * @param date         analysed day (UTC)
 * @param windows      windows used per phase ({@code day}, {@code week}, {@code month})
 * @param alerts       alerts newly raised for the day
 * @param trends       significant weekly trends
 * @param correlations strongest significant monthly correlations
 * @param dailySummary descriptive statistics of the day
 * @param healthScore  composite score over the trailing week
 * @param failures     names of the sub-analyses that failed
 */
public record DailyAnalysisReport(
        String userId,
        LocalDate date,
        Map<String, AnalysisWindow> windows,
        List<AlertDTO> alerts,
        List<TrendResult> trends,
        List<CorrelationResult> correlations,
        DailySummary dailySummary,
        HealthScore healthScore,
        List<String> failures) {

    public DailyAnalysisReport {
        windows = Map.copyOf(windows);
        alerts = List.copyOf(alerts);
        trends = List.copyOf(trends);
        correlations = List.copyOf(correlations);
        failures = List.copyOf(failures);
    }

    public boolean isPartial() {
        return !failures.isEmpty();
    }
}
