/* (C)2026 */
package com.ammann.biometrics.model;

import com.ammann.biometrics.enumeration.AlertPriority;
import com.ammann.biometrics.enumeration.AnomalyType;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Objects;

/**
 * Deviation detected in one biomarker at one point in time. Not yet surfaced to the user;
 * {@link com.ammann.biometrics.service.AlertManager} turns it into an alert.
 *
 * @param timestamp       when the deviation was observed (window start for level shifts)
 * @param biomarker       biomarker name
 * @param type            kind of deviation
 * @param priority        urgency
 * @param value           observed value (window mean for level shifts)
 * @param expectedRange   range the value was expected to lie in
 * @param deviationScore  non-negative magnitude; meaning depends on the detector
 * @param description     one-line human-readable description
 * @param clinicalContext optional extra context, may be {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Anomaly(
        Instant timestamp,
        String biomarker,
        AnomalyType type,
        AlertPriority priority,
        double value,
        ValueRange expectedRange,
        double deviationScore,
        String description,
        String clinicalContext) {

    public Anomaly {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(biomarker, "biomarker");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(expectedRange, "expectedRange");
        if (deviationScore < 0) {
            throw new IllegalArgumentException("deviationScore must be non-negative: " + deviationScore);
        }
    }
}
