/* (C)2026 */
package com.ammann.biometrics.dto;

import com.ammann.biometrics.enumeration.AlertPriority;
import com.ammann.biometrics.enumeration.AlertStatus;
import com.ammann.biometrics.model.Alert;
import com.ammann.biometrics.model.Anomaly;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Serializable snapshot of an {@link Alert}.
 *
 * <p>Alerts are mutable and owned by their manager; this record is what leaves the engine.
 */
@Schema(description = "User-facing alert raised from a detected anomaly")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AlertDTO(
        @Schema(description = "Alert id") String id,
        @Schema(description = "Owning user") String userId,
        @Schema(description = "Creation time") Instant createdAt,
        @Schema(description = "Lifecycle state") AlertStatus status,
        @Schema(description = "Urgency") AlertPriority priority,
        @Schema(description = "Short title with priority marker") String title,
        @Schema(description = "Multi-line message") String message,
        @Schema(description = "Advice, absent for medium and low priority") String recommendation,
        @Schema(description = "Anomaly the alert was raised from") Anomaly anomaly,
        @Schema(description = "Acknowledgement time") Instant acknowledgedAt,
        @Schema(description = "Resolution time") Instant resolvedAt,
        @Schema(description = "Dismissal time") Instant dismissedAt) {

    public static AlertDTO from(Alert alert) {
        return new AlertDTO(
                alert.getId(),
                alert.getUserId(),
                alert.getCreatedAt(),
                alert.getStatus(),
                alert.getAnomaly().priority(),
                alert.getTitle(),
                alert.getMessage(),
                alert.getRecommendation(),
                alert.getAnomaly(),
                alert.getAcknowledgedAt(),
                alert.getResolvedAt(),
                alert.getDismissedAt());
    }
}
