/* (C)2026 */
package com.ammann.biometrics.dto;

import com.ammann.biometrics.enumeration.AlertStatus;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Alert state after a lifecycle transition")
public record AlertStatusResponseDTO(
        @Schema(description = "Alert id") String alertId,
        @Schema(description = "New status") AlertStatus status) {}
