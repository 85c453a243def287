/* (C)2026 */
package com.ammann.biometrics.resource;

import com.ammann.biometrics.dto.AlertDTO;
import com.ammann.biometrics.dto.AlertStatusResponseDTO;
import com.ammann.biometrics.enumeration.AlertPriority;
import com.ammann.biometrics.enumeration.AlertStatus;
import com.ammann.biometrics.exception.InvalidAlertTransitionException;
import com.ammann.biometrics.exception.ValidationException;
import com.ammann.biometrics.model.Alert;
import com.ammann.biometrics.properties.ApiProperties;
import com.ammann.biometrics.service.AlertManagerRegistry;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * REST resource for listing a user's alerts and moving them through their lifecycle.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Alerts.BASE)
@Tag(name = "Alerts API", description = "Alert listing and lifecycle transitions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AlertResource {

    private static final Logger LOG = Logger.getLogger(AlertResource.class);

    @Inject
    AlertManagerRegistry alertManagers;

    @GET
    @Operation(
            summary = "List alerts",
            description = "Alerts of the user filtered by status (default: active) and optionally by priority"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Matching alerts, oldest first"),
            @APIResponse(responseCode = "400", description = "Unknown status or priority")
    })
    public Response getAlerts(
            @PathParam("userId") String userId,
            @Parameter(description = "active, acknowledged, resolved or dismissed")
            @QueryParam("status") @DefaultValue("active") String status,
            @Parameter(description = "critical, high, medium or low")
            @QueryParam("priority") String priority) {

        AlertStatus statusFilter = parseStatus(status);
        AlertPriority priorityFilter = parsePriority(priority);

        List<AlertDTO> alerts = alertManagers.ifPresent(userId, manager -> manager.getAlerts().stream()
                        .filter(a -> a.getStatus() == statusFilter)
                        .filter(a -> priorityFilter == null || a.getAnomaly().priority() == priorityFilter)
                        .map(AlertDTO::from)
                        .toList())
                .orElse(List.of());

        return Response.ok(alerts).build();
    }

    @POST
    @Path(ApiProperties.Alerts.ACKNOWLEDGE)
    @Operation(summary = "Acknowledge alert", description = "Moves an active alert to acknowledged")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Alert acknowledged",
                    content = @Content(schema = @Schema(implementation = AlertStatusResponseDTO.class))),
            @APIResponse(responseCode = "404", description = "Unknown alert"),
            @APIResponse(responseCode = "409", description = "Transition not allowed from the current state")
    })
    public Response acknowledge(@PathParam("userId") String userId, @PathParam("alertId") String alertId) {
        return transition(userId, alertId, AlertStatus.ACKNOWLEDGED);
    }

    @POST
    @Path(ApiProperties.Alerts.RESOLVE)
    @Operation(summary = "Resolve alert", description = "Closes an active or acknowledged alert as resolved")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Alert resolved",
                    content = @Content(schema = @Schema(implementation = AlertStatusResponseDTO.class))),
            @APIResponse(responseCode = "404", description = "Unknown alert"),
            @APIResponse(responseCode = "409", description = "Transition not allowed from the current state")
    })
    public Response resolve(@PathParam("userId") String userId, @PathParam("alertId") String alertId) {
        return transition(userId, alertId, AlertStatus.RESOLVED);
    }

    @POST
    @Path(ApiProperties.Alerts.DISMISS)
    @Operation(summary = "Dismiss alert", description = "Closes an active or acknowledged alert as dismissed")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Alert dismissed",
                    content = @Content(schema = @Schema(implementation = AlertStatusResponseDTO.class))),
            @APIResponse(responseCode = "404", description = "Unknown alert"),
            @APIResponse(responseCode = "409", description = "Transition not allowed from the current state")
    })
    public Response dismiss(@PathParam("userId") String userId, @PathParam("alertId") String alertId) {
        return transition(userId, alertId, AlertStatus.DISMISSED);
    }

    private Response transition(String userId, String alertId, AlertStatus target) {
        AlertStatusResponseDTO result = alertManagers.ifPresent(userId, manager -> {
            Alert alert = manager.findAlert(alertId)
                    .orElseThrow(() -> new NotFoundException("Alert not found: " + alertId));

            AlertStatus current = alert.getStatus();
            boolean changed = switch (target) {
                case ACKNOWLEDGED -> manager.acknowledgeAlert(alertId);
                case RESOLVED -> manager.resolveAlert(alertId);
                case DISMISSED -> manager.dismissAlert(alertId);
                case ACTIVE -> false;
            };
            if (!changed) {
                throw new InvalidAlertTransitionException(alertId, current, target);
            }
            return new AlertStatusResponseDTO(alertId, alert.getStatus());
        }).orElseThrow(() -> new NotFoundException("Alert not found: " + alertId));

        LOG.infof("Alert %s of user %s is now %s", alertId, userId, result.status().getWireName());
        return Response.ok(result).build();
    }

    private static AlertStatus parseStatus(String status) {
        try {
            return AlertStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidParameter("status", status, "active, acknowledged, resolved or dismissed");
        }
    }

    private static AlertPriority parsePriority(String priority) {
        if (priority == null || priority.isBlank()) {
            return null;
        }
        try {
            return AlertPriority.fromValue(priority);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidParameter("priority", priority, "critical, high, medium or low");
        }
    }
}
