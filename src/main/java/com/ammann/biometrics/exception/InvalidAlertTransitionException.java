package com.ammann.biometrics.exception;

import com.ammann.biometrics.enumeration.AlertStatus;

/**
 * Raised by the REST layer when an alert rejects a lifecycle transition.
 *
 * <p>Mapped to HTTP 409 (Conflict) by {@link GlobalExceptionHandler}. The alert manager
 * itself never throws for rejected transitions.
 */
public class InvalidAlertTransitionException extends ApiException {

    public InvalidAlertTransitionException(String alertId, AlertStatus current, AlertStatus target) {
        super(String.format("Alert %s cannot move from %s to %s",
                alertId, current.getWireName(), target.getWireName()));
    }
}
