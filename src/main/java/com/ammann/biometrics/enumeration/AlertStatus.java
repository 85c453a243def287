/* (C)2026 */
package com.ammann.biometrics.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of an alert.
 * <p>
 * Allowed transitions are ACTIVE to ACKNOWLEDGED, RESOLVED or DISMISSED, and
 * ACKNOWLEDGED to RESOLVED or DISMISSED. RESOLVED and DISMISSED are terminal.
 */
public enum AlertStatus {
    /** Raised and not yet seen by the user */
    ACTIVE("active"),
    /** Seen by the user, still open */
    ACKNOWLEDGED("acknowledged"),
    /** Closed because the underlying condition went away */
    RESOLVED("resolved"),
    /** Closed because the user chose to ignore it */
    DISMISSED("dismissed");

    private final String wireName;

    AlertStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the states reachable from this one in a single transition.
     *
     * @return the allowed target states, empty for terminal states
     */
    public Set<AlertStatus> allowedTargets() {
        return switch (this) {
            case ACTIVE -> EnumSet.of(ACKNOWLEDGED, RESOLVED, DISMISSED);
            case ACKNOWLEDGED -> EnumSet.of(RESOLVED, DISMISSED);
            case RESOLVED, DISMISSED -> EnumSet.noneOf(AlertStatus.class);
        };
    }

    public boolean canTransitionTo(AlertStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }

    /**
     * Resolves a status from its wire name or constant name, ignoring case.
     *
     * @throws IllegalArgumentException if no status matches
     */
    public static AlertStatus fromValue(String value) {
        for (AlertStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown alert status: " + value);
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
