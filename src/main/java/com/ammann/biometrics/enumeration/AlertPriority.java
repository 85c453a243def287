/* (C)2026 */
package com.ammann.biometrics.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Urgency of an anomaly and of the alert raised from it.
 * <p>
 * Declared from most to least urgent, so {@link #compareTo} orders alerts by urgency.
 */
public enum AlertPriority
{
    /** Immediate attention needed. */
    CRITICAL("critical", "[CRITICAL]"),
    /** Review within 48 hours. */
    HIGH("high", "[HIGH]"),
    /** Review at the next visit. */
    MEDIUM("medium", "[MEDIUM]"),
    /** Monitor only. */
    LOW("low", "[LOW]");

    private final String wireName;
    private final String marker;

    AlertPriority(String wireName, String marker) {
        this.wireName = wireName;
        this.marker = marker;
    }

    /**
     * Resolves a priority from its wire name or constant name, ignoring case.
     *
     * @param value wire name such as {@code "high"}
     * @return the matching priority
     * @throws IllegalArgumentException if no priority matches
     */
    public static AlertPriority fromValue(String value) {
        for (AlertPriority priority : values()) {
            if (priority.wireName.equalsIgnoreCase(value) || priority.name().equalsIgnoreCase(value)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown alert priority: " + value);
    }

    @JsonValue
    public String getWireName() { return wireName; }

    /** Short marker prepended to alert titles. */
    public String getMarker() { return marker; }
}
