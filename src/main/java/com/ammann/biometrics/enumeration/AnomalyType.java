/* (C)2026 */
package com.ammann.biometrics.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of deviation an {@link com.ammann.biometrics.model.Anomaly} describes.
 */
public enum AnomalyType
{
    /** Single outlying sample. */
    POINT("point"),
    /** Sustained change of the baseline mean. */
    LEVEL_SHIFT("level_shift"),
    /** Gradual drift over time. */
    TREND("trend"),
    /** Unusual pattern, e.g. a missing night of sleep. */
    PATTERN("pattern");

    private final String wireName;

    AnomalyType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() { return wireName; }
}
