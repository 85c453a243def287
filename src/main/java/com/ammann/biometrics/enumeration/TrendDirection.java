/* (C)2026 */
package com.ammann.biometrics.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a fitted linear trend. A trend is STABLE unless its slope is significant.
 */
public enum TrendDirection
{
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    private final String wireName;

    TrendDirection(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Classifies a slope, taking significance into account.
     *
     * @param slope       fitted slope
     * @param significant whether the slope p-value passed the significance level
     * @return INCREASING or DECREASING for a significant non-zero slope, STABLE otherwise
     */
    public static TrendDirection of(double slope, boolean significant) {
        if (!significant || slope == 0.0) return STABLE;
        return slope > 0 ? INCREASING : DECREASING;
    }

    @JsonValue
    public String getWireName() { return wireName; }
}
