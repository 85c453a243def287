/* (C)2026 */
package com.ammann.biometrics.model;

/**
 * Closed interval of expected values. An unbounded side is {@code 0} (low) or
 * {@link Double#POSITIVE_INFINITY} (high).
 */
public record ValueRange(double low, double high) {

    public boolean contains(double value) {
        return value >= low && value <= high;
    }

    public boolean isBelow(double value) {
        return value < low;
    }
}
