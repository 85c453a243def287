/* (C)2026 */
package com.ammann.biometrics.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Closed time interval analysed by one phase of the daily run.
 */
public record AnalysisWindow(Instant start, Instant end) {

    public AnalysisWindow {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Window end " + end + " is before start " + start);
        }
    }

    public Duration duration() {
        return Duration.between(start, end);
    }
}
