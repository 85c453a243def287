/* (C)2026 */
package com.ammann.biometrics.model;

import java.time.Instant;

/**
 * Timestamp at which the local mean of a series shifts significantly.
 *
 * @param timestamp       first sample after the shift
 * @param beforeMean      mean of the segment before
 * @param afterMean       mean of the segment after
 * @param changeMagnitude {@code afterMean - beforeMean}
 * @param changePercent   change relative to {@code |beforeMean|}, 0 when that is 0
 * @param confidence      {@code 1 - p} of the two-sample t-test
 */
public record ChangePoint(
        Instant timestamp,
        double beforeMean,
        double afterMean,
        double changeMagnitude,
        double changePercent,
        double confidence) {}
