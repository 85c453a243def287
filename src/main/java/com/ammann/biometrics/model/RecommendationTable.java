/* (C)2026 */
package com.ammann.biometrics.model;

import com.ammann.biometrics.enumeration.AlertPriority;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Static advice shown with an alert, keyed by biomarker, priority and the side of the
 * expected range the value fell on. Falls back to generic text for CRITICAL and HIGH
 * priorities; MEDIUM and LOW get no recommendation.
 */
public final class RecommendationTable {

    static final String GENERIC_CRITICAL =
            "This requires immediate attention. Consider contacting your healthcare provider.";
    static final String GENERIC_HIGH =
            "Monitor closely and discuss with your healthcare provider at your next visit.";

    /** Side of the expected range an anomalous value lies on. */
    public enum Side {
        LOW,
        HIGH
    }

    /** Lookup key. */
    public record Key(String biomarker, AlertPriority priority, Side side) {
        public Key {
            Objects.requireNonNull(biomarker, "biomarker");
            Objects.requireNonNull(priority, "priority");
            Objects.requireNonNull(side, "side");
        }
    }

    private final Map<Key, String> entries;

    public RecommendationTable(Map<Key, String> entries) {
        this.entries = Map.copyOf(entries);
    }

    public static RecommendationTable defaults() {
        return new RecommendationTable(
                Map.of(
                        new Key(Biomarkers.GLUCOSE, AlertPriority.CRITICAL, Side.LOW),
                        "Check your blood sugar immediately. If below 70 mg/dL, consume 15g fast-acting carbs.",
                        new Key(Biomarkers.GLUCOSE, AlertPriority.CRITICAL, Side.HIGH),
                        "High blood sugar detected. Check for ketones if over 250 mg/dL. Contact your healthcare provider.",
                        new Key(Biomarkers.HEART_RATE, AlertPriority.CRITICAL, Side.LOW),
                        "Very low heart rate detected at rest. If you feel dizzy or faint, seek medical attention.",
                        new Key(Biomarkers.HEART_RATE, AlertPriority.CRITICAL, Side.HIGH),
                        "Elevated resting heart rate. Rest and monitor. Seek medical attention if accompanied by chest pain.",
                        new Key(Biomarkers.HRV_SDNN, AlertPriority.HIGH, Side.LOW),
                        "Your HRV has been declining. Consider prioritizing sleep and stress reduction."));
    }

    /**
     * Returns the recommendation for an anomaly, or empty if none applies.
     *
     * @param anomaly anomaly to advise on
     * @return specific advice, generic advice for CRITICAL/HIGH, or empty
     */
    public Optional<String> recommend(Anomaly anomaly) {
        Side side = anomaly.expectedRange().isBelow(anomaly.value()) ? Side.LOW : Side.HIGH;
        String specific = entries.get(new Key(anomaly.biomarker(), anomaly.priority(), side));
        if (specific != null) {
            return Optional.of(specific);
        }

        return switch (anomaly.priority()) {
            case CRITICAL -> Optional.of(GENERIC_CRITICAL);
            case HIGH -> Optional.of(GENERIC_HIGH);
            case MEDIUM, LOW -> Optional.empty();
        };
    }
}
