/* (C)2026 */
package com.ammann.biometrics.service;

import com.ammann.biometrics.enumeration.AlertPriority;
import com.ammann.biometrics.enumeration.AlertStatus;
import com.ammann.biometrics.model.Alert;
import com.ammann.biometrics.model.Anomaly;
import com.ammann.biometrics.model.RecommendationTable;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns anomalies into user-facing alerts for one user and tracks their lifecycle.
 *
 * <p>An anomaly of the same biomarker and type as one of the last
 * {@value #DEDUP_RING_SIZE} alerted anomalies, at most {@link #DEDUP_WINDOW} apart,
 * is a duplicate and produces no alert. Rejected lifecycle transitions return
 * {@code false}; nothing here throws for them.
 *
 * <p>Not thread-safe. Shared instances must be accessed through
 * {@link AlertManagerRegistry#withManager}.
 */
public class AlertManager
{
    private static final Logger LOG = Logger.getLogger(AlertManager.class);

    static final int DEDUP_RING_SIZE = 50;
    static final Duration DEDUP_WINDOW = Duration.ofHours(1);

    private static final DateTimeFormatter DETECTED_AT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private final String userId;
    private final RecommendationTable recommendations;
    private final Clock clock;

    private final Map<String, Alert> alerts = new LinkedHashMap<>();
    private final Deque<Anomaly> recentAnomalies = new ArrayDeque<>(DEDUP_RING_SIZE);

    public AlertManager(String userId, RecommendationTable recommendations, Clock clock)
    {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        this.userId = userId;
        this.recommendations = recommendations;
        this.clock = clock;
    }

    public AlertManager(String userId)
    {
        this(userId, RecommendationTable.defaults(), Clock.systemUTC());
    }

    /**
     * Creates an alert for {@code anomaly} unless it duplicates a recent one.
     *
     * @param anomaly detected anomaly
     * @return the new ACTIVE alert, or empty if the anomaly was a duplicate
     */
    public Optional<Alert> createAlert(Anomaly anomaly)
    {
        if (isDuplicate(anomaly)) {
            LOG.debugf("Suppressed duplicate %s anomaly for %s at %s (user %s)",
                    anomaly.type().getWireName(), anomaly.biomarker(), anomaly.timestamp(), userId);
            return Optional.empty();
        }

        Alert alert = new Alert(
                UUID.randomUUID().toString(),
                userId,
                clock.instant(),
                anomaly,
                generateTitle(anomaly),
                generateMessage(anomaly),
                recommendations.recommend(anomaly).orElse(null));

        alerts.put(alert.getId(), alert);
        if (recentAnomalies.size() == DEDUP_RING_SIZE) {
            recentAnomalies.removeFirst();
        }
        recentAnomalies.addLast(anomaly);

        LOG.infof("Created alert %s for user %s: %s", alert.getId(), userId, alert.getTitle());
        return Optional.of(alert);
    }

    public boolean acknowledgeAlert(String alertId)
    {
        return transition(alertId, AlertStatus.ACKNOWLEDGED);
    }

    public boolean resolveAlert(String alertId)
    {
        return transition(alertId, AlertStatus.RESOLVED);
    }

    public boolean dismissAlert(String alertId)
    {
        return transition(alertId, AlertStatus.DISMISSED);
    }

    /** Alerts in ACTIVE state, oldest first. */
    public List<Alert> getActiveAlerts()
    {
        return alerts.values().stream()
                .filter(a -> a.getStatus() == AlertStatus.ACTIVE)
                .toList();
    }

    /** ACTIVE alerts of the given priority, oldest first. */
    public List<Alert> getAlertsByPriority(AlertPriority priority)
    {
        return alerts.values().stream()
                .filter(a -> a.getStatus() == AlertStatus.ACTIVE)
                .filter(a -> a.getAnomaly().priority() == priority)
                .toList();
    }

    /** All alerts in any state, oldest first. */
    public List<Alert> getAlerts()
    {
        return List.copyOf(alerts.values());
    }

    public Optional<Alert> findAlert(String alertId)
    {
        return Optional.ofNullable(alerts.get(alertId));
    }

    /**
     * Removes resolved and dismissed alerts closed before {@code before}. The dedup ring
     * is left untouched.
     *
     * @return number of alerts removed
     */
    public int purgeClosedAlerts(Instant before)
    {
        int removed = 0;
        Iterator<Alert> it = alerts.values().iterator();
        while (it.hasNext()) {
            Alert alert = it.next();
            Instant closedAt = alert.closedAt();
            if (closedAt != null && closedAt.isBefore(before)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            LOG.debugf("Purged %d closed alerts for user %s", removed, userId);
        }
        return removed;
    }

    public String getUserId()
    {
        return userId;
    }

    private boolean transition(String alertId, AlertStatus target)
    {
        Alert alert = alerts.get(alertId);
        if (alert == null) {
            return false;
        }

        AlertStatus from = alert.getStatus();
        boolean changed = alert.transitionTo(target, clock.instant());
        if (changed) {
            LOG.debugf("Alert %s moved from %s to %s", alertId, from.getWireName(), target.getWireName());
        }
        return changed;
    }

    private boolean isDuplicate(Anomaly anomaly)
    {
        long windowSeconds = DEDUP_WINDOW.getSeconds();
        for (Anomaly recent : recentAnomalies) {
            if (recent.biomarker().equals(anomaly.biomarker())
                    && recent.type() == anomaly.type()
                    && Math.abs(Duration.between(recent.timestamp(), anomaly.timestamp()).getSeconds()) <= windowSeconds) {
                return true;
            }
        }
        return false;
    }

    static String generateTitle(Anomaly anomaly)
    {
        return anomaly.priority().getMarker() + " " + anomaly.description();
    }

    static String generateMessage(Anomaly anomaly)
    {
        List<String> parts = new ArrayList<>(4);
        parts.add("Detected at: " + DETECTED_AT.format(anomaly.timestamp()));
        parts.add(String.format(Locale.ROOT, "Current value: %.1f", anomaly.value()));
        parts.add(String.format(Locale.ROOT, "Expected range: %.1f - %.1f",
                anomaly.expectedRange().low(), anomaly.expectedRange().high()));
        if (anomaly.clinicalContext() != null) {
            parts.add("Context: " + anomaly.clinicalContext());
        }
        return String.join("\n", parts);
    }
}
