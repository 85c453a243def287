/* (C)2026 */
package com.ammann.biometrics.model;

import com.ammann.biometrics.enumeration.AlertStatus;
import java.time.Instant;
import java.util.Objects;

/**
 * User-facing wrapper around a deduplicated {@link Anomaly} with lifecycle state.
 *
 * <p>The only mutable entity of the analytics core. Status changes go through
 * {@link #transitionTo(AlertStatus, Instant)}, which enforces the transition table of
 * {@link AlertStatus} and stamps the matching timestamp. Instances are owned by one
 * {@link com.ammann.biometrics.service.AlertManager} and are not thread-safe.
 */
public class Alert
{
    private final String id;
    private final String userId;
    private final Instant createdAt;
    private final Anomaly anomaly;
    private final String title;
    private final String message;
    private final String recommendation;

    private AlertStatus status = AlertStatus.ACTIVE;
    private Instant acknowledgedAt;
    private Instant resolvedAt;
    private Instant dismissedAt;

    public Alert(
            String id,
            String userId,
            Instant createdAt,
            Anomaly anomaly,
            String title,
            String message,
            String recommendation)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.anomaly = Objects.requireNonNull(anomaly, "anomaly");
        this.title = title;
        this.message = message;
        this.recommendation = recommendation;
    }

    /**
     * Moves the alert to {@code target} if the current state allows it.
     *
     * @param target desired status
     * @param at     time stamped on the alert for the transition
     * @return {@code true} if the transition happened, {@code false} if it was rejected
     */
    public boolean transitionTo(AlertStatus target, Instant at)
    {
        if (!status.canTransitionTo(target)) {
            return false;
        }

        status = target;
        switch (target) {
            case ACKNOWLEDGED -> acknowledgedAt = at;
            case RESOLVED -> resolvedAt = at;
            case DISMISSED -> dismissedAt = at;
            default -> { }
        }
        return true;
    }

    /** Time the alert reached its terminal state, or {@code null} while it is open. */
    public Instant closedAt()
    {
        return switch (status) {
            case RESOLVED -> resolvedAt;
            case DISMISSED -> dismissedAt;
            default -> null;
        };
    }

    public String getId() { return id; }

    public String getUserId() { return userId; }

    public Instant getCreatedAt() { return createdAt; }

    public Anomaly getAnomaly() { return anomaly; }

    public AlertStatus getStatus() { return status; }

    public String getTitle() { return title; }

    public String getMessage() { return message; }

    public String getRecommendation() { return recommendation; }

    public Instant getAcknowledgedAt() { return acknowledgedAt; }

    public Instant getResolvedAt() { return resolvedAt; }

    public Instant getDismissedAt() { return dismissedAt; }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof Alert other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode()
    {
        return id.hashCode();
    }

    @Override
    public String toString()
    {
        return "Alert{id='" + id + "', userId='" + userId + "', status=" + status
                + ", biomarker='" + anomaly.biomarker() + "', priority=" + anomaly.priority() + "}";
    }
}
