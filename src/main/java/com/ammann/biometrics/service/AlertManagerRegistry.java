/* (C)2026 */
package com.ammann.biometrics.service;

import com.ammann.biometrics.model.RecommendationTable;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Holds one {@link AlertManager} per user.
 *
 * <p>Every access locks on the user's manager, so calls for one user are serialized while
 * different users proceed in parallel. Only {@link #withManager} creates managers; reads go
 * through {@link #ifPresent}. {@link #purgeClosedAlerts} evicts managers left without alerts.
 */
@ApplicationScoped
public class AlertManagerRegistry
{
    private static final Logger LOG = Logger.getLogger(AlertManagerRegistry.class);

    private final ConcurrentMap<String, AlertManager> managers = new ConcurrentHashMap<>();
    private final RecommendationTable recommendations;
    private final Clock clock;

    @Inject
    public AlertManagerRegistry(RecommendationTable recommendations, Clock clock)
    {
        this.recommendations = recommendations;
        this.clock = clock;
    }

    /**
     * Runs {@code action} with exclusive access to the user's manager, creating it on first use.
     */
    public <T> T withManager(String userId, Function<AlertManager, T> action)
    {
        while (true) {
            AlertManager manager = managers.computeIfAbsent(userId, id -> {
                LOG.debugf("Creating alert manager for user %s", id);
                return new AlertManager(id, recommendations, clock);
            });
            synchronized (manager) {
                // evicted by a purge between lookup and lock
                if (managers.get(userId) == manager) {
                    return action.apply(manager);
                }
            }
        }
    }

    /**
     * Runs {@code action} with exclusive access to the user's manager if one exists.
     *
     * @return the action's result, or empty for a user without a manager
     */
    public <T> Optional<T> ifPresent(String userId, Function<AlertManager, T> action)
    {
        AlertManager manager = managers.get(userId);
        if (manager == null) {
            return Optional.empty();
        }
        synchronized (manager) {
            if (managers.get(userId) != manager) {
                return Optional.empty();
            }
            return Optional.ofNullable(action.apply(manager));
        }
    }

    /**
     * Purges closed alerts older than {@code before} for every tracked user and evicts the
     * managers that hold no alerts afterwards.
     *
     * @return total number of alerts removed
     */
    public int purgeClosedAlerts(Instant before)
    {
        int removed = 0;
        int evicted = 0;
        for (String userId : managers.keySet()) {
            AlertManager manager = managers.get(userId);
            if (manager == null) {
                continue;
            }
            synchronized (manager) {
                removed += manager.purgeClosedAlerts(before);
                if (manager.getAlerts().isEmpty() && managers.remove(userId, manager)) {
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            LOG.debugf("Evicted %d alert managers without alerts", evicted);
        }
        return removed;
    }

    public int trackedUserCount()
    {
        return managers.size();
    }
}
