package com.ammann.biometrics.health;

import com.ammann.biometrics.service.AlertManagerRegistry;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness health check for the analytics engine.
 *
 * <p>Reports UP while the process responds and exposes the number of users with an
 * in-memory alert manager.
 */
@Liveness
public class LivenessCheck implements HealthCheck
{
    @Inject
    AlertManagerRegistry alertManagers;

    @Override
    public HealthCheckResponse call()
    {
        return HealthCheckResponse.named("analytics-engine")
                .up()
                .withData("tracked-users", alertManagers.trackedUserCount())
                .build();
    }

}
