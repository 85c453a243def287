package com.ammann.biometrics.health;

import com.ammann.biometrics.model.BiomarkerReading;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.time.Duration;
import java.time.Instant;

/**
 * Readiness health check that verifies the readings table can be queried in time.
 *
 * <p>Reports DOWN if the probe queries take longer than 1 second or fail.
 */
@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    static final String NAME = "database-health";

    @Override
    @ActivateRequestContext
    public HealthCheckResponse call() {
        try {
            Instant start = Instant.now();

            long totalReadings = BiomarkerReading.count();
            long recentReadings = BiomarkerReading.count("timestamp > ?1",
                    Instant.now().minus(Duration.ofDays(1)));

            Duration queryTime = Duration.between(start, Instant.now());
            boolean performanceOk = queryTime.toMillis() < 1000;

            return HealthCheckResponse.named(NAME)
                    .status(performanceOk)
                    .withData("total-readings", totalReadings)
                    .withData("recent-readings-24h", recentReadings)
                    .withData("query-time-ms", queryTime.toMillis())
                    .withData("performance-ok", performanceOk)
                    .build();

        } catch (Exception e) {
            return HealthCheckResponse.named(NAME)
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .withData("database-accessible", false)
                    .build();
        }
    }
}
