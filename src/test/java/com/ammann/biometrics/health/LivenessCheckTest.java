/* (C)2026 */
package com.ammann.biometrics.health;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.biometrics.model.RecommendationTable;
import com.ammann.biometrics.service.AlertManagerRegistry;
import java.time.Clock;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LivenessCheck")
class LivenessCheckTest {

    @Test
    @DisplayName("should return UP status with tracked user count")
    void shouldReturnUpStatus() {
        LivenessCheck livenessCheck = new LivenessCheck();
        livenessCheck.alertManagers = new AlertManagerRegistry(RecommendationTable.defaults(), Clock.systemUTC());
        livenessCheck.alertManagers.withManager("alice", m -> m);

        HealthCheckResponse response = livenessCheck.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getName()).isEqualTo("analytics-engine");
        assertThat(response.getData()).isPresent();
        assertThat(response.getData().get().get("tracked-users")).isEqualTo(1L);
    }
}
