/* (C)2026 */
package com.ammann.biometrics.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.biometrics.exception.ValidationException;
import com.ammann.biometrics.model.Biomarkers;
import com.ammann.biometrics.model.HealthScore;
import com.ammann.biometrics.properties.ApiProperties;
import com.ammann.biometrics.service.AnalyticsService;
import jakarta.ws.rs.core.Response;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnalyticsResourceTest {

    private static final Instant NOW = Instant.parse("2026-03-10T01:30:00Z");

    private AnalyticsResource resource;
    private AnalyticsService service;

    @BeforeEach
    void setUp() {
        service = mock(AnalyticsService.class);
        resource = new AnalyticsResource();
        resource.analyticsService = service;
        resource.clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    // =========================================================================
    // Annotations / path
    // =========================================================================

    @Test
    void resource_classHasCorrectPath() {
        var path = AnalyticsResource.class.getAnnotation(jakarta.ws.rs.Path.class);
        assertThat(path).isNotNull();
        assertThat(path.value()).isEqualTo("/api/v1/users/{userId}/analytics");
        assertThat(path.value()).isEqualTo(ApiProperties.BASE_URL_V1 + ApiProperties.Analytics.BASE);
    }

    // =========================================================================
    // Date handling
    // =========================================================================

    @Test
    void healthScore_defaultsToYesterdayUtc() {
        LocalDate yesterday = LocalDate.of(2026, 3, 9);
        HealthScore score = new HealthScore(yesterday, 88.0, Map.of(HealthScore.HRV, 88.0), Map.of(HealthScore.HRV, 0.25));
        when(service.getHealthScore("alice", yesterday)).thenReturn(score);

        Response response = resource.getHealthScore("alice", null);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getEntity()).isSameAs(score);
    }

    @Test
    void healthScore_usesExplicitDate() {
        LocalDate day = LocalDate.of(2026, 1, 15);
        when(service.getHealthScore("alice", day)).thenReturn(HealthScore.unavailable(day));

        Response response = resource.getHealthScore("alice", "2026-01-15");

        assertThat(((HealthScore) response.getEntity()).date()).isEqualTo(day);
    }

    @Test
    void dailyAnalysis_rejectsMalformedDate() {
        assertThatThrownBy(() -> resource.getDailyAnalysis("alice", "09/03/2026"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("date");
        verify(service, never()).runDailyAnalysis(anyString(), any());
    }

    // =========================================================================
    // Parameter validation
    // =========================================================================

    @Test
    void correlations_rejectDaysOutOfRange() {
        assertThatThrownBy(() -> resource.getCorrelations("alice", 0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> resource.getCorrelations("alice", 366)).isInstanceOf(ValidationException.class);
        verify(service, never()).getCorrelations(anyString(), anyInt(), anyInt());
    }

    @Test
    void correlations_capResultCount() {
        when(service.getCorrelations("alice", 30, 20)).thenReturn(List.of());

        Response response = resource.getCorrelations("alice", 30);

        assertThat(response.getStatus()).isEqualTo(200);
        verify(service).getCorrelations("alice", 30, 20);
    }

    @Test
    void laggedCorrelations_rejectUnknownBiomarker() {
        assertThatThrownBy(() -> resource.getLaggedCorrelations("alice", "cortisol", Biomarkers.GLUCOSE, 30))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("biomarker1");
        assertThatThrownBy(() -> resource.getLaggedCorrelations("alice", Biomarkers.GLUCOSE, null, 30))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("biomarker2");
    }

    @Test
    void changePoints_delegateForKnownBiomarker() {
        when(service.getChangePoints("alice", Biomarkers.GLUCOSE, 60)).thenReturn(List.of());

        Response response = resource.getChangePoints("alice", Biomarkers.GLUCOSE, 60);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getEntity()).isEqualTo(List.of());
    }

    @Test
    void trends_delegateWithDays() {
        when(service.getSignificantTrends("alice", 14)).thenReturn(List.of());

        resource.getTrends("alice", 14);

        verify(service).getSignificantTrends("alice", 14);
    }
}
