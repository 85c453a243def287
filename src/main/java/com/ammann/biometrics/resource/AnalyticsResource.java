/* (C)2026 */
package com.ammann.biometrics.resource;

import com.ammann.biometrics.dto.CorrelationMatrixDTO;
import com.ammann.biometrics.exception.ValidationException;
import com.ammann.biometrics.model.Biomarkers;
import com.ammann.biometrics.model.ChangePoint;
import com.ammann.biometrics.model.CorrelationResult;
import com.ammann.biometrics.model.DailyAnalysisReport;
import com.ammann.biometrics.model.HealthScore;
import com.ammann.biometrics.model.TrendResult;
import com.ammann.biometrics.properties.ApiProperties;
import com.ammann.biometrics.service.AnalyticsService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * REST resource for per-user analytics: daily reports, health scores, correlations,
 * trends and change points.
 *
 * <p>The user id is taken from the path; authentication is handled outside this service.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Analytics.BASE)
@Tag(name = "Analytics API", description = "Anomalies, trends, correlations and health score per user")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AnalyticsResource {

    private static final Logger LOG = Logger.getLogger(AnalyticsResource.class);
    private static final int MAX_DAYS = 365;
    private static final int MAX_CORRELATIONS = 20;

    @Inject
    AnalyticsService analyticsService;

    @Inject
    Clock clock;

    @GET
    @Path(ApiProperties.Analytics.DAILY)
    @Operation(
            summary = "Daily analysis",
            description = "Runs the daily analysis for one UTC day: alerts, weekly trends, monthly correlations, summary and health score"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Report, possibly partial",
                    content = @Content(schema = @Schema(implementation = DailyAnalysisReport.class))),
            @APIResponse(responseCode = "400", description = "Invalid date")
    })
    public Response getDailyAnalysis(
            @PathParam("userId") String userId,
            @Parameter(description = "Day to analyse (YYYY-MM-DD, default: yesterday UTC)")
            @QueryParam("date") String date) {

        LocalDate day = parseDate(date);
        LOG.debugf("Daily analysis request: user=%s, date=%s", userId, day);

        DailyAnalysisReport report = analyticsService.runDailyAnalysis(userId, day);
        return Response.ok(report).build();
    }

    @GET
    @Path(ApiProperties.Analytics.SCORE)
    @Operation(
            summary = "Health score",
            description = "Composite 0-100 score over the week ending with the given day"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Health score; score is null without data",
                    content = @Content(schema = @Schema(implementation = HealthScore.class))),
            @APIResponse(responseCode = "400", description = "Invalid date")
    })
    public Response getHealthScore(
            @PathParam("userId") String userId,
            @Parameter(description = "Last day of the trailing week (YYYY-MM-DD, default: yesterday UTC)")
            @QueryParam("date") String date) {

        HealthScore score = analyticsService.getHealthScore(userId, parseDate(date));
        return Response.ok(score).build();
    }

    @GET
    @Path(ApiProperties.Analytics.CORRELATIONS)
    @Operation(
            summary = "Significant correlations",
            description = "Bonferroni-corrected lagged correlations between the tracked biomarkers, strongest first"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Up to 20 significant correlations"),
            @APIResponse(responseCode = "400", description = "Invalid days"),
            @APIResponse(responseCode = "503", description = "Time-series source unavailable")
    })
    public Response getCorrelations(
            @PathParam("userId") String userId,
            @Parameter(description = "Trailing window in days (1-365)")
            @QueryParam("days") @DefaultValue("30") int days) {

        validateDays(days);
        List<CorrelationResult> results = analyticsService.getCorrelations(userId, days, MAX_CORRELATIONS);
        return Response.ok(results).build();
    }

    @GET
    @Path(ApiProperties.Analytics.LAGGED_CORRELATIONS)
    @Operation(
            summary = "Lag sweep",
            description = "Correlations of two biomarkers at every lag up to the configured maximum, strongest first"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Correlations per lag"),
            @APIResponse(responseCode = "400", description = "Unknown biomarker or invalid days"),
            @APIResponse(responseCode = "503", description = "Time-series source unavailable")
    })
    public Response getLaggedCorrelations(
            @PathParam("userId") String userId,
            @Parameter(description = "Leading biomarker for positive lags")
            @QueryParam("biomarker1") String biomarker1,
            @Parameter(description = "Lagging biomarker for positive lags")
            @QueryParam("biomarker2") String biomarker2,
            @Parameter(description = "Trailing window in days (1-365)")
            @QueryParam("days") @DefaultValue("30") int days) {

        validateBiomarker("biomarker1", biomarker1);
        validateBiomarker("biomarker2", biomarker2);
        validateDays(days);

        List<CorrelationResult> results = analyticsService.getLaggedCorrelations(userId, biomarker1, biomarker2, days);
        return Response.ok(results).build();
    }

    @GET
    @Path(ApiProperties.Analytics.CORRELATION_MATRIX)
    @Operation(
            summary = "Correlation matrix",
            description = "Pairwise Pearson correlations of the daily series of the tracked biomarkers"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Correlation matrix",
                    content = @Content(schema = @Schema(implementation = CorrelationMatrixDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid days"),
            @APIResponse(responseCode = "503", description = "Time-series source unavailable")
    })
    public Response getCorrelationMatrix(
            @PathParam("userId") String userId,
            @Parameter(description = "Trailing window in days (1-365)")
            @QueryParam("days") @DefaultValue("30") int days) {

        validateDays(days);
        return Response.ok(analyticsService.getCorrelationMatrix(userId, days)).build();
    }

    @GET
    @Path(ApiProperties.Analytics.TRENDS)
    @Operation(
            summary = "Significant trends",
            description = "Linear trends of the daily series of the tracked biomarkers, significant ones only"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Significant trends"),
            @APIResponse(responseCode = "400", description = "Invalid days")
    })
    public Response getTrends(
            @PathParam("userId") String userId,
            @Parameter(description = "Trailing window in days (1-365)")
            @QueryParam("days") @DefaultValue("30") int days) {

        validateDays(days);
        List<TrendResult> trends = analyticsService.getSignificantTrends(userId, days);
        return Response.ok(trends).build();
    }

    @GET
    @Path(ApiProperties.Analytics.CHANGE_POINTS)
    @Operation(
            summary = "Change points",
            description = "Shifts of the local mean of one biomarker's daily series"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Merged change points in time order"),
            @APIResponse(responseCode = "400", description = "Unknown biomarker or invalid days"),
            @APIResponse(responseCode = "503", description = "Time-series source unavailable")
    })
    public Response getChangePoints(
            @PathParam("userId") String userId,
            @Parameter(description = "Biomarker name")
            @QueryParam("biomarker") String biomarker,
            @Parameter(description = "Trailing window in days (1-365)")
            @QueryParam("days") @DefaultValue("60") int days) {

        validateBiomarker("biomarker", biomarker);
        validateDays(days);

        List<ChangePoint> changePoints = analyticsService.getChangePoints(userId, biomarker, days);
        return Response.ok(changePoints).build();
    }

    private LocalDate parseDate(String date) {
        if (date == null || date.isBlank()) {
            return LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(1);
        }
        try {
            return LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw ValidationException.invalidParameter("date", date, "ISO-8601 date (YYYY-MM-DD)");
        }
    }

    private static void validateDays(int days) {
        if (days < 1 || days > MAX_DAYS) {
            throw ValidationException.invalidParameter("days", days, "value between 1 and " + MAX_DAYS);
        }
    }

    private static void validateBiomarker(String name, String biomarker) {
        if (biomarker == null || !Biomarkers.isKnown(biomarker)) {
            throw ValidationException.invalidParameter(name, biomarker, "one of " + Biomarkers.ALL);
        }
    }
}
