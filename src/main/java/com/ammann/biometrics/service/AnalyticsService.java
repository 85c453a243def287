/* (C)2026 */
package com.ammann.biometrics.service;

import com.ammann.biometrics.dto.AlertDTO;
import com.ammann.biometrics.dto.CorrelationMatrixDTO;
import com.ammann.biometrics.enumeration.AlertPriority;
import com.ammann.biometrics.enumeration.Resample;
import com.ammann.biometrics.model.AnalysisWindow;
import com.ammann.biometrics.model.Anomaly;
import com.ammann.biometrics.model.Biomarkers;
import com.ammann.biometrics.model.ChangePoint;
import com.ammann.biometrics.model.CorrelationResult;
import com.ammann.biometrics.model.DailyAnalysisReport;
import com.ammann.biometrics.model.DailySummary;
import com.ammann.biometrics.model.HealthScore;
import com.ammann.biometrics.model.Measurement;
import com.ammann.biometrics.model.MeasurementSeries;
import com.ammann.biometrics.model.TrendResult;
import com.ammann.biometrics.source.TimeSeriesSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the per-user daily analysis and serves the on-demand analytics queries.
 *
 * <p>The daily run executes its phases (alerts, trends, correlations, summary, health
 * score) concurrently on the {@code analytics-executor}. Every failure is contained at
 * the smallest unit that failed (one biomarker, one health-score component, or the
 * correlation phase as a whole when it fails otherwise or misses its deadline), logged,
 * counted and named in the report's {@code failures}. The run itself never throws.
 */
@ApplicationScoped
public class AnalyticsService
{
    private static final Logger LOG = Logger.getLogger(AnalyticsService.class);

    public static final String PHASE_ANOMALIES = "anomalies";
    public static final String PHASE_TRENDS = "trends";
    public static final String PHASE_CORRELATIONS = "correlations";
    public static final String PHASE_SUMMARY = "summary";
    public static final String PHASE_HEALTH_SCORE = "health_score";

    public static final String WINDOW_DAY = "day";
    public static final String WINDOW_WEEK = "week";
    public static final String WINDOW_MONTH = "month";

    static final int TOP_DAILY_CORRELATIONS = 10;
    static final List<String> SUMMARY_BIOMARKERS =
            List.of(Biomarkers.HEART_RATE, Biomarkers.GLUCOSE, Biomarkers.HRV_SDNN, Biomarkers.HRV_RMSSD);

    @ConfigProperty(name = "analytics.anomaly.biomarkers", defaultValue = "heart_rate,glucose,hrv_sdnn")
    List<String> anomalyBiomarkers = List.of(Biomarkers.HEART_RATE, Biomarkers.GLUCOSE, Biomarkers.HRV_SDNN);

    @ConfigProperty(name = "analytics.trend.biomarkers", defaultValue = "heart_rate,hrv_sdnn,glucose")
    List<String> trendBiomarkers = List.of(Biomarkers.HEART_RATE, Biomarkers.HRV_SDNN, Biomarkers.GLUCOSE);

    @ConfigProperty(name = "analytics.correlation.biomarkers", defaultValue = "heart_rate,hrv_sdnn,glucose")
    List<String> correlationBiomarkers = List.of(Biomarkers.HEART_RATE, Biomarkers.HRV_SDNN, Biomarkers.GLUCOSE);

    @ConfigProperty(name = "analytics.correlation.timeout", defaultValue = "30S")
    Duration correlationTimeout = Duration.ofSeconds(30);

    private final TimeSeriesSource source;
    private final AnomalyDetector anomalyDetector;
    private final TrendAnalyzer trendAnalyzer;
    private final CorrelationEngine correlationEngine;
    private final AlertManagerRegistry alertManagers;
    private final HealthScoreCalculator healthScoreCalculator;
    private final Executor executor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Map<AlertPriority, Counter> alertsCreatedCounters = new EnumMap<>(AlertPriority.class);
    private final Map<String, Counter> failureCounters = new ConcurrentHashMap<>();
    private Timer dailyAnalysisTimer;

    @Inject
    public AnalyticsService(
            TimeSeriesSource source,
            AnomalyDetector anomalyDetector,
            TrendAnalyzer trendAnalyzer,
            CorrelationEngine correlationEngine,
            AlertManagerRegistry alertManagers,
            HealthScoreCalculator healthScoreCalculator,
            @Named("analytics-executor") Executor executor,
            Clock clock,
            MeterRegistry meterRegistry)
    {
        this.source = source;
        this.anomalyDetector = anomalyDetector;
        this.trendAnalyzer = trendAnalyzer;
        this.correlationEngine = correlationEngine;
        this.alertManagers = alertManagers;
        this.healthScoreCalculator = healthScoreCalculator;
        this.executor = executor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        initMetrics();
    }

    /**
     * Registers the analytics meters. Safe to call without a MeterRegistry.
     */
    void initMetrics()
    {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - analytics metrics disabled");
            return;
        }

        for (AlertPriority priority : AlertPriority.values()) {
            alertsCreatedCounters.put(priority, Counter.builder("biometric_alerts_created_total")
                    .description("Alerts raised by the daily analysis")
                    .tag("priority", priority.getWireName())
                    .register(meterRegistry));
        }
        for (String phase : List.of(PHASE_ANOMALIES, PHASE_TRENDS, PHASE_CORRELATIONS, PHASE_SUMMARY, PHASE_HEALTH_SCORE)) {
            failureCounters.put(phase, Counter.builder("biometric_analysis_failures_total")
                    .description("Sub-analyses that failed and were left out of a report")
                    .tag("phase", phase)
                    .register(meterRegistry));
        }
        dailyAnalysisTimer = Timer.builder("biometric_daily_analysis")
                .description("Wall time of one user's daily analysis")
                .register(meterRegistry);
    }

    /**
     * Runs the full daily analysis of {@code date} (UTC) for one user.
     *
     * @return the report; partial when sub-analyses failed, never {@code null}
     */
    public DailyAnalysisReport runDailyAnalysis(String userId, LocalDate date)
    {
        long startedAt = System.nanoTime();
        long correlationDeadline = startedAt + correlationTimeout.toNanos();

        Instant dayStart = date.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant dayEnd = dayStart.plus(Duration.ofDays(1)).minusSeconds(1);
        Map<String, AnalysisWindow> windows = new LinkedHashMap<>();
        windows.put(WINDOW_DAY, new AnalysisWindow(dayStart, dayEnd));
        windows.put(WINDOW_WEEK, new AnalysisWindow(dayStart.minus(Duration.ofDays(7)), dayEnd));
        windows.put(WINDOW_MONTH, new AnalysisWindow(dayStart.minus(Duration.ofDays(30)), dayEnd));

        List<String> failures = Collections.synchronizedList(new ArrayList<>());

        CompletableFuture<List<AlertDTO>> alerts = CompletableFuture.supplyAsync(
                () -> detectDailyAnomalies(userId, windows.get(WINDOW_DAY), failures), executor);
        CompletableFuture<List<TrendResult>> trends = CompletableFuture.supplyAsync(
                () -> analyzeTrends(userId, windows.get(WINDOW_WEEK), failures), executor);
        CompletableFuture<List<CorrelationResult>> correlations = CompletableFuture.supplyAsync(
                () -> discoverCorrelations(userId, windows.get(WINDOW_MONTH), failures), executor);
        CompletableFuture<DailySummary> summary = CompletableFuture.supplyAsync(
                () -> computeDailySummary(userId, windows.get(WINDOW_DAY), failures), executor);
        CompletableFuture<HealthScore> healthScore = CompletableFuture.supplyAsync(
                () -> computeHealthScore(userId, date, failures), executor);

        DailyAnalysisReport report = new DailyAnalysisReport(
                userId,
                date,
                windows,
                await(alerts, PHASE_ANOMALIES, null, List.of(), failures),
                await(trends, PHASE_TRENDS, null, List.of(), failures),
                await(correlations, PHASE_CORRELATIONS, correlationDeadline, List.of(), failures),
                await(summary, PHASE_SUMMARY, null, DailySummary.empty(), failures),
                await(healthScore, PHASE_HEALTH_SCORE, null, HealthScore.unavailable(date), failures),
                sorted(failures));

        if (dailyAnalysisTimer != null) {
            dailyAnalysisTimer.record(System.nanoTime() - startedAt, TimeUnit.NANOSECONDS);
        }

        if (report.isPartial()) {
            LOG.warnf("Daily analysis for user %s on %s finished partially; failed: %s",
                    userId, date, report.failures());
        }
        LOG.infof("Daily analysis complete for user %s on %s: %d alerts, %d trends, %d correlations",
                userId, date, report.alerts().size(), report.trends().size(), report.correlations().size());
        return report;
    }

    /**
     * Health score over the week ending with {@code date} (UTC). Components whose data
     * cannot be loaded are left out.
     */
    public HealthScore getHealthScore(String userId, LocalDate date)
    {
        return computeHealthScore(userId, date, Collections.synchronizedList(new ArrayList<>()));
    }

    /**
     * Significant correlations among the correlation biomarkers over the last {@code days}
     * days, Bonferroni-corrected.
     */
    public List<CorrelationResult> getCorrelations(String userId, int days, int limit)
    {
        AnalysisWindow window = trailingWindow(days);
        List<CorrelationResult> results = correlationEngine.discoverAllCorrelations(
                userId, correlationBiomarkers, window.start(), window.end(), true);
        return results.subList(0, Math.min(limit, results.size()));
    }

    public List<CorrelationResult> getLaggedCorrelations(String userId, String biomarker1, String biomarker2, int days)
    {
        AnalysisWindow window = trailingWindow(days);
        return correlationEngine.findLaggedCorrelations(userId, biomarker1, biomarker2, window.start(), window.end());
    }

    public CorrelationMatrixDTO getCorrelationMatrix(String userId, int days)
    {
        AnalysisWindow window = trailingWindow(days);
        Map<String, Map<String, Double>> matrix = correlationEngine.computeCorrelationMatrix(
                userId, correlationBiomarkers, window.start(), window.end());
        return new CorrelationMatrixDTO(window, List.copyOf(matrix.keySet()), matrix);
    }

    /**
     * Significant trends of the trend biomarkers over the last {@code days} days. A
     * biomarker whose data cannot be loaded is skipped.
     */
    public List<TrendResult> getSignificantTrends(String userId, int days)
    {
        return analyzeTrends(userId, trailingWindow(days), Collections.synchronizedList(new ArrayList<>()));
    }

    /**
     * Change points of the daily series of one biomarker over the last {@code days} days.
     */
    public List<ChangePoint> getChangePoints(String userId, String biomarker, int days)
    {
        AnalysisWindow window = trailingWindow(days);
        MeasurementSeries daily = source.load(userId, biomarker, window.start(), window.end(), Resample.DAILY);
        return trendAnalyzer.detectChangePoints(daily);
    }

    public List<String> getCorrelationBiomarkers()
    {
        return correlationBiomarkers;
    }

    List<AlertDTO> detectDailyAnomalies(String userId, AnalysisWindow day, List<String> failures)
    {
        List<AlertDTO> created = new ArrayList<>();
        for (String biomarker : anomalyBiomarkers) {
            try {
                MeasurementSeries series = source.load(userId, biomarker, day.start(), day.end(), Resample.NONE);
                if (series.isEmpty()) {
                    continue;
                }

                List<Anomaly> anomalies = anomalyDetector.detect(series, biomarker);
                List<AlertDTO> alerts = alertManagers.withManager(userId, manager -> anomalies.stream()
                        .map(manager::createAlert)
                        .flatMap(Optional::stream)
                        .map(AlertDTO::from)
                        .toList());

                alerts.forEach(a -> incrementCounter(alertsCreatedCounters.get(a.priority())));
                created.addAll(alerts);
            } catch (Exception e) {
                recordFailure(failures, PHASE_ANOMALIES, biomarker, e);
            }
        }
        return created;
    }

    List<TrendResult> analyzeTrends(String userId, AnalysisWindow window, List<String> failures)
    {
        List<TrendResult> significant = new ArrayList<>();
        for (String biomarker : trendBiomarkers) {
            try {
                MeasurementSeries daily = source.load(userId, biomarker, window.start(), window.end(), Resample.DAILY);
                TrendResult trend = trendAnalyzer.computeTrend(daily, biomarker);
                if (trend != null && trend.isSignificant()) {
                    significant.add(trend);
                }
            } catch (Exception e) {
                recordFailure(failures, PHASE_TRENDS, biomarker, e);
            }
        }
        return significant;
    }

    List<CorrelationResult> discoverCorrelations(String userId, AnalysisWindow month, List<String> failures)
    {
        CorrelationEngine.Discovery discovery = correlationEngine.discover(
                userId, correlationBiomarkers, month.start(), month.end(), true);
        discovery.unavailable().forEach((biomarker, e) -> recordFailure(failures, PHASE_CORRELATIONS, biomarker, e));

        List<CorrelationResult> results = discovery.correlations();
        return List.copyOf(results.subList(0, Math.min(TOP_DAILY_CORRELATIONS, results.size())));
    }

    DailySummary computeDailySummary(String userId, AnalysisWindow day, List<String> failures)
    {
        Map<String, DailySummary.BiomarkerSummary> biomarkers = new LinkedHashMap<>();
        Double glucoseTimeInRange = null;

        for (String biomarker : SUMMARY_BIOMARKERS) {
            try {
                double[] values = source.load(userId, biomarker, day.start(), day.end(), Resample.NONE).presentValues();
                if (values.length == 0) {
                    continue;
                }
                biomarkers.put(biomarker, summarize(values));
                if (Biomarkers.GLUCOSE.equals(biomarker)) {
                    glucoseTimeInRange = HealthScoreCalculator.timeInRangePercent(values);
                }
            } catch (Exception e) {
                recordFailure(failures, PHASE_SUMMARY, biomarker, e);
            }
        }

        DailySummary.SleepSummary sleep = null;
        try {
            sleep = latestNight(userId, day.start().minus(Duration.ofDays(1)), day.end());
        } catch (Exception e) {
            recordFailure(failures, PHASE_SUMMARY, "sleep", e);
        }

        return new DailySummary(biomarkers, glucoseTimeInRange, sleep);
    }

    HealthScore computeHealthScore(String userId, LocalDate date, List<String> failures)
    {
        Instant end = date.atStartOfDay(ZoneOffset.UTC).toInstant().plus(Duration.ofDays(1)).minusSeconds(1);
        Instant start = end.minus(Duration.ofDays(7));

        Map<String, Double> components = new LinkedHashMap<>();
        try {
            components.put(HealthScore.HRV, healthScoreCalculator.hrvScore(
                    load(userId, Biomarkers.HRV_RMSSD, start, end, Resample.NONE)));
        } catch (Exception e) {
            recordFailure(failures, PHASE_HEALTH_SCORE, HealthScore.HRV, e);
        }
        try {
            components.put(HealthScore.SLEEP, healthScoreCalculator.sleepScore(
                    load(userId, Biomarkers.SLEEP_TOTAL, start, end, Resample.NONE),
                    load(userId, Biomarkers.SLEEP_EFFICIENCY, start, end, Resample.NONE)));
        } catch (Exception e) {
            recordFailure(failures, PHASE_HEALTH_SCORE, HealthScore.SLEEP, e);
        }
        try {
            components.put(HealthScore.GLUCOSE, healthScoreCalculator.glucoseScore(
                    load(userId, Biomarkers.GLUCOSE, start, end, Resample.NONE)));
        } catch (Exception e) {
            recordFailure(failures, PHASE_HEALTH_SCORE, HealthScore.GLUCOSE, e);
        }
        try {
            components.put(HealthScore.RESTING_HEART_RATE, healthScoreCalculator.restingHeartRateScore(
                    load(userId, Biomarkers.HEART_RATE, start, end, Resample.DAILY)));
        } catch (Exception e) {
            recordFailure(failures, PHASE_HEALTH_SCORE, HealthScore.RESTING_HEART_RATE, e);
        }

        return healthScoreCalculator.combine(date, components);
    }

    private DailySummary.SleepSummary latestNight(String userId, Instant start, Instant end)
    {
        List<Measurement> totals = source.load(userId, Biomarkers.SLEEP_TOTAL, start, end, Resample.NONE).present();
        if (totals.isEmpty()) {
            return null;
        }

        Measurement latest = totals.get(totals.size() - 1);
        Double deep = valueAt(source.load(userId, Biomarkers.SLEEP_DEEP, start, end, Resample.NONE), latest.timestamp());
        Double efficiency = valueAt(
                source.load(userId, Biomarkers.SLEEP_EFFICIENCY, start, end, Resample.NONE), latest.timestamp());
        return new DailySummary.SleepSummary(latest.value(), deep, efficiency);
    }

    private double[] load(String userId, String biomarker, Instant start, Instant end, Resample resample)
    {
        return source.load(userId, biomarker, start, end, resample).presentValues();
    }

    private AnalysisWindow trailingWindow(int days)
    {
        Instant end = clock.instant();
        return new AnalysisWindow(end.minus(Duration.ofDays(days)), end);
    }

    /**
     * Waits for one phase. With a deadline ({@link System#nanoTime()} based) the wait ends
     * there; cancelling only completes the future, the task itself may keep running on the
     * executor until it returns.
     */
    private <T> T await(
            CompletableFuture<T> future, String phase, Long deadlineNanos, T fallback, List<String> failures)
    {
        try {
            if (deadlineNanos == null) {
                return future.get();
            }
            long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warnf("Phase %s missed its deadline of %s", phase, correlationTimeout);
            recordFailure(failures, phase, null, e);
        } catch (ExecutionException e) {
            recordFailure(failures, phase, null, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(failures, phase, null, e);
        }
        return fallback;
    }

    private void recordFailure(List<String> failures, String phase, String unit, Throwable error)
    {
        String name = unit != null ? phase + ":" + unit : phase;
        LOG.errorf(error, "Analysis step %s failed: %s", name, error.getMessage());
        failures.add(name);
        incrementCounter(failureCounters.get(phase));
    }

    static DailySummary.BiomarkerSummary summarize(double[] values)
    {
        SummaryStatistics stats = new SummaryStatistics();
        for (double v : values) {
            stats.addValue(v);
        }
        return new DailySummary.BiomarkerSummary(stats.getMean(), stats.getMin(), stats.getMax(), stats.getN());
    }

    private static Double valueAt(MeasurementSeries series, Instant timestamp)
    {
        return series.present().stream()
                .filter(m -> m.timestamp().equals(timestamp))
                .map(Measurement::value)
                .findFirst()
                .orElse(null);
    }

    private static List<String> sorted(List<String> failures)
    {
        synchronized (failures) {
            List<String> copy = new ArrayList<>(failures);
            Collections.sort(copy);
            return copy;
        }
    }

    private static void incrementCounter(Counter counter)
    {
        if (counter != null) {
            counter.increment();
        }
    }
}
