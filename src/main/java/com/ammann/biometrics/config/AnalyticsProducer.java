/* (C)2026 */
package com.ammann.biometrics.config;

import com.ammann.biometrics.model.ClinicalThresholdTable;
import com.ammann.biometrics.model.RecommendationTable;
import com.ammann.biometrics.service.AnomalyDetector;
import com.ammann.biometrics.service.CorrelationEngine;
import com.ammann.biometrics.service.HealthScoreCalculator;
import com.ammann.biometrics.service.TrendAnalyzer;
import com.ammann.biometrics.source.TimeSeriesSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import java.time.Clock;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;
import org.jboss.logging.Logger;

/**
 * CDI producer for the analytics core.
 *
 * <p>The detectors, lookup tables and the analytics executor are plain objects built once
 * from {@code analytics.*} configuration and shared by reference. Invalid settings fail
 * at startup.
 */
@ApplicationScoped
public class AnalyticsProducer {

    private static final Logger LOG = Logger.getLogger(AnalyticsProducer.class);

    @ConfigProperty(name = "analytics.anomaly.window-size", defaultValue = "30")
    int windowSize;

    @ConfigProperty(name = "analytics.anomaly.z-threshold", defaultValue = "3.0")
    double zThreshold;

    @ConfigProperty(name = "analytics.anomaly.iqr-multiplier", defaultValue = "1.5")
    double iqrMultiplier;

    @ConfigProperty(name = "analytics.anomaly.min-shift-percent", defaultValue = "15.0")
    double minShiftPercent;

    @ConfigProperty(name = "analytics.trend.significance-level", defaultValue = "0.05")
    double trendSignificanceLevel;

    @ConfigProperty(name = "analytics.correlation.significance-level", defaultValue = "0.05")
    double correlationSignificanceLevel;

    @ConfigProperty(name = "analytics.correlation.min-samples", defaultValue = "30")
    int correlationMinSamples;

    @ConfigProperty(name = "analytics.correlation.max-lag-days", defaultValue = "7")
    int correlationMaxLagDays;

    @ConfigProperty(name = "analytics.executor.max-async", defaultValue = "4")
    int executorMaxAsync;

    @ConfigProperty(name = "analytics.executor.max-queued", defaultValue = "100")
    int executorMaxQueued;

    @Produces
    @ApplicationScoped
    public ClinicalThresholdTable clinicalThresholds() {
        return ClinicalThresholdTable.defaults();
    }

    @Produces
    @ApplicationScoped
    public RecommendationTable recommendations() {
        return RecommendationTable.defaults();
    }

    @Produces
    @ApplicationScoped
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @ApplicationScoped
    public AnomalyDetector anomalyDetector(ClinicalThresholdTable thresholds) {
        LOG.infof("Anomaly detector: window=%d, z=%.2f, minShift=%.1f%%", windowSize, zThreshold, minShiftPercent);
        return new AnomalyDetector(thresholds, windowSize, zThreshold, iqrMultiplier, minShiftPercent);
    }

    @Produces
    @ApplicationScoped
    public TrendAnalyzer trendAnalyzer() {
        return new TrendAnalyzer(trendSignificanceLevel);
    }

    @Produces
    @ApplicationScoped
    public CorrelationEngine correlationEngine(TimeSeriesSource source) {
        LOG.infof("Correlation engine: alpha=%.3f, minSamples=%d, maxLag=%d days",
                correlationSignificanceLevel, correlationMinSamples, correlationMaxLagDays);
        return new CorrelationEngine(source, correlationSignificanceLevel, correlationMinSamples, correlationMaxLagDays);
    }

    @Produces
    @ApplicationScoped
    public HealthScoreCalculator healthScoreCalculator() {
        return new HealthScoreCalculator();
    }

    /**
     * Produces the named ManagedExecutor the daily analysis runs its phases on.
     *
     * <p>CDI context is cleared so every phase opens its own request context and
     * persistence session.
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named("analytics-executor")
    @ApplicationScoped
    public ManagedExecutor analyticsExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(executorMaxAsync)
                .maxQueued(executorMaxQueued)
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION, ThreadContext.CDI)
                .build();
    }

    void shutdownExecutor(@Disposes @Named("analytics-executor") ManagedExecutor executor) {
        executor.shutdown();
    }
}
