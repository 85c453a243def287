/* (C)2026 */
package com.ammann.biometrics.scheduled;

import com.ammann.biometrics.model.DailyAnalysisReport;
import com.ammann.biometrics.service.AlertManagerRegistry;
import com.ammann.biometrics.service.AnalyticsService;
import com.ammann.biometrics.source.TimeSeriesSource;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Scheduled jobs of the analytics engine.
 * <p>
 * <ol>
 *   <li><b>Daily analysis:</b> analyses yesterday (UTC) for every user with readings in the
 *   last 30 days</li>
 *   <li><b>Cleanup:</b> purges resolved and dismissed alerts past the retention period</li>
 * </ol>
 */
@ApplicationScoped
public class DailyAnalysisScheduler {

    private static final Logger LOG = Logger.getLogger(DailyAnalysisScheduler.class);

    /** Users without readings in this window are not analysed. */
    static final Duration ACTIVE_USER_WINDOW = Duration.ofDays(30);

    @ConfigProperty(name = "analytics.daily.enabled", defaultValue = "true")
    boolean enabled = true;

    @ConfigProperty(name = "analytics.alerts.retention", defaultValue = "P7D")
    Duration alertRetention = Duration.ofDays(7);

    private final AnalyticsService analyticsService;
    private final AlertManagerRegistry alertManagers;
    private final TimeSeriesSource source;
    private final Clock clock;

    @Inject
    public DailyAnalysisScheduler(
            AnalyticsService analyticsService,
            AlertManagerRegistry alertManagers,
            TimeSeriesSource source,
            Clock clock) {
        this.analyticsService = analyticsService;
        this.alertManagers = alertManagers;
        this.source = source;
        this.clock = clock;
    }

    @Scheduled(cron = "{analytics.daily.cron}", identity = "daily-analysis")
    void scheduledDailyAnalysis() {
        runDailyAnalysis();
    }

    @Scheduled(cron = "0 30 3 * * ?", identity = "alert-cleanup")
    void scheduledAlertCleanup() {
        purgeClosedAlerts();
    }

    /**
     * Runs the daily analysis of yesterday for all active users. A failing user is logged
     * and skipped.
     *
     * @return number of users analysed successfully
     */
    public int runDailyAnalysis() {
        if (!enabled) {
            LOG.debug("Daily analysis disabled");
            return 0;
        }

        Instant now = clock.instant();
        LocalDate yesterday = LocalDate.ofInstant(now, ZoneOffset.UTC).minusDays(1);
        List<String> users = source.findActiveUsers(now.minus(ACTIVE_USER_WINDOW));
        LOG.infof("Starting daily analysis of %s for %d users", yesterday, users.size());

        int succeeded = 0;
        for (String userId : users) {
            try {
                DailyAnalysisReport report = analyticsService.runDailyAnalysis(userId, yesterday);
                succeeded++;
                if (report.isPartial()) {
                    LOG.debugf("User %s analysed partially: %s", userId, report.failures());
                }
            } catch (Exception e) {
                LOG.errorf(e, "Daily analysis failed for user %s", userId);
            }
        }

        LOG.infof("Daily analysis of %s finished: %d/%d users", yesterday, succeeded, users.size());
        return succeeded;
    }

    /**
     * Cleanup: drops closed alerts older than the retention period from memory.
     *
     * @return number of alerts removed
     */
    public int purgeClosedAlerts() {
        Instant cutoff = clock.instant().minus(alertRetention);
        int removed = alertManagers.purgeClosedAlerts(cutoff);

        if (removed > 0) {
            LOG.infof("Cleanup: purged %d closed alerts (closed before %s)", removed, cutoff);
        } else {
            LOG.debug("Cleanup: no closed alerts to purge");
        }
        return removed;
    }
}
