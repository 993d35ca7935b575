package abrazar.casework.jobs;

import abrazar.casework.api.types.QueueAlertType;
import abrazar.casework.api.types.QueueStatsType;
import abrazar.casework.integration.alerts.QueueAlertNotifier;
import abrazar.casework.observability.ObservabilityMetrics;
import abrazar.casework.services.QueueManager;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only health check over every queue. Enqueues nothing.
 *
 * <p>
 * <b>Schedule:</b> every 5 minutes ({@code casework.scheduler.health.cron}, default {@code 0 0/5 * * * ?})
 *
 * <p>
 * <b>Alerts</b> per queue when {@code failed > casework.scheduler.health.failed-threshold} (default 10) or
 * {@code waiting > casework.scheduler.health.waiting-threshold} (default 100). Each alert is logged at ERROR, counted
 * in {@code casework_queue_alerts_total} and passed to every {@link QueueAlertNotifier} bean.
 */
@ApplicationScoped
public class QueueHealthCheckScheduler extends ScheduledProducer {

    private static final Logger LOG = Logger.getLogger(QueueHealthCheckScheduler.class);

    @Inject
    QueueManager queueManager;

    @Inject
    ObservabilityMetrics observabilityMetrics;

    @Inject
    Instance<QueueAlertNotifier> notifiers;

    @ConfigProperty(
            name = "casework.scheduler.health.cron",
            defaultValue = "0 0/5 * * * ?")
    String cron;

    @ConfigProperty(
            name = "casework.scheduler.zone",
            defaultValue = "UTC")
    String zone;

    @ConfigProperty(
            name = "casework.scheduler.health.failed-threshold",
            defaultValue = "10")
    long failedThreshold;

    @ConfigProperty(
            name = "casework.scheduler.health.waiting-threshold",
            defaultValue = "100")
    long waitingThreshold;

    @Override
    protected String name() {
        return "health";
    }

    @Override
    protected String cronExpression() {
        return cron;
    }

    @Override
    protected ZoneId zone() {
        return ZoneId.of(zone);
    }

    @Override
    protected void fire() {
        check();
    }

    /**
     * Reads every queue's counts and raises alerts for the ones over threshold.
     *
     * @return the alerts raised
     */
    public List<QueueAlertType> check() {
        List<QueueAlertType> alerts = new ArrayList<>();
        for (QueueStatsType stats : queueManager.getQueuesStats().values()) {
            if (stats.failed() > failedThreshold) {
                alerts.add(new QueueAlertType(stats.queue(), "failed", stats.failed(), failedThreshold));
            }
            if (stats.waiting() > waitingThreshold) {
                alerts.add(new QueueAlertType(stats.queue(), "waiting", stats.waiting(), waitingThreshold));
            }
        }

        for (QueueAlertType alert : alerts) {
            LOG.errorf("Queue health alert: %s", alert.message());
            observabilityMetrics.recordQueueAlert(alert);
            for (QueueAlertNotifier notifier : notifiers) {
                try {
                    notifier.notify(alert);
                } catch (RuntimeException e) {
                    LOG.warnf(e, "Alert notifier %s failed for queue %s", notifier.getClass().getSimpleName(),
                            alert.queue());
                }
            }
        }
        if (alerts.isEmpty()) {
            LOG.debug("Queue health check passed");
        }
        return alerts;
    }
}
