package abrazar.casework.jobs;

import abrazar.casework.api.types.JobHandleType;
import abrazar.casework.data.repositories.TenantRepository;
import abrazar.casework.services.QueueManager;
import abrazar.casework.services.StatsView;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.ZoneId;
import java.util.List;

/**
 * Keeps tenant overviews warm by enqueueing one recompute-stats job per active tenant.
 *
 * <p>
 * <b>Schedule:</b> every 30 minutes ({@code casework.scheduler.stats.cron}, default {@code 0 0/30 * * * ?})
 *
 * <p>
 * <b>Queue:</b> recompute-stats, view {@code overview}. Enqueues are spaced by
 * {@code casework.scheduler.stats.pause-ms} (default 100) so a large tenant list does not burst the queue.
 *
 * @see StatsRecomputeJobHandler
 */
@ApplicationScoped
public class StatsRecomputeScheduler extends ScheduledProducer {

    private static final Logger LOG = Logger.getLogger(StatsRecomputeScheduler.class);

    @Inject
    TenantRepository tenantRepository;

    @Inject
    QueueManager queueManager;

    @ConfigProperty(
            name = "casework.scheduler.stats.cron",
            defaultValue = "0 0/30 * * * ?")
    String cron;

    @ConfigProperty(
            name = "casework.scheduler.zone",
            defaultValue = "UTC")
    String zone;

    @ConfigProperty(
            name = "casework.scheduler.stats.pause-ms",
            defaultValue = "100")
    long pauseMs;

    @Override
    protected String name() {
        return "stats";
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
    protected void fire() throws InterruptedException {
        List<String> tenantIds = tenantRepository.findActiveTenantIds();
        int enqueued = 0;
        for (int i = 0; i < tenantIds.size(); i++) {
            if (i > 0 && pauseMs > 0) {
                Thread.sleep(pauseMs);
            }
            JobHandleType handle = queueManager.addStatsJob(tenantIds.get(i), StatsView.OVERVIEW);
            if (!handle.skipped()) {
                enqueued++;
            }
        }
        LOG.infof("Scheduled stats recompute for %d of %d active tenants", enqueued, tenantIds.size());
    }
}
