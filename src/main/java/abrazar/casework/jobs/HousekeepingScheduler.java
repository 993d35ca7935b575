package abrazar.casework.jobs;

import abrazar.casework.services.QueueManager;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Enqueues the nightly housekeeping jobs.
 *
 * <p>
 * <b>Schedule:</b> daily at 04:00 ({@code casework.scheduler.housekeeping.cron}, default {@code 0 0 4 * * ?})
 *
 * <p>
 * <b>Jobs:</b> {@code cleanup-sessions}, {@code cleanup-tokens} and {@code cleanup-cache} every day;
 * {@code cleanup-logs} and {@code cleanup-history} on Sunday as well.
 *
 * @see HousekeepingJobHandler
 */
@ApplicationScoped
public class HousekeepingScheduler extends ScheduledProducer {

    private static final Logger LOG = Logger.getLogger(HousekeepingScheduler.class);

    static final List<HousekeepingType> DAILY = List.of(HousekeepingType.SESSIONS, HousekeepingType.TOKENS,
            HousekeepingType.CACHE);
    static final List<HousekeepingType> WEEKLY = List.of(HousekeepingType.LOGS, HousekeepingType.HISTORY);

    @Inject
    QueueManager queueManager;

    @ConfigProperty(
            name = "casework.scheduler.housekeeping.cron",
            defaultValue = "0 0 4 * * ?")
    String cron;

    @ConfigProperty(
            name = "casework.scheduler.zone",
            defaultValue = "UTC")
    String zone;

    @Override
    protected String name() {
        return "housekeeping";
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
        enqueueFor(ZonedDateTime.now(clock.withZone(zone())));
    }

    /**
     * Enqueues the housekeeping jobs due on the given local date.
     *
     * @return the sub-types enqueued
     */
    public List<HousekeepingType> enqueueFor(ZonedDateTime firedAt) {
        List<HousekeepingType> types = new ArrayList<>(DAILY);
        if (firedAt.getDayOfWeek() == DayOfWeek.SUNDAY) {
            types.addAll(WEEKLY);
        }
        for (HousekeepingType type : types) {
            queueManager.addHousekeepingJob(type);
        }
        LOG.infof("Scheduled housekeeping for %s: %s", firedAt.toLocalDate(), types);
        return types;
    }
}
