package abrazar.casework.jobs;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Starts and stops the three job producers together.
 *
 * <p>
 * Producers start on application startup unless {@code casework.scheduler.enabled} is false, and always stop on
 * shutdown. Both operations are idempotent.
 */
@ApplicationScoped
public class SchedulerRegistry {

    private static final Logger LOG = Logger.getLogger(SchedulerRegistry.class);

    @Inject
    StatsRecomputeScheduler statsRecomputeScheduler;

    @Inject
    HousekeepingScheduler housekeepingScheduler;

    @Inject
    QueueHealthCheckScheduler queueHealthCheckScheduler;

    @ConfigProperty(
            name = "casework.scheduler.enabled",
            defaultValue = "true")
    boolean enabled;

    void onStart(@Observes StartupEvent event) {
        if (!enabled) {
            LOG.info("Job producers disabled by configuration");
            return;
        }
        startSchedulers();
    }

    void onStop(@Observes ShutdownEvent event) {
        stopSchedulers();
    }

    public void startSchedulers() {
        int started = 0;
        for (ScheduledProducer producer : producers()) {
            if (producer.start()) {
                started++;
            }
        }
        LOG.infof("Started %d job producers", started);
    }

    public void stopSchedulers() {
        int stopped = 0;
        for (ScheduledProducer producer : producers()) {
            if (producer.stop()) {
                stopped++;
            }
        }
        LOG.infof("Stopped %d job producers", stopped);
    }

    List<ScheduledProducer> producers() {
        return List.of(statsRecomputeScheduler, housekeepingScheduler, queueHealthCheckScheduler);
    }
}
