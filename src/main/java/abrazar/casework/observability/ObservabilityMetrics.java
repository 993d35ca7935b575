package abrazar.casework.observability;

import abrazar.casework.api.types.QueueAlertType;
import abrazar.casework.jobs.JobLifecycleEvent;
import abrazar.casework.jobs.QueueName;
import abrazar.casework.services.QueueManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Registers and records the custom metrics of the async task layer.
 *
 * <p>
 * All metrics follow the naming convention {@code casework_<category>_<metric>}.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Gauges:</b> {@code casework_jobs_depth{queue}} - waiting plus delayed jobs per queue</li>
 * <li><b>Gauges:</b> {@code casework_jobs_failed{queue}} - retained failed jobs per queue</li>
 * <li><b>Counters:</b> {@code casework_jobs_total{queue,type,outcome}} - finished job attempts by outcome
 * ({@code completed}, {@code retry_scheduled}, {@code failed})</li>
 * <li><b>Timers:</b> {@code casework_job_duration{queue,type,outcome}} - handler execution time</li>
 * <li><b>Counters:</b> {@code casework_cache_lookups_total{domain,result}} - cache hits, misses and errors</li>
 * <li><b>Counters:</b> {@code casework_queue_alerts_total{queue,reason}} - health check alerts</li>
 * </ul>
 *
 * <p>
 * Job counters are driven by {@link JobLifecycleEvent}s fired by the worker pools; nothing in the worker pool depends
 * on this bean.
 */
@ApplicationScoped
public class ObservabilityMetrics {

    private static final Logger LOG = Logger.getLogger(ObservabilityMetrics.class);

    @Inject
    MeterRegistry registry;

    @Inject
    QueueManager queueManager;

    /**
     * Registers queue depth gauges at application startup.
     */
    public void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        LOG.info("Registering casework observability metrics");

        for (QueueName queue : QueueName.values()) {
            List<Tag> tags = List.of(Tag.of("queue", queue.getKey()));

            Gauge.builder("casework_jobs_depth", queueManager, m -> {
                var stats = m.getQueueStats(queue);
                return stats.waiting() + stats.delayed();
            }).description("Waiting and delayed jobs in the " + queue.getKey() + " queue").tags(tags)
                    .register(registry);

            Gauge.builder("casework_jobs_failed", queueManager, m -> m.getQueueStats(queue).failed())
                    .description("Retained failed jobs in the " + queue.getKey() + " queue").tags(tags)
                    .register(registry);

            LOG.debugf("Registered gauges: casework_jobs_depth/casework_jobs_failed{queue=%s}", queue.getKey());
        }
    }

    /**
     * Records job outcome counters and timers from worker pool lifecycle events.
     */
    public void onJobLifecycle(@Observes JobLifecycleEvent event) {
        if (event.stage() == JobLifecycleEvent.Stage.STARTED) {
            return;
        }

        String outcome = event.stage().name().toLowerCase();
        List<Tag> tags = List.of(Tag.of("queue", event.queue().getKey()), Tag.of("type", event.jobType()),
                Tag.of("outcome", outcome));

        Counter.builder("casework_jobs_total").description("Finished job attempts by outcome").tags(tags)
                .register(registry).increment();
        Timer.builder("casework_job_duration").description("Job handler execution time").tags(tags)
                .register(registry).record(event.duration());
    }

    /**
     * Records a cache lookup.
     *
     * @param domain
     *            key domain ({@code stats}, ...)
     * @param result
     *            {@code hit}, {@code miss} or {@code error}
     */
    public void recordCacheLookup(String domain, String result) {
        Counter.builder("casework_cache_lookups_total").description("Cache lookups by result")
                .tags(List.of(Tag.of("domain", domain), Tag.of("result", result))).register(registry).increment();
    }

    public void recordQueueAlert(QueueAlertType alert) {
        Counter.builder("casework_queue_alerts_total").description("Queue health alerts raised")
                .tags(List.of(Tag.of("queue", alert.queue()), Tag.of("reason", alert.reason()))).register(registry)
                .increment();
    }
}
