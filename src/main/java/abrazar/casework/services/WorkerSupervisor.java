package abrazar.casework.services;

import abrazar.casework.config.QueueConfig;
import abrazar.casework.jobs.JobHandler;
import abrazar.casework.jobs.JobLifecycleEvent;
import abrazar.casework.jobs.JobType;
import abrazar.casework.jobs.QueueName;
import abrazar.casework.jobs.WorkerOptions;
import abrazar.casework.jobs.WorkerPool;
import io.opentelemetry.api.trace.Tracer;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds one {@link WorkerPool} per queue from the discovered {@link JobHandler} beans and owns their lifecycle.
 *
 * <p>
 * <b>Startup:</b> when the broker is available and {@code casework.workers.enabled} is true, handlers are grouped into
 * per-queue dispatch tables keyed by job type and every queue with at least one handler gets a running pool. Two
 * handlers claiming the same job type is a deployment error and fails startup.
 *
 * <p>
 * <b>Shutdown:</b> pools stop claiming and wait for running jobs up to the shutdown grace period.
 *
 * <p>
 * Lifecycle events of every job are fired as CDI {@link JobLifecycleEvent}s.
 */
@ApplicationScoped
public class WorkerSupervisor {

    private static final Logger LOG = Logger.getLogger(WorkerSupervisor.class);

    @Inject
    Instance<JobHandler> handlers;

    @Inject
    QueueManager queueManager;

    @Inject
    QueueConfig queueConfig;

    @Inject
    Event<JobLifecycleEvent> lifecycleEvents;

    @Inject
    Tracer tracer;

    @ConfigProperty(
            name = "casework.workers.enabled",
            defaultValue = "true")
    boolean enabled;

    Clock clock = Clock.systemUTC();

    private final Map<QueueName, WorkerPool> pools = new EnumMap<>(QueueName.class);

    void onStart(@Observes StartupEvent event) {
        if (!enabled) {
            LOG.info("Workers disabled by configuration");
            return;
        }
        if (!queueManager.isBrokerAvailable()) {
            LOG.warn("Broker unavailable at startup; no workers started");
            return;
        }

        Map<QueueName, Map<String, JobHandler>> tables = buildDispatchTables(handlers);
        for (Map.Entry<QueueName, Map<String, JobHandler>> entry : tables.entrySet()) {
            register(entry.getKey(), queueConfig.workerOptions(entry.getKey()), entry.getValue());
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        stopAll();
    }

    /**
     * Groups handlers by queue, keyed by job type.
     *
     * @throws IllegalStateException
     *             if two handlers claim the same job type
     */
    public static Map<QueueName, Map<String, JobHandler>> buildDispatchTables(Iterable<JobHandler> handlers) {
        Map<QueueName, Map<String, JobHandler>> tables = new EnumMap<>(QueueName.class);
        for (JobHandler handler : handlers) {
            for (JobType type : handler.handlesTypes()) {
                Map<String, JobHandler> table = tables.computeIfAbsent(type.getQueue(), q -> new HashMap<>());
                JobHandler previous = table.putIfAbsent(type.getKey(), handler);
                if (previous != null && previous != handler) {
                    throw new IllegalStateException("Job type " + type.getKey() + " is handled by both "
                            + previous.getClass().getName() + " and " + handler.getClass().getName());
                }
            }
        }
        return tables;
    }

    /**
     * Starts a worker pool for a queue, replacing any running one.
     */
    public synchronized WorkerPool register(QueueName queueName, WorkerOptions options,
            Map<String, JobHandler> dispatchTable) {
        WorkerPool existing = pools.remove(queueName);
        if (existing != null) {
            existing.close();
        }

        WorkerPool pool = new WorkerPool(queueManager.queue(queueName), options, dispatchTable, lifecycleEvents::fire,
                tracer, clock);
        pools.put(queueName, pool);
        pool.start();
        return pool;
    }

    public WorkerPool register(QueueName queueName, int concurrency, int rateLimitMax, Duration rateLimitWindow,
            Map<String, JobHandler> dispatchTable) {
        WorkerOptions options = queueConfig.workerOptions(queueName).withConcurrency(concurrency)
                .withRateLimit(rateLimitMax, rateLimitWindow);
        return register(queueName, options, dispatchTable);
    }

    public synchronized Optional<WorkerPool> pool(QueueName queueName) {
        return Optional.ofNullable(pools.get(queueName));
    }

    public synchronized Collection<WorkerPool> pools() {
        return List.copyOf(pools.values());
    }

    public synchronized void stopAll() {
        for (WorkerPool pool : pools.values()) {
            pool.close();
        }
        LOG.infof("Stopped %d worker pools", pools.size());
        pools.clear();
    }
}
