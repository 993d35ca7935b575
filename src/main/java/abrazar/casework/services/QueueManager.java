package abrazar.casework.services;

import abrazar.casework.api.types.JobHandleType;
import abrazar.casework.api.types.QueueStatsType;
import abrazar.casework.broker.BrokerConnection;
import abrazar.casework.config.QueueConfig;
import abrazar.casework.jobs.HousekeepingType;
import abrazar.casework.jobs.JobQueue;
import abrazar.casework.jobs.JobQueues;
import abrazar.casework.jobs.JobState;
import abrazar.casework.jobs.JobType;
import abrazar.casework.jobs.QueueName;
import abrazar.casework.jobs.QueueOptions;
import abrazar.casework.jobs.QueuedJob;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the four job queues and is the only enqueue entry point for the rest of the backend.
 *
 * <p>
 * Queues are created once, when this bean is constructed, from the startup broker probe: all live or all disabled.
 * Callers inject this bean instead of reaching for a global registry and never check broker status: every enqueue
 * method returns a {@link JobHandleType}, which is the skipped sentinel when the job could not be written.
 *
 * <p>
 * <b>Enqueue helpers and default priorities</b> (lower runs first):
 * <ul>
 * <li>{@link #addStatsJob} - priority 2</li>
 * <li>{@link #addEmailJob}, {@link #addBulkEmailJob}, {@link #addPushJob} - priority 1</li>
 * <li>{@link #addHousekeepingJob} - priority 3, job type {@code cleanup-{type}}</li>
 * <li>{@link #addUploadJob} - priority 1</li>
 * </ul>
 *
 * @see JobQueues for live/disabled selection
 * @see WorkerSupervisor for the consuming side
 */
@ApplicationScoped
public class QueueManager {

    private static final Logger LOG = Logger.getLogger(QueueManager.class);

    private static final int CLEAN_LIMIT = 10_000;

    private final Map<QueueName, JobQueue> queues;
    private final boolean brokerAvailable;

    @Inject
    public QueueManager(BrokerConnection brokerConnection, QueueConfig queueConfig, ObjectMapper objectMapper) {
        this(brokerConnection, queueConfig.queueOptions(), objectMapper, Clock.systemUTC());
    }

    public QueueManager(BrokerConnection brokerConnection, QueueOptions options, ObjectMapper objectMapper,
            Clock clock) {
        Map<QueueName, JobQueue> created = new EnumMap<>(QueueName.class);
        for (QueueName name : QueueName.values()) {
            created.put(name, JobQueues.create(name, options, brokerConnection, objectMapper, clock));
        }
        this.queues = created;
        this.brokerAvailable = brokerConnection.isAvailable();
        LOG.infof("Initialized %d job queues (%s)", queues.size(), brokerAvailable ? "live" : "disabled");
    }

    public boolean isBrokerAvailable() {
        return brokerAvailable;
    }

    public JobQueue queue(QueueName name) {
        return queues.get(name);
    }

    /**
     * Appends a job to a queue. Never throws into the caller.
     *
     * @return the job handle, or the skipped sentinel
     */
    public JobHandleType enqueue(QueueName queueName, String jobType, Map<String, Object> payload, int priority) {
        try {
            return queues.get(queueName).enqueue(jobType, payload, priority);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected error enqueuing %s on queue %s; job skipped", jobType, queueName.getKey());
            return JobHandleType.skipped(queueName.getKey(), jobType);
        }
    }

    public JobHandleType enqueue(JobType jobType, Map<String, Object> payload) {
        return enqueue(jobType, payload, jobType.getDefaultPriority());
    }

    public JobHandleType enqueue(JobType jobType, Map<String, Object> payload, int priority) {
        return enqueue(jobType.getQueue(), jobType.getKey(), payload, priority);
    }

    /**
     * Enqueues a recompute of one statistics view for one tenant.
     */
    public JobHandleType addStatsJob(String tenantId, StatsView view) {
        if (tenantId == null || tenantId.isBlank()) {
            LOG.warnf("Stats job for view %s has no tenant id; job skipped", view.getKey());
            return JobHandleType.skipped(QueueName.RECOMPUTE_STATS.getKey(), JobType.RECALCULATE_STATS.getKey());
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(QueuedJob.TENANT_ID, tenantId);
        payload.put("type", view.getKey());
        return enqueue(JobType.RECALCULATE_STATS, payload);
    }

    /**
     * Enqueues a single email. Expected fields: {@code to}, {@code subject}, and either {@code template} with
     * {@code data} or a literal {@code body}.
     */
    public JobHandleType addEmailJob(Map<String, Object> email) {
        return enqueue(JobType.SEND_EMAIL, email);
    }

    public JobHandleType addBulkEmailJob(List<Map<String, Object>> recipients, String subject, String template,
            Map<String, Object> templateData) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("recipients", recipients);
        payload.put("subject", subject);
        payload.put("template", template);
        payload.put("templateData", templateData == null ? Map.of() : templateData);
        return enqueue(JobType.SEND_BULK_EMAIL, payload);
    }

    public JobHandleType addPushJob(String userId, String title, String body, Map<String, Object> data) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("userId", userId);
        payload.put("title", title);
        payload.put("body", body);
        payload.put("data", data == null ? Map.of() : data);
        return enqueue(JobType.SEND_PUSH, payload);
    }

    public JobHandleType addHousekeepingJob(HousekeepingType type) {
        return enqueue(JobType.forHousekeeping(type), Map.of("type", type.getKey()));
    }

    /**
     * Enqueues an upload job ({@code process-image}, {@code process-document} or {@code delete-file}). Image jobs
     * update a tenant-scoped record and are skipped without a {@code tenantId}.
     */
    public JobHandleType addUploadJob(JobType jobType, Map<String, Object> payload) {
        if (jobType.getQueue() != QueueName.PROCESS_UPLOAD) {
            LOG.warnf("Job type %s does not belong to the upload queue; job skipped", jobType.getKey());
            return JobHandleType.skipped(QueueName.PROCESS_UPLOAD.getKey(), jobType.getKey());
        }
        Object tenantId = payload == null ? null : payload.get(QueuedJob.TENANT_ID);
        if (jobType == JobType.PROCESS_IMAGE && (!(tenantId instanceof String tenant) || tenant.isBlank())) {
            LOG.warn("Image upload job has no tenant id; job skipped");
            return JobHandleType.skipped(QueueName.PROCESS_UPLOAD.getKey(), jobType.getKey());
        }
        return enqueue(jobType, payload);
    }

    /**
     * Returns counts for every queue, keyed by queue wire name. All zero when the broker is unavailable.
     */
    public Map<String, QueueStatsType> getQueuesStats() {
        Map<String, QueueStatsType> stats = new LinkedHashMap<>();
        for (QueueName name : QueueName.values()) {
            stats.put(name.getKey(), getQueueStats(name));
        }
        return stats;
    }

    public QueueStatsType getQueueStats(QueueName name) {
        return queues.get(name).getStats();
    }

    /**
     * Removes pending jobs and finished-job history from every queue. Test and operations helper.
     */
    public void cleanAllQueues() {
        for (JobQueue queue : queues.values()) {
            long drained = queue.drain();
            long completed = queue.clean(JobState.COMPLETED, Duration.ZERO, CLEAN_LIMIT);
            long failed = queue.clean(JobState.FAILED, Duration.ZERO, CLEAN_LIMIT);
            LOG.infof("Cleaned queue %s (pending: %d, completed: %d, failed: %d)", queue.name().getKey(), drained,
                    completed, failed);
        }
    }

    @PreDestroy
    public void closeAllQueues() {
        for (JobQueue queue : queues.values()) {
            queue.close();
        }
        LOG.info("All job queues closed");
    }
}
