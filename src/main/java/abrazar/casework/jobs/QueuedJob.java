package abrazar.casework.jobs;

import java.time.Instant;
import java.util.Map;

/**
 * A job as persisted in the broker (JSON, one hash field per job id).
 *
 * <p>
 * Instances are immutable; each state transition produces a copy through the {@code claimed/retrying/completed/failed}
 * methods and the queue writes the copy back.
 *
 * @param priority
 *            lower values are dequeued first among waiting jobs
 * @param attemptsMade
 *            finished attempts so far, never greater than {@code maxAttempts}
 */
public record QueuedJob(String id, QueueName queueName, String jobType, Map<String, Object> payload, int priority,
        int attemptsMade, int maxAttempts, BackoffPolicy backoff, JobState state, String lastError, Instant enqueuedAt,
        Instant processedAt, Instant finishedAt) {

    public static final String TENANT_ID = "tenantId";

    public static QueuedJob waiting(String id, QueueName queueName, String jobType, Map<String, Object> payload,
            int priority, QueueOptions options, Instant now) {
        return new QueuedJob(id, queueName, jobType, payload, priority, 0, options.maxAttempts(), options.backoff(),
                JobState.WAITING, null, now, null, null);
    }

    /**
     * Returns the tenant this job is scoped to, or null for tenant-independent jobs.
     */
    public String tenantId() {
        Object value = payload == null ? null : payload.get(TENANT_ID);
        return value == null ? null : value.toString();
    }

    /**
     * Returns the 1-indexed number of the attempt currently running (or about to run).
     */
    public int currentAttempt() {
        return attemptsMade + 1;
    }

    public QueuedJob claimed(Instant now) {
        return withState(JobState.ACTIVE, attemptsMade, lastError, now, null);
    }

    public QueuedJob retrying(String error) {
        return withState(JobState.DELAYED, attemptsMade + 1, error, processedAt, null);
    }

    public QueuedJob requeued() {
        return withState(JobState.WAITING, attemptsMade, lastError, processedAt, null);
    }

    public QueuedJob completed(Instant now) {
        return withState(JobState.COMPLETED, attemptsMade + 1, lastError, processedAt, now);
    }

    public QueuedJob failed(String error, Instant now) {
        return withState(JobState.FAILED, Math.min(attemptsMade + 1, maxAttempts), error, processedAt, now);
    }

    private QueuedJob withState(JobState newState, int attempts, String error, Instant processed, Instant finished) {
        return new QueuedJob(id, queueName, jobType, payload, priority, attempts, maxAttempts, backoff, newState, error,
                enqueuedAt, processed, finished);
    }
}
