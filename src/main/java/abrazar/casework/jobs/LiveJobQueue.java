package abrazar.casework.jobs;

import abrazar.casework.api.types.JobHandleType;
import abrazar.casework.api.types.QueueStatsType;
import abrazar.casework.broker.Broker;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Broker-backed job queue.
 *
 * <p>
 * <b>Key layout</b> (all under {@code queue:{name}:}):
 * <ul>
 * <li>{@code id} - counter used for job ids and FIFO order</li>
 * <li>{@code jobs} - hash of job id to job JSON</li>
 * <li>{@code waiting} - sorted set scored by {@code priority * 1e12 + sequence}</li>
 * <li>{@code active} - sorted set scored by claim time</li>
 * <li>{@code delayed} - sorted set scored by the time the retry becomes due</li>
 * <li>{@code completed}, {@code failed} - sorted sets scored by finish time, trimmed by the retention policy</li>
 * </ul>
 *
 * <p>
 * Claiming is a single ZPOPMIN, so two workers never receive the same WAITING job. Promotion of delayed jobs and
 * recovery of stalled jobs only proceed for the caller whose ZREM succeeded.
 *
 * <p>
 * <b>Moves between sets:</b> a job is always in at least one set. Completion and failure write the target set before
 * removing the job from {@code active}. When a claim, promotion or recovery fails after its pop or ZREM, the job is put
 * back into the set it came from.
 *
 * <p>
 * <b>Error contract:</b> broker failures are logged and converted to the skipped sentinel, empty claims and zero
 * counts. Nothing is thrown to callers.
 */
public class LiveJobQueue implements JobQueue {

    private static final Logger LOG = Logger.getLogger(LiveJobQueue.class);

    private static final double PRIORITY_SPAN = 1e12;
    private static final int MAX_PRIORITY = 1000;
    private static final int MAINTENANCE_BATCH = 100;

    private final QueueName name;
    private final QueueOptions options;
    private final Broker broker;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final String idKey;
    private final String jobsKey;
    private final String waitingKey;
    private final String activeKey;
    private final String delayedKey;
    private final String completedKey;
    private final String failedKey;

    private volatile boolean closed;

    public LiveJobQueue(QueueName name, QueueOptions options, Broker broker, ObjectMapper objectMapper, Clock clock) {
        this.name = name;
        this.options = options;
        this.broker = broker;
        this.objectMapper = objectMapper;
        this.clock = clock;

        String prefix = "queue:" + name.getKey() + ":";
        this.idKey = prefix + "id";
        this.jobsKey = prefix + "jobs";
        this.waitingKey = prefix + "waiting";
        this.activeKey = prefix + "active";
        this.delayedKey = prefix + "delayed";
        this.completedKey = prefix + "completed";
        this.failedKey = prefix + "failed";
    }

    @Override
    public QueueName name() {
        return name;
    }

    @Override
    public boolean isLive() {
        return !closed;
    }

    public QueueOptions options() {
        return options;
    }

    @Override
    public JobHandleType enqueue(String jobType, Map<String, Object> payload, int priority) {
        if (closed) {
            LOG.warnf("Queue %s is closed. Job %s skipped.", name.getKey(), jobType);
            return JobHandleType.skipped(name.getKey(), jobType);
        }

        try {
            long sequence = broker.increment(idKey);
            String id = String.valueOf(sequence);
            Map<String, Object> data = payload == null ? Map.of() : new LinkedHashMap<>(payload);
            QueuedJob job = QueuedJob.waiting(id, name, jobType, data, clampPriority(priority), options,
                    clock.instant());

            broker.hashPut(jobsKey, id, write(job));
            broker.sortedSetAdd(waitingKey, waitingScore(job.priority(), sequence), id);

            LOG.debugf("Enqueued job %s (type: %s, priority: %d) on queue %s", id, jobType, job.priority(),
                    name.getKey());
            return JobHandleType.enqueued(id, name.getKey(), jobType);

        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to enqueue job %s on queue %s; job skipped", jobType, name.getKey());
            return JobHandleType.skipped(name.getKey(), jobType);
        }
    }

    @Override
    public Optional<QueuedJob> claim() {
        if (closed) {
            return Optional.empty();
        }

        promoteDueJobs();

        while (true) {
            String id;
            try {
                id = broker.sortedSetPollFirst(waitingKey);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to claim job from queue %s", name.getKey());
                return Optional.empty();
            }
            if (id == null) {
                return Optional.empty();
            }

            QueuedJob stored = null;
            try {
                Instant now = clock.instant();
                broker.sortedSetAdd(activeKey, now.toEpochMilli(), id);
                Optional<QueuedJob> record = read(id);
                if (record.isEmpty()) {
                    broker.sortedSetRemove(activeKey, id);
                    continue;
                }

                stored = record.get();
                QueuedJob claimed = stored.claimed(now);
                broker.hashPut(jobsKey, id, write(claimed));
                return Optional.of(claimed);

            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to claim job %s from queue %s", id, name.getKey());
                // Popped from the head, so priority 0 keeps it there when the stored priority is unknown.
                int priority = stored == null ? 0 : stored.priority();
                returnTo(waitingKey, waitingScore(priority, sequenceOf(id)), id, activeKey);
                return Optional.empty();
            }
        }
    }

    @Override
    public void complete(QueuedJob job) {
        Instant now = clock.instant();
        try {
            QueuedJob completed = job.completed(now);
            broker.hashPut(jobsKey, job.id(), write(completed));
            broker.sortedSetAdd(completedKey, now.toEpochMilli(), job.id());
            broker.sortedSetRemove(activeKey, job.id());

            trim(completedKey, options.retention().completedMaxAge(), options.retention().completedMaxCount(), now);

        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to record completion of job %s on queue %s", job.id(), name.getKey());
        }
    }

    @Override
    public JobState fail(QueuedJob job, String error, boolean permanent) {
        boolean retry = !permanent && job.attemptsMade() + 1 < job.maxAttempts();
        try {
            JobState state = retry ? scheduleRetry(job, error) : markFailed(job, error, clock.instant());
            broker.sortedSetRemove(activeKey, job.id());
            return state;

        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to record failure of job %s on queue %s", job.id(), name.getKey());
            return retry ? JobState.DELAYED : JobState.FAILED;
        }
    }

    @Override
    public Optional<QueuedJob> getJob(String jobId) {
        try {
            return read(jobId);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to load job %s from queue %s", jobId, name.getKey());
            return Optional.empty();
        }
    }

    @Override
    public QueueStatsType getStats() {
        try {
            return QueueStatsType.of(name.getKey(), broker.sortedSetSize(waitingKey), broker.sortedSetSize(activeKey),
                    broker.sortedSetSize(completedKey), broker.sortedSetSize(failedKey),
                    broker.sortedSetSize(delayedKey));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to read stats for queue %s", name.getKey());
            return QueueStatsType.empty(name.getKey());
        }
    }

    @Override
    public int promoteDueJobs() {
        int promoted = 0;
        try {
            Collection<String> due = broker.sortedSetRangeByScore(delayedKey, Double.NEGATIVE_INFINITY,
                    clock.millis(), MAINTENANCE_BATCH);
            for (String id : due) {
                if (!broker.sortedSetRemove(delayedKey, id)) {
                    continue;
                }
                try {
                    Optional<QueuedJob> job = read(id);
                    if (job.isPresent()) {
                        requeue(job.get().requeued());
                        promoted++;
                    }
                } catch (RuntimeException e) {
                    returnTo(delayedKey, clock.millis(), id, null);
                    throw e;
                }
            }
            if (promoted > 0) {
                LOG.debugf("Promoted %d delayed jobs on queue %s", promoted, name.getKey());
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to promote delayed jobs on queue %s", name.getKey());
        }
        return promoted;
    }

    @Override
    public int recoverStalled(Duration stalledTimeout) {
        int recovered = 0;
        try {
            Instant now = clock.instant();
            Collection<String> stalled = broker.sortedSetRangeByScore(activeKey, Double.NEGATIVE_INFINITY,
                    now.minus(stalledTimeout).toEpochMilli(), MAINTENANCE_BATCH);
            for (String id : stalled) {
                if (!broker.sortedSetRemove(activeKey, id)) {
                    continue;
                }
                try {
                    if (recover(id, now)) {
                        recovered++;
                    }
                } catch (RuntimeException e) {
                    returnTo(activeKey, now.minus(stalledTimeout).toEpochMilli(), id, null);
                    throw e;
                }
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to recover stalled jobs on queue %s", name.getKey());
        }
        return recovered;
    }

    @Override
    public long drain() {
        try {
            long removed = removeAll(waitingKey) + removeAll(delayedKey);
            LOG.infof("Drained %d pending jobs from queue %s", removed, name.getKey());
            return removed;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to drain queue %s", name.getKey());
            return 0;
        }
    }

    @Override
    public long clean(JobState state, Duration grace, int limit) {
        String setKey = switch (state) {
            case COMPLETED -> completedKey;
            case FAILED -> failedKey;
            default -> throw new IllegalArgumentException("Only COMPLETED and FAILED jobs can be cleaned: " + state);
        };

        try {
            Collection<String> ids = broker.sortedSetRangeByScore(setKey, Double.NEGATIVE_INFINITY,
                    clock.instant().minus(grace).toEpochMilli(), limit);
            return removeIds(setKey, ids);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to clean %s jobs on queue %s", state, name.getKey());
            return 0;
        }
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            LOG.infof("Queue %s closed", name.getKey());
        }
    }

    private boolean recover(String id, Instant now) {
        Optional<QueuedJob> job = read(id);
        if (job.isEmpty()) {
            return false;
        }

        QueuedJob abandoned = job.get();
        if (abandoned.state() != JobState.ACTIVE) {
            return reconcile(abandoned, now);
        }

        String error = "Job stalled: claimed at " + abandoned.processedAt() + " and never finished";
        if (abandoned.attemptsMade() + 1 < abandoned.maxAttempts()) {
            requeue(abandoned.retrying(error).requeued());
        } else {
            markFailed(abandoned, error, now);
        }
        LOG.warnf("Recovered stalled job %s (type: %s) on queue %s", id, abandoned.jobType(), name.getKey());
        return true;
    }

    /**
     * Puts a job found in {@code active} without an ACTIVE record back into the set its record names.
     *
     * @return true when the job went back to waiting
     */
    private boolean reconcile(QueuedJob job, Instant now) {
        switch (job.state()) {
            case WAITING -> {
                // The claim was never recorded; no attempt ran.
                requeue(job);
                LOG.warnf("Returned unclaimed job %s on queue %s to waiting", job.id(), name.getKey());
                return true;
            }
            case DELAYED -> broker.sortedSetAdd(delayedKey, now.toEpochMilli(), job.id());
            case COMPLETED -> broker.sortedSetAdd(completedKey, finishedMillis(job, now), job.id());
            case FAILED -> broker.sortedSetAdd(failedKey, finishedMillis(job, now), job.id());
            default -> throw new IllegalStateException("Job " + job.id() + " is unexpectedly " + job.state());
        }
        LOG.debugf("Job %s on queue %s was left in active while %s", job.id(), name.getKey(), job.state());
        return false;
    }

    private static long finishedMillis(QueuedJob job, Instant now) {
        return (job.finishedAt() == null ? now : job.finishedAt()).toEpochMilli();
    }

    /**
     * Puts a job back into the set it was taken from, then removes it from {@code leftKey} when given.
     */
    private void returnTo(String setKey, double score, String id, String leftKey) {
        try {
            broker.sortedSetAdd(setKey, score, id);
            if (leftKey != null) {
                broker.sortedSetRemove(leftKey, id);
            }
            LOG.warnf("Job %s on queue %s returned to %s after a broker error", id, name.getKey(), setKey);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Job %s on queue %s could not be returned to %s", id, name.getKey(), setKey);
        }
    }

    private JobState scheduleRetry(QueuedJob job, String error) {
        QueuedJob delayed = job.retrying(error);
        Duration wait = delayed.backoff().delayFor(delayed.attemptsMade());
        broker.hashPut(jobsKey, job.id(), write(delayed));
        broker.sortedSetAdd(delayedKey, clock.millis() + wait.toMillis(), job.id());
        return JobState.DELAYED;
    }

    private JobState markFailed(QueuedJob job, String error, Instant now) {
        broker.hashPut(jobsKey, job.id(), write(job.failed(error, now)));
        broker.sortedSetAdd(failedKey, now.toEpochMilli(), job.id());
        trim(failedKey, options.retention().failedMaxAge(), 0, now);
        return JobState.FAILED;
    }

    private void requeue(QueuedJob job) {
        broker.hashPut(jobsKey, job.id(), write(job));
        broker.sortedSetAdd(waitingKey, waitingScore(job.priority(), sequenceOf(job.id())), job.id());
    }

    private void trim(String setKey, Duration maxAge, int maxCount, Instant now) {
        if (maxAge != null) {
            removeIds(setKey, broker.sortedSetRangeByScore(setKey, Double.NEGATIVE_INFINITY,
                    now.minus(maxAge).toEpochMilli(), MAINTENANCE_BATCH));
        }
        if (maxCount > 0) {
            int size = broker.sortedSetSize(setKey);
            if (size > maxCount) {
                removeIds(setKey, broker.sortedSetRangeByRank(setKey, 0, size - maxCount - 1));
            }
        }
    }

    private long removeAll(String setKey) {
        long removed = 0;
        Collection<String> batch = broker.sortedSetRangeByRank(setKey, 0, MAINTENANCE_BATCH - 1);
        while (!batch.isEmpty()) {
            long removedInBatch = removeIds(setKey, batch);
            removed += removedInBatch;
            if (removedInBatch == 0) {
                break;
            }
            batch = broker.sortedSetRangeByRank(setKey, 0, MAINTENANCE_BATCH - 1);
        }
        return removed;
    }

    private long removeIds(String setKey, Collection<String> ids) {
        long removed = 0;
        for (String id : ids) {
            if (broker.sortedSetRemove(setKey, id)) {
                broker.hashDelete(jobsKey, id);
                removed++;
            }
        }
        return removed;
    }

    private Optional<QueuedJob> read(String id) {
        String json = broker.hashGet(jobsKey, id);
        if (json == null) {
            LOG.warnf("Job %s on queue %s has no stored record; dropping it", id, name.getKey());
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, QueuedJob.class));
        } catch (JsonProcessingException e) {
            LOG.errorf(e, "Job %s on queue %s has an unreadable record; moving it to failed", id, name.getKey());
            broker.sortedSetAdd(failedKey, clock.millis(), id);
            return Optional.empty();
        }
    }

    private String write(QueuedJob job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job " + job.id() + " payload is not serializable", e);
        }
    }

    private static long sequenceOf(String id) {
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static int clampPriority(int priority) {
        return Math.max(0, Math.min(priority, MAX_PRIORITY));
    }

    private static double waitingScore(int priority, long sequence) {
        return priority * PRIORITY_SPAN + sequence;
    }
}
