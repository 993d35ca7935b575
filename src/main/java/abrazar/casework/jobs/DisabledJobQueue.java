package abrazar.casework.jobs;

import abrazar.casework.api.types.JobHandleType;
import abrazar.casework.api.types.QueueStatsType;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Queue used when the broker was unreachable at startup.
 *
 * <p>
 * Enqueue logs a warning and returns the skipped sentinel; counts are zero and maintenance operations do nothing, so
 * callers never need to check broker status.
 */
public class DisabledJobQueue implements JobQueue {

    private static final Logger LOG = Logger.getLogger(DisabledJobQueue.class);

    private final QueueName name;

    public DisabledJobQueue(QueueName name) {
        this.name = name;
    }

    @Override
    public QueueName name() {
        return name;
    }

    @Override
    public boolean isLive() {
        return false;
    }

    @Override
    public JobHandleType enqueue(String jobType, Map<String, Object> payload, int priority) {
        LOG.warnf("Queue %s is disabled (broker unavailable). Job %s skipped.", name.getKey(), jobType);
        return JobHandleType.skipped(name.getKey(), jobType);
    }

    @Override
    public Optional<QueuedJob> claim() {
        return Optional.empty();
    }

    @Override
    public void complete(QueuedJob job) {
        LOG.debugf("Queue %s is disabled; ignoring completion of job %s", name.getKey(), job.id());
    }

    @Override
    public JobState fail(QueuedJob job, String error, boolean permanent) {
        LOG.debugf("Queue %s is disabled; ignoring failure of job %s", name.getKey(), job.id());
        return JobState.FAILED;
    }

    @Override
    public Optional<QueuedJob> getJob(String jobId) {
        return Optional.empty();
    }

    @Override
    public QueueStatsType getStats() {
        return QueueStatsType.empty(name.getKey());
    }

    @Override
    public int promoteDueJobs() {
        return 0;
    }

    @Override
    public int recoverStalled(Duration stalledTimeout) {
        return 0;
    }

    @Override
    public long drain() {
        return 0;
    }

    @Override
    public long clean(JobState state, Duration grace, int limit) {
        return 0;
    }

    @Override
    public void close() {
        // nothing to release
    }
}
