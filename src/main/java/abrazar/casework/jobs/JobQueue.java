package abrazar.casework.jobs;

import abrazar.casework.api.types.JobHandleType;
import abrazar.casework.api.types.QueueStatsType;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * A named, priority-then-FIFO ordered job queue.
 *
 * <p>
 * Two implementations exist and one is selected per queue at startup by {@link JobQueues#create}:
 * <ul>
 * <li>{@link LiveJobQueue} - jobs persisted in the broker</li>
 * <li>{@link DisabledJobQueue} - broker unreachable at startup; every operation is a logged no-op</li>
 * </ul>
 *
 * <p>
 * <b>Error contract:</b> no method throws because of a broker failure. Enqueue returns the skipped sentinel, claims
 * return empty, counts return zero and maintenance operations report zero work done.
 */
public interface JobQueue extends AutoCloseable {

    QueueName name();

    /**
     * Returns true when jobs are actually persisted.
     */
    boolean isLive();

    /**
     * Appends a job in WAITING state. O(1) broker writes, never waits for processing.
     *
     * @param priority
     *            lower values are dequeued first; a hint, not a preemption
     * @return the job handle, or the skipped sentinel
     */
    JobHandleType enqueue(String jobType, Map<String, Object> payload, int priority);

    /**
     * Moves the most urgent WAITING job to ACTIVE and returns it. Due DELAYED jobs are promoted first.
     */
    Optional<QueuedJob> claim();

    /**
     * Marks an ACTIVE job COMPLETED and applies completed-job retention.
     */
    void complete(QueuedJob job);

    /**
     * Records a failed attempt.
     *
     * @param permanent
     *            skip remaining attempts
     * @return {@link JobState#DELAYED} when a retry was scheduled, {@link JobState#FAILED} otherwise
     */
    JobState fail(QueuedJob job, String error, boolean permanent);

    Optional<QueuedJob> getJob(String jobId);

    QueueStatsType getStats();

    /**
     * Moves DELAYED jobs whose backoff has elapsed back to WAITING.
     *
     * @return number of jobs promoted
     */
    int promoteDueJobs();

    /**
     * Returns ACTIVE jobs claimed longer ago than {@code stalledTimeout} to WAITING (or FAILED when their attempts are
     * exhausted). The abandoned attempt counts.
     *
     * @return number of jobs recovered
     */
    int recoverStalled(Duration stalledTimeout);

    /**
     * Removes all WAITING and DELAYED jobs.
     */
    long drain();

    /**
     * Removes up to {@code limit} COMPLETED or FAILED jobs finished more than {@code grace} ago.
     */
    long clean(JobState state, Duration grace, int limit);

    @Override
    void close();
}
