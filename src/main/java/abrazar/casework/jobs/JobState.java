package abrazar.casework.jobs;

/**
 * Lifecycle state of a queued job.
 *
 * <p>
 * WAITING jobs are owned by the queue. A claim moves a job to ACTIVE and hands it to one worker until it reaches
 * COMPLETED, FAILED (terminal) or DELAYED (waiting out a retry backoff, then promoted back to WAITING).
 */
public enum JobState {
    WAITING, ACTIVE, DELAYED, COMPLETED, FAILED
}
