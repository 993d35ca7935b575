package abrazar.casework.jobs;

import java.time.Duration;

/**
 * Explicit outcome of one job execution attempt.
 *
 * @param value
 *            handler return value (logged only), null unless completed
 * @param error
 *            failure message, null when completed
 */
public record JobRunResult(String jobId, String jobType, QueueName queue, Outcome outcome, int attempt, Object value,
        String error, Duration duration) {

    public enum Outcome {
        /** Handler returned normally. */
        COMPLETED,
        /** Transient failure with attempts left; the job is DELAYED. */
        RETRY_SCHEDULED,
        /** Permanent failure or attempts exhausted; the job is FAILED. */
        FAILED
    }

    public boolean isCompleted() {
        return outcome == Outcome.COMPLETED;
    }
}
