package abrazar.casework.jobs;

import java.time.Duration;

/**
 * Per-queue job defaults applied at enqueue time, plus retention and stall detection.
 *
 * @param maxAttempts
 *            attempts before a job is FAILED permanently
 * @param backoff
 *            delay policy between attempts
 * @param retention
 *            bounds for completed and failed jobs
 * @param stalledTimeout
 *            age of an ACTIVE claim after which the job is considered abandoned by a crashed worker
 */
public record QueueOptions(int maxAttempts, BackoffPolicy backoff, RetentionPolicy retention,
        Duration stalledTimeout) {

    public static QueueOptions defaults() {
        return new QueueOptions(3, BackoffPolicy.exponential(Duration.ofSeconds(2)), RetentionPolicy.defaults(),
                Duration.ofMinutes(10));
    }
}
