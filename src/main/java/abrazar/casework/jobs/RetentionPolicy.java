package abrazar.casework.jobs;

import java.time.Duration;

/**
 * Bounds on how long finished jobs stay inspectable.
 *
 * <p>
 * Completed jobs are trimmed by age and by count, whichever bound is hit first. Failed jobs are trimmed by age only. A
 * non-positive count disables the count bound.
 */
public record RetentionPolicy(Duration completedMaxAge, int completedMaxCount, Duration failedMaxAge) {

    public static RetentionPolicy defaults() {
        return new RetentionPolicy(Duration.ofHours(24), 1000, Duration.ofDays(7));
    }
}
