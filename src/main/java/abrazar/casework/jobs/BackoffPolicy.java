package abrazar.casework.jobs;

import java.time.Duration;

/**
 * Retry delay policy stored with every job.
 *
 * <p>
 * Exponential backoff doubles the base delay for each attempt already made: with a 2s base the retries wait 2s, 4s,
 * 8s.
 */
public record BackoffPolicy(Kind kind, long delayMillis) {

    private static final int MAX_SHIFT = 20;

    public enum Kind {
        FIXED, EXPONENTIAL
    }

    public static BackoffPolicy exponential(Duration baseDelay) {
        return new BackoffPolicy(Kind.EXPONENTIAL, baseDelay.toMillis());
    }

    public static BackoffPolicy fixed(Duration delay) {
        return new BackoffPolicy(Kind.FIXED, delay.toMillis());
    }

    /**
     * Returns the wait before the next attempt.
     *
     * @param attemptsMade
     *            attempts already made, including the one that just failed (1-indexed)
     */
    public Duration delayFor(int attemptsMade) {
        if (kind == Kind.FIXED) {
            return Duration.ofMillis(delayMillis);
        }
        int shift = Math.min(Math.max(attemptsMade - 1, 0), MAX_SHIFT);
        return Duration.ofMillis(delayMillis * (1L << shift));
    }
}
