package abrazar.casework.jobs;

import java.util.Arrays;
import java.util.Optional;

/**
 * The four named job queues of the casework backend.
 *
 * <p>
 * Each queue has its own worker pool. Concurrency bounds how many jobs of the queue run at once, and the rate limit
 * caps how many jobs may <em>start</em> within a rolling window. Both hold simultaneously and both can be overridden
 * per queue under {@code casework.workers.<queue>.*}.
 *
 * @see JobType for job-to-queue assignments
 * @see abrazar.casework.config.QueueConfig for overrides
 */
public enum QueueName {

    /**
     * Recomputes cached statistics views for one tenant.
     * <p>
     * <b>Concurrency:</b> 2 workers, at most 10 starts per minute
     */
    RECOMPUTE_STATS("recompute-stats", 2, 10, "Cached statistics recomputation"),

    /**
     * Email and push notifications, single or bulk.
     * <p>
     * <b>Concurrency:</b> 3 workers, at most 50 starts per minute
     */
    SEND_NOTIFICATION("send-notification", 3, 50, "Email and push notification delivery"),

    /**
     * Periodic removal of expired sessions, tokens, cache keys, old audit logs and case history.
     * <p>
     * <b>Concurrency:</b> 3 workers, at most 3 starts per minute
     */
    HOUSEKEEPING("housekeeping", 3, 3, "Obsolete record and key cleanup"),

    /**
     * Asset storage for uploaded images and documents, and asset deletion.
     * <p>
     * <b>Concurrency:</b> 2 workers, at most 20 starts per minute
     */
    PROCESS_UPLOAD("process-upload", 2, 20, "Uploaded image/document processing");

    private final String key;
    private final int defaultConcurrency;
    private final int defaultRateLimitMax;
    private final String description;

    QueueName(String key, int defaultConcurrency, int defaultRateLimitMax, String description) {
        this.key = key;
        this.defaultConcurrency = defaultConcurrency;
        this.defaultRateLimitMax = defaultRateLimitMax;
        this.description = description;
    }

    /**
     * Returns the wire name used in broker keys and configuration ({@code recompute-stats}, ...).
     */
    public String getKey() {
        return key;
    }

    public int getDefaultConcurrency() {
        return defaultConcurrency;
    }

    /**
     * Returns the default number of job starts allowed per 60 second window.
     */
    public int getDefaultRateLimitMax() {
        return defaultRateLimitMax;
    }

    public String getDescription() {
        return description;
    }

    public static Optional<QueueName> fromKey(String key) {
        return Arrays.stream(values()).filter(q -> q.key.equals(key)).findFirst();
    }
}
