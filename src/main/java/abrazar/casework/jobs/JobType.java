package abrazar.casework.jobs;

import java.util.Arrays;
import java.util.Optional;

/**
 * Enumeration of all async job types with their queue assignments and default priorities.
 *
 * <p>
 * Each job type maps to exactly one {@link QueueName}. The {@link #getKey() key} is the {@code jobType} string stored
 * with every job and used by the worker pool to dispatch into its handler table. Lower priority values are dequeued
 * first among waiting jobs of the same queue.
 *
 * @see QueueName for queue descriptions
 * @see JobHandler for handler contract
 */
public enum JobType {

    // ========== RECOMPUTE-STATS QUEUE ==========

    /**
     * Recomputes one statistics view for a tenant and repopulates its cache key.
     * <p>
     * <b>Triggers:</b> cache invalidation after a mutation, stats producer every 30 minutes
     */
    RECALCULATE_STATS("recalculate-stats", QueueName.RECOMPUTE_STATS, 2, "Statistics view recomputation"),

    // ========== SEND-NOTIFICATION QUEUE ==========

    SEND_EMAIL("send-email", QueueName.SEND_NOTIFICATION, 1, "Single email"),

    /**
     * Sends one email per recipient in chunks of 10. Partial failures are reported, not retried.
     */
    SEND_BULK_EMAIL("send-bulk-email", QueueName.SEND_NOTIFICATION, 1, "Bulk email"),

    SEND_PUSH("send-push", QueueName.SEND_NOTIFICATION, 1, "Push notification to one user"),

    // ========== HOUSEKEEPING QUEUE ==========

    CLEANUP_SESSIONS("cleanup-sessions", QueueName.HOUSEKEEPING, 3, "Expired session cleanup"),

    CLEANUP_TOKENS("cleanup-tokens", QueueName.HOUSEKEEPING, 3, "Revoked/expired token cleanup"),

    CLEANUP_CACHE("cleanup-cache", QueueName.HOUSEKEEPING, 3, "Cache keys without TTL"),

    /**
     * Weekly (Sunday) audit log purge, 90 day retention with protected actions kept.
     */
    CLEANUP_LOGS("cleanup-logs", QueueName.HOUSEKEEPING, 3, "Audit log retention"),

    /**
     * Weekly (Sunday) case history purge for cases resolved over a year ago.
     */
    CLEANUP_HISTORY("cleanup-history", QueueName.HOUSEKEEPING, 3, "Case history retention"),

    CLEANUP_ALL("cleanup-all", QueueName.HOUSEKEEPING, 3, "Every housekeeping sub-type"),

    // ========== PROCESS-UPLOAD QUEUE ==========

    /**
     * Stores an uploaded image (max 800x800) and updates one media field on one entity.
     */
    PROCESS_IMAGE("process-image", QueueName.PROCESS_UPLOAD, 1, "Image upload"),

    PROCESS_DOCUMENT("process-document", QueueName.PROCESS_UPLOAD, 1, "Raw document upload"),

    DELETE_FILE("delete-file", QueueName.PROCESS_UPLOAD, 1, "Stored asset deletion");

    private final String key;
    private final QueueName queue;
    private final int defaultPriority;
    private final String description;

    JobType(String key, QueueName queue, int defaultPriority, String description) {
        this.key = key;
        this.queue = queue;
        this.defaultPriority = defaultPriority;
        this.description = description;
    }

    /**
     * Returns the {@code jobType} string stored with the job and used for dispatch.
     */
    public String getKey() {
        return key;
    }

    /**
     * Returns the queue this job type executes in.
     */
    public QueueName getQueue() {
        return queue;
    }

    public int getDefaultPriority() {
        return defaultPriority;
    }

    public String getDescription() {
        return description;
    }

    public static Optional<JobType> fromKey(String key) {
        return Arrays.stream(values()).filter(t -> t.key.equals(key)).findFirst();
    }

    /**
     * Returns the {@code cleanup-{type}} job type for a housekeeping sub-type.
     */
    public static JobType forHousekeeping(HousekeepingType type) {
        return switch (type) {
            case SESSIONS -> CLEANUP_SESSIONS;
            case TOKENS -> CLEANUP_TOKENS;
            case CACHE -> CLEANUP_CACHE;
            case LOGS -> CLEANUP_LOGS;
            case HISTORY -> CLEANUP_HISTORY;
            case ALL -> CLEANUP_ALL;
        };
    }
}
