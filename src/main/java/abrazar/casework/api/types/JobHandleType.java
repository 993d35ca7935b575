package abrazar.casework.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Handle returned by every enqueue call.
 *
 * <p>
 * When the broker is unavailable (or the enqueue failed) the handle is the {@link #skipped(String, String)} sentinel:
 * {@code id} is {@value #SKIPPED_ID} and {@code skipped} is true. Callers on a mutation path may ignore the handle.
 *
 * @param id
 *            broker-assigned job id, or {@value #SKIPPED_ID}
 * @param queue
 *            queue wire name
 * @param jobType
 *            dispatch key of the job
 * @param skipped
 *            true when no job was written
 */
public record JobHandleType(@JsonProperty("id") String id, @JsonProperty("queue") String queue,
        @JsonProperty("jobType") String jobType, @JsonProperty("skipped") boolean skipped) {

    public static final String SKIPPED_ID = "skipped";

    public static JobHandleType enqueued(String id, String queue, String jobType) {
        return new JobHandleType(id, queue, jobType, false);
    }

    public static JobHandleType skipped(String queue, String jobType) {
        return new JobHandleType(SKIPPED_ID, queue, jobType, true);
    }
}
