package abrazar.casework.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Alert raised by the queue health check when a queue crosses a threshold.
 *
 * @param reason
 *            {@code failed} or {@code waiting}
 * @param count
 *            observed count
 * @param threshold
 *            configured threshold that was exceeded
 */
public record QueueAlertType(@JsonProperty("queue") String queue, @JsonProperty("reason") String reason,
        @JsonProperty("count") long count, @JsonProperty("threshold") long threshold) {

    public String message() {
        return "Queue " + queue + " has " + count + " " + reason + " jobs (threshold " + threshold + ")";
    }
}
