package abrazar.casework.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-queue job counts by state.
 */
public record QueueStatsType(@JsonProperty("queue") String queue, @JsonProperty("waiting") long waiting,
        @JsonProperty("active") long active, @JsonProperty("completed") long completed,
        @JsonProperty("failed") long failed, @JsonProperty("delayed") long delayed, @JsonProperty("total") long total) {

    public static QueueStatsType of(String queue, long waiting, long active, long completed, long failed,
            long delayed) {
        return new QueueStatsType(queue, waiting, active, completed, failed, delayed,
                waiting + active + completed + failed + delayed);
    }

    public static QueueStatsType empty(String queue) {
        return new QueueStatsType(queue, 0, 0, 0, 0, 0, 0);
    }
}
