package abrazar.casework.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of a bulk email job. Individual recipient failures are counted, not retried.
 */
public record BulkNotificationResultType(@JsonProperty("total") int total, @JsonProperty("successful") int successful,
        @JsonProperty("failed") int failed, @JsonProperty("failedRecipients") List<String> failedRecipients) {
}
