package abrazar.casework.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Outcome of one housekeeping job.
 *
 * @param type
 *            housekeeping sub-type that ran ({@code sessions}, ..., {@code all})
 * @param removed
 *            total records and keys removed
 * @param breakdown
 *            removed count per source (e.g. {@code sessions.store}, {@code sessions.keys})
 */
public record HousekeepingResultType(@JsonProperty("type") String type, @JsonProperty("removed") long removed,
        @JsonProperty("breakdown") Map<String, Long> breakdown) {
}
