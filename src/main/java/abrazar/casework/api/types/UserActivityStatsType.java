package abrazar.casework.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Distinct active users over the trailing window.
 *
 * @param period
 *            window label, {@code last_30_days}
 * @param casesCreated
 *            distinct users who created a case in the window
 * @param casesUpdated
 *            distinct users who updated a case in the window
 * @param commentsPosted
 *            distinct users who commented on a case in the window
 */
public record UserActivityStatsType(@JsonProperty("period") String period,
        @JsonProperty("casesCreated") long casesCreated, @JsonProperty("casesUpdated") long casesUpdated,
        @JsonProperty("commentsPosted") long commentsPosted) {
}
