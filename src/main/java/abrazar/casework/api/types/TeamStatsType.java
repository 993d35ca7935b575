package abrazar.casework.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Membership and assigned-case counts for one team.
 */
public record TeamStatsType(@JsonProperty("teamId") String teamId, @JsonProperty("teamName") String teamName,
        @JsonProperty("totalMembers") long totalMembers, @JsonProperty("totalCases") long totalCases,
        @JsonProperty("emergencyCases") long emergencyCases, @JsonProperty("resolvedCases") long resolvedCases) {
}
