package abrazar.casework.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Tenant-wide case overview ({@code stats:{tenantId}:overview}).
 *
 * @param casesByStatus
 *            case count per status name; statuses without cases are absent
 * @param emergencyCases
 *            emergency cases not yet resolved
 */
public record OverviewStatsType(@JsonProperty("totalCases") long totalCases,
        @JsonProperty("casesByStatus") Map<String, Long> casesByStatus,
        @JsonProperty("emergencyCases") long emergencyCases, @JsonProperty("resolvedCases") long resolvedCases,
        @JsonProperty("totalUsers") long totalUsers, @JsonProperty("totalTeams") long totalTeams,
        @JsonProperty("totalZones") long totalZones, @JsonProperty("calculatedAt") Instant calculatedAt) {
}
