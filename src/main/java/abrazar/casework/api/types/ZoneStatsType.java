package abrazar.casework.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Case counts for one zone of a tenant.
 */
public record ZoneStatsType(@JsonProperty("zoneId") String zoneId, @JsonProperty("zoneName") String zoneName,
        @JsonProperty("totalCases") long totalCases, @JsonProperty("totalServicePoints") long totalServicePoints,
        @JsonProperty("emergencyCases") long emergencyCases, @JsonProperty("resolvedCases") long resolvedCases) {
}
