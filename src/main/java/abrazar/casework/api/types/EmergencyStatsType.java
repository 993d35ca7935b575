package abrazar.casework.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Emergency counts for a tenant, overall and per emergency level.
 *
 * <p>
 * This view is volatile and is cached with a short TTL.
 */
public record EmergencyStatsType(@JsonProperty("totalEmergencies") long totalEmergencies,
        @JsonProperty("activeEmergencies") long activeEmergencies,
        @JsonProperty("resolvedEmergencies") long resolvedEmergencies,
        @JsonProperty("byLevel") Map<String, LevelCounts> byLevel) {

    /**
     * Counts for one emergency level.
     */
    public record LevelCounts(@JsonProperty("total") long total, @JsonProperty("resolved") long resolved,
            @JsonProperty("active") long active) {
    }
}
