package abrazar.casework.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Case counts per status with each status's share of the total.
 */
public record StatusStatsType(@JsonProperty("total") long total,
        @JsonProperty("breakdown") List<StatusCount> breakdown) {

    /**
     * @param percentage
     *            share of all cases, 0-100 with two decimals
     */
    public record StatusCount(@JsonProperty("status") String status, @JsonProperty("count") long count,
            @JsonProperty("percentage") double percentage) {
    }
}
