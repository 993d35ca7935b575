package abrazar.casework.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Time from case creation to the first status change out of {@code REPORTED}, in hours with two decimals.
 *
 * @param totalCasesWithResponse
 *            cases that have left {@code REPORTED}; zero means both averages are zero
 */
public record ResponseTimeStatsType(@JsonProperty("averageResponseHours") double averageResponseHours,
        @JsonProperty("medianResponseHours") double medianResponseHours,
        @JsonProperty("totalCasesWithResponse") long totalCasesWithResponse) {
}
