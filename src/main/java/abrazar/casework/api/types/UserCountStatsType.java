package abrazar.casework.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record UserCountStatsType(@JsonProperty("totalUsers") long totalUsers,
        @JsonProperty("usersByRole") Map<String, Long> usersByRole) {
}
