package abrazar.casework.jobs;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Discriminator for housekeeping jobs ({@code payload.type}).
 */
public enum HousekeepingType {

    SESSIONS("sessions"),
    TOKENS("tokens"),
    CACHE("cache"),
    LOGS("logs"),
    HISTORY("history"),
    ALL("all");

    /** Sub-types run by {@link #ALL}, in order. */
    public static final List<HousekeepingType> INDIVIDUAL = List.of(SESSIONS, TOKENS, CACHE, LOGS, HISTORY);

    private final String key;

    HousekeepingType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<HousekeepingType> fromKey(String key) {
        return Arrays.stream(values()).filter(t -> t.key.equals(key)).findFirst();
    }
}
