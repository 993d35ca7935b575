package abrazar.casework.services;

import java.util.Arrays;
import java.util.Optional;

/**
 * Fixed enumeration of cached statistics views, one cache key per tenant and view ({@code stats:{tenantId}:{view}}).
 *
 * <p>
 * Every view is deleted on invalidation. Only recomputable views can be produced by a recompute-stats job; the others
 * are written by request-path reads.
 */
public enum StatsView {

    OVERVIEW("overview", true, false),
    STATUS("status", false, false),
    ZONES("zones", true, false),
    TEAMS("teams", true, false),
    /** Short TTL: emergency counts change minute to minute. */
    EMERGENCIES("emergencies", true, true),
    RESPONSE_TIME("response-time", false, false),
    USER_ACTIVITY("user-activity", true, false),
    USER_COUNT("user-count", false, false);

    private final String key;
    private final boolean recomputable;
    private final boolean volatileData;

    StatsView(String key, boolean recomputable, boolean volatileData) {
        this.key = key;
        this.recomputable = recomputable;
        this.volatileData = volatileData;
    }

    public String getKey() {
        return key;
    }

    public boolean isRecomputable() {
        return recomputable;
    }

    public boolean isVolatileData() {
        return volatileData;
    }

    public static Optional<StatsView> fromKey(String key) {
        return Arrays.stream(values()).filter(v -> v.key.equals(key)).findFirst();
    }
}
