package abrazar.casework.services;

import abrazar.casework.api.types.EmergencyStatsType;
import abrazar.casework.api.types.JobHandleType;
import abrazar.casework.api.types.OverviewStatsType;
import abrazar.casework.api.types.ResponseTimeStatsType;
import abrazar.casework.api.types.StatusStatsType;
import abrazar.casework.api.types.TeamStatsType;
import abrazar.casework.api.types.UserActivityStatsType;
import abrazar.casework.api.types.UserCountStatsType;
import abrazar.casework.api.types.ZoneStatsType;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cache-aside access to tenant statistics and their invalidation.
 *
 * <p>
 * <b>Read path:</b> on a miss the view is computed synchronously, cached with a fresh TTL and returned. The first
 * reader after expiry pays the cost; reads never wait for a worker.
 *
 * <p>
 * <b>Invalidation:</b> after a tenant-scoped mutation has succeeded, {@link #invalidate(String)} deletes every view key
 * of the tenant and enqueues one recompute-stats job. Both steps are best effort and never throw into the mutation.
 *
 * <p>
 * <b>TTLs:</b> {@code casework.cache.stats-ttl-seconds} (default 1800) for all views except the volatile emergencies
 * view, which uses {@code casework.cache.volatile-stats-ttl-seconds} (default 60).
 */
@ApplicationScoped
public class StatisticsService {

    private static final Logger LOG = Logger.getLogger(StatisticsService.class);

    public static final String DOMAIN = "stats";

    private static final TypeReference<List<ZoneStatsType>> ZONE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<TeamStatsType>> TEAM_LIST = new TypeReference<>() {
    };

    @Inject
    CacheService cacheService;

    @Inject
    StatisticsCalculator statisticsCalculator;

    @Inject
    QueueManager queueManager;

    @ConfigProperty(
            name = "casework.cache.stats-ttl-seconds",
            defaultValue = "1800")
    long statsTtlSeconds;

    @ConfigProperty(
            name = "casework.cache.volatile-stats-ttl-seconds",
            defaultValue = "60")
    long volatileStatsTtlSeconds;

    public static String cacheKey(String tenantId, StatsView view) {
        return CacheService.generateKey(DOMAIN, tenantId, view.getKey());
    }

    public long ttlSeconds(StatsView view) {
        return view.isVolatileData() ? volatileStatsTtlSeconds : statsTtlSeconds;
    }

    public OverviewStatsType getOverview(String tenantId) {
        return readThrough(tenantId, StatsView.OVERVIEW, () -> cacheService
                .get(cacheKey(tenantId, StatsView.OVERVIEW), OverviewStatsType.class),
                () -> statisticsCalculator.overview(tenantId));
    }

    public StatusStatsType getStatusStats(String tenantId) {
        return readThrough(tenantId, StatsView.STATUS,
                () -> cacheService.get(cacheKey(tenantId, StatsView.STATUS), StatusStatsType.class),
                () -> statisticsCalculator.status(tenantId));
    }

    public ResponseTimeStatsType getResponseTimeStats(String tenantId) {
        return readThrough(tenantId, StatsView.RESPONSE_TIME,
                () -> cacheService.get(cacheKey(tenantId, StatsView.RESPONSE_TIME), ResponseTimeStatsType.class),
                () -> statisticsCalculator.responseTime(tenantId));
    }

    public UserCountStatsType getUserCount(String tenantId) {
        return readThrough(tenantId, StatsView.USER_COUNT,
                () -> cacheService.get(cacheKey(tenantId, StatsView.USER_COUNT), UserCountStatsType.class),
                () -> statisticsCalculator.userCount(tenantId));
    }

    public List<ZoneStatsType> getZoneStats(String tenantId) {
        return readThrough(tenantId, StatsView.ZONES,
                () -> cacheService.get(cacheKey(tenantId, StatsView.ZONES), ZONE_LIST),
                () -> statisticsCalculator.zones(tenantId));
    }

    public List<TeamStatsType> getTeamStats(String tenantId) {
        return readThrough(tenantId, StatsView.TEAMS,
                () -> cacheService.get(cacheKey(tenantId, StatsView.TEAMS), TEAM_LIST),
                () -> statisticsCalculator.teams(tenantId));
    }

    public EmergencyStatsType getEmergencyStats(String tenantId) {
        return readThrough(tenantId, StatsView.EMERGENCIES,
                () -> cacheService.get(cacheKey(tenantId, StatsView.EMERGENCIES), EmergencyStatsType.class),
                () -> statisticsCalculator.emergencies(tenantId));
    }

    public UserActivityStatsType getUserActivity(String tenantId) {
        return readThrough(tenantId, StatsView.USER_ACTIVITY,
                () -> cacheService.get(cacheKey(tenantId, StatsView.USER_ACTIVITY), UserActivityStatsType.class),
                () -> statisticsCalculator.userActivity(tenantId));
    }

    /**
     * Computes a view and writes it to the cache with a fresh TTL. Used by the recompute-stats job.
     *
     * @return the computed value
     */
    public Object recompute(String tenantId, StatsView view) {
        Object value = statisticsCalculator.compute(tenantId, view);
        cacheService.set(cacheKey(tenantId, view), value, ttlSeconds(view));
        return value;
    }

    /**
     * Drops every cached view of a tenant, then enqueues an overview recompute.
     *
     * @return the recompute job handle, or the skipped sentinel
     */
    public JobHandleType invalidate(String tenantId) {
        int deleted = 0;
        for (StatsView view : StatsView.values()) {
            if (cacheService.del(cacheKey(tenantId, view))) {
                deleted++;
            }
        }
        LOG.debugf("Invalidated %d cached stats views for tenant %s", deleted, tenantId);
        return queueManager.addStatsJob(tenantId, StatsView.OVERVIEW);
    }

    private <T> T readThrough(String tenantId, StatsView view, Supplier<Optional<T>> cached, Supplier<T> compute) {
        Optional<T> hit = cached.get();
        if (hit.isPresent()) {
            return hit.get();
        }
        T value = compute.get();
        cacheService.set(cacheKey(tenantId, view), value, ttlSeconds(view));
        LOG.debugf("Stats cache miss for %s; recomputed", cacheKey(tenantId, view));
        return value;
    }
}
