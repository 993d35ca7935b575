package abrazar.casework.services;

import abrazar.casework.api.types.EmergencyStatsType;
import abrazar.casework.api.types.OverviewStatsType;
import abrazar.casework.api.types.ResponseTimeStatsType;
import abrazar.casework.api.types.StatusStatsType;
import abrazar.casework.api.types.TeamStatsType;
import abrazar.casework.api.types.UserActivityStatsType;
import abrazar.casework.api.types.UserCountStatsType;
import abrazar.casework.api.types.ZoneStatsType;
import abrazar.casework.data.repositories.StatisticsRepository;
import abrazar.casework.data.repositories.StatisticsRepository.EmergencyRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes statistics views for one tenant from the relational store.
 *
 * <p>
 * Pure read side: nothing here touches the cache. Used by the recompute-stats job handler and by cache-aside reads in
 * {@link StatisticsService} on a miss.
 */
@ApplicationScoped
public class StatisticsCalculator {

    static final Duration ACTIVITY_WINDOW = Duration.ofDays(30);

    private static final double MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

    @Inject
    StatisticsRepository statisticsRepository;

    Clock clock = Clock.systemUTC();

    /**
     * Computes any recomputable view.
     *
     * @throws IllegalArgumentException
     *             if the view is not recomputable
     */
    public Object compute(String tenantId, StatsView view) {
        return switch (view) {
            case OVERVIEW -> overview(tenantId);
            case ZONES -> zones(tenantId);
            case TEAMS -> teams(tenantId);
            case EMERGENCIES -> emergencies(tenantId);
            case USER_ACTIVITY -> userActivity(tenantId);
            default -> throw new IllegalArgumentException("Statistics view " + view.getKey() + " is not recomputable");
        };
    }

    public OverviewStatsType overview(String tenantId) {
        Map<String, Long> byStatus = new TreeMap<>(statisticsRepository.countCasesByStatus(tenantId));
        return new OverviewStatsType(statisticsRepository.countCases(tenantId), byStatus,
                statisticsRepository.countOpenEmergencyCases(tenantId), statisticsRepository.countResolvedCases(tenantId),
                statisticsRepository.countUsers(tenantId), statisticsRepository.countTeams(tenantId),
                statisticsRepository.countZones(tenantId), clock.instant());
    }

    public StatusStatsType status(String tenantId) {
        Map<String, Long> byStatus = new TreeMap<>(statisticsRepository.countCasesByStatus(tenantId));
        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();

        List<StatusStatsType.StatusCount> breakdown = new ArrayList<>();
        byStatus.forEach((status, count) -> breakdown.add(new StatusStatsType.StatusCount(status, count,
                total > 0 ? round2(count * 100.0 / total) : 0)));
        return new StatusStatsType(total, List.copyOf(breakdown));
    }

    /**
     * Average and median first-response time. The median of an even count is the upper middle value.
     */
    public ResponseTimeStatsType responseTime(String tenantId) {
        List<Duration> delays = new ArrayList<>(statisticsRepository.findFirstResponseDelays(tenantId));
        if (delays.isEmpty()) {
            return new ResponseTimeStatsType(0, 0, 0);
        }
        delays.sort(null);

        double totalHours = 0;
        for (Duration delay : delays) {
            totalHours += delay.toMillis() / MILLIS_PER_HOUR;
        }
        double medianHours = delays.get(delays.size() / 2).toMillis() / MILLIS_PER_HOUR;
        return new ResponseTimeStatsType(round2(totalHours / delays.size()), round2(medianHours), delays.size());
    }

    public UserCountStatsType userCount(String tenantId) {
        return new UserCountStatsType(statisticsRepository.countUsers(tenantId),
                new TreeMap<>(statisticsRepository.countUsersByRole(tenantId)));
    }

    public List<ZoneStatsType> zones(String tenantId) {
        return List.copyOf(statisticsRepository.findZoneStats(tenantId));
    }

    public List<TeamStatsType> teams(String tenantId) {
        return List.copyOf(statisticsRepository.findTeamStats(tenantId));
    }

    public EmergencyStatsType emergencies(String tenantId) {
        List<EmergencyRecord> emergencies = statisticsRepository.findEmergencies(tenantId);

        Map<String, long[]> counts = new LinkedHashMap<>();
        long resolved = 0;
        for (EmergencyRecord emergency : emergencies) {
            long[] levelCounts = counts.computeIfAbsent(emergency.level(), level -> new long[2]);
            if (emergency.resolved()) {
                levelCounts[0]++;
                resolved++;
            } else {
                levelCounts[1]++;
            }
        }

        Map<String, EmergencyStatsType.LevelCounts> byLevel = new LinkedHashMap<>();
        counts.forEach((level, c) -> byLevel.put(level, new EmergencyStatsType.LevelCounts(c[0] + c[1], c[0], c[1])));

        return new EmergencyStatsType(emergencies.size(), emergencies.size() - resolved, resolved, byLevel);
    }

    public UserActivityStatsType userActivity(String tenantId) {
        Instant since = clock.instant().minus(ACTIVITY_WINDOW);
        return new UserActivityStatsType("last_30_days",
                statisticsRepository.countDistinctCaseCreatorsSince(tenantId, since),
                statisticsRepository.countDistinctCaseUpdatersSince(tenantId, since),
                statisticsRepository.countDistinctCommentAuthorsSince(tenantId, since));
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
