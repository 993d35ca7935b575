package abrazar.casework.data.repositories;

import abrazar.casework.api.types.TeamStatsType;
import abrazar.casework.api.types.ZoneStatsType;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregate queries backing the cached statistics views. Every query is scoped to one tenant.
 *
 * <p>
 * Implemented by the host application's persistence layer; failures surface as unchecked exceptions and make the
 * recompute job retry.
 */
public interface StatisticsRepository {

    /** Case status treated as resolved by every view. */
    String RESOLVED_STATUS = "RESOLVED";

    long countCases(String tenantId);

    /**
     * Case count per status; statuses without cases may be absent.
     */
    Map<String, Long> countCasesByStatus(String tenantId);

    /**
     * Emergency cases whose status is not {@value #RESOLVED_STATUS}.
     */
    long countOpenEmergencyCases(String tenantId);

    long countResolvedCases(String tenantId);

    long countUsers(String tenantId);

    /**
     * User count per role; roles without users may be absent.
     */
    Map<String, Long> countUsersByRole(String tenantId);

    long countTeams(String tenantId);

    long countZones(String tenantId);

    List<ZoneStatsType> findZoneStats(String tenantId);

    List<TeamStatsType> findTeamStats(String tenantId);

    List<EmergencyRecord> findEmergencies(String tenantId);

    long countDistinctCaseCreatorsSince(String tenantId, Instant since);

    long countDistinctCaseUpdatersSince(String tenantId, Instant since);

    long countDistinctCommentAuthorsSince(String tenantId, Instant since);

    /**
     * For every case that has left {@code REPORTED}, the time between its creation and its first status change to
     * another status. Cases still reported are not included.
     */
    List<Duration> findFirstResponseDelays(String tenantId);

    /**
     * One emergency attached to a case of the tenant.
     */
    record EmergencyRecord(String level, boolean resolved) {
    }
}
