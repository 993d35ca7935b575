package abrazar.casework.jobs;

import abrazar.casework.api.types.HousekeepingResultType;
import abrazar.casework.data.repositories.HousekeepingRepository;
import abrazar.casework.exceptions.PermanentJobFailureException;
import abrazar.casework.services.CacheService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Removes obsolete records and broker keys for every {@code cleanup-*} job type.
 *
 * <p>
 * <b>Sub-types</b> ({@code payload.type}):
 * <ul>
 * <li>{@code sessions} - expired or invalid sessions, plus {@code session:*} keys with no TTL or already expired</li>
 * <li>{@code tokens} - tokens expired or revoked more than 30 days ago, plus expired {@code token:blacklist:*} keys</li>
 * <li>{@code cache} - {@code stats:*}, {@code cache:*} and {@code temp:*} keys with no TTL or already expired</li>
 * <li>{@code logs} - audit rows older than 90 days, except protected actions</li>
 * <li>{@code history} - case history older than one year for cases resolved over a year ago</li>
 * <li>{@code all} - every sub-type above, the total is the sum</li>
 * </ul>
 *
 * <p>
 * Every sub-type only deletes rows and keys that are already obsolete, so it is safe to run concurrently with itself and
 * a second run with no new obsolete data removes nothing.
 */
@ApplicationScoped
public class HousekeepingJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(HousekeepingJobHandler.class);

    static final Duration REVOKED_TOKEN_RETENTION = Duration.ofDays(30);
    static final Duration AUDIT_LOG_RETENTION = Duration.ofDays(90);
    static final Duration CASE_HISTORY_RETENTION = Duration.ofDays(365);

    static final Set<String> PROTECTED_AUDIT_ACTIONS = Set.of("delete_user", "delete_organization",
            "security_breach");

    static final List<String> CACHE_KEY_PATTERNS = List.of("stats:*", "cache:*", "temp:*");

    @Inject
    HousekeepingRepository housekeepingRepository;

    @Inject
    CacheService cacheService;

    Clock clock = Clock.systemUTC();

    @Override
    public Set<JobType> handlesTypes() {
        return EnumSet.of(JobType.CLEANUP_SESSIONS, JobType.CLEANUP_TOKENS, JobType.CLEANUP_CACHE,
                JobType.CLEANUP_LOGS, JobType.CLEANUP_HISTORY, JobType.CLEANUP_ALL);
    }

    @Override
    public HousekeepingResultType execute(String jobId, Map<String, Object> payload) {
        String typeKey = JobPayloads.requireString(payload, "type");
        HousekeepingType type = HousekeepingType.fromKey(typeKey)
                .orElseThrow(() -> new PermanentJobFailureException("Unknown housekeeping type: " + typeKey));

        Map<String, Long> breakdown = new LinkedHashMap<>();
        Instant now = clock.instant();
        if (type == HousekeepingType.ALL) {
            for (HousekeepingType individual : HousekeepingType.INDIVIDUAL) {
                run(individual, now, breakdown);
            }
        } else {
            run(type, now, breakdown);
        }

        long removed = breakdown.values().stream().mapToLong(Long::longValue).sum();
        LOG.infof("Housekeeping %s removed %d entries (job %s): %s", type.getKey(), removed, jobId, breakdown);
        return new HousekeepingResultType(type.getKey(), removed, breakdown);
    }

    private void run(HousekeepingType type, Instant now, Map<String, Long> breakdown) {
        switch (type) {
            case SESSIONS -> {
                breakdown.put("sessions.store", housekeepingRepository.deleteExpiredSessions(now));
                breakdown.put("sessions.keys", cacheService.sweepExpiredKeys("session:*", true));
            }
            case TOKENS -> {
                breakdown.put("tokens.store",
                        housekeepingRepository.deleteObsoleteTokens(now, now.minus(REVOKED_TOKEN_RETENTION)));
                breakdown.put("tokens.keys", cacheService.sweepExpiredKeys("token:blacklist:*", false));
            }
            case CACHE -> {
                long keys = 0;
                for (String pattern : CACHE_KEY_PATTERNS) {
                    keys += cacheService.sweepExpiredKeys(pattern, true);
                }
                breakdown.put("cache.keys", keys);
            }
            case LOGS -> breakdown.put("logs.store",
                    housekeepingRepository.deleteAuditLogsBefore(now.minus(AUDIT_LOG_RETENTION),
                            PROTECTED_AUDIT_ACTIONS));
            case HISTORY -> breakdown.put("history.store",
                    housekeepingRepository.deleteResolvedCaseHistoryBefore(now.minus(CASE_HISTORY_RETENTION)));
            case ALL -> throw new IllegalArgumentException("ALL is expanded by the caller");
        }
    }
}
