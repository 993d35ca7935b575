package abrazar.casework.data.repositories;

import java.time.Instant;
import java.util.Set;

/**
 * Bulk deletions run by housekeeping jobs. Implemented by the host application's persistence layer.
 *
 * <p>
 * Every method must be idempotent: running it again with no new obsolete rows deletes nothing and returns 0.
 */
public interface HousekeepingRepository {

    /**
     * Deletes sessions that expired before {@code now} or were invalidated.
     *
     * @return rows deleted
     */
    long deleteExpiredSessions(Instant now);

    /**
     * Deletes tokens that expired before {@code now} or were revoked before {@code revokedBefore}.
     *
     * @return rows deleted
     */
    long deleteObsoleteTokens(Instant now, Instant revokedBefore);

    /**
     * Deletes audit log rows created before {@code cutoff}, except rows whose action is in
     * {@code protectedActions}.
     *
     * @return rows deleted
     */
    long deleteAuditLogsBefore(Instant cutoff, Set<String> protectedActions);

    /**
     * Deletes case history rows created before {@code cutoff} for cases resolved and last updated before
     * {@code cutoff}.
     *
     * @return rows deleted
     */
    long deleteResolvedCaseHistoryBefore(Instant cutoff);
}
