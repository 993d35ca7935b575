package abrazar.casework.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import abrazar.casework.TestFixtures;
import abrazar.casework.api.types.HousekeepingResultType;
import abrazar.casework.data.repositories.HousekeepingRepository;
import abrazar.casework.exceptions.PermanentJobFailureException;
import abrazar.casework.services.TestServices;
import abrazar.casework.testing.InMemoryBroker;
import abrazar.casework.testing.MutableClock;

/**
 * Unit tests for {@link HousekeepingJobHandler}.
 */
class HousekeepingJobHandlerTest {

    private MutableClock clock;
    private InMemoryBroker broker;
    private FakeHousekeepingRepository repository;
    private HousekeepingJobHandler handler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestFixtures.T0);
        broker = new InMemoryBroker(clock);
        repository = new FakeHousekeepingRepository();

        handler = new HousekeepingJobHandler();
        handler.housekeepingRepository = repository;
        handler.cacheService = TestServices.cacheService(TestFixtures.connection(broker));
        handler.clock = clock;
    }

    @Test
    void testHandlesTypes_coversEveryCleanupType() {
        assertEquals(6, handler.handlesTypes().size());
        assertTrue(handler.handlesTypes().contains(JobType.CLEANUP_ALL));
    }

    @Test
    void testSessions_removesStoreRowsAndStaleKeys() {
        repository.expiredSessions = 4;
        broker.putPersistent("session:abandoned", "{}");
        broker.set("session:live", "{}", Duration.ofHours(1));
        broker.set("session:expired", "{}", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));

        HousekeepingResultType result = handler.execute("1", Map.of("type", "sessions"));

        assertEquals("sessions", result.type());
        assertEquals(5, result.removed());
        assertEquals(4L, result.breakdown().get("sessions.store"));
        assertEquals(1L, result.breakdown().get("sessions.keys"));
        assertEquals("{}", broker.get("session:live"));
        assertNull(broker.get("session:abandoned"));
    }

    @Test
    void testTokens_keepsPersistentBlacklistEntries() {
        repository.obsoleteTokens = 2;
        broker.putPersistent("token:blacklist:permanent", "1");
        broker.set("token:blacklist:old", "1", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(5));

        HousekeepingResultType result = handler.execute("1", Map.of("type", "tokens"));

        assertEquals(2, result.removed());
        assertEquals("1", broker.get("token:blacklist:permanent"));
        assertEquals(TestFixtures.T0.plusSeconds(5).minus(Duration.ofDays(30)), repository.revokedBefore);
    }

    @Test
    void testCache_sweepsKeysWithoutTtl() {
        broker.putPersistent("stats:T1:overview", "{}");
        broker.putPersistent("temp:upload", "x");
        broker.set("cache:fresh", "x", Duration.ofMinutes(5));

        HousekeepingResultType result = handler.execute("1", Map.of("type", "cache"));

        assertEquals(2, result.removed());
        assertNull(broker.get("stats:T1:overview"));
        assertEquals("x", broker.get("cache:fresh"));
    }

    @Test
    void testLogs_protectsSecurityActions() {
        repository.auditLogs = 7;

        HousekeepingResultType result = handler.execute("1", Map.of("type", "logs"));

        assertEquals(7, result.removed());
        assertEquals(Set.of("delete_user", "delete_organization", "security_breach"), repository.protectedActions);
        assertEquals(TestFixtures.T0.minus(Duration.ofDays(90)), repository.auditCutoff);
    }

    @Test
    void testAll_sumsEverySubType() {
        repository.expiredSessions = 1;
        repository.obsoleteTokens = 2;
        repository.auditLogs = 3;
        repository.caseHistory = 4;
        broker.putPersistent("cache:orphan", "x");

        HousekeepingResultType result = handler.execute("1", Map.of("type", "all"));

        assertEquals(11, result.removed());
        assertEquals(4L, result.breakdown().get("history.store"));
    }

    @Test
    void testAll_secondRunRemovesNothing() {
        repository.expiredSessions = 5;
        repository.caseHistory = 2;
        broker.putPersistent("session:stale", "{}");

        assertEquals(8, handler.execute("1", Map.of("type", "all")).removed());
        assertEquals(0, handler.execute("2", Map.of("type", "all")).removed());
    }

    @Test
    void testUnknownType_failsPermanently() {
        assertThrows(PermanentJobFailureException.class, () -> handler.execute("1", Map.of("type", "orphans")));
        assertThrows(PermanentJobFailureException.class, () -> handler.execute("1", Map.of()));
    }

    /**
     * Deletes its configured rows once, then reports nothing left to delete.
     */
    private static class FakeHousekeepingRepository implements HousekeepingRepository {
        long expiredSessions;
        long obsoleteTokens;
        long auditLogs;
        long caseHistory;

        Instant revokedBefore;
        Instant auditCutoff;
        Set<String> protectedActions;

        @Override
        public long deleteExpiredSessions(Instant now) {
            long deleted = expiredSessions;
            expiredSessions = 0;
            return deleted;
        }

        @Override
        public long deleteObsoleteTokens(Instant now, Instant revokedBefore) {
            this.revokedBefore = revokedBefore;
            long deleted = obsoleteTokens;
            obsoleteTokens = 0;
            return deleted;
        }

        @Override
        public long deleteAuditLogsBefore(Instant cutoff, Set<String> protectedActions) {
            this.auditCutoff = cutoff;
            this.protectedActions = protectedActions;
            long deleted = auditLogs;
            auditLogs = 0;
            return deleted;
        }

        @Override
        public long deleteResolvedCaseHistoryBefore(Instant cutoff) {
            long deleted = caseHistory;
            caseHistory = 0;
            return deleted;
        }
    }
}
