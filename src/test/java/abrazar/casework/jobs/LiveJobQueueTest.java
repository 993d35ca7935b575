package abrazar.casework.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import abrazar.casework.TestFixtures;
import abrazar.casework.api.types.JobHandleType;
import abrazar.casework.api.types.QueueStatsType;
import abrazar.casework.testing.InMemoryBroker;
import abrazar.casework.testing.MutableClock;

/**
 * Unit tests for {@link LiveJobQueue} against the in-memory broker.
 */
class LiveJobQueueTest {

    private MutableClock clock;
    private InMemoryBroker broker;
    private LiveJobQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestFixtures.T0);
        broker = new InMemoryBroker(clock);
        queue = new LiveJobQueue(QueueName.SEND_NOTIFICATION, TestFixtures.queueOptions(), broker,
                TestFixtures.objectMapper(), clock);
    }

    @Test
    void testEnqueueAndClaim_roundTripsPayload() {
        JobHandleType handle = queue.enqueue("send-email", Map.of("to", "ana@example.org", "subject", "Hola"), 1);

        assertFalse(handle.skipped());
        assertEquals("send-notification", handle.queue());

        QueuedJob claimed = queue.claim().orElseThrow();
        assertEquals(handle.id(), claimed.id());
        assertEquals(JobState.ACTIVE, claimed.state());
        assertEquals("ana@example.org", claimed.payload().get("to"));
        assertEquals(0, claimed.attemptsMade());
        assertEquals(3, claimed.maxAttempts());
        assertEquals(TestFixtures.T0, claimed.processedAt());

        QueueStatsType stats = queue.getStats();
        assertEquals(0, stats.waiting());
        assertEquals(1, stats.active());
        assertEquals(1, stats.total());
    }

    @Test
    void testClaim_lowerPriorityFirstThenInsertionOrder() {
        String low = queue.enqueue("send-email", Map.of(), 5).id();
        String high = queue.enqueue("send-email", Map.of(), 1).id();
        String highLater = queue.enqueue("send-email", Map.of(), 1).id();

        assertEquals(high, queue.claim().orElseThrow().id());
        assertEquals(highLater, queue.claim().orElseThrow().id());
        assertEquals(low, queue.claim().orElseThrow().id());
        assertTrue(queue.claim().isEmpty());
    }

    @Test
    void testClaim_emptyQueue() {
        assertTrue(queue.claim().isEmpty());
    }

    @Test
    void testComplete_movesToCompleted() {
        queue.enqueue("send-email", Map.of(), 1);
        QueuedJob job = queue.claim().orElseThrow();

        queue.complete(job);

        QueuedJob stored = queue.getJob(job.id()).orElseThrow();
        assertEquals(JobState.COMPLETED, stored.state());
        assertEquals(1, stored.attemptsMade());
        assertEquals(0, queue.getStats().active());
        assertEquals(1, queue.getStats().completed());
    }

    @Test
    void testComplete_trimsCompletedByCount() {
        QueueOptions options = new QueueOptions(3, BackoffPolicy.fixed(Duration.ofSeconds(1)),
                new RetentionPolicy(Duration.ofHours(24), 2, Duration.ofDays(7)), Duration.ofMinutes(10));
        queue = new LiveJobQueue(QueueName.SEND_NOTIFICATION, options, broker, TestFixtures.objectMapper(), clock);

        for (int i = 0; i < 3; i++) {
            queue.enqueue("send-email", Map.of(), 1);
            QueuedJob job = queue.claim().orElseThrow();
            clock.advance(Duration.ofSeconds(1));
            queue.complete(job);
        }

        assertEquals(2, queue.getStats().completed());
        assertTrue(queue.getJob("1").isEmpty());
    }

    @Test
    void testFail_transientSchedulesRetryAfterBackoff() {
        queue.enqueue("send-email", Map.of(), 1);
        QueuedJob first = queue.claim().orElseThrow();

        assertEquals(JobState.DELAYED, queue.fail(first, "SMTP timeout", false));
        assertEquals(1, queue.getStats().delayed());
        assertTrue(queue.claim().isEmpty());

        clock.advance(Duration.ofSeconds(1));
        QueuedJob second = queue.claim().orElseThrow();
        assertEquals(first.id(), second.id());
        assertEquals(1, second.attemptsMade());
        assertEquals("SMTP timeout", second.lastError());
    }

    @Test
    void testFail_exhaustedAttemptsIsTerminal() {
        queue.enqueue("send-email", Map.of(), 1);

        JobState state = null;
        for (int attempt = 1; attempt <= 3; attempt++) {
            clock.advance(Duration.ofSeconds(1));
            QueuedJob job = queue.claim().orElseThrow();
            state = queue.fail(job, "boom " + attempt, false);
        }

        assertEquals(JobState.FAILED, state);
        QueuedJob failed = queue.getJob("1").orElseThrow();
        assertEquals(3, failed.attemptsMade());
        assertTrue(failed.attemptsMade() <= failed.maxAttempts());
        assertEquals("boom 3", failed.lastError());

        clock.advance(Duration.ofMinutes(5));
        assertTrue(queue.claim().isEmpty());
        assertEquals(1, queue.getStats().failed());
    }

    @Test
    void testFail_permanentSkipsRetries() {
        queue.enqueue("send-email", Map.of(), 1);
        QueuedJob job = queue.claim().orElseThrow();

        assertEquals(JobState.FAILED, queue.fail(job, "bad payload", true));
        assertEquals(1, queue.getJob(job.id()).orElseThrow().attemptsMade());
        assertEquals(0, queue.getStats().delayed());
    }

    @Test
    void testRecoverStalled_requeuesAbandonedClaim() {
        queue.enqueue("send-email", Map.of(), 1);
        QueuedJob job = queue.claim().orElseThrow();

        assertEquals(0, queue.recoverStalled(Duration.ofMinutes(10)));

        clock.advance(Duration.ofMinutes(11));
        assertEquals(1, queue.recoverStalled(Duration.ofMinutes(10)));

        QueuedJob reclaimed = queue.claim().orElseThrow();
        assertEquals(job.id(), reclaimed.id());
        assertEquals(1, reclaimed.attemptsMade());
    }

    @Test
    void testRead_unreadableRecordIsMovedToFailed() {
        broker.hashPut("queue:send-notification:jobs", "99", "{not json");
        broker.sortedSetAdd("queue:send-notification:waiting", 1, "99");
        String good = queue.enqueue("send-email", Map.of(), 5).id();

        assertEquals(good, queue.claim().orElseThrow().id());
        assertEquals(1, queue.getStats().failed());
    }

    @Test
    void testDrainAndClean() {
        queue.enqueue("send-email", Map.of(), 1);
        queue.enqueue("send-email", Map.of(), 1);
        queue.enqueue("send-email", Map.of(), 1);
        queue.complete(queue.claim().orElseThrow());

        assertEquals(2, queue.drain());
        assertEquals(1, queue.clean(JobState.COMPLETED, Duration.ZERO, 100));
        assertEquals(0, queue.getStats().total());
    }

    @Test
    void testClean_rejectsPendingStates() {
        assertThrows(IllegalArgumentException.class, () -> queue.clean(JobState.WAITING, Duration.ZERO, 10));
    }

    @Test
    void testBrokerDown_returnsSentinelsWithoutThrowing() {
        queue.enqueue("send-email", Map.of(), 1);
        broker.goDown();

        JobHandleType handle = queue.enqueue("send-email", Map.of(), 1);
        assertTrue(handle.skipped());
        assertEquals(JobHandleType.SKIPPED_ID, handle.id());
        assertEquals(Optional.empty(), queue.claim());
        assertEquals(0, queue.getStats().total());
        assertEquals(0, queue.drain());
    }

    @Test
    void testEnqueue_afterCloseIsSkipped() {
        queue.close();

        assertTrue(queue.enqueue("send-email", Map.of(), 1).skipped());
        assertFalse(queue.isLive());
    }

    @Test
    void testEnqueue_tenThousandJobsGetDistinctIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            ids.add(queue.enqueue("send-email", Map.of("n", i), 1).id());
        }

        assertEquals(10_000, ids.size());
        assertEquals(10_000, queue.getStats().waiting());
    }

    @Test
    void testEnqueue_costDoesNotGrowWithDepth() {
        LiveJobQueue warmup = new LiveJobQueue(QueueName.HOUSEKEEPING, TestFixtures.queueOptions(), broker,
                TestFixtures.objectMapper(), clock);
        enqueueBatch(warmup, 2_000);

        long shallow = enqueueBatch(queue, 1_000);
        enqueueBatch(queue, 10_000);
        long deep = enqueueBatch(queue, 1_000);

        assertEquals(12_000, queue.getStats().waiting());
        long floor = Duration.ofMillis(20).toNanos();
        assertTrue(deep <= Math.max(shallow, floor) * 5,
                "1000 enqueues took " + deep + "ns at depth 11000 vs " + shallow + "ns on an empty queue");
    }

    @Test
    void testClaim_brokerErrorAfterPopKeepsJobClaimable() {
        String id = queue.enqueue("send-email", Map.of(), 1).id();
        broker.failNext("hashPut", 1);

        assertTrue(queue.claim().isEmpty());
        assertEquals(1, queue.getStats().waiting());
        assertEquals(0, queue.getStats().active());

        clock.advance(Duration.ofHours(1));
        assertEquals(0, queue.recoverStalled(Duration.ofMinutes(10)));
        QueuedJob claimed = queue.claim().orElseThrow();
        assertEquals(id, claimed.id());
        assertEquals(0, claimed.attemptsMade());
    }

    @Test
    void testClaim_unrecordedClaimIsReturnedWithoutCountingAttempt() {
        String id = queue.enqueue("send-email", Map.of(), 1).id();
        broker.sortedSetPollFirst("queue:send-notification:waiting");
        broker.sortedSetAdd("queue:send-notification:active", clock.millis(), id);

        clock.advance(Duration.ofMinutes(11));
        assertEquals(1, queue.recoverStalled(Duration.ofMinutes(10)));

        QueuedJob claimed = queue.claim().orElseThrow();
        assertEquals(id, claimed.id());
        assertEquals(0, claimed.attemptsMade());
    }

    @Test
    void testFail_brokerErrorLeavesJobRecoverable() {
        queue.enqueue("send-email", Map.of(), 1);
        QueuedJob job = queue.claim().orElseThrow();
        broker.failNext("sortedSetAdd", 1);

        queue.fail(job, "SMTP timeout", false);
        assertEquals(1, queue.getStats().active());

        clock.advance(Duration.ofMinutes(11));
        assertEquals(0, queue.recoverStalled(Duration.ofMinutes(10)));
        assertEquals(0, queue.getStats().active());
        assertEquals(1, queue.getStats().delayed());

        QueuedJob retried = queue.claim().orElseThrow();
        assertEquals(job.id(), retried.id());
        assertEquals(1, retried.attemptsMade());
    }

    @Test
    void testPromote_brokerErrorKeepsJobDelayed() {
        queue.enqueue("send-email", Map.of(), 1);
        queue.fail(queue.claim().orElseThrow(), "SMTP timeout", false);
        clock.advance(Duration.ofSeconds(1));
        broker.failNext("hashPut", 1);

        assertEquals(0, queue.promoteDueJobs());
        assertEquals(1, queue.getStats().delayed());
        assertEquals(0, queue.getStats().waiting());

        assertEquals(1, queue.promoteDueJobs());
        assertEquals(1, queue.getStats().waiting());
    }

    @Test
    void testRecoverStalled_brokerErrorKeepsJobActive() {
        queue.enqueue("send-email", Map.of(), 1);
        queue.claim().orElseThrow();
        clock.advance(Duration.ofMinutes(11));
        broker.failNext("hashPut", 1);

        assertEquals(0, queue.recoverStalled(Duration.ofMinutes(10)));
        assertEquals(1, queue.getStats().active());

        assertEquals(1, queue.recoverStalled(Duration.ofMinutes(10)));
        assertEquals(1, queue.getStats().waiting());
    }

    private static long enqueueBatch(LiveJobQueue target, int count) {
        long start = System.nanoTime();
        for (int i = 0; i < count; i++) {
            target.enqueue("send-email", Map.of("n", i), 1);
        }
        return System.nanoTime() - start;
    }
}
