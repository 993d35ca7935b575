package abrazar.casework.broker;

import java.time.Duration;
import java.util.Collection;

/**
 * Minimal set of broker primitives used by the job queues and the cache store.
 *
 * <p>
 * Every call is individually atomic on the broker side. No caller relies on a multi-call atomic sequence: claiming a
 * job is a single {@link #sortedSetPollFirst(String)} (ZPOPMIN) and promoting or recovering a job is guarded by the
 * boolean result of {@link #sortedSetRemove(String, String)}.
 *
 * <p>
 * Implementations throw {@link abrazar.casework.exceptions.BrokerException} on any transport or command failure.
 *
 * @see RedissonBroker
 */
public interface Broker {

    /** Returned by {@link #ttlMillis(String)} when the key does not exist. */
    long TTL_MISSING = -2L;

    /** Returned by {@link #ttlMillis(String)} when the key exists but has no expiry. */
    long TTL_PERSISTENT = -1L;

    String get(String key);

    /**
     * Stores a string value.
     *
     * @param ttl
     *            time to live, or {@code null} for no expiry
     */
    void set(String key, String value, Duration ttl);

    /**
     * @return true if the key existed and was removed
     */
    boolean delete(String key);

    /**
     * Remaining time to live in milliseconds, {@link #TTL_MISSING} or {@link #TTL_PERSISTENT}.
     */
    long ttlMillis(String key);

    /**
     * Iterates keys matching a glob pattern with a cursor-based SCAN. Never issues {@code KEYS}.
     */
    Iterable<String> scan(String pattern, int batchSize);

    long increment(String key);

    void hashPut(String key, String field, String value);

    String hashGet(String key, String field);

    boolean hashDelete(String key, String field);

    boolean sortedSetAdd(String key, double score, String member);

    /**
     * Atomically removes and returns the lowest-scored member, or {@code null} when the set is empty.
     */
    String sortedSetPollFirst(String key);

    boolean sortedSetRemove(String key, String member);

    /**
     * Members with {@code min <= score <= max}, lowest score first, at most {@code limit} entries.
     */
    Collection<String> sortedSetRangeByScore(String key, double min, double max, int limit);

    /**
     * Members by rank (0-based, inclusive, negative indexes count from the end).
     */
    Collection<String> sortedSetRangeByRank(String key, int start, int end);

    int sortedSetSize(String key);

    boolean ping();
}
