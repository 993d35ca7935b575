package abrazar.casework.broker;

import abrazar.casework.exceptions.BrokerException;
import org.jboss.logging.Logger;
import org.redisson.api.RBucket;
import org.redisson.api.RMap;
import org.redisson.api.RScoredSortedSet;
import org.redisson.api.RedissonClient;
import org.redisson.api.options.KeysScanOptions;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;

import java.time.Duration;
import java.util.Collection;
import java.util.Iterator;
import java.util.function.Supplier;

/**
 * {@link Broker} backed by a shared {@link RedissonClient}.
 *
 * <p>
 * All values use {@link StringCodec} so that job records and cache entries remain readable JSON in Redis. Every
 * {@link RedisException} (timeouts, dropped connections, command errors) is rethrown as {@link BrokerException}.
 */
public class RedissonBroker implements Broker {

    private static final Logger LOG = Logger.getLogger(RedissonBroker.class);

    private final RedissonClient redisson;

    public RedissonBroker(RedissonClient redisson) {
        this.redisson = redisson;
    }

    @Override
    public String get(String key) {
        return call("GET", key, () -> bucket(key).get());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        call("SET", key, () -> {
            RBucket<String> bucket = bucket(key);
            if (ttl == null) {
                bucket.set(value);
            } else {
                bucket.set(value, ttl.toMillis() < 1 ? Duration.ofMillis(1) : ttl);
            }
            return null;
        });
    }

    @Override
    public boolean delete(String key) {
        return call("DEL", key, () -> redisson.getKeys().delete(key) > 0);
    }

    @Override
    public long ttlMillis(String key) {
        return call("PTTL", key, () -> redisson.getKeys().remainTimeToLive(key));
    }

    @Override
    public Iterable<String> scan(String pattern, int batchSize) {
        Iterable<String> keys = call("SCAN", pattern, () -> redisson.getKeys()
                .getKeys(KeysScanOptions.defaults().pattern(pattern).chunkSize(batchSize)));
        // the cursor advances lazily, so iteration failures need the same translation
        return () -> {
            Iterator<String> cursor = keys.iterator();
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return call("SCAN", pattern, cursor::hasNext);
                }

                @Override
                public String next() {
                    return call("SCAN", pattern, cursor::next);
                }
            };
        };
    }

    @Override
    public long increment(String key) {
        return call("INCR", key, () -> redisson.getAtomicLong(key).incrementAndGet());
    }

    @Override
    public void hashPut(String key, String field, String value) {
        call("HSET", key, () -> map(key).fastPut(field, value));
    }

    @Override
    public String hashGet(String key, String field) {
        return call("HGET", key, () -> map(key).get(field));
    }

    @Override
    public boolean hashDelete(String key, String field) {
        return call("HDEL", key, () -> map(key).fastRemove(field) > 0);
    }

    @Override
    public boolean sortedSetAdd(String key, double score, String member) {
        return call("ZADD", key, () -> sortedSet(key).add(score, member));
    }

    @Override
    public String sortedSetPollFirst(String key) {
        return call("ZPOPMIN", key, () -> sortedSet(key).pollFirst());
    }

    @Override
    public boolean sortedSetRemove(String key, String member) {
        return call("ZREM", key, () -> sortedSet(key).remove(member));
    }

    @Override
    public Collection<String> sortedSetRangeByScore(String key, double min, double max, int limit) {
        return call("ZRANGEBYSCORE", key, () -> sortedSet(key).valueRange(min, true, max, true, 0, limit));
    }

    @Override
    public Collection<String> sortedSetRangeByRank(String key, int start, int end) {
        return call("ZRANGE", key, () -> sortedSet(key).valueRange(start, end));
    }

    @Override
    public int sortedSetSize(String key) {
        return call("ZCARD", key, () -> sortedSet(key).size());
    }

    @Override
    public boolean ping() {
        try {
            redisson.getKeys().count();
            return true;
        } catch (RedisException e) {
            LOG.warnf("Broker ping failed: %s", e.getMessage());
            return false;
        }
    }

    private RBucket<String> bucket(String key) {
        return redisson.getBucket(key, StringCodec.INSTANCE);
    }

    private RMap<String, String> map(String key) {
        return redisson.getMap(key, StringCodec.INSTANCE);
    }

    private RScoredSortedSet<String> sortedSet(String key) {
        return redisson.getScoredSortedSet(key, StringCodec.INSTANCE);
    }

    private <T> T call(String command, String key, Supplier<T> action) {
        try {
            return action.get();
        } catch (RedisException e) {
            throw new BrokerException("Broker command " + command + " failed for key " + key, e);
        }
    }
}
