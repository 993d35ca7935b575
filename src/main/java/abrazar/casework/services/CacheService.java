package abrazar.casework.services;

import abrazar.casework.broker.Broker;
import abrazar.casework.broker.BrokerConnection;
import abrazar.casework.exceptions.BrokerException;
import abrazar.casework.exceptions.CacheSerializationException;
import abrazar.casework.observability.ObservabilityMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;
import java.util.function.LongPredicate;

/**
 * Read-through key/value cache with per-key TTL, stored in the broker as JSON.
 *
 * <p>
 * <b>Key format:</b> {@code {domain}:{identifier}[:{view}]}, built with {@link #generateKey}. For statistics:
 * {@code stats:{tenantId}:{view}}.
 *
 * <p>
 * <b>Guarantees:</b>
 * <ul>
 * <li>A present entry is never older than its TTL; absence always means "recompute", never "empty"</li>
 * <li>Reads return empty and writes are ignored when the broker was unavailable at startup</li>
 * <li>Broker errors and unreadable values are logged and treated as misses; nothing is thrown to callers</li>
 * <li>Pattern deletion iterates with a cursor-based SCAN, never {@code KEYS}</li>
 * </ul>
 */
@ApplicationScoped
public class CacheService {

    private static final Logger LOG = Logger.getLogger(CacheService.class);

    private static final int SCAN_BATCH = 100;

    @Inject
    BrokerConnection brokerConnection;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    ObservabilityMetrics observabilityMetrics;

    /**
     * Builds a cache key from its parts; {@code view} may be null.
     */
    public static String generateKey(String domain, String identifier, String view) {
        StringBuilder key = new StringBuilder(domain).append(':').append(identifier);
        if (view != null && !view.isEmpty()) {
            key.append(':').append(view);
        }
        return key.toString();
    }

    public boolean isAvailable() {
        return brokerConnection.isAvailable();
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        return getRaw(key).flatMap(json -> decode(key, json, () -> objectMapper.readValue(json, type)));
    }

    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return getRaw(key).flatMap(json -> decode(key, json, () -> objectMapper.readValue(json, type)));
    }

    /**
     * Returns the stored JSON for a key, or empty on a miss.
     */
    public Optional<String> getRaw(String key) {
        Optional<Broker> broker = brokerConnection.broker();
        if (broker.isEmpty()) {
            return Optional.empty();
        }
        try {
            String json = broker.get().get(key);
            observabilityMetrics.recordCacheLookup(domainOf(key), json == null ? "miss" : "hit");
            return Optional.ofNullable(json);
        } catch (BrokerException e) {
            LOG.warnf(e, "Cache read failed for %s; treating as miss", key);
            observabilityMetrics.recordCacheLookup(domainOf(key), "error");
            return Optional.empty();
        }
    }

    /**
     * Stores a value with a TTL.
     *
     * @return true when the value was written
     */
    public boolean set(String key, Object value, long ttlSeconds) {
        Optional<Broker> broker = brokerConnection.broker();
        if (broker.isEmpty()) {
            return false;
        }
        try {
            broker.get().set(key, encode(key, value), Duration.ofSeconds(ttlSeconds));
            LOG.debugf("Cached %s for %d s", key, ttlSeconds);
            return true;
        } catch (CacheSerializationException | BrokerException e) {
            LOG.warnf(e, "Cache write failed for %s", key);
            return false;
        }
    }

    /**
     * @return true when the key existed and was removed
     */
    public boolean del(String key) {
        Optional<Broker> broker = brokerConnection.broker();
        if (broker.isEmpty()) {
            return false;
        }
        try {
            return broker.get().delete(key);
        } catch (BrokerException e) {
            LOG.warnf(e, "Cache delete failed for %s", key);
            return false;
        }
    }

    /**
     * Deletes every key matching a glob pattern, for full-domain sweeps.
     *
     * @return number of keys removed
     */
    public long delByPattern(String pattern) {
        return sweep(pattern, ttl -> true);
    }

    /**
     * Deletes keys matching a pattern that are already expired or, when {@code includePersistent}, have no TTL at
     * all. Keys with a live TTL are left alone.
     *
     * @return number of keys removed
     */
    public long sweepExpiredKeys(String pattern, boolean includePersistent) {
        return sweep(pattern, ttl -> ttl == Broker.TTL_MISSING || ttl == 0
                || (includePersistent && ttl == Broker.TTL_PERSISTENT));
    }

    private long sweep(String pattern, LongPredicate shouldDelete) {
        Optional<Broker> broker = brokerConnection.broker();
        if (broker.isEmpty()) {
            return 0;
        }

        long removed = 0;
        try {
            for (String key : broker.get().scan(pattern, SCAN_BATCH)) {
                if (shouldDelete.test(broker.get().ttlMillis(key)) && broker.get().delete(key)) {
                    removed++;
                }
            }
        } catch (BrokerException e) {
            LOG.warnf(e, "Cache sweep of %s interrupted after %d keys", pattern, removed);
        }
        LOG.debugf("Removed %d keys matching %s", removed, pattern);
        return removed;
    }

    private String encode(String key, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException("Cannot serialize cache value for " + key, e);
        }
    }

    private <T> Optional<T> decode(String key, String json, JsonReader<T> reader) {
        try {
            return Optional.ofNullable(reader.read());
        } catch (JsonProcessingException e) {
            CacheSerializationException failure = new CacheSerializationException(
                    "Cannot deserialize cache value for " + key, e);
            LOG.warnf(failure, "Ignoring unreadable cache entry %s (%d chars); treating as miss", key, json.length());
            observabilityMetrics.recordCacheLookup(domainOf(key), "error");
            return Optional.empty();
        }
    }

    private static String domainOf(String key) {
        int separator = key.indexOf(':');
        return separator < 0 ? key : key.substring(0, separator);
    }

    @FunctionalInterface
    private interface JsonReader<T> {
        T read() throws JsonProcessingException;
    }
}
