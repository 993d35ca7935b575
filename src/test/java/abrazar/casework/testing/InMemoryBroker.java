package abrazar.casework.testing;

import abrazar.casework.broker.Broker;
import abrazar.casework.exceptions.BrokerException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Thread-safe in-memory {@link Broker} for unit tests.
 *
 * <p>
 * Expiry is evaluated lazily against the supplied clock. {@link #goDown()} makes every subsequent call throw
 * {@link BrokerException}, simulating a broker dropping mid-operation; {@link #failNext(String, int)} fails single
 * operations.
 */
public class InMemoryBroker implements Broker {

    private record Value(String data, Instant expiresAt) {
    }

    private record Scored(double score, String member) {
    }

    private static final Comparator<Scored> BY_SCORE = Comparator.comparingDouble(Scored::score)
            .thenComparing(Scored::member);

    private final Clock clock;
    private final Map<String, Value> values = new HashMap<>();
    private final Map<String, Map<String, String>> hashes = new HashMap<>();
    private final Map<String, TreeSet<Scored>> sortedSets = new HashMap<>();
    private final Map<String, Map<String, Double>> scores = new HashMap<>();

    private final Map<String, Integer> faults = new HashMap<>();

    private volatile boolean down;

    public InMemoryBroker() {
        this(Clock.systemUTC());
    }

    public InMemoryBroker(Clock clock) {
        this.clock = clock;
    }

    public void goDown() {
        down = true;
    }

    public void comeBack() {
        down = false;
    }

    /**
     * Makes the next {@code times} calls of one operation (a {@link Broker} method name, e.g. {@code hashPut}) throw
     * {@link BrokerException}. Other operations keep working.
     */
    public synchronized void failNext(String operation, int times) {
        faults.put(operation, times);
    }

    /**
     * Stores a value with no expiry, bypassing {@link #set}.
     */
    public synchronized void putPersistent(String key, String value) {
        values.put(key, new Value(value, null));
    }

    public synchronized Map<String, String> hash(String key) {
        return Map.copyOf(hashes.getOrDefault(key, Map.of()));
    }

    @Override
    public synchronized String get(String key) {
        check("get");
        Value value = live(key);
        return value == null ? null : value.data();
    }

    @Override
    public synchronized void set(String key, String value, Duration ttl) {
        check("set");
        values.put(key, new Value(value, ttl == null ? null : clock.instant().plus(ttl)));
    }

    @Override
    public synchronized boolean delete(String key) {
        check("delete");
        boolean existed = live(key) != null;
        values.remove(key);
        existed |= hashes.remove(key) != null;
        existed |= sortedSets.remove(key) != null;
        scores.remove(key);
        return existed;
    }

    @Override
    public synchronized long ttlMillis(String key) {
        check("ttlMillis");
        Value value = live(key);
        if (value == null) {
            return TTL_MISSING;
        }
        if (value.expiresAt() == null) {
            return TTL_PERSISTENT;
        }
        return Duration.between(clock.instant(), value.expiresAt()).toMillis();
    }

    @Override
    public synchronized Iterable<String> scan(String pattern, int batchSize) {
        check("scan");
        Pattern regex = Pattern.compile(globToRegex(pattern));
        List<String> matches = new ArrayList<>();
        for (String key : values.keySet()) {
            if (live(key) != null && regex.matcher(key).matches()) {
                matches.add(key);
            }
        }
        return matches;
    }

    @Override
    public synchronized long increment(String key) {
        check("increment");
        Value value = live(key);
        long next = (value == null ? 0 : Long.parseLong(value.data())) + 1;
        values.put(key, new Value(Long.toString(next), value == null ? null : value.expiresAt()));
        return next;
    }

    @Override
    public synchronized void hashPut(String key, String field, String value) {
        check("hashPut");
        hashes.computeIfAbsent(key, k -> new HashMap<>()).put(field, value);
    }

    @Override
    public synchronized String hashGet(String key, String field) {
        check("hashGet");
        Map<String, String> hash = hashes.get(key);
        return hash == null ? null : hash.get(field);
    }

    @Override
    public synchronized boolean hashDelete(String key, String field) {
        check("hashDelete");
        Map<String, String> hash = hashes.get(key);
        return hash != null && hash.remove(field) != null;
    }

    @Override
    public synchronized boolean sortedSetAdd(String key, double score, String member) {
        check("sortedSetAdd");
        Map<String, Double> memberScores = scores.computeIfAbsent(key, k -> new HashMap<>());
        TreeSet<Scored> set = sortedSets.computeIfAbsent(key, k -> new TreeSet<>(BY_SCORE));
        Double previous = memberScores.put(member, score);
        if (previous != null) {
            set.remove(new Scored(previous, member));
        }
        set.add(new Scored(score, member));
        return previous == null;
    }

    @Override
    public synchronized String sortedSetPollFirst(String key) {
        check("sortedSetPollFirst");
        TreeSet<Scored> set = sortedSets.get(key);
        if (set == null || set.isEmpty()) {
            return null;
        }
        Scored first = set.pollFirst();
        scores.get(key).remove(first.member());
        return first.member();
    }

    @Override
    public synchronized boolean sortedSetRemove(String key, String member) {
        check("sortedSetRemove");
        Map<String, Double> memberScores = scores.get(key);
        Double score = memberScores == null ? null : memberScores.remove(member);
        if (score == null) {
            return false;
        }
        sortedSets.get(key).remove(new Scored(score, member));
        return true;
    }

    @Override
    public synchronized Collection<String> sortedSetRangeByScore(String key, double min, double max, int limit) {
        check("sortedSetRangeByScore");
        List<String> members = new ArrayList<>();
        for (Scored entry : sortedSets.getOrDefault(key, new TreeSet<>(BY_SCORE))) {
            if (members.size() >= limit || entry.score() > max) {
                break;
            }
            if (entry.score() >= min) {
                members.add(entry.member());
            }
        }
        return members;
    }

    @Override
    public synchronized Collection<String> sortedSetRangeByRank(String key, int start, int end) {
        check("sortedSetRangeByRank");
        List<String> all = new ArrayList<>();
        for (Scored entry : sortedSets.getOrDefault(key, new TreeSet<>(BY_SCORE))) {
            all.add(entry.member());
        }
        int size = all.size();
        int from = start < 0 ? Math.max(0, size + start) : start;
        int to = end < 0 ? size + end : Math.min(end, size - 1);
        if (from > to || from >= size) {
            return List.of();
        }
        return new ArrayList<>(all.subList(from, to + 1));
    }

    @Override
    public synchronized int sortedSetSize(String key) {
        check("sortedSetSize");
        TreeSet<Scored> set = sortedSets.get(key);
        return set == null ? 0 : set.size();
    }

    @Override
    public boolean ping() {
        return !down;
    }

    private Value live(String key) {
        Value value = values.get(key);
        if (value != null && value.expiresAt() != null && !clock.instant().isBefore(value.expiresAt())) {
            return null;
        }
        return value;
    }

    private void check(String operation) {
        Integer pending = faults.get(operation);
        if (pending != null) {
            if (pending <= 1) {
                faults.remove(operation);
            } else {
                faults.put(operation, pending - 1);
            }
            throw new BrokerException("Injected failure: " + operation);
        }
        if (down) {
            throw new BrokerException("Connection refused: in-memory broker is down");
        }
    }

    private static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }
}
