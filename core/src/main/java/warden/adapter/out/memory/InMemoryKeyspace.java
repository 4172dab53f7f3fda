package warden.adapter.out.memory;

import java.time.Clock;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * A process-local keyspace with the data types and expiry rules the stores rely on:
 * counters, hashes of longs, sets, scored sets and strings, each with an optional
 * millisecond expiry.
 *
 * <p>Every method is synchronized on the keyspace, and {@link #atomically} runs a sequence
 * of calls as one step, which gives store procedures the same atomicity a server-side
 * script has.
 *
 * <p>Expired keys behave as absent and are dropped when touched.
 */
public class InMemoryKeyspace {

    /** TTL reported for a missing key. */
    public static final long ABSENT = -2;

    /** TTL reported for a key without expiry. */
    public static final long PERSISTENT = -1;

    private final Map<String, Entry> entries = new HashMap<>();
    private final Clock clock;

    public InMemoryKeyspace(Clock clock) {
        this.clock = clock;
    }

    /**
     * Run several operations without interleaving with other callers.
     */
    public synchronized <T> T atomically(Supplier<T> procedure) {
        return procedure.get();
    }

    public synchronized long incrBy(String key, long delta) {
        final var entry = live(key);
        final long next = (entry == null ? 0L : (Long) entry.value) + delta;
        if (entry == null) {
            entries.put(key, new Entry(next));
        } else {
            entry.value = next;
        }
        return next;
    }

    public synchronized Optional<Long> getLong(String key) {
        final var entry = live(key);
        return entry == null ? Optional.empty() : Optional.of((Long) entry.value);
    }

    public synchronized void hset(String key, String field, long value) {
        hash(key, true).put(field, value);
    }

    public synchronized Map<String, Long> hgetall(String key) {
        final var hash = hash(key, false);
        return hash == null ? Map.of() : new LinkedHashMap<>(hash);
    }

    public synchronized void sadd(String key, Collection<String> members) {
        if (!members.isEmpty()) {
            set(key, true).addAll(members);
        }
    }

    public synchronized void srem(String key, Collection<String> members) {
        final var set = set(key, false);
        if (set != null) {
            set.removeAll(members);
            if (set.isEmpty()) {
                entries.remove(key);
            }
        }
    }

    public synchronized boolean sismember(String key, String member) {
        final var set = set(key, false);
        return set != null && set.contains(member);
    }

    public synchronized Set<String> smembers(String key) {
        final var set = set(key, false);
        return set == null ? Set.of() : new HashSet<>(set);
    }

    /**
     * Replace a set with {@code members}, deleting the key when empty.
     */
    public synchronized void sstore(String key, Set<String> members) {
        entries.remove(key);
        sadd(key, members);
    }

    public synchronized long zincrby(String key, String member, long delta) {
        return scored(key, true).merge(member, delta, Long::sum);
    }

    /**
     * Members of a scored set with their scores, in insertion order.
     */
    public synchronized Map<String, Long> zrangeWithScores(String key) {
        final var scored = scored(key, false);
        return scored == null ? Map.of() : new LinkedHashMap<>(scored);
    }

    public synchronized void setString(String key, String value, long ttlMillis) {
        final var entry = new Entry(value);
        if (ttlMillis > 0) {
            entry.expiresAt = clock.millis() + ttlMillis;
        }
        entries.put(key, entry);
    }

    public synchronized Optional<String> getString(String key) {
        final var entry = live(key);
        return entry == null ? Optional.empty() : Optional.of((String) entry.value);
    }

    public synchronized boolean exists(String key) {
        return live(key) != null;
    }

    public synchronized boolean pexpire(String key, long ttlMillis) {
        final var entry = live(key);
        if (entry == null) {
            return false;
        }
        entry.expiresAt = clock.millis() + ttlMillis;
        return true;
    }

    /**
     * Remaining time to live in milliseconds, {@link #ABSENT} or {@link #PERSISTENT}.
     */
    public synchronized long pttl(String key) {
        final var entry = live(key);
        if (entry == null) {
            return ABSENT;
        }
        if (entry.expiresAt == Long.MAX_VALUE) {
            return PERSISTENT;
        }
        return entry.expiresAt - clock.millis();
    }

    /**
     * Remaining time to live in whole seconds, rounded up, or {@link #ABSENT} or {@link #PERSISTENT}.
     */
    public synchronized long ttl(String key) {
        final var pttl = pttl(key);
        return pttl < 0 ? pttl : (pttl + 999) / 1000;
    }

    public synchronized void del(String key) {
        entries.remove(key);
    }

    /**
     * Delete every key matching a glob pattern where {@code *} matches any characters.
     *
     * @return how many keys were deleted
     */
    public synchronized int deleteMatching(String pattern) {
        final var regex = globToRegex(pattern);
        final var before = entries.size();
        entries.keySet().removeIf(key -> regex.matcher(key).matches());
        return before - entries.size();
    }

    public synchronized int size() {
        entries.entrySet().removeIf(e -> expired(e.getValue()));
        return entries.size();
    }

    static Pattern globToRegex(String glob) {
        final var regex = new StringBuilder();
        var literal = new StringBuilder();
        for (var c : glob.toCharArray()) {
            if (c == '*') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal = new StringBuilder();
                }
                regex.append(".*");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Long> hash(String key, boolean create) {
        final var entry = live(key);
        if (entry == null) {
            if (!create) {
                return null;
            }
            final var hash = new LinkedHashMap<String, Long>();
            entries.put(key, new Entry(hash));
            return hash;
        }
        return (Map<String, Long>) entry.value;
    }

    @SuppressWarnings("unchecked")
    private Set<String> set(String key, boolean create) {
        final var entry = live(key);
        if (entry == null) {
            if (!create) {
                return null;
            }
            final var set = new HashSet<String>();
            entries.put(key, new Entry(set));
            return set;
        }
        return (Set<String>) entry.value;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Long> scored(String key, boolean create) {
        final var entry = live(key);
        if (entry == null) {
            if (!create) {
                return null;
            }
            final var scored = new LinkedHashMap<String, Long>();
            entries.put(key, new Entry(scored));
            return scored;
        }
        return (Map<String, Long>) entry.value;
    }

    private Entry live(String key) {
        final var entry = entries.get(key);
        if (entry != null && expired(entry)) {
            entries.remove(key);
            return null;
        }
        return entry;
    }

    private boolean expired(Entry entry) {
        return entry.expiresAt <= clock.millis();
    }

    private static final class Entry {
        private Object value;
        private long expiresAt = Long.MAX_VALUE;

        private Entry(Object value) {
            this.value = value;
        }
    }
}
