package warden.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Policy;

/**
 * Process-local map of identifiers to epoch millis, used two ways.
 *
 * <ul>
 *   <li>Block entries: an identifier maps to the time until which it is known to be
 *       blocked. A hit lets a limiter reject without a store round trip.</li>
 *   <li>Counters: the cached fixed window keeps its per-bucket counts here.</li>
 * </ul>
 *
 * <p>The cache is advisory. It may only shortcut towards rejection, so losing entries
 * (bounded eviction, another process) never admits a request the store would refuse.
 *
 * <p>The Caffeine-backed cache expires each entry at the deadline it was written with,
 * measured by the injected clock. A caller-supplied map has no expiry of its own: block entries
 * are dropped when found expired and stale counters when their key is reseeded.
 */
public class EphemeralCache {

    /** Default bound of the Caffeine-backed map. */
    public static final long DEFAULT_MAX_ENTRIES = 10_000;

    private final Map<String, Long> entries;
    private final Clock clock;
    private final Cache<String, Long> caffeine;
    private final Policy.VarExpiration<String, Long> expiration;

    /**
     * Create a cache backed by a bounded Caffeine map.
     *
     * @param maxEntries maximum number of entries before eviction
     * @param clock time source for block expiry
     */
    public EphemeralCache(long maxEntries, Clock clock) {
        this(Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new UntilWrittenExpiry())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build(), clock);
    }

    private EphemeralCache(Cache<String, Long> caffeine, Clock clock) {
        this.entries = caffeine.asMap();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.caffeine = caffeine;
        this.expiration = caffeine.policy().expireVariably().orElseThrow();
    }

    /**
     * Create a cache on an externally supplied map, for callers that share one map between
     * several limiters.
     *
     * @param entries the backing map, which must tolerate concurrent access
     * @param clock time source for block expiry
     */
    public EphemeralCache(Map<String, Long> entries, Clock clock) {
        this.entries = Objects.requireNonNull(entries, "entries must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.caffeine = null;
        this.expiration = null;
    }

    /**
     * Check whether an identifier is blocked. Expired block entries are removed.
     *
     * @param identifier the identifier
     * @return the block status
     */
    public BlockStatus isBlocked(String identifier) {
        final var reset = entries.get(identifier);
        if (reset == null) {
            return BlockStatus.NOT_BLOCKED;
        }
        if (reset < clock.millis()) {
            entries.remove(identifier, reset);
            return BlockStatus.NOT_BLOCKED;
        }
        return new BlockStatus(true, reset);
    }

    public void blockUntil(String identifier, long resetMillis) {
        // still blocked at the reset millisecond itself
        put(identifier, resetMillis, resetMillis + 1);
    }

    public OptionalLong get(String key) {
        final var value = entries.get(key);
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }

    /**
     * Store a counter until a point in time.
     *
     * @param key the counter key
     * @param value the count
     * @param expiresAtMillis epoch millis at which the entry stops being useful
     */
    public void set(String key, long value, long expiresAtMillis) {
        put(key, value, expiresAtMillis);
    }

    /**
     * Add to a counter, starting from zero. An existing counter keeps its expiry.
     *
     * @param key the counter key
     * @param delta amount to add
     * @return the new value
     */
    public long increment(String key, long delta) {
        return entries.merge(key, delta, Long::sum);
    }

    public void pop(String key) {
        entries.remove(key);
    }

    /**
     * Remove every entry whose key starts with {@code prefix}.
     *
     * @param prefix key prefix
     */
    public void evictPrefix(String prefix) {
        entries.keySet().removeIf(key -> key.startsWith(prefix));
    }

    /**
     * Remove the counters {@code <key>:<bucket>} of every bucket except {@code currentBucket}.
     *
     * @param key the counter key without its bucket suffix
     * @param currentBucket the bucket to keep
     */
    public void evictOtherBuckets(String key, long currentBucket) {
        final var prefix = key + ":";
        final var current = prefix + currentBucket;
        entries.keySet().removeIf(candidate -> candidate.startsWith(prefix)
                && !candidate.equals(current)
                && isBucket(candidate.substring(prefix.length())));
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        if (caffeine != null) {
            caffeine.cleanUp();
        }
        return entries.size();
    }

    private void put(String key, long value, long expiresAtMillis) {
        if (expiration == null) {
            entries.put(key, value);
            return;
        }
        expiration.put(key, value, Duration.ofMillis(Math.max(0, expiresAtMillis - clock.millis())));
    }

    private static boolean isBucket(String suffix) {
        return !suffix.isEmpty() && suffix.chars().allMatch(Character::isDigit);
    }

    /**
     * Entries written through {@link #put} carry their own duration. Anything else, such as
     * a counter created by {@link #increment}, lives until size eviction, and updates keep
     * the current deadline.
     */
    private static final class UntilWrittenExpiry implements Expiry<String, Long> {
        @Override
        public long expireAfterCreate(String key, Long value, long currentTime) {
            return Long.MAX_VALUE;
        }

        @Override
        public long expireAfterUpdate(String key, Long value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        @Override
        public long expireAfterRead(String key, Long value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    /**
     * Result of {@link #isBlocked}.
     *
     * @param blocked whether the identifier is blocked
     * @param reset until when, in epoch millis; 0 when not blocked
     */
    public record BlockStatus(boolean blocked, long reset) {
        public static final BlockStatus NOT_BLOCKED = new BlockStatus(false, 0);
    }
}
