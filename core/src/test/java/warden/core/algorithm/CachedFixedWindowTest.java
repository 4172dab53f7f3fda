package warden.core.algorithm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.adapter.out.memory.InMemoryKeyspace;
import warden.adapter.out.memory.InMemoryRateLimitStore;
import warden.core.cache.EphemeralCache;
import warden.core.model.ratelimit.InvalidRateLimitConfigurationException;
import warden.support.MutableClock;

@DisplayName("CachedFixedWindow")
class CachedFixedWindowTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private InMemoryRateLimitStore store;
    private EphemeralCache cache;
    private SingleRegionContext context;
    private CachedFixedWindow algorithm;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(0);
        store = new InMemoryRateLimitStore(new InMemoryKeyspace(clock));
        cache = new EphemeralCache(100, clock);
        context = new SingleRegionContext(store, Optional.of(cache), clock);
        algorithm = Algorithms.cachedFixedWindow(3, "10 s");
    }

    @Test
    @DisplayName("should seed the cache from the store on the first request")
    void shouldSeedCacheFromStore() {
        var response = algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);

        assertTrue(response.success());
        assertEquals(2, response.remaining());
        assertEquals(1L, cache.get("app:user:0").getAsLong());
    }

    @Test
    @DisplayName("should count locally and write through in the background")
    void shouldCountLocallyAndWriteThrough() {
        algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);

        var response = algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);
        response.pending().await().atMost(TIMEOUT);

        assertTrue(response.success());
        assertEquals(1, response.remaining());
        assertEquals(2L, store.getCounter("app:user:0").await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should reject locally without writing through once the limit is used")
    void shouldRejectLocallyOverLimit() {
        for (int i = 0; i < 3; i++) {
            algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT).pending().await().atMost(TIMEOUT);
        }

        var rejected = algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);
        rejected.pending().await().atMost(TIMEOUT);

        assertFalse(rejected.success());
        assertEquals(3L, store.getCounter("app:user:0").await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should adopt the shared store count after each write-through")
    void shouldAdoptStoreCountAfterWriteThrough() {
        var otherProcess = new SingleRegionContext(store, Optional.of(new EphemeralCache(100, clock)), clock);

        var admitted = 0;
        for (int i = 0; i < 5; i++) {
            for (var process : List.of(context, otherProcess)) {
                var response = algorithm.limit(process, "app:user", 1).await().atMost(TIMEOUT);
                response.pending().await().atMost(TIMEOUT);
                if (response.success()) {
                    admitted++;
                }
            }
        }

        assertEquals(4, admitted);
        assertEquals(4L, store.getCounter("app:user:0").await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should drop the previous window's counter when a new window is seeded")
    void shouldDropPreviousWindowCounter() {
        algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);

        clock.set(10_000);
        algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);

        assertTrue(cache.get("app:user:0").isEmpty());
        assertEquals(1L, cache.get("app:user:1").getAsLong());
    }

    @Test
    @DisplayName("should expire a cached counter at the window reset")
    void shouldExpireCounterAtReset() {
        algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);

        clock.set(9_999);
        assertTrue(cache.get("app:user:0").isPresent());

        clock.set(10_000);
        assertTrue(cache.get("app:user:0").isEmpty());
    }

    @Test
    @DisplayName("should evict cached counters on reset")
    void shouldEvictCachedCountersOnReset() {
        algorithm.limit(context, "app:user", 3).await().atMost(TIMEOUT);

        algorithm.resetTokens(context, "app:user").await().atMost(TIMEOUT);

        assertTrue(cache.get("app:user:0").isEmpty());
        assertEquals(3, algorithm.getRemaining(context, "app:user").await().atMost(TIMEOUT).remaining());
    }

    @Test
    @DisplayName("should refuse to run without an ephemeral cache")
    void shouldRefuseToRunWithoutCache() {
        var uncached = new SingleRegionContext(store, Optional.empty(), clock);

        assertTrue(algorithm.requiresCache());
        assertThrows(InvalidRateLimitConfigurationException.class, () -> algorithm.limit(uncached, "app:user", 1));
    }
}
