package warden.core.algorithm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.memory.InMemoryKeyspace;
import warden.adapter.out.memory.InMemoryRateLimitStore;
import warden.core.cache.EphemeralCache;
import warden.core.model.ratelimit.RateLimitReason;
import warden.support.MutableClock;

@DisplayName("FixedWindow")
class FixedWindowTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private SingleRegionContext context;
    private FixedWindow algorithm;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(0);
        context = new SingleRegionContext(
                new InMemoryRateLimitStore(new InMemoryKeyspace(clock)),
                Optional.of(new EphemeralCache(100, clock)),
                clock);
        algorithm = Algorithms.fixedWindow(5, "60 s");
    }

    @Nested
    @DisplayName("limit")
    class LimitTests {

        @Test
        @DisplayName("should count down remaining and reject the request over the limit")
        void shouldCountDownRemainingAndRejectOverLimit() {
            for (long expected = 4; expected >= 0; expected--) {
                var response = algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);
                assertTrue(response.success());
                assertEquals(expected, response.remaining());
                assertEquals(5, response.limit());
                assertEquals(60_000, response.reset());
            }

            var rejected = algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);

            assertFalse(rejected.success());
            assertEquals(0, rejected.remaining());
            assertEquals(60_000, rejected.reset());
        }

        @Test
        @DisplayName("should serve repeated rejections from the ephemeral cache")
        void shouldServeRepeatedRejectionsFromCache() {
            algorithm.limit(context, "app:user", 5).await().atMost(TIMEOUT);
            var first = algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);
            assertFalse(first.success());
            assertTrue(first.reason().isEmpty());

            var second = algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);

            assertFalse(second.success());
            assertTrue(second.hasReason(RateLimitReason.CACHE_BLOCK));
            assertEquals(60_000, second.reset());
        }

        @Test
        @DisplayName("should start a fresh window after the reset")
        void shouldStartFreshWindowAfterReset() {
            algorithm.limit(context, "app:user", 5).await().atMost(TIMEOUT);
            algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);

            clock.set(60_001);
            var response = algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);

            assertTrue(response.success());
            assertEquals(4, response.remaining());
            assertEquals(120_000, response.reset());
        }

        @Test
        @DisplayName("should consume the requested number of tokens")
        void shouldConsumeRequestedTokens() {
            var response = algorithm.limit(context, "app:user", 3).await().atMost(TIMEOUT);

            assertTrue(response.success());
            assertEquals(2, response.remaining());
        }

        @Test
        @DisplayName("should track identifiers separately")
        void shouldTrackIdentifiersSeparately() {
            algorithm.limit(context, "app:a", 5).await().atMost(TIMEOUT);

            var response = algorithm.limit(context, "app:b", 1).await().atMost(TIMEOUT);

            assertTrue(response.success());
            assertEquals(4, response.remaining());
        }
    }

    @Nested
    @DisplayName("getRemaining and resetTokens")
    class RemainingTests {

        @Test
        @DisplayName("should report remaining without consuming")
        void shouldReportRemainingWithoutConsuming() {
            algorithm.limit(context, "app:user", 2).await().atMost(TIMEOUT);

            var remaining = algorithm.getRemaining(context, "app:user").await().atMost(TIMEOUT);
            var again = algorithm.getRemaining(context, "app:user").await().atMost(TIMEOUT);

            assertEquals(3, remaining.remaining());
            assertEquals(60_000, remaining.reset());
            assertEquals(5, remaining.limit());
            assertEquals(remaining, again);
        }

        @Test
        @DisplayName("should restore the full limit after reset")
        void shouldRestoreFullLimitAfterReset() {
            algorithm.limit(context, "app:user", 5).await().atMost(TIMEOUT);
            algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);

            algorithm.resetTokens(context, "app:user").await().atMost(TIMEOUT);

            assertEquals(5, algorithm.getRemaining(context, "app:user").await().atMost(TIMEOUT).remaining());
            assertTrue(algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT).success());
        }
    }

    @Test
    @DisplayName("should report the end of the current window as the next reset")
    void shouldReportWindowEndAsNextReset() {
        assertEquals(60_000, algorithm.nextReset(0));
        assertEquals(60_000, algorithm.nextReset(59_999));
        assertEquals(120_000, algorithm.nextReset(60_000));
    }
}
