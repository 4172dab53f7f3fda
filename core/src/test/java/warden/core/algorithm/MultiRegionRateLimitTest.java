package warden.core.algorithm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.memory.InMemoryKeyspace;
import warden.adapter.out.memory.InMemoryRateLimitStore;
import warden.core.model.ratelimit.InvalidRateLimitConfigurationException;
import warden.core.model.ratelimit.RegionsUnavailableException;
import warden.core.port.out.RateLimitStore;
import warden.support.MutableClock;

@DisplayName("Multi-region algorithms")
class MultiRegionRateLimitTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private InMemoryRateLimitStore east;
    private InMemoryRateLimitStore west;
    private InMemoryRateLimitStore flaky;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(0);
        east = new InMemoryRateLimitStore(new InMemoryKeyspace(clock));
        west = new InMemoryRateLimitStore(new InMemoryKeyspace(clock));
        flaky = spy(new InMemoryRateLimitStore(new InMemoryKeyspace(clock)));
    }

    private MultiRegionContext context(RateLimitStore... regions) {
        return new MultiRegionContext(List.of(regions), Optional.empty(), clock);
    }

    private void failWrites(InMemoryRateLimitStore store) {
        doReturn(Uni.createFrom().failure(new IllegalStateException("region down")))
                .when(store)
                .recordRequest(anyString(), anyString(), anyLong(), anyLong());
    }

    private void failSlidingWrites(InMemoryRateLimitStore store) {
        doReturn(Uni.createFrom().failure(new IllegalStateException("region down")))
                .when(store)
                .recordSlidingRequest(anyString(), anyString(), anyLong(), anyString(), anyLong(), anyLong(), anyLong());
    }

    private long requestCount(RateLimitStore store, String key) {
        return store.getRequests(key).await().atMost(TIMEOUT).size();
    }

    @Nested
    @DisplayName("Fixed window")
    class FixedWindowTests {

        private MultiRegionFixedWindow algorithm;

        @BeforeEach
        void setUp() {
            algorithm = MultiRegionAlgorithms.fixedWindow(10, "60 s");
        }

        @Test
        @DisplayName("should record every request in every region")
        void shouldRecordInEveryRegion() {
            var context = context(east, west, flaky);

            for (int i = 0; i < 4; i++) {
                var response = algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);
                response.pending().await().atMost(TIMEOUT);
                assertTrue(response.success());
            }

            assertEquals(4, requestCount(east, "app:user:0"));
            assertEquals(4, requestCount(west, "app:user:0"));
            assertEquals(4, requestCount(flaky, "app:user:0"));
        }

        @Test
        @DisplayName("should repair a region that missed writes once it answers again")
        void shouldRepairRegionThatMissedWrites() {
            var context = context(east, west, flaky);
            failWrites(flaky);

            for (int i = 0; i < 3; i++) {
                var response = algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);
                response.pending().await().atMost(TIMEOUT);
                assertTrue(response.success());
            }

            assertEquals(3, requestCount(east, "app:user:0"));
            assertEquals(3, requestCount(west, "app:user:0"));
            // the failed writes are copied in by read repair
            assertEquals(3, requestCount(flaky, "app:user:0"));
        }

        @Test
        @DisplayName("should sum the union of requests when reading remaining")
        void shouldSumUnionWhenReadingRemaining() {
            var context = context(east, west);
            east.replicateRequests("app:user:0", Map.of("a", 2L, "b", 1L), 60_000)
                    .await()
                    .atMost(TIMEOUT);
            west.replicateRequests("app:user:0", Map.of("b", 1L, "c", 4L), 60_000)
                    .await()
                    .atMost(TIMEOUT);

            var remaining = algorithm.getRemaining(context, "app:user").await().atMost(TIMEOUT);

            assertEquals(3, remaining.remaining());
            assertEquals(60_000, remaining.reset());
        }

        @Test
        @DisplayName("should reject once the limit is reached")
        void shouldRejectAtLimit() {
            var context = context(east, west);
            algorithm.limit(context, "app:user", 10).await().atMost(TIMEOUT).pending().await().atMost(TIMEOUT);

            var rejected = algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);

            assertFalse(rejected.success());
            assertEquals(0, rejected.remaining());
        }

        @Test
        @DisplayName("should fail when no region answers")
        void shouldFailWhenNoRegionAnswers() {
            var down = spy(new InMemoryRateLimitStore(new InMemoryKeyspace(clock)));
            failWrites(down);
            failWrites(flaky);
            var context = context(flaky, down);

            var error = assertThrows(
                    RegionsUnavailableException.class,
                    () -> algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT));

            assertEquals(2, error.getRegionCount());
        }

        @Test
        @DisplayName("should clear every region on reset")
        void shouldClearEveryRegionOnReset() {
            var context = context(east, west);
            algorithm.limit(context, "app:user", 5).await().atMost(TIMEOUT).pending().await().atMost(TIMEOUT);

            algorithm.resetTokens(context, "app:user").await().atMost(TIMEOUT);

            assertEquals(0, requestCount(east, "app:user:0"));
            assertEquals(0, requestCount(west, "app:user:0"));
        }
    }

    @Nested
    @DisplayName("Sliding window")
    class SlidingWindowTests {

        private MultiRegionSlidingWindow algorithm;

        @BeforeEach
        void setUp() {
            algorithm = MultiRegionAlgorithms.slidingWindow(5, "1 s");
        }

        @Test
        @DisplayName("should converge regions and reject over the limit")
        void shouldConvergeAndReject() {
            var context = context(east, west, flaky);
            failSlidingWrites(flaky);

            for (int i = 0; i < 5; i++) {
                var response = algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);
                response.pending().await().atMost(TIMEOUT);
                assertTrue(response.success(), "request " + i);
            }
            var rejected = algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);

            assertFalse(rejected.success());
            assertEquals(5, requestCount(flaky, "app:user:0"));
        }

        @Test
        @DisplayName("should weight the previous window")
        void shouldWeightPreviousWindow() {
            var context = context(east, west);
            clock.set(900);
            algorithm.limit(context, "app:user", 4).await().atMost(TIMEOUT).pending().await().atMost(TIMEOUT);

            clock.set(1_500);
            var remaining = algorithm.getRemaining(context, "app:user").await().atMost(TIMEOUT);

            // floor(0.5 * 4) from the previous window
            assertEquals(3, remaining.remaining());
        }
    }

    @Test
    @DisplayName("should refuse an empty region list")
    void shouldRefuseEmptyRegionList() {
        assertThrows(
                InvalidRateLimitConfigurationException.class,
                () -> new MultiRegionContext(List.of(), Optional.empty(), clock));
    }
}
