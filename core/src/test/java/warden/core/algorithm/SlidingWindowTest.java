package warden.core.algorithm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.adapter.out.memory.InMemoryKeyspace;
import warden.adapter.out.memory.InMemoryRateLimitStore;
import warden.support.MutableClock;

@DisplayName("SlidingWindow")
class SlidingWindowTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private SingleRegionContext context;
    private SlidingWindow algorithm;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(0);
        context = new SingleRegionContext(
                new InMemoryRateLimitStore(new InMemoryKeyspace(clock)), Optional.empty(), clock);
        algorithm = Algorithms.slidingWindow(10, "1 s");
    }

    private void burst(int requests) {
        for (int i = 0; i < requests; i++) {
            assertTrue(algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT).success(), "request " + i);
        }
    }

    @Test
    @DisplayName("should weight the previous window by the share still covered")
    void shouldWeightPreviousWindow() {
        clock.set(900);
        burst(10);

        // half of the previous window is still covered: floor(0.5 * 10) = 5
        clock.set(1_500);
        burst(5);
        var rejected = algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);

        assertFalse(rejected.success());
        assertEquals(0, rejected.remaining());
        assertEquals(2_000, rejected.reset());
    }

    @Test
    @DisplayName("should not carry a head burst beyond the next window")
    void shouldForgetWindowsOlderThanPrevious() {
        clock.set(0);
        burst(10);
        assertFalse(algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT).success());

        clock.set(2_000);
        var response = algorithm.limit(context, "app:user", 1).await().atMost(TIMEOUT);

        assertTrue(response.success());
        assertEquals(9, response.remaining());
    }

    @Test
    @DisplayName("should report remaining including the weighted previous window")
    void shouldReportWeightedRemaining() {
        clock.set(900);
        burst(8);

        clock.set(1_500);
        burst(1);
        var remaining = algorithm.getRemaining(context, "app:user").await().atMost(TIMEOUT);

        // 1 current + floor(0.5 * 8) previous
        assertEquals(5, remaining.remaining());
        assertEquals(2_000, remaining.reset());
    }

    @Test
    @DisplayName("should reject a multi-token request that does not fit")
    void shouldRejectOversizedRequest() {
        burst(8);

        var response = algorithm.limit(context, "app:user", 3).await().atMost(TIMEOUT);

        assertFalse(response.success());
        // the rejected request consumed nothing
        assertEquals(2, algorithm.getRemaining(context, "app:user").await().atMost(TIMEOUT).remaining());
    }
}
