package warden.core.service.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.core.algorithm.SingleRegionContext;
import warden.core.model.ratelimit.RateLimitResponse;
import warden.core.service.ratelimit.RateLimiter;

@ExtendWith(MockitoExtension.class)
@DisplayName("PlanQuotaService")
class PlanQuotaServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    @Mock
    private RateLimiter<SingleRegionContext> perMinute;

    @Mock
    private RateLimiter<SingleRegionContext> perDay;

    @Mock
    private RateLimiter<SingleRegionContext> api;

    private PlanQuotaService service;

    @BeforeEach
    void setUp() {
        var limiters = new PlanRateLimiters(Map.of("free", new PlanLimiters(perMinute, perDay)), Optional.of(api));
        service = new PlanQuotaService(limiters);
    }

    @Nested
    @DisplayName("checkPlanQuota")
    class PlanQuotaTests {

        @Test
        @DisplayName("should stop at an exhausted per-minute quota")
        void shouldStopAtExhaustedMinuteQuota() {
            when(perMinute.limit("user:1")).thenReturn(Uni.createFrom().item(RateLimitResponse.of(false, 5, 0, 60_000)));

            var result = service.checkPlanQuota("free", "user:1").await().atMost(TIMEOUT);

            assertFalse(result.allowed());
            assertEquals(0, result.remaining());
            assertEquals(60_000, result.reset());
            assertEquals(PlanQuotaService.MINUTE_EXHAUSTED, result.message().orElseThrow());
            verify(perDay, never()).limit(anyString());
        }

        @Test
        @DisplayName("should report an exhausted per-day quota")
        void shouldReportExhaustedDayQuota() {
            when(perMinute.limit("user:1")).thenReturn(Uni.createFrom().item(RateLimitResponse.of(true, 5, 4, 60_000)));
            when(perDay.limit("user:1")).thenReturn(Uni.createFrom().item(RateLimitResponse.of(false, 20, 0, 86_400_000)));

            var result = service.checkPlanQuota("free", "user:1").await().atMost(TIMEOUT);

            assertFalse(result.allowed());
            assertEquals(86_400_000, result.reset());
            assertEquals(PlanQuotaService.DAY_EXHAUSTED, result.message().orElseThrow());
        }

        @Test
        @DisplayName("should return the tighter remaining and the earlier reset")
        void shouldReturnTighterQuota() {
            when(perMinute.limit("user:1")).thenReturn(Uni.createFrom().item(RateLimitResponse.of(true, 5, 4, 60_000)));
            when(perDay.limit("user:1")).thenReturn(Uni.createFrom().item(RateLimitResponse.of(true, 20, 2, 86_400_000)));

            var result = service.checkPlanQuota("free", "user:1").await().atMost(TIMEOUT);

            assertTrue(result.allowed());
            assertEquals(2, result.remaining());
            assertEquals(20, result.limit());
            assertEquals(60_000, result.reset());
            assertTrue(result.message().isEmpty());
        }

        @Test
        @DisplayName("should use the free plan by default")
        void shouldUseFreePlanByDefault() {
            when(perMinute.limit("user:1")).thenReturn(Uni.createFrom().item(RateLimitResponse.of(false, 5, 0, 60_000)));

            var result = service.checkPlanQuota("user:1").await().atMost(TIMEOUT);

            assertFalse(result.allowed());
        }

        @Test
        @DisplayName("should reject unknown plans")
        void shouldRejectUnknownPlans() {
            assertThrows(IllegalArgumentException.class, () -> service.checkPlanQuota("platinum", "user:1"));
        }
    }

    @Test
    @DisplayName("should pass api checks to the api limiter")
    void shouldPassApiChecksToApiLimiter() {
        var response = RateLimitResponse.of(true, 100, 99, 60_000);
        when(api.limit("ip:203.0.113.1")).thenReturn(Uni.createFrom().item(response));

        assertSame(response, service.checkApiRateLimit("ip:203.0.113.1").await().atMost(TIMEOUT));
    }
}
