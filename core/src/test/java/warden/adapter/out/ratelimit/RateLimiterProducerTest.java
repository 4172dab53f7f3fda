package warden.adapter.out.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.inject.Instance;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.config.RateLimitingConfig;
import warden.config.RateLimitingConfig.EphemeralCacheConfig;
import warden.config.RateLimitingConfig.LimitConfig;
import warden.config.RateLimitingConfig.PlanConfig;
import warden.config.RateLimitingConfig.RedisConfig;
import warden.core.algorithm.SingleRegionContext;
import warden.core.model.ratelimit.AlgorithmType;
import warden.core.model.ratelimit.InvalidRateLimitConfigurationException;
import warden.support.MutableClock;

@ExtendWith(MockitoExtension.class)
@DisplayName("RateLimiterProducer")
class RateLimiterProducerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    @Mock
    private RateLimitingConfig config;

    @Mock
    private EphemeralCacheConfig ephemeralCacheConfig;

    @Mock
    private RedisConfig redisConfig;

    @Mock
    private PlanConfig freePlan;

    @Mock
    private LimitConfig perMinute;

    @Mock
    private LimitConfig perDay;

    @Mock
    private LimitConfig apiLimit;

    @Mock
    private Instance<ReactiveRedisDataSource> redisDataSource;

    @Mock
    private Instance<MeterRegistry> meterRegistry;

    private Vertx vertx;
    private SimpleMeterRegistry registry;
    private RateLimiterProducer producer;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        registry = new SimpleMeterRegistry();

        lenient().when(config.keyPrefix()).thenReturn("ratelimit");
        lenient().when(config.timeout()).thenReturn(Duration.ofSeconds(5));
        lenient().when(config.analytics()).thenReturn(true);
        lenient().when(config.protection()).thenReturn(false);
        lenient().when(config.denyListThreshold()).thenReturn(6);
        lenient().when(config.denyListFeedUrl()).thenReturn("http://localhost/{threshold}.txt");
        lenient().when(config.denyListFeedTimeout()).thenReturn(Duration.ofSeconds(1));
        lenient().when(config.analyticsBucket()).thenReturn(Duration.ofHours(1));
        lenient().when(config.analyticsRetention()).thenReturn(Duration.ofDays(90));
        lenient().when(config.ephemeralCache()).thenReturn(ephemeralCacheConfig);
        lenient().when(ephemeralCacheConfig.enabled()).thenReturn(true);
        lenient().when(ephemeralCacheConfig.maxEntries()).thenReturn(1_000L);
        lenient().when(config.redis()).thenReturn(redisConfig);
        lenient().when(redisConfig.enabled()).thenReturn(false);
        lenient().when(config.plans()).thenReturn(Map.of("free", freePlan));
        lenient().when(config.api()).thenReturn(Optional.of(apiLimit));
        lenient().when(freePlan.perMinute()).thenReturn(perMinute);
        lenient().when(freePlan.perDay()).thenReturn(perDay);
        stubLimit(perMinute, AlgorithmType.SLIDING_WINDOW, 5, "1 m");
        stubLimit(perDay, AlgorithmType.SLIDING_WINDOW, 20, "24 h");
        stubLimit(apiLimit, AlgorithmType.FIXED_WINDOW, 100, "1 m");

        lenient().when(redisDataSource.isResolvable()).thenReturn(false);
        lenient().when(meterRegistry.isResolvable()).thenReturn(true);
        lenient().when(meterRegistry.get()).thenReturn(registry);

        producer = new RateLimiterProducer(config, redisDataSource, meterRegistry, vertx, new MutableClock(0));
    }

    @AfterEach
    void tearDown() {
        if (vertx != null) {
            vertx.close().await().indefinitely();
        }
    }

    private static void stubLimit(LimitConfig limit, AlgorithmType algorithm, long value, String window) {
        lenient().when(limit.algorithm()).thenReturn(algorithm);
        lenient().when(limit.limit()).thenReturn(value);
        lenient().when(limit.window()).thenReturn(window);
        lenient().when(limit.refillRate()).thenReturn(Optional.empty());
        lenient().when(limit.maxTokens()).thenReturn(Optional.empty());
    }

    @Test
    @DisplayName("should build per-minute and per-day limiters for each plan")
    void shouldBuildLimitersForEachPlan() {
        var limiters = producer.producePlanRateLimiters();

        var free = limiters.plan("free").orElseThrow();
        assertEquals("ratelimit:free:minute", free.perMinute().options().prefix());
        assertEquals("ratelimit:free:day", free.perDay().options().prefix());
        assertEquals(5, free.perMinute().maxRequests());
        assertEquals(20, free.perDay().maxRequests());
        assertEquals("ratelimit:api", limiters.api().orElseThrow().options().prefix());
        assertTrue(free.perMinute().options().analytics());
    }

    @Test
    @DisplayName("should apply plan quotas against the in-memory store")
    void shouldApplyPlanQuotas() {
        var service = producer.producePlanQuotaService(producer.producePlanRateLimiters());

        var result = service.checkPlanQuota("free", "user:1").await().atMost(TIMEOUT);

        assertTrue(result.allowed());
        assertEquals(4, result.remaining());
        assertTrue(registry.find("warden.ratelimit.decisions").counters().size() > 0);
    }

    @Test
    @DisplayName("should fall back to memory when Redis is enabled but unavailable")
    void shouldFallBackToMemoryWhenRedisUnavailable() {
        lenient().when(redisConfig.enabled()).thenReturn(true);

        var limiters = producer.producePlanRateLimiters();

        assertInstanceOf(
                SingleRegionContext.class,
                limiters.plan("free").orElseThrow().perMinute().context());
        verify(redisDataSource, never()).get();
    }

    @Test
    @DisplayName("should map token bucket limits")
    void shouldMapTokenBucketLimits() {
        var bucket = mock(LimitConfig.class);
        stubLimit(bucket, AlgorithmType.TOKEN_BUCKET, 0, "10 s");
        lenient().when(bucket.refillRate()).thenReturn(Optional.of(2L));
        lenient().when(bucket.maxTokens()).thenReturn(Optional.of(8L));

        var limit = RateLimiterProducer.toPlanLimit(bucket);

        assertEquals(AlgorithmType.TOKEN_BUCKET, limit.algorithm());
        assertEquals(10_000, limit.window().millis());
        assertEquals(Optional.of(8L), limit.maxTokens());
    }

    @Test
    @DisplayName("should reject an unparsable window")
    void shouldRejectUnparsableWindow() {
        lenient().when(perMinute.window()).thenReturn("one minute");

        assertThrows(InvalidRateLimitConfigurationException.class, producer::producePlanRateLimiters);
    }
}
