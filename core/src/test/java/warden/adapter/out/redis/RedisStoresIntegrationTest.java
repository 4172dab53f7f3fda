package warden.adapter.out.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import io.quarkus.redis.runtime.datasource.ReactiveRedisDataSourceImpl;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.redis.client.Redis;
import io.vertx.mutiny.redis.client.RedisAPI;
import io.vertx.redis.client.RedisOptions;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import warden.adapter.out.telemetry.NoOpRateLimitMetrics;
import warden.core.algorithm.Algorithms;
import warden.core.algorithm.SingleRegionContext;
import warden.core.cache.EphemeralCache;
import warden.core.model.analytics.AnalyticsEvent;
import warden.core.model.analytics.EventOutcome;
import warden.core.model.analytics.IdentifierCount;
import warden.core.model.analytics.UsageCounts;
import warden.core.model.denylist.DenyListThreshold;
import warden.core.port.out.StoreBackend;
import warden.core.service.analytics.UsageAnalytics;
import warden.core.service.denylist.DenyListService;
import warden.core.service.denylist.RefreshSchedule;
import warden.support.MutableClock;

/**
 * Runs the Lua procedures against a real Redis.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Redis stores integration")
class RedisStoresIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Container
    static GenericContainer<?> redis =
            new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

    private static Vertx vertx;
    private static Redis redisClient;
    private static RedisScriptExecutor scripts;
    private static StoreBackend backend;

    private MutableClock clock;
    private String prefix;

    @BeforeAll
    static void setUpClass() {
        vertx = Vertx.vertx();
        var redisOptions =
                new RedisOptions().setConnectionString("redis://" + redis.getHost() + ":" + redis.getMappedPort(6379));
        redisClient = Redis.createClient(vertx, redisOptions);
        var dataSource = new ReactiveRedisDataSourceImpl(vertx, redisClient, RedisAPI.api(redisClient));
        scripts = new RedisScriptExecutor(dataSource);
        backend = RedisBackend.create(dataSource);
    }

    @AfterAll
    static void tearDownClass() {
        if (redisClient != null) {
            redisClient.close();
        }
        if (vertx != null) {
            vertx.close().await().indefinitely();
        }
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(System.currentTimeMillis());
        prefix = "test-" + UUID.randomUUID();
    }

    private SingleRegionContext context() {
        return new SingleRegionContext(backend.rateLimitStore(), Optional.of(new EphemeralCache(100, clock)), clock);
    }

    @Nested
    @DisplayName("Rate limit procedures")
    class RateLimitTests {

        @Test
        @DisplayName("should count a fixed window and reject over the limit")
        void shouldCountFixedWindow() {
            var algorithm = Algorithms.fixedWindow(3, "60 s");
            var context = context();

            for (long expected = 2; expected >= 0; expected--) {
                var response = algorithm.limit(context, prefix, 1).await().atMost(TIMEOUT);
                assertTrue(response.success());
                assertEquals(expected, response.remaining());
            }

            assertFalse(algorithm.limit(context, prefix, 1).await().atMost(TIMEOUT).success());
            assertEquals(0, algorithm.getRemaining(context, prefix).await().atMost(TIMEOUT).remaining());
        }

        @Test
        @DisplayName("should not consume a rejected sliding window request")
        void shouldNotConsumeRejectedSlidingRequest() {
            var algorithm = Algorithms.slidingWindow(5, "60 s");
            var context = context();

            assertTrue(algorithm.limit(context, prefix, 4).await().atMost(TIMEOUT).success());
            assertFalse(algorithm.limit(context, prefix, 2).await().atMost(TIMEOUT).success());

            assertEquals(1, algorithm.getRemaining(context, prefix).await().atMost(TIMEOUT).remaining());
        }

        @Test
        @DisplayName("should drain and refill a token bucket")
        void shouldDrainAndRefillTokenBucket() {
            var algorithm = Algorithms.tokenBucket(1, "10 s", 2);
            var context = new SingleRegionContext(backend.rateLimitStore(), Optional.empty(), clock);

            assertTrue(algorithm.limit(context, prefix, 1).await().atMost(TIMEOUT).success());
            assertTrue(algorithm.limit(context, prefix, 1).await().atMost(TIMEOUT).success());
            assertFalse(algorithm.limit(context, prefix, 1).await().atMost(TIMEOUT).success());

            clock.advance(10_000);
            var refilled = algorithm.limit(context, prefix, 1).await().atMost(TIMEOUT);

            assertTrue(refilled.success());
            assertEquals(0, refilled.remaining());
        }

        @Test
        @DisplayName("should add missing requests to an existing hash")
        void shouldReplicateRequests() {
            var store = backend.rateLimitStore();
            store.recordRequest(prefix, "a", 1, 60_000).await().atMost(TIMEOUT);

            store.replicateRequests(prefix, Map.of("b", 2L), 60_000).await().atMost(TIMEOUT);

            assertEquals(Map.of("a", 1L, "b", 2L), store.getRequests(prefix).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should delete keys matching a pattern")
        void shouldDeleteMatchingKeys() {
            var algorithm = Algorithms.fixedWindow(3, "60 s");
            var context = new SingleRegionContext(backend.rateLimitStore(), Optional.empty(), clock);
            algorithm.limit(context, prefix, 3).await().atMost(TIMEOUT);

            algorithm.resetTokens(context, prefix).await().atMost(TIMEOUT);

            assertEquals(3, algorithm.getRemaining(context, prefix).await().atMost(TIMEOUT).remaining());
        }

        @Test
        @DisplayName("should fall back to EVAL when the script cache was flushed")
        void shouldFallBackToEvalAfterFlush() {
            scripts.execute("SCRIPT", "FLUSH").await().atMost(TIMEOUT);

            var used = backend.rateLimitStore().incrementFixedWindow(prefix, 60_000, 1).await().atMost(TIMEOUT);

            assertEquals(1L, used);
        }
    }

    @Nested
    @DisplayName("Analytics procedures")
    class AnalyticsTests {

        @Test
        @DisplayName("should aggregate and classify recorded events")
        void shouldAggregateAndClassify() {
            var analytics = new UsageAnalytics(
                    backend.analyticsStore(), prefix, Duration.ofHours(1), Duration.ofDays(1), clock);
            record(analytics, "alice", EventOutcome.ALLOWED, 3);
            record(analytics, "alice", EventOutcome.RATE_LIMITED, 1);
            record(analytics, "mallory", EventOutcome.DENIED, 2);

            var usage = analytics.getUsage(clock.millis()).await().atMost(TIMEOUT);
            var overTime = analytics.getUsageOverTime(2).await().atMost(TIMEOUT);
            var most = analytics.getMostAllowedBlocked(1).await().atMost(TIMEOUT);

            assertEquals(new UsageCounts(3, 1), usage.get("alice"));
            assertEquals(new UsageCounts(0, 2), usage.get("mallory"));
            assertEquals(3L, overTime.get(0).count("true"));
            assertEquals(2L, overTime.get(0).count("denied"));
            assertTrue(overTime.get(1).counts().isEmpty());
            assertEquals(List.of(new IdentifierCount("alice", 3)), most.allowed());
            assertEquals(List.of(new IdentifierCount("mallory", 2)), most.denied());
        }

        private void record(UsageAnalytics analytics, String identifier, EventOutcome outcome, int times) {
            for (int i = 0; i < times; i++) {
                analytics.record(new AnalyticsEvent(identifier, clock.millis(), outcome, Optional.empty()))
                        .await()
                        .atMost(TIMEOUT);
            }
        }
    }

    @Nested
    @DisplayName("Deny-list procedures")
    class DenyListTests {

        @Test
        @DisplayName("should replace the ip subset, keep manual entries and single-flight refreshes")
        void shouldReplaceIpSubset() {
            var service = new DenyListService(
                    prefix,
                    backend.denyListStore(),
                    threshold -> Uni.createFrom().item(List.of("192.0.2.1", "192.0.2.2")),
                    new EphemeralCache(100, clock),
                    NoOpRateLimitMetrics.getInstance(),
                    clock);

            var first = service.check(List.of("user")).await().atMost(TIMEOUT);
            var second = service.check(List.of("user")).await().atMost(TIMEOUT);
            assertTrue(first.refreshNeeded());
            assertFalse(second.refreshNeeded());

            service.add(List.of("manual")).await().atMost(TIMEOUT);
            service.updateIpDenyList(DenyListThreshold.DEFAULT).await().atMost(TIMEOUT);
            var afterUpdate = service.check(List.of("manual", "192.0.2.2", "user")).await().atMost(TIMEOUT);

            assertEquals(List.of("manual", "192.0.2.2"), afterUpdate.deniedValues());
            assertTrue(afterUpdate.statusTtl() > 0);
            assertTrue(afterUpdate.statusTtl() * 1000 <= RefreshSchedule.millisUntilNextRefresh(clock) + 1000);

            service.disableIpDenyList().await().atMost(TIMEOUT);
            var afterDisable = service.check(List.of("manual", "192.0.2.2")).await().atMost(TIMEOUT);

            assertEquals(List.of("manual"), afterDisable.deniedValues());
            assertFalse(afterDisable.refreshNeeded());
        }
    }
}
