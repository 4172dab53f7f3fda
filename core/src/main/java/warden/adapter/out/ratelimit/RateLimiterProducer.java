package warden.adapter.out.ratelimit;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.vertx.mutiny.core.Vertx;
import org.jboss.logging.Logger;

import warden.adapter.out.http.IpsumDenyListFeed;
import warden.adapter.out.memory.InMemoryBackend;
import warden.adapter.out.redis.RedisBackend;
import warden.adapter.out.telemetry.MicrometerRateLimitMetrics;
import warden.adapter.out.telemetry.NoOpRateLimitMetrics;
import warden.config.RateLimitingConfig;
import warden.config.RateLimitingConfig.LimitConfig;
import warden.core.algorithm.Algorithms;
import warden.core.model.denylist.DenyListThreshold;
import warden.core.model.plan.PlanLimit;
import warden.core.model.ratelimit.WindowDuration;
import warden.core.port.out.RateLimitMetrics;
import warden.core.port.out.StoreBackend;
import warden.core.service.plan.PlanLimiters;
import warden.core.service.plan.PlanQuotaService;
import warden.core.service.plan.PlanRateLimiters;
import warden.core.service.ratelimit.RateLimiter;
import warden.core.service.ratelimit.RateLimiterFactory;
import warden.core.service.ratelimit.RateLimiterOptions;

/**
 * CDI producer for the plan rate limiters.
 *
 * <p>Selects the store based on configuration and availability:
 * <ul>
 *   <li>Redis - Used when Redis is enabled and a data source is available</li>
 *   <li>In-memory - Fallback, always available</li>
 * </ul>
 *
 * <p>All limiters are built once at startup and shared.
 */
@ApplicationScoped
public class RateLimiterProducer {

    private static final Logger LOG = Logger.getLogger(RateLimiterProducer.class);

    private final RateLimitingConfig config;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final Instance<MeterRegistry> meterRegistry;
    private final Vertx vertx;
    private final Clock clock;

    @Inject
    public RateLimiterProducer(
            RateLimitingConfig config,
            Instance<ReactiveRedisDataSource> redisDataSource,
            Instance<MeterRegistry> meterRegistry,
            Vertx vertx) {
        this(config, redisDataSource, meterRegistry, vertx, Clock.systemUTC());
    }

    RateLimiterProducer(
            RateLimitingConfig config,
            Instance<ReactiveRedisDataSource> redisDataSource,
            Instance<MeterRegistry> meterRegistry,
            Vertx vertx,
            Clock clock) {
        this.config = config;
        this.redisDataSource = redisDataSource;
        this.meterRegistry = meterRegistry;
        this.vertx = vertx;
        this.clock = clock;
    }

    /**
     * Produces the limiters of every configured plan.
     *
     * @return the plan registry
     */
    @Produces
    @Singleton
    public PlanRateLimiters producePlanRateLimiters() {
        final var factory = new RateLimiterFactory(backend(), feed(), metrics(), clock);

        final var plans = new LinkedHashMap<String, PlanLimiters>();
        config.plans().forEach((name, plan) -> {
            final var perMinute = limiter(factory, plan.perMinute(), config.keyPrefix() + ":" + name + ":minute");
            final var perDay = limiter(factory, plan.perDay(), config.keyPrefix() + ":" + name + ":day");
            plans.put(name, new PlanLimiters(perMinute, perDay));
        });
        final Optional<RateLimiter<?>> api =
                config.api().map(limit -> limiter(factory, limit, config.keyPrefix() + ":api"));

        LOG.infov("Rate limiting configured for plans {0} (api limiter: {1})", plans.keySet(), api.isPresent());
        return new PlanRateLimiters(plans, api);
    }

    @Produces
    @Singleton
    public PlanQuotaService producePlanQuotaService(PlanRateLimiters limiters) {
        return new PlanQuotaService(limiters);
    }

    private RateLimiter<?> limiter(RateLimiterFactory factory, LimitConfig limit, String prefix) {
        return factory.singleRegion(Algorithms.forLimit(toPlanLimit(limit)), options(prefix));
    }

    static PlanLimit toPlanLimit(LimitConfig limit) {
        return new PlanLimit(
                limit.algorithm(),
                limit.limit(),
                WindowDuration.parse(limit.window()),
                limit.refillRate(),
                limit.maxTokens());
    }

    RateLimiterOptions options(String prefix) {
        return new RateLimiterOptions(
                prefix,
                config.timeout(),
                config.analytics(),
                config.protection(),
                new DenyListThreshold(config.denyListThreshold()),
                config.ephemeralCache().enabled(),
                config.ephemeralCache().maxEntries(),
                Optional.empty(),
                config.analyticsBucket(),
                config.analyticsRetention());
    }

    private StoreBackend backend() {
        return redisBackend().orElseGet(() -> {
            LOG.info("Using in-memory rate limit store");
            return InMemoryBackend.create(clock);
        });
    }

    private Optional<StoreBackend> redisBackend() {
        if (!config.redis().enabled()) {
            LOG.debug("Redis rate limiting not enabled in configuration");
            return Optional.empty();
        }

        if (!redisDataSource.isResolvable()) {
            LOG.warn("Redis rate limiting enabled but ReactiveRedisDataSource not available");
            return Optional.empty();
        }

        try {
            final var backend = RedisBackend.create(redisDataSource.get());
            LOG.info("Using Redis rate limit store");
            return Optional.of(backend);
        } catch (Exception e) {
            LOG.warnv(e, "Failed to initialize Redis rate limit store, falling back to in-memory");
            return Optional.empty();
        }
    }

    private IpsumDenyListFeed feed() {
        return new IpsumDenyListFeed(vertx, config.denyListFeedUrl(), config.denyListFeedTimeout());
    }

    private RateLimitMetrics metrics() {
        if (meterRegistry.isResolvable()) {
            return new MicrometerRateLimitMetrics(meterRegistry.get());
        }
        LOG.debug("No MeterRegistry available, rate limit metrics disabled");
        return NoOpRateLimitMetrics.getInstance();
    }
}
