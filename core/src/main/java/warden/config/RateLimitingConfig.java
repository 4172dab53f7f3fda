package warden.config;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import warden.core.model.ratelimit.AlgorithmType;

/**
 * Configuration mapping for rate limiting.
 *
 * <p>Configuration prefix: {@code warden.rate-limiting}
 *
 * <p>The settings at the top level apply to every limiter. Each plan names its own
 * per-minute and per-day limits.
 *
 * <h2>Example</h2>
 * <pre>
 * warden.rate-limiting.analytics=true
 * warden.rate-limiting.plans.free.per-minute.limit=5
 * warden.rate-limiting.plans.free.per-minute.window=1 m
 * warden.rate-limiting.plans.free.per-day.limit=20
 * warden.rate-limiting.plans.free.per-day.window=24 h
 * warden.rate-limiting.api.limit=100
 * warden.rate-limiting.api.window=1 m
 * </pre>
 */
@ConfigMapping(prefix = "warden.rate-limiting")
public interface RateLimitingConfig {

    /**
     * Prefix of the store keys of the plan limiters. A limiter of plan {@code free}
     * uses {@code <key-prefix>:free:minute}.
     *
     * @return key prefix (default: ratelimit)
     */
    @WithDefault("ratelimit")
    String keyPrefix();

    /**
     * How long to wait for the store before allowing a request.
     *
     * <p>Zero disables the timeout.
     *
     * @return the timeout (default: PT5S)
     */
    @WithDefault("PT5S")
    Duration timeout();

    /**
     * Record every decision as an analytics event.
     *
     * @return true to record analytics (default: false)
     */
    @WithDefault("false")
    boolean analytics();

    /**
     * Check identifiers, IPs, user agents and countries against the deny-list.
     *
     * @return true to enable deny-list protection (default: false)
     */
    @WithDefault("false")
    boolean protection();

    /**
     * Severity level of the IP feed used to refresh the deny-list, from 1 to 8.
     *
     * @return the level (default: 6)
     */
    @WithDefault("6")
    int denyListThreshold();

    /**
     * URL of the IP deny-list feed. {@code {threshold}} is replaced with the level.
     *
     * @return the feed URL template
     */
    @WithDefault("https://raw.githubusercontent.com/stamparm/ipsum/master/levels/{threshold}.txt")
    String denyListFeedUrl();

    /**
     * Timeout of a single deny-list feed download.
     *
     * @return the timeout (default: PT30S)
     */
    @WithDefault("PT30S")
    Duration denyListFeedTimeout();

    /**
     * Size of an analytics time bucket.
     *
     * @return bucket size (default: PT1H)
     */
    @WithDefault("PT1H")
    Duration analyticsBucket();

    /**
     * How long analytics buckets are kept.
     *
     * @return retention (default: P90D)
     */
    @WithDefault("P90D")
    Duration analyticsRetention();

    /**
     * Local cache of blocked identifiers.
     */
    EphemeralCacheConfig ephemeralCache();

    /**
     * Redis backend configuration.
     */
    RedisConfig redis();

    /**
     * Limits per subscription plan, keyed by plan name.
     */
    Map<String, PlanConfig> plans();

    /**
     * Limit applied to generic API endpoints.
     */
    Optional<LimitConfig> api();

    interface EphemeralCacheConfig {

        /**
         * @return true to keep blocked identifiers in a local cache (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * @return bound of the local cache (default: 10000)
         */
        @WithDefault("10000")
        long maxEntries();
    }

    /**
     * Redis-specific configuration.
     */
    interface RedisConfig {

        /**
         * Enable Redis as the store.
         *
         * <p>When enabled and a Redis data source is available, counters, analytics and
         * the deny-list live in Redis. Otherwise they are kept in memory.
         *
         * @return true to use Redis (default: false)
         */
        @WithDefault("false")
        boolean enabled();
    }

    /**
     * The two quotas of a plan.
     */
    interface PlanConfig {

        LimitConfig perMinute();

        LimitConfig perDay();
    }

    /**
     * One limit.
     */
    interface LimitConfig {

        /**
         * @return the algorithm (default: SLIDING_WINDOW)
         */
        @WithDefault("SLIDING_WINDOW")
        AlgorithmType algorithm();

        /**
         * Requests per window. Ignored by the token bucket, which uses {@link #maxTokens()}.
         *
         * @return the limit (default: 100)
         */
        @WithDefault("100")
        long limit();

        /**
         * Window or refill interval, such as {@code 1 m} or {@code 24 h}.
         *
         * @return the window (default: 1 m)
         */
        @WithDefault("1 m")
        String window();

        /**
         * @return tokens added per interval, token bucket only
         */
        Optional<Long> refillRate();

        /**
         * @return bucket capacity, token bucket only
         */
        Optional<Long> maxTokens();
    }
}
