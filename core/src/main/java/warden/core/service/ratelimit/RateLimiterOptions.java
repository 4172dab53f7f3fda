package warden.core.service.ratelimit;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import warden.core.cache.EphemeralCache;
import warden.core.model.denylist.DenyListThreshold;
import warden.core.model.ratelimit.InvalidRateLimitConfigurationException;

/**
 * Settings of one rate limiter.
 *
 * @param prefix prefix of every store key, {@code @app/ratelimit} by default
 * @param timeout how long to wait for the store before allowing the request; zero disables
 *     the timeout
 * @param analytics whether decisions are recorded as analytics events
 * @param protection whether candidates are checked against the deny-list
 * @param denyListThreshold feed severity used for automatic deny-list refreshes
 * @param ephemeralCache whether the limiter keeps a local cache of blocked identifiers
 * @param ephemeralCacheEntries bound of the local cache when the limiter creates it
 * @param sharedCache an externally supplied map to back the local cache
 * @param analyticsBucket size of an analytics time bucket
 * @param analyticsRetention how long analytics buckets are kept
 */
public record RateLimiterOptions(
        String prefix,
        Duration timeout,
        boolean analytics,
        boolean protection,
        DenyListThreshold denyListThreshold,
        boolean ephemeralCache,
        long ephemeralCacheEntries,
        Optional<Map<String, Long>> sharedCache,
        Duration analyticsBucket,
        Duration analyticsRetention) {

    public static final String DEFAULT_PREFIX = "@app/ratelimit";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    public RateLimiterOptions {
        Objects.requireNonNull(prefix, "prefix must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative()) {
            throw new InvalidRateLimitConfigurationException("timeout must not be negative, got " + timeout);
        }
        denyListThreshold = Objects.requireNonNullElse(denyListThreshold, DenyListThreshold.DEFAULT);
        sharedCache = Objects.requireNonNullElse(sharedCache, Optional.empty());
    }

    public static RateLimiterOptions defaults() {
        return new RateLimiterOptions(
                DEFAULT_PREFIX,
                DEFAULT_TIMEOUT,
                false,
                false,
                DenyListThreshold.DEFAULT,
                true,
                EphemeralCache.DEFAULT_MAX_ENTRIES,
                Optional.empty(),
                Duration.ofHours(1),
                Duration.ofDays(90));
    }

    public RateLimiterOptions withPrefix(String value) {
        return new RateLimiterOptions(
                value,
                timeout,
                analytics,
                protection,
                denyListThreshold,
                ephemeralCache,
                ephemeralCacheEntries,
                sharedCache,
                analyticsBucket,
                analyticsRetention);
    }

    public RateLimiterOptions withTimeout(Duration value) {
        return new RateLimiterOptions(
                prefix,
                value,
                analytics,
                protection,
                denyListThreshold,
                ephemeralCache,
                ephemeralCacheEntries,
                sharedCache,
                analyticsBucket,
                analyticsRetention);
    }

    public RateLimiterOptions withAnalytics(boolean value) {
        return new RateLimiterOptions(
                prefix,
                timeout,
                value,
                protection,
                denyListThreshold,
                ephemeralCache,
                ephemeralCacheEntries,
                sharedCache,
                analyticsBucket,
                analyticsRetention);
    }

    public RateLimiterOptions withProtection(boolean value) {
        return new RateLimiterOptions(
                prefix,
                timeout,
                analytics,
                value,
                denyListThreshold,
                ephemeralCache,
                ephemeralCacheEntries,
                sharedCache,
                analyticsBucket,
                analyticsRetention);
    }

    public RateLimiterOptions withDenyListThreshold(int level) {
        return new RateLimiterOptions(
                prefix,
                timeout,
                analytics,
                protection,
                new DenyListThreshold(level),
                ephemeralCache,
                ephemeralCacheEntries,
                sharedCache,
                analyticsBucket,
                analyticsRetention);
    }

    /**
     * Disable or enable the local cache of blocked identifiers.
     */
    public RateLimiterOptions withEphemeralCache(boolean enabled) {
        return new RateLimiterOptions(
                prefix,
                timeout,
                analytics,
                protection,
                denyListThreshold,
                enabled,
                ephemeralCacheEntries,
                sharedCache,
                analyticsBucket,
                analyticsRetention);
    }

    /**
     * Back the local cache with a caller-owned map, e.g. to share it between limiters.
     */
    public RateLimiterOptions withEphemeralCache(Map<String, Long> entries) {
        return new RateLimiterOptions(
                prefix,
                timeout,
                analytics,
                protection,
                denyListThreshold,
                true,
                ephemeralCacheEntries,
                Optional.of(entries),
                analyticsBucket,
                analyticsRetention);
    }

    public RateLimiterOptions withAnalyticsBuckets(Duration bucket, Duration retention) {
        return new RateLimiterOptions(
                prefix,
                timeout,
                analytics,
                protection,
                denyListThreshold,
                ephemeralCache,
                ephemeralCacheEntries,
                sharedCache,
                bucket,
                retention);
    }
}
