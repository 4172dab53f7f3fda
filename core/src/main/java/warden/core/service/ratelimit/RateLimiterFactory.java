package warden.core.service.ratelimit;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import org.jboss.logging.Logger;

import warden.core.algorithm.MultiRegionContext;
import warden.core.algorithm.RateLimitAlgorithm;
import warden.core.algorithm.SingleRegionContext;
import warden.core.cache.EphemeralCache;
import warden.core.port.out.DenyListFeed;
import warden.core.port.out.RateLimitMetrics;
import warden.core.port.out.RateLimitStore;
import warden.core.port.out.StoreBackend;
import warden.core.service.analytics.UsageAnalytics;
import warden.core.service.denylist.DenyListService;

/**
 * Builds rate limiters on one primary store deployment.
 *
 * <p>The primary backend holds counters of single-region limiters, analytics and the
 * deny-list. Multi-region limiters keep their counters in the regional stores they are
 * given.
 */
public class RateLimiterFactory {

    private static final Logger LOG = Logger.getLogger(RateLimiterFactory.class);

    private final StoreBackend primary;
    private final DenyListFeed feed;
    private final RateLimitMetrics metrics;
    private final Clock clock;

    public RateLimiterFactory(StoreBackend primary, DenyListFeed feed, RateLimitMetrics metrics, Clock clock) {
        this.primary = primary;
        this.feed = feed;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Create a limiter on the primary store.
     *
     * @param algorithm the algorithm
     * @param options limiter settings
     * @return the limiter
     */
    public SingleRegionRateLimiter singleRegion(
            RateLimitAlgorithm<SingleRegionContext> algorithm, RateLimiterOptions options) {
        final var context = new SingleRegionContext(primary.rateLimitStore(), cache(options), clock);
        LOG.infov(
                "Created rate limiter {0} with {1} (limit {2})",
                options.prefix(), algorithm.getClass().getSimpleName(), algorithm.maxRequests());
        return new SingleRegionRateLimiter(
                algorithm, context, options, analytics(options), denyList(options), metrics);
    }

    /**
     * Create a limiter replicated over regional stores.
     *
     * @param algorithm a multi-region algorithm
     * @param regions one store per region
     * @param options limiter settings
     * @return the limiter
     */
    public MultiRegionRateLimiter multiRegion(
            RateLimitAlgorithm<MultiRegionContext> algorithm, List<RateLimitStore> regions, RateLimiterOptions options) {
        final var context = new MultiRegionContext(regions, cache(options), clock);
        LOG.infov(
                "Created rate limiter {0} with {1} over {2} regions (limit {3})",
                options.prefix(), algorithm.getClass().getSimpleName(), regions.size(), algorithm.maxRequests());
        return new MultiRegionRateLimiter(
                algorithm, context, options, analytics(options), denyList(options), metrics);
    }

    private Optional<EphemeralCache> cache(RateLimiterOptions options) {
        if (!options.ephemeralCache()) {
            return Optional.empty();
        }
        return Optional.of(options.sharedCache()
                .map(entries -> new EphemeralCache(entries, clock))
                .orElseGet(() -> new EphemeralCache(options.ephemeralCacheEntries(), clock)));
    }

    private UsageAnalytics analytics(RateLimiterOptions options) {
        return new UsageAnalytics(
                primary.analyticsStore(),
                options.prefix(),
                options.analyticsBucket(),
                options.analyticsRetention(),
                clock);
    }

    private DenyListService denyList(RateLimiterOptions options) {
        return new DenyListService(
                options.prefix(),
                primary.denyListStore(),
                feed,
                new EphemeralCache(EphemeralCache.DEFAULT_MAX_ENTRIES, clock),
                metrics,
                clock);
    }
}
