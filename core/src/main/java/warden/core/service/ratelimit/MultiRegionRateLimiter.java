package warden.core.service.ratelimit;

import warden.core.algorithm.MultiRegionContext;
import warden.core.algorithm.RateLimitAlgorithm;
import warden.core.port.out.RateLimitMetrics;
import warden.core.service.analytics.UsageAnalytics;
import warden.core.service.denylist.DenyListService;

/**
 * Rate limiter replicated over independent regional stores.
 *
 * <p>The first region to answer decides each call; the others are reconciled in the
 * background. Analytics and the deny-list live in one primary deployment.
 */
public class MultiRegionRateLimiter extends RateLimiter<MultiRegionContext> {

    public MultiRegionRateLimiter(
            RateLimitAlgorithm<MultiRegionContext> algorithm,
            MultiRegionContext context,
            RateLimiterOptions options,
            UsageAnalytics analytics,
            DenyListService denyList,
            RateLimitMetrics metrics) {
        super(algorithm, context, options, analytics, denyList, metrics);
    }

    public int regionCount() {
        return context().regions().size();
    }
}
