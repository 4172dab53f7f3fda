package warden.core.service.ratelimit;

import warden.core.algorithm.RateLimitAlgorithm;
import warden.core.algorithm.SingleRegionContext;
import warden.core.port.out.RateLimitMetrics;
import warden.core.service.analytics.UsageAnalytics;
import warden.core.service.denylist.DenyListService;

/**
 * Rate limiter backed by a single store.
 */
public class SingleRegionRateLimiter extends RateLimiter<SingleRegionContext> {

    public SingleRegionRateLimiter(
            RateLimitAlgorithm<SingleRegionContext> algorithm,
            SingleRegionContext context,
            RateLimiterOptions options,
            UsageAnalytics analytics,
            DenyListService denyList,
            RateLimitMetrics metrics) {
        super(algorithm, context, options, analytics, denyList, metrics);
    }
}
