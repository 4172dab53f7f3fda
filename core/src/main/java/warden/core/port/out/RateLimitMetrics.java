package warden.core.port.out;

import warden.core.model.ratelimit.RateLimitResponse;

/**
 * Port interface for rate limiting metrics.
 */
public interface RateLimitMetrics {

    /**
     * Record the decision returned to the caller.
     *
     * @param prefix the limiter's key prefix
     * @param response the response
     */
    void recordDecision(String prefix, RateLimitResponse response);

    void recordTimeout(String prefix);

    void recordAnalyticsFailure(String prefix);

    /**
     * Record a background or explicit deny-list refresh.
     *
     * @param prefix the limiter's key prefix
     * @param success whether the refresh completed
     */
    void recordDenyListRefresh(String prefix, boolean success);
}
