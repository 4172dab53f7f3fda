package warden.adapter.out.telemetry;

import warden.core.model.ratelimit.RateLimitResponse;
import warden.core.port.out.RateLimitMetrics;

/**
 * Metrics implementation used when no meter registry is available.
 */
public final class NoOpRateLimitMetrics implements RateLimitMetrics {

    private static final NoOpRateLimitMetrics INSTANCE = new NoOpRateLimitMetrics();

    private NoOpRateLimitMetrics() {}

    public static NoOpRateLimitMetrics getInstance() {
        return INSTANCE;
    }

    @Override
    public void recordDecision(String prefix, RateLimitResponse response) {}

    @Override
    public void recordTimeout(String prefix) {}

    @Override
    public void recordAnalyticsFailure(String prefix) {}

    @Override
    public void recordDenyListRefresh(String prefix, boolean success) {}
}
