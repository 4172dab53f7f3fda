package warden.adapter.out.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import warden.core.model.ratelimit.RateLimitResponse;
import warden.core.port.out.RateLimitMetrics;

/**
 * Records rate limiting metrics using Micrometer.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code warden.ratelimit.decisions} - Decisions by prefix, outcome (allowed/blocked) and reason</li>
 *   <li>{@code warden.ratelimit.timeouts} - Decisions that fell back to allowing after a store timeout</li>
 *   <li>{@code warden.analytics.failures} - Analytics events that could not be recorded</li>
 *   <li>{@code warden.denylist.refreshes} - Deny-list refreshes by result (success/failure)</li>
 * </ul>
 */
public class MicrometerRateLimitMetrics implements RateLimitMetrics {

    private final MeterRegistry registry;

    public MicrometerRateLimitMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordDecision(String prefix, RateLimitResponse response) {
        Counter.builder("warden.ratelimit.decisions")
                .description("Rate limit decisions")
                .tag("prefix", prefix)
                .tag("outcome", response.success() ? "allowed" : "blocked")
                .tag("reason", response.reason().map(reason -> reason.value()).orElse("none"))
                .register(registry)
                .increment();
    }

    @Override
    public void recordTimeout(String prefix) {
        Counter.builder("warden.ratelimit.timeouts")
                .description("Decisions allowed because the store did not answer in time")
                .tag("prefix", prefix)
                .register(registry)
                .increment();
    }

    @Override
    public void recordAnalyticsFailure(String prefix) {
        Counter.builder("warden.analytics.failures")
                .description("Analytics events that could not be recorded")
                .tag("prefix", prefix)
                .register(registry)
                .increment();
    }

    @Override
    public void recordDenyListRefresh(String prefix, boolean success) {
        Counter.builder("warden.denylist.refreshes")
                .description("Deny-list refreshes")
                .tag("prefix", prefix)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }
}
