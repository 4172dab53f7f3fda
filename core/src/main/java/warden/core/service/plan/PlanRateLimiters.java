package warden.core.service.plan;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import warden.core.service.ratelimit.RateLimiter;

/**
 * Registry of the limiters built for each subscription plan, plus the limiter guarding
 * generic API endpoints.
 *
 * <p>Built once at startup and shared by reference.
 */
public class PlanRateLimiters {

    private final Map<String, PlanLimiters> plans;
    private final Optional<RateLimiter<?>> api;

    public PlanRateLimiters(Map<String, PlanLimiters> plans, Optional<RateLimiter<?>> api) {
        this.plans = Map.copyOf(plans);
        this.api = api;
    }

    /**
     * Look up the limiters of a plan.
     *
     * @param plan plan name, e.g. {@code "free"}
     * @return the plan's limiters, if the plan is configured
     */
    public Optional<PlanLimiters> plan(String plan) {
        return Optional.ofNullable(plans.get(plan));
    }

    public Set<String> planNames() {
        return plans.keySet();
    }

    public Optional<RateLimiter<?>> api() {
        return api;
    }
}
