package warden.core.service.plan;

import java.util.Objects;

import warden.core.service.ratelimit.RateLimiter;

/**
 * The two quotas of a subscription plan.
 */
public record PlanLimiters(RateLimiter<?> perMinute, RateLimiter<?> perDay) {

    public PlanLimiters {
        Objects.requireNonNull(perMinute, "perMinute must not be null");
        Objects.requireNonNull(perDay, "perDay must not be null");
    }
}
