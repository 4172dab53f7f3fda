package warden.core.service.plan;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.plan.PlanQuotaResult;
import warden.core.model.ratelimit.RateLimitResponse;
import warden.core.service.ratelimit.RateLimiter;

/**
 * Applies per-plan quotas to users.
 */
public class PlanQuotaService {

    private static final Logger LOG = Logger.getLogger(PlanQuotaService.class);

    static final String MINUTE_EXHAUSTED = "Too many requests. Please wait a minute before trying again.";
    static final String DAY_EXHAUSTED = "Daily limit reached. Please upgrade your plan for more generations.";

    /** Plan applied when none is given. */
    public static final String DEFAULT_PLAN = "free";

    private final PlanRateLimiters limiters;

    public PlanQuotaService(PlanRateLimiters limiters) {
        this.limiters = limiters;
    }

    public Uni<PlanQuotaResult> checkPlanQuota(String userId) {
        return checkPlanQuota(DEFAULT_PLAN, userId);
    }

    /**
     * Consume one request from the user's per-minute quota, then from the per-day quota.
     *
     * <p>The per-day quota is not touched when the per-minute quota is exhausted. When both
     * allow the request, the result carries the smaller remaining count and the earlier reset.
     *
     * @param plan plan name
     * @param userId the user
     * @return the outcome
     * @throws IllegalArgumentException if the plan is not configured
     */
    public Uni<PlanQuotaResult> checkPlanQuota(String plan, String userId) {
        final var planLimiters = limiters.plan(plan)
                .orElseThrow(() -> new IllegalArgumentException("Unknown plan: " + plan));

        return planLimiters.perMinute().limit(userId).flatMap(minute -> {
            if (!minute.success()) {
                LOG.debugv("Per-minute quota of plan {0} exhausted for {1}", plan, userId);
                return Uni.createFrom().item(PlanQuotaResult.exhausted(minute.limit(), minute.reset(), MINUTE_EXHAUSTED));
            }
            return planLimiters.perDay().limit(userId).map(day -> {
                if (!day.success()) {
                    LOG.debugv("Per-day quota of plan {0} exhausted for {1}", plan, userId);
                    return PlanQuotaResult.exhausted(day.limit(), day.reset(), DAY_EXHAUSTED);
                }
                final var tighter = day.remaining() < minute.remaining() ? day : minute;
                return PlanQuotaResult.allowed(
                        tighter.limit(), tighter.remaining(), Math.min(minute.reset(), day.reset()));
            });
        });
    }

    /**
     * Apply the API endpoint limiter.
     *
     * @param identifier the caller, see {@link RequestIdentifiers}
     * @return the limiter's response
     * @throws IllegalStateException if no API limiter is configured
     */
    public Uni<RateLimitResponse> checkApiRateLimit(String identifier) {
        final RateLimiter<?> api =
                limiters.api().orElseThrow(() -> new IllegalStateException("No API rate limiter configured"));
        return api.limit(identifier);
    }
}
