package warden.core.model.plan;

import java.util.Optional;

/**
 * Outcome of checking a user's plan quotas.
 *
 * @param allowed whether every quota of the plan still had room
 * @param limit limit of the quota that decided the outcome
 * @param remaining remaining requests of that quota
 * @param reset epoch millis at which that quota resets
 * @param message explanation when a quota was exhausted
 */
public record PlanQuotaResult(boolean allowed, long limit, long remaining, long reset, Optional<String> message) {

    public static PlanQuotaResult allowed(long limit, long remaining, long reset) {
        return new PlanQuotaResult(true, limit, remaining, reset, Optional.empty());
    }

    public static PlanQuotaResult exhausted(long limit, long reset, String message) {
        return new PlanQuotaResult(false, limit, 0, reset, Optional.of(message));
    }
}
