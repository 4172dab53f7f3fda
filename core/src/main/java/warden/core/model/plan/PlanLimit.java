package warden.core.model.plan;

import java.util.Optional;

import warden.core.model.ratelimit.AlgorithmType;
import warden.core.model.ratelimit.InvalidRateLimitConfigurationException;
import warden.core.model.ratelimit.WindowDuration;

/**
 * One configured limit of a plan, such as "100 per minute".
 *
 * @param algorithm the algorithm
 * @param limit requests per window for window algorithms
 * @param window window or refill interval
 * @param refillRate tokens per interval for the token bucket
 * @param maxTokens bucket capacity for the token bucket
 */
public record PlanLimit(
        AlgorithmType algorithm, long limit, WindowDuration window, Optional<Long> refillRate, Optional<Long> maxTokens) {

    public PlanLimit {
        if (algorithm == AlgorithmType.TOKEN_BUCKET) {
            if (refillRate.isEmpty() || maxTokens.isEmpty()) {
                throw new InvalidRateLimitConfigurationException("token bucket limits need refill-rate and max-tokens");
            }
        } else if (limit <= 0) {
            throw new InvalidRateLimitConfigurationException("limit must be positive, got " + limit);
        }
    }

    public static PlanLimit fixedWindow(long limit, WindowDuration window) {
        return new PlanLimit(AlgorithmType.FIXED_WINDOW, limit, window, Optional.empty(), Optional.empty());
    }

    public static PlanLimit slidingWindow(long limit, WindowDuration window) {
        return new PlanLimit(AlgorithmType.SLIDING_WINDOW, limit, window, Optional.empty(), Optional.empty());
    }

    public static PlanLimit tokenBucket(long refillRate, WindowDuration interval, long maxTokens) {
        return new PlanLimit(
                AlgorithmType.TOKEN_BUCKET, maxTokens, interval, Optional.of(refillRate), Optional.of(maxTokens));
    }
}
