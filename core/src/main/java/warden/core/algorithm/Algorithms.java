package warden.core.algorithm;

import warden.core.model.plan.PlanLimit;
import warden.core.model.ratelimit.InvalidRateLimitConfigurationException;
import warden.core.model.ratelimit.WindowDuration;

/**
 * Factories for single-region algorithms.
 *
 * <p>Windows may be given as {@link WindowDuration} or in the compact string form,
 * e.g. {@code "10 s"}.
 */
public final class Algorithms {

    private Algorithms() {}

    public static FixedWindow fixedWindow(long tokens, String window) {
        return fixedWindow(tokens, WindowDuration.parse(window));
    }

    public static FixedWindow fixedWindow(long tokens, WindowDuration window) {
        return new FixedWindow(requirePositive(tokens, "tokens"), window);
    }

    public static SlidingWindow slidingWindow(long tokens, String window) {
        return slidingWindow(tokens, WindowDuration.parse(window));
    }

    public static SlidingWindow slidingWindow(long tokens, WindowDuration window) {
        return new SlidingWindow(requirePositive(tokens, "tokens"), window);
    }

    public static TokenBucket tokenBucket(long refillRate, String interval, long maxTokens) {
        return tokenBucket(refillRate, WindowDuration.parse(interval), maxTokens);
    }

    public static TokenBucket tokenBucket(long refillRate, WindowDuration interval, long maxTokens) {
        return new TokenBucket(
                requirePositive(refillRate, "refillRate"), interval, requirePositive(maxTokens, "maxTokens"));
    }

    public static CachedFixedWindow cachedFixedWindow(long tokens, String window) {
        return cachedFixedWindow(tokens, WindowDuration.parse(window));
    }

    public static CachedFixedWindow cachedFixedWindow(long tokens, WindowDuration window) {
        return new CachedFixedWindow(requirePositive(tokens, "tokens"), window);
    }

    /**
     * Build the algorithm a configured plan limit describes.
     *
     * @param limit the plan limit
     * @return the algorithm
     */
    public static RateLimitAlgorithm<SingleRegionContext> forLimit(PlanLimit limit) {
        return switch (limit.algorithm()) {
            case FIXED_WINDOW -> fixedWindow(limit.limit(), limit.window());
            case SLIDING_WINDOW -> slidingWindow(limit.limit(), limit.window());
            case CACHED_FIXED_WINDOW -> cachedFixedWindow(limit.limit(), limit.window());
            case TOKEN_BUCKET -> tokenBucket(
                    limit.refillRate().orElseThrow(), limit.window(), limit.maxTokens().orElseThrow());
        };
    }

    static long requirePositive(long value, String name) {
        if (value <= 0) {
            throw new InvalidRateLimitConfigurationException(name + " must be positive, got " + value);
        }
        return value;
    }
}
