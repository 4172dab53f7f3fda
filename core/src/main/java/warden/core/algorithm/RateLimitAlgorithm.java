package warden.core.algorithm;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.RateLimitResponse;
import warden.core.model.ratelimit.RemainingTokens;

/**
 * A rate limiting strategy.
 *
 * <p>Algorithms hold only their parameters; all state lives in the context's stores, so
 * one instance can serve any number of identifiers and limiters.
 *
 * @param <C> the context the algorithm runs against
 */
public interface RateLimitAlgorithm<C extends RegionContext> {

    /**
     * Returns the limit reported in responses: the window limit, or the bucket capacity.
     */
    long maxRequests();

    /**
     * Returns when quota next frees up if nothing is known about the identifier: the end of
     * the current window, or one refill interval from now for the token bucket.
     *
     * @param nowMillis epoch millis
     * @return a reset strictly after {@code nowMillis}
     */
    long nextReset(long nowMillis);

    /**
     * Decide whether a request may proceed and record it if so.
     *
     * @param context the stores and cache
     * @param key the prefixed identifier
     * @param incrementBy tokens the request consumes
     * @return the decision; store failures are propagated
     */
    Uni<RateLimitResponse> limit(C context, String key, long incrementBy);

    /**
     * Read the remaining quota without consuming any.
     *
     * @param context the stores and cache
     * @param key the prefixed identifier
     * @return remaining tokens, reset time and limit
     */
    Uni<RemainingTokens> getRemaining(C context, String key);

    /**
     * Delete every stored window of the identifier and its local cache entries.
     *
     * @param context the stores and cache
     * @param key the prefixed identifier
     * @return completion signal
     */
    Uni<Void> resetTokens(C context, String key);

    /**
     * Whether the algorithm can only run with an ephemeral cache in its context.
     */
    default boolean requiresCache() {
        return false;
    }
}
