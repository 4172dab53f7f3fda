package warden.core.model.ratelimit;

/**
 * Stored token bucket state.
 *
 * <p>Refills happen in whole intervals: after {@code n} full intervals since
 * {@code refilledAt}, {@code n * refillRate} tokens are added (capped at the maximum)
 * and {@code refilledAt} advances by {@code n * interval}.
 *
 * <p>{@code tokens} may be negative when a multi-token request overdrew the bucket.
 *
 * @param tokens the tokens currently in the bucket
 * @param refilledAt epoch millis of the last applied refill
 */
public record TokenBucketState(long tokens, long refilledAt) {

    /**
     * Creates the state of a bucket that has never been used.
     *
     * @param maxTokens the bucket capacity
     * @param nowMillis current time
     * @return a full bucket
     */
    public static TokenBucketState full(long maxTokens, long nowMillis) {
        return new TokenBucketState(maxTokens, nowMillis);
    }

    /**
     * Returns the state after applying every full refill interval elapsed by {@code nowMillis}.
     *
     * @param nowMillis current time
     * @param intervalMillis refill interval
     * @param refillRate tokens added per interval
     * @param maxTokens bucket capacity
     * @return the refilled state, or this state if no interval has fully elapsed
     */
    public TokenBucketState refill(long nowMillis, long intervalMillis, long refillRate, long maxTokens) {
        if (nowMillis < refilledAt + intervalMillis) {
            return this;
        }
        final var refills = (nowMillis - refilledAt) / intervalMillis;
        final var newTokens = Math.min(maxTokens, tokens + refills * refillRate);
        return new TokenBucketState(newTokens, refilledAt + refills * intervalMillis);
    }

    /**
     * Returns the state after taking {@code count} tokens.
     *
     * @param count tokens to take
     * @return the new state
     */
    public TokenBucketState consume(long count) {
        return new TokenBucketState(tokens - count, refilledAt);
    }

    /**
     * Returns how long the stored state stays useful: the time until the bucket would be
     * full again, after which the key may expire.
     *
     * @param intervalMillis refill interval
     * @param refillRate tokens added per interval
     * @param maxTokens bucket capacity
     * @return time to live in milliseconds, at least one interval
     */
    public long millisUntilFull(long intervalMillis, long refillRate, long maxTokens) {
        final var missing = Math.max(0, maxTokens - tokens);
        final var intervals = Math.max(1, (missing + refillRate - 1) / refillRate);
        return intervals * intervalMillis;
    }

    /**
     * Returns the epoch millis of the next refill.
     *
     * @param intervalMillis refill interval
     * @return {@code refilledAt + interval}
     */
    public long nextRefill(long intervalMillis) {
        return refilledAt + intervalMillis;
    }
}
