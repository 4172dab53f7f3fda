package warden.core.algorithm;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.RateLimitResponse;
import warden.core.model.ratelimit.RemainingTokens;
import warden.core.model.ratelimit.TokenBucketState;
import warden.core.model.ratelimit.WindowDuration;

/**
 * Token bucket refilled by {@code refillRate} tokens every interval, up to {@code maxTokens}.
 *
 * <p>The bucket is stored under the key itself rather than per window. It starts full.
 */
public final class TokenBucket extends CacheBlockingAlgorithm<SingleRegionContext> {

    private final long refillRate;
    private final WindowDuration interval;
    private final long maxTokens;

    TokenBucket(long refillRate, WindowDuration interval, long maxTokens) {
        this.refillRate = refillRate;
        this.interval = interval;
        this.maxTokens = maxTokens;
    }

    @Override
    public long maxRequests() {
        return maxTokens;
    }

    @Override
    public long nextReset(long nowMillis) {
        return nowMillis + interval.millis();
    }

    @Override
    protected Uni<RateLimitResponse> decide(SingleRegionContext context, String key, long incrementBy) {
        final var now = context.clock().millis();
        return context.store()
                .consumeTokens(key, maxTokens, interval.millis(), refillRate, now, incrementBy)
                .map(outcome -> RateLimitResponse.of(outcome.accepted(), maxTokens, outcome.remaining(), outcome.reset()));
    }

    @Override
    public Uni<RemainingTokens> getRemaining(SingleRegionContext context, String key) {
        final var now = context.clock().millis();
        return context.store().getTokenBucket(key).map(stored -> {
            final var state = stored.orElseGet(() -> TokenBucketState.full(maxTokens, now))
                    .refill(now, interval.millis(), refillRate, maxTokens);
            return new RemainingTokens(state.tokens(), state.nextRefill(interval.millis()), maxTokens);
        });
    }

    @Override
    public Uni<Void> resetTokens(SingleRegionContext context, String key) {
        context.cache().ifPresent(cache -> cache.pop(key));
        return context.store().deleteMatching(key);
    }
}
