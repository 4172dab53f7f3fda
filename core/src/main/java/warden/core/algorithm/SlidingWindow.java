package warden.core.algorithm;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.RateLimitResponse;
import warden.core.model.ratelimit.RemainingTokens;
import warden.core.model.ratelimit.WindowDuration;

/**
 * Sliding window approximated from two fixed window counters.
 *
 * <p>The previous window counts in proportion to how much of it the sliding window still
 * covers: {@code effective = current + floor((1 - elapsed) * previous)} where
 * {@code elapsed = (now mod window) / window}.
 */
public final class SlidingWindow extends CacheBlockingAlgorithm<SingleRegionContext> {

    private final long tokens;
    private final WindowDuration window;

    SlidingWindow(long tokens, WindowDuration window) {
        this.tokens = tokens;
        this.window = window;
    }

    @Override
    public long maxRequests() {
        return tokens;
    }

    @Override
    public long nextReset(long nowMillis) {
        return window.resetAfter(nowMillis);
    }

    @Override
    protected Uni<RateLimitResponse> decide(SingleRegionContext context, String key, long incrementBy) {
        final var now = context.clock().millis();
        final var bucket = window.bucketOf(now);
        final var reset = window.resetAfter(now);

        return context.store()
                .incrementSlidingWindow(
                        windowKey(key, bucket), windowKey(key, bucket - 1), tokens, now, window.millis(), incrementBy)
                .map(remaining -> RateLimitResponse.of(remaining >= 0, tokens, remaining, reset));
    }

    @Override
    public Uni<RemainingTokens> getRemaining(SingleRegionContext context, String key) {
        final var now = context.clock().millis();
        final var bucket = window.bucketOf(now);
        return context.store()
                .getSlidingWindowCounts(windowKey(key, bucket), windowKey(key, bucket - 1))
                .map(counts ->
                        new RemainingTokens(tokens - counts.effectiveCount(window, now), window.resetAfter(now), tokens));
    }

    @Override
    public Uni<Void> resetTokens(SingleRegionContext context, String key) {
        context.cache().ifPresent(cache -> cache.pop(key));
        return context.store().deleteMatching(key + ":*");
    }
}
