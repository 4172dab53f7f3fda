package warden.core.algorithm;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.RateLimitResponse;
import warden.core.model.ratelimit.RemainingTokens;
import warden.core.model.ratelimit.WindowDuration;

/**
 * Fixed window: one counter per aligned window, keyed {@code key:floor(now / window)}.
 *
 * <p>A request succeeds while the counter after incrementing is at most the limit. Bursts
 * straddling a window boundary may see up to twice the limit.
 */
public final class FixedWindow extends CacheBlockingAlgorithm<SingleRegionContext> {

    private final long tokens;
    private final WindowDuration window;

    FixedWindow(long tokens, WindowDuration window) {
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
        final var windowKey = windowKey(key, window.bucketOf(now));
        final var reset = window.resetAfter(now);

        return context.store()
                .incrementFixedWindow(windowKey, window.millis(), incrementBy)
                .map(used -> RateLimitResponse.of(used <= tokens, tokens, tokens - used, reset));
    }

    @Override
    public Uni<RemainingTokens> getRemaining(SingleRegionContext context, String key) {
        final var now = context.clock().millis();
        return context.store()
                .getCounter(windowKey(key, window.bucketOf(now)))
                .map(used -> new RemainingTokens(tokens - used, window.resetAfter(now), tokens));
    }

    @Override
    public Uni<Void> resetTokens(SingleRegionContext context, String key) {
        context.cache().ifPresent(cache -> cache.pop(key));
        return context.store().deleteMatching(key + ":*");
    }
}
