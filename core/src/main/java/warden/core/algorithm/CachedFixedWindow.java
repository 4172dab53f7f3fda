package warden.core.algorithm;

import io.smallrye.mutiny.Uni;

import warden.core.cache.EphemeralCache;
import warden.core.model.ratelimit.InvalidRateLimitConfigurationException;
import warden.core.model.ratelimit.RateLimitResponse;
import warden.core.model.ratelimit.RemainingTokens;
import warden.core.model.ratelimit.WindowDuration;
import warden.core.util.Pending;

/**
 * Fixed window whose counters are kept in the ephemeral cache.
 *
 * <p>The first call for a window asks the store and caches the count. Later calls in this
 * process increment the cached count and, when allowed, write the increment through to
 * the store in the background; the store's count then replaces the cached one, so each
 * process learns what the others admitted. Between write-throughs, processes sharing the
 * store may each admit a little more than the limit.
 */
public final class CachedFixedWindow implements RateLimitAlgorithm<SingleRegionContext> {

    private final long tokens;
    private final WindowDuration window;

    CachedFixedWindow(long tokens, WindowDuration window) {
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
    public boolean requiresCache() {
        return true;
    }

    @Override
    public Uni<RateLimitResponse> limit(SingleRegionContext context, String key, long incrementBy) {
        final var cache = requireCache(context);
        final var now = context.clock().millis();
        final var windowKey = CacheBlockingAlgorithm.windowKey(key, window.bucketOf(now));
        final var reset = window.resetAfter(now);

        if (cache.get(windowKey).isPresent()) {
            final var used = cache.increment(windowKey, incrementBy);
            final var success = used <= tokens;
            final var pending = success
                    ? Pending.start(
                            context.store()
                                    .incrementFixedWindow(windowKey, window.millis(), incrementBy)
                                    .invoke(stored -> cache.set(windowKey, stored, reset)),
                            "cached window write-through")
                    : Pending.none();
            return Uni.createFrom()
                    .item(RateLimitResponse.of(success, tokens, tokens - used, reset).withPending(pending));
        }

        return context.store().incrementFixedWindow(windowKey, window.millis(), incrementBy).map(used -> {
            cache.evictOtherBuckets(key, window.bucketOf(now));
            cache.set(windowKey, used, reset);
            return RateLimitResponse.of(used <= tokens, tokens, tokens - used, reset);
        });
    }

    @Override
    public Uni<RemainingTokens> getRemaining(SingleRegionContext context, String key) {
        final var cache = requireCache(context);
        final var now = context.clock().millis();
        final var windowKey = CacheBlockingAlgorithm.windowKey(key, window.bucketOf(now));
        final var reset = window.resetAfter(now);

        final var cached = cache.get(windowKey);
        if (cached.isPresent()) {
            return Uni.createFrom().item(new RemainingTokens(tokens - cached.getAsLong(), reset, tokens));
        }
        return context.store().getCounter(windowKey).map(used -> new RemainingTokens(tokens - used, reset, tokens));
    }

    @Override
    public Uni<Void> resetTokens(SingleRegionContext context, String key) {
        final var cache = requireCache(context);
        cache.pop(key);
        cache.evictPrefix(key + ":");
        return context.store().deleteMatching(key + ":*");
    }

    private static EphemeralCache requireCache(SingleRegionContext context) {
        return context.cache()
                .orElseThrow(() -> new InvalidRateLimitConfigurationException(
                        "The cached fixed window algorithm requires an ephemeral cache"));
    }
}
