package warden.core.algorithm;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.RateLimitResponse;

/**
 * Base for algorithms that remember rejections in the ephemeral cache.
 *
 * <p>A key rejected by the store is blocked locally until its reset, and later calls for
 * it are rejected with reason {@code cacheBlock} without a store round trip.
 *
 * @param <C> the context the algorithm runs against
 */
abstract class CacheBlockingAlgorithm<C extends RegionContext> implements RateLimitAlgorithm<C> {

    @Override
    public final Uni<RateLimitResponse> limit(C context, String key, long incrementBy) {
        if (context.cache().isPresent()) {
            final var status = context.cache().get().isBlocked(key);
            if (status.blocked()) {
                return Uni.createFrom().item(RateLimitResponse.cacheBlocked(maxRequests(), status.reset()));
            }
        }

        return decide(context, key, incrementBy).invoke(response -> {
            if (!response.success()) {
                context.cache().ifPresent(cache -> cache.blockUntil(key, response.reset()));
            }
        });
    }

    /**
     * Ask the store for a decision.
     */
    protected abstract Uni<RateLimitResponse> decide(C context, String key, long incrementBy);

    static String windowKey(String key, long bucket) {
        return key + ":" + bucket;
    }
}
