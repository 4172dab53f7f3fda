package warden.adapter.out.redis;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.SlidingRequestOutcome;
import warden.core.model.ratelimit.SlidingWindowCounts;
import warden.core.model.ratelimit.TokenBucketOutcome;
import warden.core.model.ratelimit.TokenBucketState;
import warden.core.port.out.RateLimitStore;

/**
 * Redis-backed counter store.
 *
 * <p>Every mutating operation is one Lua script, so the read, the write and the expiry
 * update are atomic across all processes sharing the Redis instance.
 */
public class RedisRateLimitStore implements RateLimitStore {

    private final RedisScriptExecutor scripts;

    public RedisRateLimitStore(RedisScriptExecutor scripts) {
        this.scripts = scripts;
    }

    @Override
    public Uni<Long> incrementFixedWindow(String key, long windowMillis, long incrementBy) {
        return scripts.eval(
                        RateLimitScripts.FIXED_WINDOW,
                        List.of(key),
                        List.of(String.valueOf(windowMillis), String.valueOf(incrementBy)))
                .map(RedisResponses::toLong);
    }

    @Override
    public Uni<Long> getCounter(String key) {
        return scripts.execute("GET", key).map(RedisResponses::toLong);
    }

    @Override
    public Uni<Long> incrementSlidingWindow(
            String currentKey, String previousKey, long tokens, long nowMillis, long windowMillis, long incrementBy) {
        return scripts.eval(
                        RateLimitScripts.SLIDING_WINDOW,
                        List.of(currentKey, previousKey),
                        List.of(
                                String.valueOf(tokens),
                                String.valueOf(nowMillis),
                                String.valueOf(windowMillis),
                                String.valueOf(incrementBy)))
                .map(RedisResponses::toLong);
    }

    @Override
    public Uni<SlidingWindowCounts> getSlidingWindowCounts(String currentKey, String previousKey) {
        return scripts.execute("MGET", currentKey, previousKey)
                .map(response -> new SlidingWindowCounts(
                        RedisResponses.toLong(response.get(0)), RedisResponses.toLong(response.get(1))));
    }

    @Override
    public Uni<TokenBucketOutcome> consumeTokens(
            String key, long maxTokens, long intervalMillis, long refillRate, long nowMillis, long incrementBy) {
        return scripts.eval(
                        RateLimitScripts.TOKEN_BUCKET,
                        List.of(key),
                        List.of(
                                String.valueOf(maxTokens),
                                String.valueOf(intervalMillis),
                                String.valueOf(refillRate),
                                String.valueOf(nowMillis),
                                String.valueOf(incrementBy)))
                .map(response -> new TokenBucketOutcome(
                        RedisResponses.toLong(response.get(0)), RedisResponses.toLong(response.get(1))));
    }

    @Override
    public Uni<Optional<TokenBucketState>> getTokenBucket(String key) {
        return scripts.execute("HMGET", key, "refilledAt", "tokens").map(response -> {
            if (response.get(0) == null || response.get(1) == null) {
                return Optional.empty();
            }
            return Optional.of(new TokenBucketState(
                    RedisResponses.toLong(response.get(1)), RedisResponses.toLong(response.get(0))));
        });
    }

    @Override
    public Uni<Map<String, Long>> recordRequest(String key, String requestId, long incrementBy, long windowMillis) {
        return scripts.eval(
                        RateLimitScripts.RECORD_REQUEST,
                        List.of(key),
                        List.of(requestId, String.valueOf(windowMillis), String.valueOf(incrementBy)))
                .map(RedisResponses::toLongMap);
    }

    @Override
    public Uni<SlidingRequestOutcome> recordSlidingRequest(
            String currentKey,
            String previousKey,
            long tokens,
            String requestId,
            long nowMillis,
            long windowMillis,
            long incrementBy) {
        return scripts.eval(
                        RateLimitScripts.RECORD_SLIDING_REQUEST,
                        List.of(currentKey, previousKey),
                        List.of(
                                String.valueOf(tokens),
                                String.valueOf(nowMillis),
                                String.valueOf(windowMillis),
                                requestId,
                                String.valueOf(incrementBy)))
                .map(response -> new SlidingRequestOutcome(
                        RedisResponses.toLongMap(response.get(0)),
                        RedisResponses.toLongMap(response.get(1)),
                        RedisResponses.toLong(response.get(2)) == 1));
    }

    @Override
    public Uni<Map<String, Long>> getRequests(String key) {
        return scripts.execute("HGETALL", key).map(RedisResponses::toLongMap);
    }

    @Override
    public Uni<Void> replicateRequests(String key, Map<String, Long> requests, long ttlMillis) {
        if (requests.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        final var args = new ArrayList<String>(1 + requests.size() * 2);
        args.add(String.valueOf(ttlMillis));
        requests.forEach((id, tokens) -> {
            args.add(id);
            args.add(String.valueOf(tokens));
        });
        return scripts.eval(RateLimitScripts.REPLICATE, List.of(key), args).replaceWithVoid();
    }

    @Override
    public Uni<Void> deleteMatching(String pattern) {
        return scripts.eval(RateLimitScripts.DELETE_MATCHING, List.of(pattern), List.of())
                .replaceWithVoid();
    }
}
