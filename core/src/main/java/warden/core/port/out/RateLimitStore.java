package warden.core.port.out;

import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.SlidingRequestOutcome;
import warden.core.model.ratelimit.SlidingWindowCounts;
import warden.core.model.ratelimit.TokenBucketOutcome;
import warden.core.model.ratelimit.TokenBucketState;

/**
 * Port interface for the shared counter store of one region.
 *
 * <p>Every mutating operation is a single atomic procedure on the store: the read, the
 * write and the expiry update happen indivisibly, so concurrent callers in other
 * processes never observe a half-applied update.
 *
 * <p>All operations are non-blocking and return reactive types. Store failures are
 * propagated through the returned {@link Uni}.
 */
public interface RateLimitStore {

    /**
     * Increment a fixed window counter, setting its expiry on the first write.
     *
     * @param key the window key
     * @param windowMillis expiry applied when the counter is created
     * @param incrementBy amount to add
     * @return the counter after the increment
     */
    Uni<Long> incrementFixedWindow(String key, long windowMillis, long incrementBy);

    /**
     * Read a counter without changing it.
     *
     * @param key the counter key
     * @return the value, 0 when absent
     */
    Uni<Long> getCounter(String key);

    /**
     * Check the weighted sliding window count and increment the current bucket if the
     * request fits.
     *
     * <p>The request fits when {@code current + floor((1 - elapsed) * previous) + incrementBy}
     * does not exceed {@code tokens}. A new current bucket expires after two windows plus
     * one second.
     *
     * @param currentKey key of the current bucket
     * @param previousKey key of the previous bucket
     * @param tokens the window limit
     * @param nowMillis current time
     * @param windowMillis the window
     * @param incrementBy amount to add
     * @return remaining requests after the increment, or {@code -1} if rejected
     */
    Uni<Long> incrementSlidingWindow(
            String currentKey, String previousKey, long tokens, long nowMillis, long windowMillis, long incrementBy);

    /**
     * Read both sliding window buckets.
     *
     * @param currentKey key of the current bucket
     * @param previousKey key of the previous bucket
     * @return the raw counts
     */
    Uni<SlidingWindowCounts> getSlidingWindowCounts(String currentKey, String previousKey);

    /**
     * Refill and consume a token bucket.
     *
     * <p>An empty bucket rejects with {@link TokenBucketOutcome#REJECTED} and is not written.
     * Otherwise {@code incrementBy} tokens are taken (the stored count may go negative) and
     * the key expires when the bucket would be full again.
     *
     * @param key the bucket key
     * @param maxTokens capacity
     * @param intervalMillis refill interval
     * @param refillRate tokens per interval
     * @param nowMillis current time
     * @param incrementBy tokens to take
     * @return remaining tokens and the next refill time
     */
    Uni<TokenBucketOutcome> consumeTokens(
            String key, long maxTokens, long intervalMillis, long refillRate, long nowMillis, long incrementBy);

    /**
     * Read a token bucket without refilling or consuming.
     *
     * @param key the bucket key
     * @return the stored state, empty for an unused bucket
     */
    Uni<Optional<TokenBucketState>> getTokenBucket(String key);

    /**
     * Record a request in a multi-region fixed window hash.
     *
     * @param key the window key
     * @param requestId field name, unique per request
     * @param incrementBy tokens the request consumes
     * @param windowMillis expiry applied when the hash is created
     * @return every request in the window after the write
     */
    Uni<Map<String, Long>> recordRequest(String key, String requestId, long incrementBy, long windowMillis);

    /**
     * Record a request in a multi-region sliding window if the weighted count leaves room.
     *
     * <p>The request is rejected when
     * {@code floor((1 - elapsed) * sum(previous)) + sum(current) + incrementBy > tokens}.
     *
     * @param currentKey key of the current bucket hash
     * @param previousKey key of the previous bucket hash
     * @param tokens the window limit
     * @param requestId field name, unique per request
     * @param nowMillis current time
     * @param windowMillis the window
     * @param incrementBy tokens the request consumes
     * @return both buckets after the call and whether the request was recorded
     */
    Uni<SlidingRequestOutcome> recordSlidingRequest(
            String currentKey,
            String previousKey,
            long tokens,
            String requestId,
            long nowMillis,
            long windowMillis,
            long incrementBy);

    /**
     * Read every request recorded in a multi-region window hash.
     *
     * @param key the window key
     * @return request ids and their token counts, empty when absent
     */
    Uni<Map<String, Long>> getRequests(String key);

    /**
     * Copy requests recorded elsewhere into a window hash, setting its expiry if the hash
     * did not exist yet.
     *
     * @param key the window key
     * @param requests request ids and token counts to write
     * @param ttlMillis expiry applied when the hash is created
     * @return completion signal
     */
    Uni<Void> replicateRequests(String key, Map<String, Long> requests, long ttlMillis);

    /**
     * Delete every key matching a glob pattern where {@code *} matches any run of characters.
     *
     * @param pattern the pattern, e.g. {@code "@app/ratelimit:user1:*"}
     * @return completion signal
     */
    Uni<Void> deleteMatching(String pattern);
}
