package warden.adapter.out.memory;

import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.SlidingRequestOutcome;
import warden.core.model.ratelimit.SlidingWindowCounts;
import warden.core.model.ratelimit.TokenBucketOutcome;
import warden.core.model.ratelimit.TokenBucketState;
import warden.core.model.ratelimit.WindowDuration;
import warden.core.port.out.RateLimitStore;

/**
 * In-memory counter store for single-process deployments and tests.
 *
 * <p>Each procedure runs as one {@link InMemoryKeyspace#atomically} step, mirroring the
 * Redis scripts.
 */
public class InMemoryRateLimitStore implements RateLimitStore {

    private static final String TOKENS = "tokens";
    private static final String REFILLED_AT = "refilledAt";

    private final InMemoryKeyspace keyspace;

    public InMemoryRateLimitStore(InMemoryKeyspace keyspace) {
        this.keyspace = keyspace;
    }

    @Override
    public Uni<Long> incrementFixedWindow(String key, long windowMillis, long incrementBy) {
        return Uni.createFrom().item(() -> keyspace.atomically(() -> {
            final var used = keyspace.incrBy(key, incrementBy);
            if (used == incrementBy) {
                keyspace.pexpire(key, windowMillis);
            }
            return used;
        }));
    }

    @Override
    public Uni<Long> getCounter(String key) {
        return Uni.createFrom().item(() -> keyspace.getLong(key).orElse(0L));
    }

    @Override
    public Uni<Long> incrementSlidingWindow(
            String currentKey, String previousKey, long tokens, long nowMillis, long windowMillis, long incrementBy) {
        return Uni.createFrom().item(() -> keyspace.atomically(() -> {
            final var current = keyspace.getLong(currentKey).orElse(0L);
            final var previous = SlidingWindowCounts.weightedPrevious(
                    keyspace.getLong(previousKey).orElse(0L), WindowDuration.ofMillis(windowMillis), nowMillis);
            if (previous + current + incrementBy > tokens) {
                return -1L;
            }
            final var updated = keyspace.incrBy(currentKey, incrementBy);
            if (updated == incrementBy) {
                keyspace.pexpire(currentKey, windowMillis * 2 + 1000);
            }
            return tokens - (updated + previous);
        }));
    }

    @Override
    public Uni<SlidingWindowCounts> getSlidingWindowCounts(String currentKey, String previousKey) {
        return Uni.createFrom().item(() -> keyspace.atomically(() -> new SlidingWindowCounts(
                keyspace.getLong(currentKey).orElse(0L), keyspace.getLong(previousKey).orElse(0L))));
    }

    @Override
    public Uni<TokenBucketOutcome> consumeTokens(
            String key, long maxTokens, long intervalMillis, long refillRate, long nowMillis, long incrementBy) {
        return Uni.createFrom().item(() -> keyspace.atomically(() -> {
            final var state = read(key)
                    .orElseGet(() -> TokenBucketState.full(maxTokens, nowMillis))
                    .refill(nowMillis, intervalMillis, refillRate, maxTokens);
            if (state.tokens() <= 0 && incrementBy > 0) {
                return new TokenBucketOutcome(TokenBucketOutcome.REJECTED, state.nextRefill(intervalMillis));
            }
            final var next = state.consume(incrementBy);
            keyspace.hset(key, TOKENS, next.tokens());
            keyspace.hset(key, REFILLED_AT, next.refilledAt());
            keyspace.pexpire(key, next.millisUntilFull(intervalMillis, refillRate, maxTokens));
            return new TokenBucketOutcome(next.tokens(), next.nextRefill(intervalMillis));
        }));
    }

    @Override
    public Uni<Optional<TokenBucketState>> getTokenBucket(String key) {
        return Uni.createFrom().item(() -> keyspace.atomically(() -> read(key)));
    }

    @Override
    public Uni<Map<String, Long>> recordRequest(String key, String requestId, long incrementBy, long windowMillis) {
        return Uni.createFrom().item(() -> keyspace.atomically(() -> {
            keyspace.hset(key, requestId, incrementBy);
            final var requests = keyspace.hgetall(key);
            if (requests.size() == 1) {
                keyspace.pexpire(key, windowMillis);
            }
            return requests;
        }));
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
        return Uni.createFrom().item(() -> keyspace.atomically(() -> {
            final var current = keyspace.hgetall(currentKey);
            final var previous = keyspace.hgetall(previousKey);
            final var weighted = SlidingWindowCounts.weightedPrevious(
                    sum(previous), WindowDuration.ofMillis(windowMillis), nowMillis);
            if (weighted + sum(current) + incrementBy > tokens) {
                return new SlidingRequestOutcome(current, previous, false);
            }
            keyspace.hset(currentKey, requestId, incrementBy);
            if (current.isEmpty()) {
                keyspace.pexpire(currentKey, windowMillis * 2 + 1000);
            }
            return new SlidingRequestOutcome(keyspace.hgetall(currentKey), previous, true);
        }));
    }

    @Override
    public Uni<Map<String, Long>> getRequests(String key) {
        return Uni.createFrom().item(() -> keyspace.hgetall(key));
    }

    @Override
    public Uni<Void> replicateRequests(String key, Map<String, Long> requests, long ttlMillis) {
        return Uni.createFrom()
                .item(() -> keyspace.atomically(() -> {
                    final var existed = keyspace.exists(key);
                    requests.forEach((id, tokens) -> keyspace.hset(key, id, tokens));
                    if (!existed) {
                        keyspace.pexpire(key, ttlMillis);
                    }
                    return requests.size();
                }))
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> deleteMatching(String pattern) {
        return Uni.createFrom().item(() -> keyspace.deleteMatching(pattern)).replaceWithVoid();
    }

    private Optional<TokenBucketState> read(String key) {
        final var hash = keyspace.hgetall(key);
        if (!hash.containsKey(TOKENS) || !hash.containsKey(REFILLED_AT)) {
            return Optional.empty();
        }
        return Optional.of(new TokenBucketState(hash.get(TOKENS), hash.get(REFILLED_AT)));
    }

    private static long sum(Map<String, Long> requests) {
        return requests.values().stream().mapToLong(Long::longValue).sum();
    }
}
