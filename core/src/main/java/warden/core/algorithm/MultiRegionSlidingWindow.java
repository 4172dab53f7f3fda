package warden.core.algorithm;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.RateLimitResponse;
import warden.core.model.ratelimit.RegionsUnavailableException;
import warden.core.model.ratelimit.RemainingTokens;
import warden.core.model.ratelimit.SlidingRequestOutcome;
import warden.core.model.ratelimit.SlidingWindowCounts;
import warden.core.model.ratelimit.WindowDuration;
import warden.core.util.Pending;
import warden.core.util.Unis;

/**
 * Sliding window replicated over independent regions.
 *
 * <p>Works like {@link MultiRegionFixedWindow} with two hashes per identifier, the
 * current and the previous window. Only the current window is reconciled.
 */
public final class MultiRegionSlidingWindow extends CacheBlockingAlgorithm<MultiRegionContext> {

    private final long tokens;
    private final WindowDuration window;

    MultiRegionSlidingWindow(long tokens, WindowDuration window) {
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
    protected Uni<RateLimitResponse> decide(MultiRegionContext context, String key, long incrementBy) {
        return Uni.createFrom().deferred(() -> {
            final var requestId = UUID.randomUUID().toString();
            final var now = context.clock().millis();
            final var bucket = window.bucketOf(now);
            final var currentKey = windowKey(key, bucket);
            final var previousKey = windowKey(key, bucket - 1);
            final var reset = window.resetAfter(now);

            final var regions = context.regions();
            final var requests = new ArrayList<Uni<SlidingRequestOutcome>>(regions.size());
            for (var region : regions) {
                requests.add(region.recordSlidingRequest(
                                currentKey, previousKey, tokens, requestId, now, window.millis(), incrementBy)
                        .memoize()
                        .indefinitely());
            }

            return Unis.firstSuccess(requests, failures -> new RegionsUnavailableException(regions.size(), failures))
                    .map(first -> {
                        final var used = new SlidingWindowCounts(
                                        RegionReconciler.total(first.current()),
                                        RegionReconciler.total(first.previous()))
                                .effectiveCount(window, now);
                        final List<Uni<Map<String, Long>>> currents = requests.stream()
                                .map(request -> request.map(SlidingRequestOutcome::current))
                                .toList();
                        final var pending = Pending.start(
                                RegionReconciler.reconcile(currentKey, regions, currents, tokens, ttl()),
                                "multi-region reconciliation");
                        return RateLimitResponse.of(first.accepted(), tokens, tokens - used, reset)
                                .withPending(pending);
                    });
        });
    }

    @Override
    public Uni<RemainingTokens> getRemaining(MultiRegionContext context, String key) {
        final var now = context.clock().millis();
        final var bucket = window.bucketOf(now);
        final var currentKey = windowKey(key, bucket);
        final var previousKey = windowKey(key, bucket - 1);

        final List<Uni<Map<String, Long>>> currents = context.regions().stream()
                .map(region -> region.getRequests(currentKey))
                .toList();
        final List<Uni<Map<String, Long>>> previous = context.regions().stream()
                .map(region -> region.getRequests(previousKey))
                .toList();

        return Uni.combine()
                .all()
                .unis(Unis.settleAll(currents), Unis.settleAll(previous))
                .asTuple()
                .map(tuple -> {
                    if (tuple.getItem1().stream().noneMatch(Optional::isPresent)) {
                        throw new RegionsUnavailableException(context.regions().size(), List.of());
                    }
                    final var counts = new SlidingWindowCounts(
                            RegionReconciler.total(RegionReconciler.union(tuple.getItem1())),
                            RegionReconciler.total(RegionReconciler.union(tuple.getItem2())));
                    return new RemainingTokens(
                            tokens - counts.effectiveCount(window, now), window.resetAfter(now), tokens);
                });
    }

    @Override
    public Uni<Void> resetTokens(MultiRegionContext context, String key) {
        context.cache().ifPresent(cache -> cache.pop(key));
        final List<Uni<Void>> deletes = context.regions().stream()
                .map(region -> region.deleteMatching(key + ":*"))
                .toList();
        return Uni.combine().all().unis(deletes).discardItems();
    }

    private long ttl() {
        return window.millis() * 2 + 1000;
    }
}
