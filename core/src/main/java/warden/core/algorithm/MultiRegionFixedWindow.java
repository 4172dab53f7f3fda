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
import warden.core.model.ratelimit.WindowDuration;
import warden.core.util.Pending;
import warden.core.util.Unis;

/**
 * Fixed window replicated over independent regions.
 *
 * <p>Each request is recorded in every region as a hash field named by a random request
 * id. The first region to answer decides; the others keep running and
 * {@link RegionReconciler} copies missing ids between regions in the background, so the
 * same request is never counted twice in one region.
 */
public final class MultiRegionFixedWindow extends CacheBlockingAlgorithm<MultiRegionContext> {

    private final long tokens;
    private final WindowDuration window;

    MultiRegionFixedWindow(long tokens, WindowDuration window) {
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
            final var windowKey = windowKey(key, window.bucketOf(now));
            final var reset = window.resetAfter(now);

            final var regions = context.regions();
            final var requests = new ArrayList<Uni<Map<String, Long>>>(regions.size());
            for (var region : regions) {
                requests.add(region.recordRequest(windowKey, requestId, incrementBy, window.millis())
                        .memoize()
                        .indefinitely());
            }

            return Unis.firstSuccess(requests, failures -> new RegionsUnavailableException(regions.size(), failures))
                    .map(first -> {
                        final var used = RegionReconciler.total(first);
                        final var pending = Pending.start(
                                RegionReconciler.reconcile(windowKey, regions, requests, tokens, window.millis()),
                                "multi-region reconciliation");
                        return RateLimitResponse.of(used <= tokens, tokens, tokens - used, reset)
                                .withPending(pending);
                    });
        });
    }

    @Override
    public Uni<RemainingTokens> getRemaining(MultiRegionContext context, String key) {
        final var now = context.clock().millis();
        final var windowKey = windowKey(key, window.bucketOf(now));
        final List<Uni<Map<String, Long>>> reads = context.regions().stream()
                .map(region -> region.getRequests(windowKey))
                .toList();

        return Unis.settleAll(reads).map(settled -> {
            if (settled.stream().noneMatch(Optional::isPresent)) {
                throw new RegionsUnavailableException(settled.size(), List.of());
            }
            final var used = RegionReconciler.total(RegionReconciler.union(settled));
            return new RemainingTokens(tokens - used, window.resetAfter(now), tokens);
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
}
