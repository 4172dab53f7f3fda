package warden.core.algorithm;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import warden.core.cache.EphemeralCache;
import warden.core.port.out.RateLimitStore;

/**
 * Context of an algorithm backed by a single store.
 */
public record SingleRegionContext(RateLimitStore store, Optional<EphemeralCache> cache, Clock clock)
        implements RegionContext {

    public SingleRegionContext {
        Objects.requireNonNull(store, "store must not be null");
        cache = Objects.requireNonNullElse(cache, Optional.empty());
        Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<RateLimitStore> stores() {
        return List.of(store);
    }
}
