package warden.core.algorithm;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import warden.core.cache.EphemeralCache;
import warden.core.model.ratelimit.InvalidRateLimitConfigurationException;
import warden.core.port.out.RateLimitStore;

/**
 * Context of an algorithm replicated over independent regional stores.
 */
public record MultiRegionContext(List<RateLimitStore> regions, Optional<EphemeralCache> cache, Clock clock)
        implements RegionContext {

    public MultiRegionContext {
        if (regions == null || regions.isEmpty()) {
            throw new InvalidRateLimitConfigurationException("at least one region is required");
        }
        regions = List.copyOf(regions);
        cache = Objects.requireNonNullElse(cache, Optional.empty());
        Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<RateLimitStore> stores() {
        return regions;
    }
}
