package warden.core.algorithm;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import warden.core.cache.EphemeralCache;
import warden.core.port.out.RateLimitStore;

/**
 * What an algorithm runs against: one store, or one store per region.
 *
 * <p>Algorithms are typed by the context they accept, so a single-region algorithm can
 * never be paired with a multi-region context.
 */
public sealed interface RegionContext permits SingleRegionContext, MultiRegionContext {

    /** Local cache for block entries and cached counters, if any. */
    Optional<EphemeralCache> cache();

    Clock clock();

    /** Every store of this context, one per region. */
    List<RateLimitStore> stores();
}
