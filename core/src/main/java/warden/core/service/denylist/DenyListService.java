package warden.core.service.denylist;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.cache.EphemeralCache;
import warden.core.model.denylist.DeniedValue;
import warden.core.model.denylist.DenyListCheck;
import warden.core.model.denylist.DenyListKeys;
import warden.core.model.denylist.DenyListThreshold;
import warden.core.port.out.DenyListFeed;
import warden.core.port.out.DenyListStore;
import warden.core.port.out.RateLimitMetrics;
import warden.core.util.Pending;

/**
 * Deny-list of one limiter prefix.
 *
 * <p>Values found on the list are remembered locally for {@link #LOCAL_BLOCK} so repeated
 * calls are rejected without a store round trip. The IP subset comes from an external feed
 * and expires at the time given by {@link RefreshSchedule}; the first check that sees it
 * expired triggers a refresh while the others carry on with the stale list.
 */
public class DenyListService {

    private static final Logger LOG = Logger.getLogger(DenyListService.class);

    /** How long a value found on the list is rejected locally. */
    public static final Duration LOCAL_BLOCK = Duration.ofMinutes(1);

    private final String prefix;
    private final DenyListKeys keys;
    private final DenyListStore store;
    private final DenyListFeed feed;
    private final EphemeralCache deniedCache;
    private final RateLimitMetrics metrics;
    private final Clock clock;

    public DenyListService(
            String prefix,
            DenyListStore store,
            DenyListFeed feed,
            EphemeralCache deniedCache,
            RateLimitMetrics metrics,
            Clock clock) {
        this.prefix = prefix;
        this.keys = DenyListKeys.forPrefix(prefix);
        this.store = store;
        this.feed = feed;
        this.deniedCache = deniedCache;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Find the first candidate rejected locally.
     *
     * @param candidates values to look up
     * @return the denied candidate, if any is still blocked locally
     */
    public Optional<DeniedValue> findCached(List<String> candidates) {
        for (var candidate : candidates) {
            final var status = deniedCache.isBlocked(candidate);
            if (status.blocked()) {
                return Optional.of(new DeniedValue(candidate, status.reset()));
            }
        }
        return Optional.empty();
    }

    /**
     * Check candidates against the stored list and remember the first denied one locally.
     *
     * @param candidates values to check
     * @return the check result
     */
    public Uni<DenyListCheck> check(List<String> candidates) {
        return store.check(keys, candidates).invoke(result -> {
            if (result.denied()) {
                deniedCache.blockUntil(result.firstDenied(), clock.millis() + LOCAL_BLOCK.toMillis());
            }
        });
    }

    /**
     * Replace the IP subset with the feed's current list.
     *
     * @param threshold feed severity
     * @return completion signal; fails when the feed or the store fails
     */
    public Uni<Void> updateIpDenyList(DenyListThreshold threshold) {
        return feed.fetch(threshold)
                .flatMap(ips -> {
                    final var ttl = RefreshSchedule.millisUntilNextRefresh(clock);
                    LOG.infov("Refreshing IP deny-list for {0}: {1} entries valid for {2}ms", prefix, ips.size(), ttl);
                    return store.replaceIpDenyList(keys, ips, ttl);
                })
                .invoke(() -> metrics.recordDenyListRefresh(prefix, true))
                .onFailure()
                .invoke(e -> metrics.recordDenyListRefresh(prefix, false));
    }

    /**
     * Start a refresh detached from the caller.
     *
     * @param threshold feed severity
     * @return handle of the refresh; never fails
     */
    public Uni<Void> refreshInBackground(DenyListThreshold threshold) {
        return Pending.start(Uni.createFrom().deferred(() -> updateIpDenyList(threshold)), "deny-list refresh");
    }

    /**
     * Drop the IP subset and stop refreshing it. Manual entries stay.
     *
     * @return completion signal
     */
    public Uni<Void> disableIpDenyList() {
        LOG.infov("Disabling IP deny-list for {0}", prefix);
        return store.disableIpDenyList(keys);
    }

    public Uni<Void> add(List<String> values) {
        return store.add(keys, values);
    }

    /**
     * Remove values from the list and from the local cache of this process.
     *
     * @param values values to allow again
     * @return completion signal
     */
    public Uni<Void> remove(List<String> values) {
        values.forEach(deniedCache::pop);
        return store.remove(keys, values);
    }

    public DenyListKeys keys() {
        return keys;
    }
}
