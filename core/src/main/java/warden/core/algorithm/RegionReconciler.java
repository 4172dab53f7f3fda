package warden.core.algorithm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.RateLimitStore;
import warden.core.util.Unis;

/**
 * Read repair for multi-region windows.
 *
 * <p>Once every region has answered, the request ids recorded anywhere are merged by
 * name. Each reachable region still under the limit receives the ids it is missing, with
 * the token counts recorded where they came from. A region whose write failed is read
 * again and repaired like the others if it answers now. Regions that stay unreachable are
 * skipped.
 */
final class RegionReconciler {

    private static final Logger LOG = Logger.getLogger(RegionReconciler.class);

    private RegionReconciler() {}

    /**
     * Converge one window hash across regions.
     *
     * @param key the window hash key
     * @param regions the regional stores
     * @param observed each region's requests as returned by its write, in region order
     * @param limit the window limit
     * @param ttlMillis expiry for hashes created by the repair
     * @return completion signal; failures of individual regions are logged, not propagated
     */
    static Uni<Void> reconcile(
            String key,
            List<RateLimitStore> regions,
            List<Uni<Map<String, Long>>> observed,
            long limit,
            long ttlMillis) {

        final var states = new ArrayList<Uni<Map<String, Long>>>(regions.size());
        for (var i = 0; i < regions.size(); i++) {
            final var region = i;
            states.add(observed.get(i).onFailure().recoverWithUni(error -> {
                LOG.debugv(error, "Region {0} did not record {1}, reading its current state", region, key);
                return regions.get(region).getRequests(key);
            }));
        }

        return Unis.settleAll(states).flatMap(settled -> {
            final var union = union(settled);
            final var repairs = new ArrayList<Uni<Void>>();
            for (var i = 0; i < regions.size(); i++) {
                final var state = settled.get(i);
                if (state.isEmpty()) {
                    LOG.warnv("Region {0} unreachable, skipping reconciliation of {1}", i, key);
                    continue;
                }
                final var missing = missingFrom(state.get(), union);
                if (total(state.get()) >= limit || missing.isEmpty()) {
                    continue;
                }
                final var region = i;
                repairs.add(regions.get(i)
                        .replicateRequests(key, missing, ttlMillis)
                        .onFailure()
                        .invoke(e -> LOG.warnv(e, "Failed to replicate {0} requests into region {1}", missing.size(), region))
                        .onFailure()
                        .recoverWithNull());
            }
            if (repairs.isEmpty()) {
                return Uni.createFrom().voidItem();
            }
            return Uni.combine().all().unis(repairs).discardItems();
        });
    }

    /**
     * Merge request maps by request id. The first region to report an id wins.
     */
    static Map<String, Long> union(List<Optional<Map<String, Long>>> states) {
        final var union = new LinkedHashMap<String, Long>();
        states.forEach(state -> state.ifPresent(requests -> requests.forEach(union::putIfAbsent)));
        return union;
    }

    static long total(Map<String, Long> requests) {
        return requests.values().stream().mapToLong(Long::longValue).sum();
    }

    private static Map<String, Long> missingFrom(Map<String, Long> present, Map<String, Long> union) {
        final var missing = new LinkedHashMap<String, Long>();
        union.forEach((id, tokens) -> {
            if (!present.containsKey(id)) {
                missing.put(id, tokens);
            }
        });
        return missing;
    }
}
