package warden.core.port.out;

import java.util.Objects;

/**
 * The stores of one backing deployment: counters, analytics and deny-list.
 */
public record StoreBackend(RateLimitStore rateLimitStore, AnalyticsStore analyticsStore, DenyListStore denyListStore) {

    public StoreBackend {
        Objects.requireNonNull(rateLimitStore, "rateLimitStore must not be null");
        Objects.requireNonNull(analyticsStore, "analyticsStore must not be null");
        Objects.requireNonNull(denyListStore, "denyListStore must not be null");
    }
}
