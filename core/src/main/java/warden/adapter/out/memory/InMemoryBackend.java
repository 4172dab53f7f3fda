package warden.adapter.out.memory;

import java.time.Clock;

import warden.core.port.out.StoreBackend;

/**
 * Creates the in-memory stores on one shared keyspace.
 */
public final class InMemoryBackend {

    private InMemoryBackend() {}

    public static StoreBackend create(Clock clock) {
        return create(new InMemoryKeyspace(clock));
    }

    public static StoreBackend create(InMemoryKeyspace keyspace) {
        return new StoreBackend(
                new InMemoryRateLimitStore(keyspace),
                new InMemoryAnalyticsStore(keyspace),
                new InMemoryDenyListStore(keyspace));
    }
}
