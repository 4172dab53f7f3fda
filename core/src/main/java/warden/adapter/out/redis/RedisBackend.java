package warden.adapter.out.redis;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;

import warden.core.port.out.StoreBackend;

/**
 * Creates the Redis stores on one data source.
 */
public final class RedisBackend {

    private RedisBackend() {}

    public static StoreBackend create(ReactiveRedisDataSource redis) {
        final var scripts = new RedisScriptExecutor(redis);
        return new StoreBackend(
                new RedisRateLimitStore(scripts), new RedisAnalyticsStore(scripts), new RedisDenyListStore(scripts));
    }
}
