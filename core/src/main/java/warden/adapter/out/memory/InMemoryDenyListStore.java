package warden.adapter.out.memory;

import java.util.HashSet;
import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.denylist.DenyListCheck;
import warden.core.model.denylist.DenyListKeys;
import warden.core.port.out.DenyListStore;

/**
 * In-memory deny-list store.
 */
public class InMemoryDenyListStore implements DenyListStore {

    static final long PENDING_TTL_MILLIS = 30_000;

    private final InMemoryKeyspace keyspace;

    public InMemoryDenyListStore(InMemoryKeyspace keyspace) {
        this.keyspace = keyspace;
    }

    @Override
    public Uni<DenyListCheck> check(DenyListKeys keys, List<String> candidates) {
        return Uni.createFrom().item(() -> keyspace.atomically(() -> {
            final var denied = candidates.stream()
                    .filter(candidate -> keyspace.sismember(keys.all(), candidate))
                    .toList();
            final var statusTtl = keyspace.ttl(keys.ipDenyListStatus());
            if (statusTtl == InMemoryKeyspace.ABSENT) {
                keyspace.setString(keys.ipDenyListStatus(), "pending", PENDING_TTL_MILLIS);
            }
            return new DenyListCheck(denied, statusTtl);
        }));
    }

    @Override
    public Uni<Void> replaceIpDenyList(DenyListKeys keys, List<String> ips, long ttlMillis) {
        return Uni.createFrom()
                .item(() -> keyspace.atomically(() -> {
                    final var manual = new HashSet<>(keyspace.smembers(keys.all()));
                    manual.removeAll(keyspace.smembers(keys.ipDenyList()));

                    final var fetched = new HashSet<>(ips);
                    fetched.removeAll(manual);
                    keyspace.sstore(keys.ipDenyList(), fetched);

                    final var all = new HashSet<>(manual);
                    all.addAll(fetched);
                    keyspace.sstore(keys.all(), all);

                    keyspace.setString(keys.ipDenyListStatus(), "valid", ttlMillis);
                    return all.size();
                }))
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> disableIpDenyList(DenyListKeys keys) {
        return Uni.createFrom()
                .item(() -> keyspace.atomically(() -> {
                    final var manual = new HashSet<>(keyspace.smembers(keys.all()));
                    manual.removeAll(keyspace.smembers(keys.ipDenyList()));
                    keyspace.sstore(keys.all(), manual);
                    keyspace.del(keys.ipDenyList());
                    keyspace.setString(keys.ipDenyListStatus(), "disabled", 0);
                    return manual.size();
                }))
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> add(DenyListKeys keys, List<String> values) {
        return Uni.createFrom()
                .item(() -> keyspace.atomically(() -> {
                    keyspace.sadd(keys.all(), values);
                    keyspace.srem(keys.ipDenyList(), values);
                    return values.size();
                }))
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> remove(DenyListKeys keys, List<String> values) {
        return Uni.createFrom()
                .item(() -> keyspace.atomically(() -> {
                    keyspace.srem(keys.all(), values);
                    keyspace.srem(keys.ipDenyList(), values);
                    return values.size();
                }))
                .replaceWithVoid();
    }
}
