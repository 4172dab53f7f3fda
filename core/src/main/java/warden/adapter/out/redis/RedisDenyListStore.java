package warden.adapter.out.redis;

import java.util.ArrayList;
import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.denylist.DenyListCheck;
import warden.core.model.denylist.DenyListKeys;
import warden.core.port.out.DenyListStore;

/**
 * Redis-backed deny-list store.
 */
public class RedisDenyListStore implements DenyListStore {

    private final RedisScriptExecutor scripts;

    public RedisDenyListStore(RedisScriptExecutor scripts) {
        this.scripts = scripts;
    }

    @Override
    public Uni<DenyListCheck> check(DenyListKeys keys, List<String> candidates) {
        return scripts.eval(DenyListScripts.CHECK, List.of(keys.ipDenyListStatus(), keys.all()), candidates)
                .map(response -> new DenyListCheck(
                        RedisResponses.toStrings(response.get(0)), RedisResponses.toLong(response.get(1))));
    }

    @Override
    public Uni<Void> replaceIpDenyList(DenyListKeys keys, List<String> ips, long ttlMillis) {
        final var args = new ArrayList<String>(ips.size() + 1);
        args.add(String.valueOf(ttlMillis));
        args.addAll(ips);
        return scripts.eval(DenyListScripts.REPLACE_IP, List.of(keys.all(), keys.ipDenyList(), keys.ipDenyListStatus()), args)
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> disableIpDenyList(DenyListKeys keys) {
        return scripts.eval(
                        DenyListScripts.DISABLE_IP,
                        List.of(keys.all(), keys.ipDenyList(), keys.ipDenyListStatus()),
                        List.of())
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> add(DenyListKeys keys, List<String> values) {
        if (values.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        return scripts.eval(DenyListScripts.ADD, List.of(keys.all(), keys.ipDenyList()), values)
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> remove(DenyListKeys keys, List<String> values) {
        if (values.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        return scripts.eval(DenyListScripts.REMOVE, List.of(keys.all(), keys.ipDenyList()), values)
                .replaceWithVoid();
    }
}
