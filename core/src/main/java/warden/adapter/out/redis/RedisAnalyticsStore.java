package warden.adapter.out.redis;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;

import warden.core.model.analytics.ClassifiedMembers;
import warden.core.model.analytics.ScoredMember;
import warden.core.model.analytics.UsageCounts;
import warden.core.port.out.AnalyticsStore;

/**
 * Redis-backed analytics store. Buckets are sorted sets; aggregation runs server-side.
 */
public class RedisAnalyticsStore implements AnalyticsStore {

    private final RedisScriptExecutor scripts;

    public RedisAnalyticsStore(RedisScriptExecutor scripts) {
        this.scripts = scripts;
    }

    @Override
    public Uni<Void> increment(String key, String member, long retentionMillis) {
        return scripts.eval(AnalyticsScripts.INCREMENT, List.of(key), List.of(member, String.valueOf(retentionMillis)))
                .replaceWithVoid();
    }

    @Override
    public Uni<Map<String, Long>> aggregate(String key, String field) {
        return scripts.eval(AnalyticsScripts.AGGREGATE, List.of(key), List.of(field))
                .map(RedisResponses::toLongMap);
    }

    /**
     * Loads the aggregation script once, then sends one pipelined batch of {@code EVALSHA}
     * calls per {@code batchSize} buckets, one batch after the other.
     */
    @Override
    public Uni<List<Map<String, Long>>> aggregateAll(List<String> keys, String field, int batchSize) {
        if (keys.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        final var batches = new ArrayList<List<String>>();
        for (var i = 0; i < keys.size(); i += batchSize) {
            batches.add(keys.subList(i, Math.min(keys.size(), i + batchSize)));
        }

        return scripts.load(AnalyticsScripts.AGGREGATE)
                .onItem()
                .transformToMulti(ignored -> Multi.createFrom().iterable(batches))
                .onItem()
                .transformToUniAndConcatenate(batch -> scripts.batch(batch.stream()
                        .map(key -> scripts.evalShaRequest(AnalyticsScripts.AGGREGATE, List.of(key), List.of(field)))
                        .toList()))
                .collect()
                .asList()
                .map(replies -> {
                    final var results = new ArrayList<Map<String, Long>>(keys.size());
                    replies.forEach(batch -> batch.forEach(reply -> results.add(RedisResponses.toLongMap(reply))));
                    return results;
                });
    }

    @Override
    public Uni<Map<String, UsageCounts>> allowedBlocked(List<String> keys) {
        if (keys.isEmpty()) {
            return Uni.createFrom().item(Map.of());
        }
        return scripts.eval(AnalyticsScripts.ALLOWED_BLOCKED, keys, List.of()).map(response -> {
            final var usage = new HashMap<String, UsageCounts>();
            for (var i = 0; i + 2 < response.size(); i += 3) {
                usage.put(
                        response.get(i).toString(),
                        new UsageCounts(
                                RedisResponses.toLong(response.get(i + 1)), RedisResponses.toLong(response.get(i + 2))));
            }
            return usage;
        });
    }

    @Override
    public Uni<ClassifiedMembers> classify(List<String> keys, int top, int checkAtMost) {
        if (keys.isEmpty()) {
            return Uni.createFrom().item(new ClassifiedMembers(List.of(), List.of(), List.of()));
        }
        return scripts.eval(
                        AnalyticsScripts.CLASSIFY, keys, List.of(String.valueOf(top), String.valueOf(checkAtMost)))
                .map(response -> new ClassifiedMembers(
                        scored(response.get(0)), scored(response.get(1)), scored(response.get(2))));
    }

    private static List<ScoredMember> scored(Response category) {
        final var members = new ArrayList<ScoredMember>();
        RedisResponses.toLongMap(category).forEach((member, score) -> members.add(new ScoredMember(member, score)));
        return members;
    }
}
