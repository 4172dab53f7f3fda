package warden.adapter.out.memory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.analytics.ClassifiedMembers;
import warden.core.model.analytics.EventOutcome;
import warden.core.model.analytics.ScoredMember;
import warden.core.model.analytics.UsageCounts;
import warden.core.port.out.AnalyticsStore;

/**
 * In-memory analytics store. Members are decoded with Jackson where the Redis adapter
 * decodes them in Lua.
 */
public class InMemoryAnalyticsStore implements AnalyticsStore {

    private static final Logger LOG = Logger.getLogger(InMemoryAnalyticsStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final InMemoryKeyspace keyspace;

    public InMemoryAnalyticsStore(InMemoryKeyspace keyspace) {
        this.keyspace = keyspace;
    }

    @Override
    public Uni<Void> increment(String key, String member, long retentionMillis) {
        return Uni.createFrom()
                .item(() -> keyspace.atomically(() -> {
                    keyspace.zincrby(key, member, 1);
                    return keyspace.pexpire(key, retentionMillis);
                }))
                .replaceWithVoid();
    }

    @Override
    public Uni<Map<String, Long>> aggregate(String key, String field) {
        return Uni.createFrom().item(() -> aggregateNow(key, field));
    }

    @Override
    public Uni<List<Map<String, Long>>> aggregateAll(List<String> keys, String field, int batchSize) {
        return Uni.createFrom().item(() -> keys.stream().map(key -> aggregateNow(key, field)).toList());
    }

    @Override
    public Uni<Map<String, UsageCounts>> allowedBlocked(List<String> keys) {
        return Uni.createFrom().item(() -> {
            final var usage = new HashMap<String, UsageCounts>();
            for (var key : keys) {
                forEachDecoded(key, (node, score) -> {
                    final var identifier = node.get("identifier");
                    if (identifier != null) {
                        final var outcome = EventOutcome.fromJson(node.get(EventOutcome.FIELD));
                        usage.merge(identifier.asText(), UsageCounts.ZERO.add(outcome, score), UsageCounts::plus);
                    }
                });
            }
            return usage;
        });
    }

    @Override
    public Uni<ClassifiedMembers> classify(List<String> keys, int top, int checkAtMost) {
        return Uni.createFrom().item(() -> {
            final var union = new HashMap<String, Long>();
            keyspace.atomically(() -> {
                keys.forEach(key -> keyspace.zrangeWithScores(key).forEach((m, s) -> union.merge(m, s, Long::sum)));
                return union.size();
            });

            final var sorted = union.entrySet().stream()
                    .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                            .thenComparing(Map.Entry.comparingByKey()))
                    .limit(checkAtMost)
                    .toList();

            final var allowed = new ArrayList<ScoredMember>();
            final var rateLimited = new ArrayList<ScoredMember>();
            final var denied = new ArrayList<ScoredMember>();
            for (var entry : sorted) {
                if (allowed.size() >= top && rateLimited.size() >= top && denied.size() >= top) {
                    break;
                }
                final var member = new ScoredMember(entry.getKey(), entry.getValue());
                if (entry.getKey().contains("\"success\":true")) {
                    addIfRoom(allowed, member, top);
                } else if (entry.getKey().contains("\"success\":false")) {
                    addIfRoom(rateLimited, member, top);
                } else if (entry.getKey().contains("\"success\":\"denied\"")) {
                    addIfRoom(denied, member, top);
                }
            }
            return new ClassifiedMembers(allowed, rateLimited, denied);
        });
    }

    private Map<String, Long> aggregateNow(String key, String field) {
        final var counts = new LinkedHashMap<String, Long>();
        forEachDecoded(key, (node, score) -> {
            final var value = node.get(field);
            if (value != null && !value.isNull()) {
                counts.merge(value.asText(), score, Long::sum);
            }
        });
        return counts;
    }

    private void forEachDecoded(String key, BiConsumer<JsonNode, Long> consumer) {
        keyspace.zrangeWithScores(key).forEach((member, score) -> {
            try {
                consumer.accept(MAPPER.readTree(member), score);
            } catch (JsonProcessingException e) {
                LOG.debugv("Skipping undecodable member in {0}", key);
            }
        });
    }

    private static void addIfRoom(List<ScoredMember> members, ScoredMember member, int top) {
        if (members.size() < top) {
            members.add(member);
        }
    }
}
