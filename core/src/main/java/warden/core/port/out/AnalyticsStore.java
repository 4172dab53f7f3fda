package warden.core.port.out;

import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;

import warden.core.model.analytics.ClassifiedMembers;
import warden.core.model.analytics.UsageCounts;

/**
 * Port interface for time-bucketed analytics storage.
 *
 * <p>Each bucket is a scored set of serialized events. Identical events in one bucket
 * share a member whose score counts them.
 */
public interface AnalyticsStore {

    /**
     * Add one occurrence of a member to a bucket and refresh the bucket's retention.
     *
     * @param key the bucket key
     * @param member the serialized event
     * @param retentionMillis how long the bucket is kept
     * @return completion signal
     */
    Uni<Void> increment(String key, String member, long retentionMillis);

    /**
     * Sum scores per distinct value of a field within one bucket.
     *
     * <p>Members whose field is absent or that cannot be decoded are skipped. Values are
     * compared by their string form, so {@code true} and {@code "true"} group together.
     *
     * @param key the bucket key
     * @param field the field to group by
     * @return summed score per value
     */
    Uni<Map<String, Long>> aggregate(String key, String field);

    /**
     * Aggregate many buckets on the same field, sending them to the store in batches.
     *
     * @param keys bucket keys
     * @param field the field to group by
     * @param batchSize buckets per round trip
     * @return one aggregate per key, in key order
     */
    Uni<List<Map<String, Long>>> aggregateAll(List<String> keys, String field, int batchSize);

    /**
     * Count allowed and blocked requests per identifier across buckets.
     *
     * @param keys bucket keys
     * @return counts per identifier
     */
    Uni<Map<String, UsageCounts>> allowedBlocked(List<String> keys);

    /**
     * Union buckets and return their highest scored members per outcome.
     *
     * <p>Members are visited by descending score. The scan stops after {@code checkAtMost}
     * members or once every category holds {@code top} members, so rare categories in very
     * large unions can be under-reported.
     *
     * @param keys bucket keys
     * @param top members to keep per category
     * @param checkAtMost scan budget
     * @return the classified members
     */
    Uni<ClassifiedMembers> classify(List<String> keys, int top, int checkAtMost);
}
