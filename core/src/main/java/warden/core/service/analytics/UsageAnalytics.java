package warden.core.service.analytics;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.analytics.AnalyticsEvent;
import warden.core.model.analytics.BucketAggregate;
import warden.core.model.analytics.EventOutcome;
import warden.core.model.analytics.IdentifierCount;
import warden.core.model.analytics.MostAllowedBlocked;
import warden.core.model.analytics.ScoredMember;
import warden.core.model.analytics.UsageCounts;
import warden.core.port.out.AnalyticsStore;

/**
 * Records usage events into time buckets and answers usage queries.
 *
 * <p>Bucket keys are {@code <prefix>:events:<bucketStart>} where {@code bucketStart} is the
 * event time rounded down to the bucket size.
 */
public class UsageAnalytics {

    private static final Logger LOG = Logger.getLogger(UsageAnalytics.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Buckets aggregated per store round trip. */
    public static final int DEFAULT_BATCH_SIZE = 48;

    /** Upper bound on the buckets a usage query walks. */
    public static final int MAX_BUCKETS = 256;

    public static final int DEFAULT_TOP = 5;
    public static final int DEFAULT_CHECK_AT_MOST = 1000;

    private final AnalyticsStore store;
    private final String table;
    private final long bucketMillis;
    private final long retentionMillis;
    private final Clock clock;

    public UsageAnalytics(AnalyticsStore store, String prefix, Duration bucket, Duration retention, Clock clock) {
        if (bucket.toMillis() <= 0) {
            throw new IllegalArgumentException("analytics bucket must be positive, got " + bucket);
        }
        this.store = store;
        this.table = prefix + ":events";
        this.bucketMillis = bucket.toMillis();
        this.retentionMillis = retention.toMillis();
        this.clock = clock;
    }

    /**
     * Add an event to its bucket.
     *
     * @param event the event
     * @return completion signal
     */
    public Uni<Void> record(AnalyticsEvent event) {
        final String member;
        try {
            member = MAPPER.writeValueAsString(event.toMember(MAPPER));
        } catch (JsonProcessingException e) {
            return Uni.createFrom().failure(e);
        }
        return store.increment(bucketKey(bucketStart(event.time())), member, retentionMillis);
    }

    /**
     * Sum event counts per value of a field within the bucket containing {@code timestamp}.
     *
     * @param field field to group by, e.g. {@code "success"} or {@code "country"}
     * @param timestamp any instant within the bucket
     * @return the aggregate
     */
    public Uni<BucketAggregate> aggregateBucket(String field, long timestamp) {
        final var start = bucketStart(timestamp);
        return store.aggregate(bucketKey(start), field).map(counts -> new BucketAggregate(start, counts));
    }

    /**
     * Aggregate {@code bucketCount} buckets ending with the one containing {@code timestamp}.
     *
     * @param field field to group by
     * @param bucketCount how many buckets to walk back
     * @param timestamp any instant within the newest bucket
     * @param batchSize buckets per store round trip
     * @return aggregates, newest first
     */
    public Uni<List<BucketAggregate>> aggregateBuckets(String field, int bucketCount, long timestamp, int batchSize) {
        final var starts = bucketStarts(bucketCount, timestamp);
        final var keys = starts.stream().map(this::bucketKey).toList();
        return store.aggregateAll(keys, field, batchSize).map(results -> {
            final var aggregates = new ArrayList<BucketAggregate>(results.size());
            for (var i = 0; i < results.size(); i++) {
                aggregates.add(new BucketAggregate(starts.get(i), results.get(i)));
            }
            return aggregates;
        });
    }

    /**
     * Count allowed and blocked requests per identifier since {@code sinceMillis}.
     *
     * <p>Denied requests count as blocked. At most {@link #MAX_BUCKETS} buckets are read.
     *
     * @param sinceMillis start of the range in epoch millis
     * @return counts per identifier
     */
    public Uni<Map<String, UsageCounts>> getUsage(long sinceMillis) {
        final var now = clock.millis();
        final var span = (bucketStart(now) - bucketStart(Math.min(sinceMillis, now))) / bucketMillis + 1;
        final var bucketCount = (int) Math.min(span, MAX_BUCKETS);
        final var keys = bucketStarts(bucketCount, now).stream().map(this::bucketKey).toList();
        return store.allowedBlocked(keys);
    }

    /**
     * Aggregate outcomes of the last {@code bucketCount} buckets.
     *
     * @param bucketCount buckets to walk back
     * @return per bucket counts keyed {@code "true"}, {@code "false"} and {@code "denied"}, newest first
     */
    public Uni<List<BucketAggregate>> getUsageOverTime(int bucketCount) {
        return aggregateBuckets(EventOutcome.FIELD, bucketCount, clock.millis(), DEFAULT_BATCH_SIZE);
    }

    public Uni<MostAllowedBlocked> getMostAllowedBlocked(int bucketCount) {
        return getMostAllowedBlocked(bucketCount, DEFAULT_TOP, DEFAULT_CHECK_AT_MOST);
    }

    /**
     * Find the identifiers with the most allowed, rate-limited and denied requests.
     *
     * <p>Only the {@code checkAtMost} highest scored events are inspected, so in very busy
     * ranges rare categories may be missing or under-counted.
     *
     * @param bucketCount buckets to walk back
     * @param top identifiers per category
     * @param checkAtMost events to inspect
     * @return the top identifiers per category
     */
    public Uni<MostAllowedBlocked> getMostAllowedBlocked(int bucketCount, int top, int checkAtMost) {
        final var keys = bucketStarts(Math.min(bucketCount, MAX_BUCKETS), clock.millis()).stream()
                .map(this::bucketKey)
                .toList();
        return store.classify(keys, top, checkAtMost)
                .map(classified -> new MostAllowedBlocked(
                        topIdentifiers(classified.allowed(), top),
                        topIdentifiers(classified.rateLimited(), top),
                        topIdentifiers(classified.denied(), top)));
    }

    long bucketStart(long timestamp) {
        return Math.floorDiv(timestamp, bucketMillis) * bucketMillis;
    }

    String bucketKey(long bucketStart) {
        return table + ":" + bucketStart;
    }

    private List<Long> bucketStarts(int bucketCount, long timestamp) {
        final var newest = bucketStart(timestamp);
        final var starts = new ArrayList<Long>(bucketCount);
        for (var i = 0; i < bucketCount; i++) {
            starts.add(newest - i * bucketMillis);
        }
        return starts;
    }

    private static List<IdentifierCount> topIdentifiers(List<ScoredMember> members, int top) {
        final var totals = new HashMap<String, Long>();
        for (var member : members) {
            try {
                final var identifier = MAPPER.readTree(member.member()).path("identifier");
                if (!identifier.isMissingNode()) {
                    totals.merge(identifier.asText(), member.score(), Long::sum);
                }
            } catch (JsonProcessingException e) {
                LOG.debugv("Skipping undecodable analytics member {0}", member.member());
            }
        }
        return totals.entrySet().stream()
                .map(entry -> new IdentifierCount(entry.getKey(), entry.getValue()))
                .sorted(Comparator.comparingLong(IdentifierCount::count)
                        .reversed()
                        .thenComparing(IdentifierCount::identifier))
                .limit(top)
                .toList();
    }
}
