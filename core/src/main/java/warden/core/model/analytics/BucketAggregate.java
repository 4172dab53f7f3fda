package warden.core.model.analytics;

import java.util.Map;

/**
 * Summed scores per distinct value of one field within one time bucket.
 *
 * @param bucketStart epoch millis at which the bucket starts
 * @param counts summed score per field value
 */
public record BucketAggregate(long bucketStart, Map<String, Long> counts) {

    public BucketAggregate {
        counts = Map.copyOf(counts);
    }

    public long count(String value) {
        return counts.getOrDefault(value, 0L);
    }
}
