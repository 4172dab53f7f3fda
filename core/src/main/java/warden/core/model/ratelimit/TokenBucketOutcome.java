package warden.core.model.ratelimit;

/**
 * Result of the token bucket consume procedure.
 *
 * @param remaining tokens left after this call; negative when the call was rejected
 * @param reset epoch millis of the next refill
 */
public record TokenBucketOutcome(long remaining, long reset) {

    /** Marker returned by the procedure for an empty bucket. */
    public static final long REJECTED = -1;

    public boolean accepted() {
        return remaining >= 0;
    }
}
