package warden.core.model.ratelimit;

/**
 * Raw counters of the current and previous sliding window buckets.
 *
 * @param current requests recorded in the current bucket
 * @param previous requests recorded in the previous bucket
 */
public record SlidingWindowCounts(long current, long previous) {

    /**
     * Weight the previous bucket by the part of it still covered by the sliding window.
     *
     * @param window the window
     * @param nowMillis current time
     * @return {@code current + floor((1 - elapsedFraction) * previous)}
     */
    public long effectiveCount(WindowDuration window, long nowMillis) {
        return current + weightedPrevious(previous, window, nowMillis);
    }

    /**
     * Weight a previous-bucket count by the part of it still covered by the sliding window.
     *
     * @param previous the previous bucket count
     * @param window the window
     * @param nowMillis current time
     * @return {@code floor((1 - elapsedFraction) * previous)}
     */
    public static long weightedPrevious(long previous, WindowDuration window, long nowMillis) {
        return (long) Math.floor((1 - window.elapsedFraction(nowMillis)) * previous);
    }
}
