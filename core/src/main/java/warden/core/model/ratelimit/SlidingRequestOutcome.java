package warden.core.model.ratelimit;

import java.util.Map;

/**
 * Result of recording a request in a multi-region sliding window.
 *
 * @param current request ids and their token counts in the current bucket, after this call
 * @param previous request ids and their token counts in the previous bucket
 * @param accepted whether the region accepted and recorded the request
 */
public record SlidingRequestOutcome(Map<String, Long> current, Map<String, Long> previous, boolean accepted) {

    public SlidingRequestOutcome {
        current = Map.copyOf(current);
        previous = Map.copyOf(previous);
    }
}
