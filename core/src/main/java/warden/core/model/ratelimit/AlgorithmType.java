package warden.core.model.ratelimit;

/**
 * Rate limiting algorithms selectable from configuration.
 */
public enum AlgorithmType {

    /**
     * Counts requests per aligned window. Allows up to twice the limit across a boundary.
     */
    FIXED_WINDOW,

    /**
     * Weights the previous window by the part of it still inside the sliding window.
     */
    SLIDING_WINDOW,

    /**
     * Refills a bucket of tokens in whole intervals.
     */
    TOKEN_BUCKET,

    /**
     * Fixed window whose counter is served from the local cache after the first store round trip.
     */
    CACHED_FIXED_WINDOW
}
