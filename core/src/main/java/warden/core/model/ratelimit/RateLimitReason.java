package warden.core.model.ratelimit;

/**
 * Why a response deviates from the plain algorithm verdict.
 */
public enum RateLimitReason {

    /**
     * One of the request candidates is on the deny-list.
     */
    DENY_LIST("denyList"),

    /**
     * The local ephemeral cache already knows the identifier is blocked until the window resets.
     */
    CACHE_BLOCK("cacheBlock"),

    /**
     * The store did not answer in time and the request was allowed without a definite decision.
     */
    TIMEOUT("timeout");

    private final String value;

    RateLimitReason(String value) {
        this.value = value;
    }

    /**
     * Return the wire value used in logs and analytics.
     *
     * @return the reason value
     */
    public String value() {
        return value;
    }
}
