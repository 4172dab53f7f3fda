package warden.core.model.ratelimit;

/**
 * Read-only view of an identifier's quota.
 *
 * @param remaining requests left in the current window, never negative
 * @param reset epoch millis at which the current window ends
 * @param limit the window limit
 */
public record RemainingTokens(long remaining, long reset, long limit) {

    public RemainingTokens {
        remaining = Math.max(0, remaining);
    }
}
