package warden.core.model.ratelimit;

import java.util.Objects;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Result of a single {@code limit} call.
 *
 * <p>Instances are immutable. Every {@code with*} method returns a new response.
 *
 * <p>{@code remaining} is clamped to zero here, so algorithms may hand in negative
 * intermediate values.
 *
 * @param success whether the request may proceed
 * @param limit the maximum number of requests allowed in the window
 * @param remaining requests left in the current window, never negative
 * @param reset epoch millis at which the current window (or refill interval) ends
 * @param pending handle on background work started by this call; awaiting it never fails
 * @param reason why the response deviates from the plain algorithm verdict, if it does
 * @param deniedValue the deny-listed candidate when {@code reason} is {@link RateLimitReason#DENY_LIST}
 */
public record RateLimitResponse(
        boolean success,
        long limit,
        long remaining,
        long reset,
        Uni<Void> pending,
        Optional<RateLimitReason> reason,
        Optional<String> deniedValue) {

    public RateLimitResponse {
        Objects.requireNonNull(pending, "pending must not be null");
        reason = Objects.requireNonNullElse(reason, Optional.empty());
        deniedValue = Objects.requireNonNullElse(deniedValue, Optional.empty());
        remaining = Math.max(0, remaining);
    }

    /**
     * Create a response without background work.
     *
     * @param success whether the request may proceed
     * @param limit the window limit
     * @param remaining remaining requests (clamped to zero)
     * @param reset window reset in epoch millis
     * @return the response
     */
    public static RateLimitResponse of(boolean success, long limit, long remaining, long reset) {
        return new RateLimitResponse(
                success, limit, remaining, reset, Uni.createFrom().voidItem(), Optional.empty(), Optional.empty());
    }

    /**
     * Create a rejection served from the local cache.
     *
     * @param limit the window limit
     * @param reset epoch millis until which the identifier is blocked
     * @return the response
     */
    public static RateLimitResponse cacheBlocked(long limit, long reset) {
        return new RateLimitResponse(
                false,
                limit,
                0,
                reset,
                Uni.createFrom().voidItem(),
                Optional.of(RateLimitReason.CACHE_BLOCK),
                Optional.empty());
    }

    /**
     * Create a rejection for a deny-listed candidate.
     *
     * @param limit the window limit
     * @param reset epoch millis at which the local deny entry expires
     * @param deniedValue the candidate found on the deny-list
     * @return the response
     */
    public static RateLimitResponse denied(long limit, long reset, String deniedValue) {
        return new RateLimitResponse(
                false,
                limit,
                0,
                reset,
                Uni.createFrom().voidItem(),
                Optional.of(RateLimitReason.DENY_LIST),
                Optional.of(deniedValue));
    }

    /**
     * Create the optimistic response used when the store did not answer in time.
     *
     * @param limit the window limit
     * @param reset end of the window current when the timeout fired
     * @return the response
     */
    public static RateLimitResponse timedOut(long limit, long reset) {
        return new RateLimitResponse(
                true, limit, 0, reset, Uni.createFrom().voidItem(), Optional.of(RateLimitReason.TIMEOUT), Optional.empty());
    }

    /**
     * Return a copy that rejects the request because of a deny-listed candidate.
     *
     * <p>The algorithm's limit and reset are kept.
     *
     * @param value the deny-listed candidate
     * @return the overridden response
     */
    public RateLimitResponse deniedBy(String value) {
        return new RateLimitResponse(
                false, limit, 0, reset, pending, Optional.of(RateLimitReason.DENY_LIST), Optional.of(value));
    }

    /**
     * Return a copy carrying a different pending handle.
     *
     * @param newPending the new handle
     * @return the response
     */
    public RateLimitResponse withPending(Uni<Void> newPending) {
        return new RateLimitResponse(success, limit, remaining, reset, newPending, reason, deniedValue);
    }

    /**
     * Check whether the response was produced for the given reason.
     *
     * @param candidate the reason to compare with
     * @return true if this response carries that reason
     */
    public boolean hasReason(RateLimitReason candidate) {
        return reason.map(candidate::equals).orElse(false);
    }
}
