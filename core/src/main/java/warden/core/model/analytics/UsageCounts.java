package warden.core.model.analytics;

/**
 * Allowed and blocked request counts for one identifier.
 *
 * @param allowed allowed requests
 * @param blocked rate-limited and denied requests
 */
public record UsageCounts(long allowed, long blocked) {

    public static final UsageCounts ZERO = new UsageCounts(0, 0);

    public UsageCounts add(EventOutcome outcome, long count) {
        return outcome.blocked() ? new UsageCounts(allowed, blocked + count) : new UsageCounts(allowed + count, blocked);
    }

    public UsageCounts plus(UsageCounts other) {
        return new UsageCounts(allowed + other.allowed, blocked + other.blocked);
    }
}
