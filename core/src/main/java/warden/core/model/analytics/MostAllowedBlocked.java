package warden.core.model.analytics;

import java.util.List;

/**
 * Top identifiers per outcome category, each list sorted by count descending.
 *
 * @param allowed most allowed identifiers
 * @param rateLimited most rate-limited identifiers
 * @param denied most denied identifiers
 */
public record MostAllowedBlocked(
        List<IdentifierCount> allowed, List<IdentifierCount> rateLimited, List<IdentifierCount> denied) {

    public MostAllowedBlocked {
        allowed = List.copyOf(allowed);
        rateLimited = List.copyOf(rateLimited);
        denied = List.copyOf(denied);
    }
}
