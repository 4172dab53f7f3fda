package warden.core.model.analytics;

import java.util.List;

/**
 * Highest scored members of a bucket union, split by outcome.
 */
public record ClassifiedMembers(List<ScoredMember> allowed, List<ScoredMember> rateLimited, List<ScoredMember> denied) {

    public ClassifiedMembers {
        allowed = List.copyOf(allowed);
        rateLimited = List.copyOf(rateLimited);
        denied = List.copyOf(denied);
    }
}
