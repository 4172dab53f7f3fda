package warden.core.model.analytics;

/**
 * A serialized event and its accumulated score.
 */
public record ScoredMember(String member, long score) {}
