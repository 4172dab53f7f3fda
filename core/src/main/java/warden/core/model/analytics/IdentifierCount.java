package warden.core.model.analytics;

/**
 * An identifier and how often it occurred in one category.
 */
public record IdentifierCount(String identifier, long count) {}
