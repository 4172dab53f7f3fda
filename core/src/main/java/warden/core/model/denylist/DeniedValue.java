package warden.core.model.denylist;

/**
 * A candidate known locally to be on the deny-list.
 *
 * @param value the denied candidate
 * @param until epoch millis until which the local entry is trusted
 */
public record DeniedValue(String value, long until) {}
