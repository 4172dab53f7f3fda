package warden.core.model.denylist;

import java.util.List;

/**
 * Result of checking candidates against the deny-list.
 *
 * @param deniedValues the candidates found on the deny-list, in candidate order
 * @param statusTtl TTL of the freshness marker in seconds as the store reports it; {@code -2}
 *     when the marker is absent
 */
public record DenyListCheck(List<String> deniedValues, long statusTtl) {

    /** TTL reported for a missing key. */
    public static final long ABSENT = -2;

    public DenyListCheck {
        deniedValues = List.copyOf(deniedValues);
    }

    public static DenyListCheck clean() {
        return new DenyListCheck(List.of(), -1);
    }

    public boolean denied() {
        return !deniedValues.isEmpty();
    }

    public String firstDenied() {
        return deniedValues.get(0);
    }

    /**
     * The marker is gone, so this caller won the refresh and has already flagged it as pending.
     */
    public boolean refreshNeeded() {
        return statusTtl == ABSENT;
    }
}
