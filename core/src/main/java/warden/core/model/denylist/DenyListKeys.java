package warden.core.model.denylist;

/**
 * Store keys of the deny-list under one prefix.
 *
 * <p>{@code all} holds every denied value; {@code ipDenyList} the subset that came from
 * the IP feed; {@code ipDenyListStatus} the freshness marker whose TTL says how long the
 * IP subset stays valid.
 */
public record DenyListKeys(String all, String ipDenyList, String ipDenyListStatus) {

    public static DenyListKeys forPrefix(String prefix) {
        final var base = prefix + ":denyList:";
        return new DenyListKeys(base + "all", base + "ipDenyList", base + "ipDenyListStatus");
    }
}
