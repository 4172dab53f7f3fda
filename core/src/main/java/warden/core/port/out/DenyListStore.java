package warden.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.denylist.DenyListCheck;
import warden.core.model.denylist.DenyListKeys;

/**
 * Port interface for deny-list storage.
 */
public interface DenyListStore {

    /**
     * Test candidates for membership and read the freshness marker in one atomic step.
     *
     * <p>When the marker is absent, the procedure sets it to {@code pending} for 30 seconds
     * before returning, so only the caller that saw it missing refreshes the list.
     *
     * @param keys deny-list keys
     * @param candidates values to test
     * @return the denied candidates and the marker TTL as read before any write
     */
    Uni<DenyListCheck> check(DenyListKeys keys, List<String> candidates);

    /**
     * Replace the IP-sourced subset with a fresh list and mark it valid.
     *
     * <p>Manually added values are kept. Values both fetched and manually added stay
     * manual.
     *
     * @param keys deny-list keys
     * @param ips the fetched addresses
     * @param ttlMillis how long the marker stays valid
     * @return completion signal
     */
    Uni<Void> replaceIpDenyList(DenyListKeys keys, List<String> ips, long ttlMillis);

    /**
     * Drop the IP-sourced subset and mark the list disabled without expiry, so no caller
     * schedules a refresh.
     *
     * @param keys deny-list keys
     * @return completion signal
     */
    Uni<Void> disableIpDenyList(DenyListKeys keys);

    /**
     * Add manual entries.
     *
     * @param keys deny-list keys
     * @param values values to deny
     * @return completion signal
     */
    Uni<Void> add(DenyListKeys keys, List<String> values);

    /**
     * Remove entries, whether manual or IP-sourced.
     *
     * @param keys deny-list keys
     * @param values values to allow again
     * @return completion signal
     */
    Uni<Void> remove(DenyListKeys keys, List<String> values);
}
