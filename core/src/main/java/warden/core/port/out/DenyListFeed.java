package warden.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.denylist.DenyListThreshold;

/**
 * Port interface for the external source of denied IP addresses.
 */
public interface DenyListFeed {

    /**
     * Fetch the addresses listed at a severity threshold.
     *
     * @param threshold the threshold
     * @return the addresses; fails with
     *     {@link warden.core.model.denylist.DenyListFeedException} when the source is unavailable
     */
    Uni<List<String>> fetch(DenyListThreshold threshold);
}
