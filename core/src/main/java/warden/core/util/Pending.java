package warden.core.util;

import java.util.List;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

/**
 * Handles on background work attached to a rate limit response.
 *
 * <p>{@link #start} subscribes to the work immediately and returns a memoized handle:
 * awaiting the handle replays the outcome instead of running the work again, and a
 * failure of the work is logged and turned into completion.
 */
public final class Pending {

    private static final Logger LOG = Logger.getLogger(Pending.class);

    private static final Uni<Void> NONE = Uni.createFrom().voidItem();

    private Pending() {}

    /**
     * Returns the handle of a response without background work.
     */
    public static Uni<Void> none() {
        return NONE;
    }

    /**
     * Starts background work and returns its handle.
     *
     * @param work the work, not yet subscribed
     * @param description what the work does, for log messages
     * @return a memoized handle that completes when the work ends and never fails
     */
    public static Uni<Void> start(Uni<?> work, String description) {
        final Uni<Void> handle = work.replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.warnv(e, "Background {0} failed", description))
                .onFailure()
                .recoverWithNull()
                .memoize()
                .indefinitely();
        handle.subscribe().with(ignored -> LOG.tracev("Background {0} completed", description));
        return handle;
    }

    /**
     * Combines handles into one that completes once all of them have.
     *
     * @param handles handles produced by {@link #start} or {@link #none}
     * @return the combined handle
     */
    public static Uni<Void> all(List<Uni<Void>> handles) {
        final var started = handles.stream().filter(h -> h != NONE).toList();
        if (started.isEmpty()) {
            return NONE;
        }
        if (started.size() == 1) {
            return started.get(0);
        }
        return Uni.combine().all().unis(started).discardItems();
    }

    public static Uni<Void> all(Uni<Void> first, Uni<Void> second) {
        return all(List.of(first, second));
    }
}
