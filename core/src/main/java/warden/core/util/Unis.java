package warden.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import io.smallrye.mutiny.Uni;

/**
 * Combinators for racing and settling groups of {@link Uni}s.
 */
public final class Unis {

    private Unis() {}

    /**
     * Emits the item of the first {@link Uni} to succeed.
     *
     * <p>Failures are ignored while at least one source is still running. When every source
     * has failed, the returned {@code Uni} fails with the exception built from all failures.
     * Sources that lose the race keep running; callers should pass memoized sources if
     * they need the other results later.
     *
     * @param sources the competing sources
     * @param whenAllFail builds the failure from every source's exception
     * @param <T> item type
     * @return the first success
     */
    public static <T> Uni<T> firstSuccess(
            List<Uni<T>> sources, Function<List<Throwable>, ? extends Throwable> whenAllFail) {
        if (sources.isEmpty()) {
            return Uni.createFrom().failure(() -> whenAllFail.apply(List.of()));
        }
        return Uni.createFrom().emitter(emitter -> {
            final var done = new AtomicBoolean();
            final var failed = new AtomicInteger();
            final var failures = new ConcurrentLinkedQueue<Throwable>();
            for (var source : sources) {
                source.subscribe()
                        .with(
                                item -> {
                                    if (done.compareAndSet(false, true)) {
                                        emitter.complete(item);
                                    }
                                },
                                failure -> {
                                    failures.add(failure);
                                    if (failed.incrementAndGet() == sources.size() && done.compareAndSet(false, true)) {
                                        emitter.fail(whenAllFail.apply(new ArrayList<>(failures)));
                                    }
                                });
            }
        });
    }

    /**
     * Waits for every source to terminate. Each failure becomes an empty slot.
     *
     * @param sources the sources
     * @param <T> item type
     * @return results in source order
     */
    @SuppressWarnings("unchecked")
    public static <T> Uni<List<Optional<T>>> settleAll(List<Uni<T>> sources) {
        if (sources.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        final List<Uni<Optional<T>>> settled = sources.stream()
                .map(source -> source.map(Optional::ofNullable).onFailure().recoverWithItem(Optional.empty()))
                .toList();
        return Uni.combine()
                .all()
                .unis(settled)
                .with(items -> items.stream().map(item -> (Optional<T>) item).toList());
    }
}
