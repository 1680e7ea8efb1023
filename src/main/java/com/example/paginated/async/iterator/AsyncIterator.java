package com.example.paginated.async.iterator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Non-blocking counterpart of {@link java.util.Iterator}: each element arrives in a future
 * that completes once the page holding it has been fetched.
 *
 * <p>Example usage:
 * <pre>{@code
 * AsyncIterator<Integer> items = new AsyncPaginatedIterator<>(list, options);
 *
 * items.forEachAsync(this::process)
 *     .thenRun(() -> log.info("Done"));
 * }</pre>
 *
 * @param <T> the element type
 */
public interface AsyncIterator<T> {

    /**
     * Returns the next element.
     *
     * @return a future holding the next element, {@code Optional.empty()} once the
     *         iteration is complete or cancelled; it fails if fetching a page failed
     */
    CompletableFuture<Optional<T>> nextAsync();

    /**
     * Applies {@code action} to every remaining element, one after the other.
     *
     * <p>Elements that are already available are consumed in a loop; the iteration only
     * continues asynchronously after an element that is still being fetched.
     *
     * @param action the action to apply to each element
     * @return a future that completes once every element has been processed, or
     *         exceptionally with the first fetch or action failure
     */
    default CompletableFuture<Void> forEachAsync(Consumer<T> action) {
        while (true) {
            CompletableFuture<Optional<T>> next = nextAsync();
            if (!next.isDone() || next.isCompletedExceptionally()) {
                return next.thenCompose(element -> {
                    if (element.isEmpty()) {
                        return CompletableFuture.completedFuture(null);
                    }
                    action.accept(element.get());
                    return forEachAsync(action);
                });
            }

            Optional<T> element = next.join();
            if (element.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            try {
                action.accept(element.get());
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
    }

    /**
     * Collects every remaining element into a list.
     *
     * @return a future holding the remaining elements in iteration order
     */
    default CompletableFuture<List<T>> toListAsync() {
        List<T> elements = new ArrayList<>();
        return forEachAsync(elements::add).thenApply(ignored -> elements);
    }

    /**
     * Stops the iteration: no further pages are fetched and {@link #nextAsync()}
     * completes empty from now on.
     */
    void cancel();

    boolean isCancelled();
}
