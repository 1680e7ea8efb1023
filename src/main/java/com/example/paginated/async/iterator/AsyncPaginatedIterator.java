package com.example.paginated.async.iterator;

import com.example.paginated.list.PaginatedList;
import com.example.paginated.model.Direction;
import com.example.paginated.model.QueryResult;
import com.example.paginated.model.TraversalOptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An AsyncIterator that walks a {@link PaginatedList} page by page without blocking.
 *
 * <ul>
 *   <li>Pages are fetched only when the current one is used up</li>
 *   <li>Only one page is held at a time</li>
 *   <li>Pages without items are skipped until the list reports its boundary</li>
 *   <li>Walking {@link Direction#PREV} yields items from the end of the list backwards</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>{@code
 * AsyncPaginatedIterator<Integer, String, Predicate<Integer>, Comparator<Integer>> iterator =
 *     new AsyncPaginatedIterator<>(list, TraversalOptions.defaults(x -> true, Comparator.naturalOrder()));
 *
 * iterator.forEachAsync(this::process)
 *     .thenRun(() -> log.info("Done"));
 * }</pre>
 *
 * <p><b>Thread Safety:</b> State lives in atomic references, so continuations may run on
 * any thread. Calls are expected to be composed sequentially.
 *
 * @param <T> the item type
 * @param <C> the cursor type
 * @param <F> the filter type
 * @param <O> the order-by type
 */
public class AsyncPaginatedIterator<T, C, F, O> implements AsyncIterator<T> {

    private final PaginatedList<T, C, F, O> list;
    private final TraversalOptions<F, O> options;

    private final AtomicReference<C> currentCursor;
    private final AtomicReference<Iterator<T>> currentPageIterator;
    private final AtomicBoolean boundaryReached;
    private final AtomicBoolean cancelled;

    /**
     * Creates an iterator positioned at the start sentinel of {@code options.direction()}.
     * No page is fetched before the first {@link #nextAsync()}.
     *
     * @param list the list to walk
     * @param options the filter, ordering and page shape of every fetch
     */
    public AsyncPaginatedIterator(PaginatedList<T, C, F, O> list, TraversalOptions<F, O> options) {
        this.list = list;
        this.options = options;
        this.currentCursor = new AtomicReference<>(
                options.direction() == Direction.NEXT ? list.getFirstCursor() : list.getLastCursor());
        this.currentPageIterator = new AtomicReference<>(Collections.emptyIterator());
        this.boundaryReached = new AtomicBoolean(false);
        this.cancelled = new AtomicBoolean(false);
    }

    @Override
    public CompletableFuture<Optional<T>> nextAsync() {
        while (true) {
            if (cancelled.get()) {
                return CompletableFuture.completedFuture(Optional.empty());
            }

            Iterator<T> pageIter = currentPageIterator.get();
            if (pageIter.hasNext()) {
                return CompletableFuture.completedFuture(Optional.of(pageIter.next()));
            }
            if (boundaryReached.get()) {
                return CompletableFuture.completedFuture(Optional.empty());
            }

            // The fetched page may be empty without being the last one
            CompletableFuture<Boolean> fetch = fetchNextPageAsync();
            if (!fetch.isDone() || fetch.isCompletedExceptionally()) {
                return fetch.thenCompose(fetched -> fetched
                        ? nextAsync()
                        : CompletableFuture.completedFuture(Optional.<T>empty()));
            }
            if (!fetch.join()) {
                return CompletableFuture.completedFuture(Optional.empty());
            }
        }
    }

    /**
     * Fetches the page after the current cursor.
     *
     * @return CompletableFuture that completes with true if a page was fetched, false if cancelled
     */
    private CompletableFuture<Boolean> fetchNextPageAsync() {
        C cursor = currentCursor.get();
        Direction direction = options.direction();

        return list.nextOrPrev(direction, options.toQuery(cursor))
                .thenApply(page -> {
                    if (cancelled.get()) {
                        return false;
                    }
                    currentPageIterator.set(itemsInTraversalOrder(page, direction).iterator());
                    currentCursor.set(page.cursor());
                    if (page.reachedBoundary(direction)) {
                        boundaryReached.set(true);
                    }
                    return true;
                })
                .exceptionally(ex -> {
                    boundaryReached.set(true);
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    throw new RuntimeException("Failed to fetch page with cursor: " + cursor, cause);
                });
    }

    private static <T> List<T> itemsInTraversalOrder(QueryResult<T, ?> page, Direction direction) {
        List<T> items = new ArrayList<>(page.items());
        if (direction == Direction.PREV) {
            Collections.reverse(items);
        }
        return items;
    }

    @Override
    public void cancel() {
        cancelled.set(true);
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Returns true once no more items will be returned.
     */
    public boolean isFinished() {
        return cancelled.get() || (boundaryReached.get() && !currentPageIterator.get().hasNext());
    }
}
