package com.example.paginated.streaming.spliterator;

import com.example.paginated.list.PaginatedList;
import com.example.paginated.model.Direction;
import com.example.paginated.model.QueryResult;
import com.example.paginated.model.TraversalOptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A Spliterator that walks a {@link PaginatedList} lazily and streams its items.
 *
 * <ul>
 *   <li>Pages are only fetched when needed</li>
 *   <li>Only one page is held in memory at a time</li>
 *   <li>Items are handed out one at a time via {@link #tryAdvance}</li>
 * </ul>
 *
 * <p>Each page fetch blocks the consuming thread until the list's future completes.
 *
 * <p>Example usage:
 * <pre>{@code
 * long matching = PaginatedSpliterator.stream(list, TraversalOptions.defaults(filter, orderBy))
 *     .filter(order -> order.amount() > 100)
 *     .count();
 * }</pre>
 *
 * @param <T> the item type
 * @param <C> the cursor type
 * @param <F> the filter type
 * @param <O> the order-by type
 */
public class PaginatedSpliterator<T, C, F, O> implements Spliterator<T> {

    private final PaginatedList<T, C, F, O> list;
    private final TraversalOptions<F, O> options;

    private C currentCursor;
    private Iterator<T> currentPageIterator = Collections.emptyIterator();
    private boolean finished = false;

    public PaginatedSpliterator(PaginatedList<T, C, F, O> list, TraversalOptions<F, O> options) {
        this.list = list;
        this.options = options;
        this.currentCursor = options.direction() == Direction.NEXT ? list.getFirstCursor() : list.getLastCursor();
    }

    /**
     * Returns a sequential stream over all items of the list, in traversal order.
     *
     * @param list the list to walk
     * @param options the filter, ordering and page shape of every fetch
     * @return a lazy stream; pages are fetched as it is consumed
     */
    public static <T, C, F, O> Stream<T> stream(PaginatedList<T, C, F, O> list, TraversalOptions<F, O> options) {
        return StreamSupport.stream(new PaginatedSpliterator<>(list, options), false);
    }

    @Override
    public boolean tryAdvance(Consumer<? super T> action) {
        while (!currentPageIterator.hasNext()) {
            if (!fetchNextPage()) {
                return false;
            }
        }

        action.accept(currentPageIterator.next());
        return true;
    }

    /**
     * Fetches the page after the current cursor.
     *
     * @return true if a page was fetched, false once the list's boundary has been passed
     */
    private boolean fetchNextPage() {
        if (finished) {
            return false;
        }

        Direction direction = options.direction();
        try {
            QueryResult<T, C> page = list.nextOrPrev(direction, options.toQuery(currentCursor)).join();

            List<T> items = new ArrayList<>(page.items());
            if (direction == Direction.PREV) {
                Collections.reverse(items);
            }
            currentPageIterator = items.iterator();
            currentCursor = page.cursor();
            finished = page.reachedBoundary(direction);
            return true;
        } catch (CompletionException e) {
            finished = true;
            throw new RuntimeException("Failed to fetch page with cursor: " + currentCursor, e.getCause());
        }
    }

    /**
     * Returns null: a page can only be requested with the cursor of the page before it.
     */
    @Override
    public Spliterator<T> trySplit() {
        return null;
    }

    @Override
    public long estimateSize() {
        return Long.MAX_VALUE;
    }

    @Override
    public int characteristics() {
        return ORDERED;
    }
}
