package com.example.paginated.reactor;

import com.example.paginated.list.PaginatedList;
import com.example.paginated.model.Direction;
import com.example.paginated.model.QueryResult;
import com.example.paginated.model.TraversalOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Project Reactor views of a {@link PaginatedList}.
 *
 * <p>Pages are requested one after the other, each with the cursor of the previous
 * page, and only as fast as subscribers demand them. Cancelling the subscription
 * stops the walk.
 *
 * <p>Example usage:
 * <pre>{@code
 * PaginatedFlux.items(list, TraversalOptions.defaults(filter, orderBy))
 *     .filter(order -> "completed".equals(order.status()))
 *     .take(10)
 *     .subscribe(this::process);
 * }</pre>
 */
public final class PaginatedFlux {

    private PaginatedFlux() {
    }

    /**
     * Returns every page from the start sentinel of the traversal direction up to and
     * including the page that reports the boundary.
     *
     * @param list the list to walk
     * @param options the filter, ordering and page shape of every fetch
     * @return a cold flux; each subscription starts over from the sentinel
     */
    public static <T, C, F, O> Flux<QueryResult<T, C>> pages(
            PaginatedList<T, C, F, O> list,
            TraversalOptions<F, O> options
    ) {
        Direction direction = options.direction();
        C start = direction == Direction.NEXT ? list.getFirstCursor() : list.getLastCursor();

        return fetchPage(list, options, start)
                .expand(page -> page.reachedBoundary(direction)
                        ? Mono.<QueryResult<T, C>>empty()
                        : fetchPage(list, options, page.cursor()));
    }

    /**
     * Returns every item in traversal order: ascending for {@link Direction#NEXT},
     * descending for {@link Direction#PREV}.
     */
    public static <T, C, F, O> Flux<T> items(PaginatedList<T, C, F, O> list, TraversalOptions<F, O> options) {
        Direction direction = options.direction();
        // One page in flight at a time
        return pages(list, options).concatMapIterable(page -> {
            if (direction == Direction.NEXT) {
                return page.items();
            }
            List<T> reversed = new ArrayList<>(page.items());
            Collections.reverse(reversed);
            return reversed;
        }, 1);
    }

    /**
     * Collects {@link #items} into a single list.
     */
    public static <T, C, F, O> Mono<List<T>> collectAll(PaginatedList<T, C, F, O> list, TraversalOptions<F, O> options) {
        return items(list, options).collectList();
    }

    private static <T, C, F, O> Mono<QueryResult<T, C>> fetchPage(
            PaginatedList<T, C, F, O> list,
            TraversalOptions<F, O> options,
            C cursor
    ) {
        return Mono.defer(() -> Mono.fromFuture(list.nextOrPrev(options.direction(), options.toQuery(cursor))));
    }
}
