package com.example.paginated.list;

import java.util.Objects;
import java.util.function.Function;

/**
 * Everything {@link PaginatedList#flatMap(FlatMapOptions)} needs to translate between
 * a source list and the list it produces.
 *
 * @param itemMapper maps each source entry to zero or more new entries
 * @param compare the ordering of the new list
 * @param newCursorFromOldCursor translates source cursors into new cursors
 * @param oldCursorFromNewCursor translates new cursors back into source cursors
 * @param oldFilterFromNewFilter derives the source filter from the new filter
 * @param oldOrderByFromNewOrderBy derives the source ordering from the new ordering
 * @param estimateItemsToFetch how many source items to request per underlying fetch
 */
public record FlatMapOptions<T, C, F, O, T2, C2, F2, O2>(
        ItemMapper<T, C, F2, O2, T2, C2> itemMapper,
        OrderComparator<O2, T2> compare,
        Function<C, C2> newCursorFromOldCursor,
        Function<C2, C> oldCursorFromNewCursor,
        Function<F2, F> oldFilterFromNewFilter,
        Function<O2, O> oldOrderByFromNewOrderBy,
        FetchSizeEstimator<F2, O2> estimateItemsToFetch
) {
    public FlatMapOptions {
        Objects.requireNonNull(itemMapper, "itemMapper must not be null");
        Objects.requireNonNull(compare, "compare must not be null");
        Objects.requireNonNull(newCursorFromOldCursor, "newCursorFromOldCursor must not be null");
        Objects.requireNonNull(oldCursorFromNewCursor, "oldCursorFromNewCursor must not be null");
        Objects.requireNonNull(oldFilterFromNewFilter, "oldFilterFromNewFilter must not be null");
        Objects.requireNonNull(oldOrderByFromNewOrderBy, "oldOrderByFromNewOrderBy must not be null");
        Objects.requireNonNull(estimateItemsToFetch, "estimateItemsToFetch must not be null");
    }
}
