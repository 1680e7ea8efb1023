package com.example.paginated.list;

import com.example.paginated.model.Direction;
import com.example.paginated.model.LimitPrecision;
import com.example.paginated.model.PageEntry;
import com.example.paginated.model.QueryOptions;
import com.example.paginated.model.QueryResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A list derived from a source list entry by entry, see {@link PaginatedList#flatMap}.
 *
 * <p>Each fetch asks the source for an estimated number of entries, maps them and
 * translates the flags and cursor back into this list's cursor space. The source's own
 * traversal loop does the fetching; the loop of this list re-fetches when mapping
 * produced too few entries.
 */
final class FlatMapPaginatedList<T, C, F, O, T2, C2, F2, O2> extends PaginatedList<T2, C2, F2, O2> {

    private final PaginatedList<T, C, F, O> source;
    private final FlatMapOptions<T, C, F, O, T2, C2, F2, O2> options;

    FlatMapPaginatedList(PaginatedList<T, C, F, O> source, FlatMapOptions<T, C, F, O, T2, C2, F2, O2> options) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    @Override
    protected C2 doGetFirstCursor() {
        return options.newCursorFromOldCursor().apply(source.getFirstCursor());
    }

    @Override
    protected C2 doGetLastCursor() {
        return options.newCursorFromOldCursor().apply(source.getLastCursor());
    }

    @Override
    protected int doCompare(O2 orderBy, T2 a, T2 b) {
        return options.compare().compare(orderBy, a, b);
    }

    @Override
    protected CompletableFuture<QueryResult<T2, C2>> doNextOrPrev(Direction direction, QueryOptions<C2, F2, O2> query) {
        F2 filter = query.filter();
        O2 orderBy = query.orderBy();
        QueryOptions<C, F, O> sourceQuery = new QueryOptions<>(
                options.oldCursorFromNewCursor().apply(query.cursor()),
                options.oldFilterFromNewFilter().apply(filter),
                options.oldOrderByFromNewOrderBy().apply(orderBy),
                itemsToFetch(query),
                LimitPrecision.APPROXIMATE
        );

        return source.nextOrPrev(direction, sourceQuery).thenApply(original -> {
            List<PageEntry<T2, C2>> mapped = new ArrayList<>();
            for (PageEntry<T, C> entry : original.entries()) {
                mapped.addAll(options.itemMapper().map(entry, filter, orderBy));
            }
            return new QueryResult<>(
                    mapped,
                    original.isFirst(),
                    original.isLast(),
                    options.newCursorFromOldCursor().apply(original.cursor())
            );
        });
    }

    // A positive limit always requests at least one source item so the source keeps advancing.
    private int itemsToFetch(QueryOptions<C2, F2, O2> query) {
        int estimate = options.estimateItemsToFetch().estimate(query.filter(), query.orderBy(), query.limit());
        return Math.max(estimate, query.limit() > 0 ? 1 : 0);
    }
}
