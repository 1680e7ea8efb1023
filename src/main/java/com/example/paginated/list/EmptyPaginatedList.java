package com.example.paginated.list;

import com.example.paginated.model.Direction;
import com.example.paginated.model.QueryOptions;
import com.example.paginated.model.QueryResult;

import java.util.concurrent.CompletableFuture;

/**
 * A list without items. Both sentinels are {@value #SENTINEL} and every fetch is exhausted.
 */
final class EmptyPaginatedList<T, F, O> extends PaginatedList<T, String, F, O> {

    static final String SENTINEL = "empty";

    @Override
    protected String doGetFirstCursor() {
        return SENTINEL;
    }

    @Override
    protected String doGetLastCursor() {
        return SENTINEL;
    }

    @Override
    protected int doCompare(O orderBy, T a, T b) {
        return 0;
    }

    @Override
    protected CompletableFuture<QueryResult<T, String>> doNextOrPrev(
            Direction direction,
            QueryOptions<String, F, O> options
    ) {
        return CompletableFuture.completedFuture(QueryResult.exhausted(SENTINEL));
    }
}
