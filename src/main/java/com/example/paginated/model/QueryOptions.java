package com.example.paginated.model;

import java.util.Objects;

/**
 * Options of a single {@code next}/{@code prev} call.
 *
 * <p>{@code cursor} is the exclusive boundary: the {@code after} cursor when walking
 * {@link Direction#NEXT}, the {@code before} cursor when walking {@link Direction#PREV}.
 *
 * @param <C> the cursor type
 * @param <F> the filter type
 * @param <O> the order-by type
 */
public record QueryOptions<C, F, O>(
        C cursor,
        F filter,
        O orderBy,
        int limit,
        LimitPrecision limitPrecision
) {
    public QueryOptions {
        Objects.requireNonNull(cursor, "cursor must not be null");
        Objects.requireNonNull(limitPrecision, "limitPrecision must not be null");
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
    }

    /**
     * Creates options with {@link LimitPrecision#EXACT} precision.
     */
    public static <C, F, O> QueryOptions<C, F, O> of(C cursor, F filter, O orderBy, int limit) {
        return new QueryOptions<>(cursor, filter, orderBy, limit, LimitPrecision.EXACT);
    }

    public QueryOptions<C, F, O> withCursor(C newCursor) {
        return new QueryOptions<>(newCursor, filter, orderBy, limit, limitPrecision);
    }

    public QueryOptions<C, F, O> withLimit(int newLimit) {
        return new QueryOptions<>(cursor, filter, orderBy, newLimit, limitPrecision);
    }

    public QueryOptions<C, F, O> withLimitPrecision(LimitPrecision newPrecision) {
        return new QueryOptions<>(cursor, filter, orderBy, limit, newPrecision);
    }
}
