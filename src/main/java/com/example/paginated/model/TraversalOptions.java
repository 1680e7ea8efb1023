package com.example.paginated.model;

/**
 * Configuration for walking a whole paginated list page by page.
 *
 * @param filter the filter passed unchanged to every page query
 * @param orderBy the ordering passed unchanged to every page query
 * @param pageSize the limit of every page query
 * @param limitPrecision the precision of every page query
 * @param direction {@link Direction#NEXT} walks from the first cursor, {@link Direction#PREV} from the last
 * @param <F> the filter type
 * @param <O> the order-by type
 */
public record TraversalOptions<F, O>(
        F filter,
        O orderBy,
        int pageSize,
        LimitPrecision limitPrecision,
        Direction direction
) {
    public static final int DEFAULT_PAGE_SIZE = 100;

    public TraversalOptions {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        if (limitPrecision == null) {
            limitPrecision = LimitPrecision.EXACT;
        }
        if (direction == null) {
            direction = Direction.NEXT;
        }
    }

    /**
     * Forward traversal with {@value #DEFAULT_PAGE_SIZE} items per page and exact precision.
     */
    public static <F, O> TraversalOptions<F, O> defaults(F filter, O orderBy) {
        return new TraversalOptions<>(filter, orderBy, DEFAULT_PAGE_SIZE, LimitPrecision.EXACT, Direction.NEXT);
    }

    public TraversalOptions<F, O> withPageSize(int newPageSize) {
        return new TraversalOptions<>(filter, orderBy, newPageSize, limitPrecision, direction);
    }

    public TraversalOptions<F, O> withLimitPrecision(LimitPrecision newPrecision) {
        return new TraversalOptions<>(filter, orderBy, pageSize, newPrecision, direction);
    }

    public TraversalOptions<F, O> withDirection(Direction newDirection) {
        return new TraversalOptions<>(filter, orderBy, pageSize, limitPrecision, newDirection);
    }

    /**
     * Returns the query options for one page starting at {@code cursor}.
     *
     * @param cursor the position to fetch from
     * @param <C> the cursor type of the list being walked
     * @return the query for that page
     */
    public <C> QueryOptions<C, F, O> toQuery(C cursor) {
        return new QueryOptions<>(cursor, filter, orderBy, pageSize, limitPrecision);
    }
}
