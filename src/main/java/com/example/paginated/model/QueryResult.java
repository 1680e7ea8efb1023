package com.example.paginated.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One page of a paginated list.
 *
 * <p>{@code isFirst}/{@code isLast} tell whether the leading/trailing edge of the
 * page touches the absolute start/end of the (filtered) list. {@code cursor} is
 * the boundary to continue the traversal from, in the same direction.
 *
 * @param <T> the item type
 * @param <C> the cursor type
 */
public record QueryResult<T, C>(
        List<PageEntry<T, C>> entries,
        boolean isFirst,
        boolean isLast,
        C cursor
) {
    public QueryResult {
        entries = entries != null ? List.copyOf(entries) : List.of();
        Objects.requireNonNull(cursor, "cursor must not be null");
    }

    /**
     * Creates a page without entries that touches both ends of the list.
     */
    public static <T, C> QueryResult<T, C> exhausted(C cursor) {
        return new QueryResult<>(List.of(), true, true, cursor);
    }

    /**
     * Returns the items of this page, without their cursors.
     */
    public List<T> items() {
        return entries.stream().map(PageEntry::item).collect(Collectors.toList());
    }

    /**
     * Returns {@code true} if this page reaches the boundary the given direction walks towards.
     */
    public boolean reachedBoundary(Direction direction) {
        return direction.reachedBoundary(isFirst, isLast);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
